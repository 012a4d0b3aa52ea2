/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.torproject.davsync.ledger.BaselineLedger;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public class DeletionReconcilerTest extends ReplicaFixture {

  private ScriptedConfirmationGate gate;

  private DeletionReconciler reconciler(boolean answer) {
    gate = new ScriptedConfirmationGate(answer);
    return new DeletionReconciler(local, remote, baselineStore, gate);
  }

  private static BaselineLedger ledger(String... paths) {
    return new BaselineLedger(Arrays.asList(paths));
  }

  @Test()
  public void testNothingToDeleteDoesNotAsk() throws Exception {
    localFile("a.txt", "a", T0);
    remote.putFile("a.txt", "a", T0);
    DeletionReconciler reconciler = reconciler(true);
    reconciler.reconcileRemoteDeletions(TreeSnapshot.of(remote),
        ledger("a.txt"), newContext());
    assertEquals(0, gate.getPromptCount());
  }

  @Test()
  public void testDeclinedRemoteDeletionKeepsLocalFileAndLedger()
      throws Exception {
    localFile("a.txt", "a", T0);
    localFile("b.txt", "b", T0);
    remote.putFile("b.txt", "b", T0);
    BaselineLedger ledger = ledger("a.txt", "b.txt");
    reconciler(false).reconcileRemoteDeletions(TreeSnapshot.of(remote),
        ledger, newContext());
    assertEquals(1, gate.getPromptCount());
    ConfirmationRequest request = gate.getRequests().get(0);
    assertEquals(1, request.getTotal());
    assertEquals(Collections.singletonList("a.txt"), request.getPreview());
    assertTrue(localExists("a.txt"));
    assertTrue(ledger.contains("a.txt"));
  }

  @Test()
  public void testConfirmedRemoteDeletionRemovesLocalFileAndLedgerEntry()
      throws Exception {
    localFile("a.txt", "a", T0);
    localFile("b.txt", "b", T0);
    remote.putFile("b.txt", "b", T0);
    BaselineLedger ledger = ledger("a.txt", "b.txt");
    CycleContext ctx = newContext();
    reconciler(true).reconcileRemoteDeletions(TreeSnapshot.of(remote),
        ledger, ctx);
    assertFalse(localExists("a.txt"));
    assertTrue(localExists("b.txt"));
    assertFalse(ledger.contains("a.txt"));
    BaselineLedger saved = baselineStore.load();
    assertFalse(saved.contains("a.txt"));
    assertTrue(saved.contains("b.txt"));
    assertEquals(1, ctx.report().getLocalDeletions());
  }

  @Test()
  public void testRepeatedDeclineIsNotAskedAgain() throws Exception {
    localFile("a.txt", "a", T0);
    localFile("b.txt", "b", T0);
    remote.putFile("b.txt", "b", T0);
    BaselineLedger ledger = ledger("a.txt", "b.txt");
    DeletionReconciler reconciler = reconciler(false);
    reconciler.reconcileRemoteDeletions(TreeSnapshot.of(remote), ledger,
        newContext());
    reconciler.reconcileRemoteDeletions(TreeSnapshot.of(remote), ledger,
        newContext());
    assertEquals(1, gate.getPromptCount());

    remote.removeEntry("b.txt");
    reconciler.reconcileRemoteDeletions(TreeSnapshot.of(remote), ledger,
        newContext());
    assertEquals("A different set must be asked for.", 2,
        gate.getPromptCount());
    assertEquals(2, gate.getRequests().get(1).getTotal());

    reconciler.clearDeclined();
    reconciler.reconcileRemoteDeletions(TreeSnapshot.of(remote), ledger,
        newContext());
    assertEquals(3, gate.getPromptCount());
  }

  @Test()
  public void testDirectoriesDeletedDeepestFirstWithPruning()
      throws Exception {
    localFile("x/y/z/f.txt", "f", T0);
    localFile("keep/new.txt", "n", T0);
    local.mkdirs("empty");
    remote.putDirectory("empty");
    BaselineLedger ledger = ledger("x/y/z/f.txt");
    CycleContext ctx = newContext();
    reconciler(true).reconcileRemoteDeletions(TreeSnapshot.of(remote),
        ledger, ctx);
    ConfirmationRequest request = gate.getRequests().get(0);
    assertEquals(4, request.getTotal());
    assertThat(request.getPreview(), contains("x/", "x/y/", "x/y/z/",
        "x/y/z/f.txt"));
    assertFalse(localExists("x"));
    assertTrue(localExists("keep/new.txt"));
    assertTrue(localExists("empty"));
    assertEquals(4, ctx.report().getLocalDeletions());
  }

  @Test()
  public void testNewEmptyDirectoryIsOfferedAndKeptWhenDeclined()
      throws Exception {
    local.mkdirs("fresh");
    localFile("filled/new.txt", "n", T0);
    reconciler(false).reconcileRemoteDeletions(TreeSnapshot.of(remote),
        ledger(), newContext());
    assertEquals(1, gate.getPromptCount());
    assertEquals(Collections.singletonList("fresh/"),
        gate.getRequests().get(0).getPreview());
    assertTrue(localExists("fresh"));
  }

  @Test()
  public void testConflictArtifactKeepsDirectory() throws Exception {
    String artifact = "d/a.conflict-remote-" + STAMP + ".txt";
    localFile("d/a.txt", "a", T0);
    localFile(artifact, "old", T0);
    BaselineLedger ledger = ledger("d/a.txt");
    reconciler(true).reconcileRemoteDeletions(TreeSnapshot.of(remote),
        ledger, newContext());
    for (String path : gate.getRequests().get(0).getPreview()) {
      assertFalse(path, ConflictNames.isConflictPath(path));
    }
    assertFalse(localExists("d/a.txt"));
    assertTrue(localExists(artifact));
  }

  @Test()
  public void testPreviewIsLimited() throws Exception {
    BaselineLedger ledger = new BaselineLedger();
    for (int i = 0; i < 15; i++) {
      localFile("f" + i + ".txt", "f", T0);
      ledger.add("f" + i + ".txt");
    }
    reconciler(false).reconcileRemoteDeletions(TreeSnapshot.of(remote),
        ledger, newContext());
    ConfirmationRequest request = gate.getRequests().get(0);
    assertEquals(15, request.getTotal());
    assertEquals(ConfirmationRequest.MAX_PREVIEW,
        request.getPreview().size());
  }

  @Test()
  public void testFailedConfirmationCountsAsDecline() throws Exception {
    localFile("a.txt", "a", T0);
    CompletableFuture<Boolean> broken = new CompletableFuture<>();
    broken.completeExceptionally(new IllegalStateException("Window closed"));
    DeletionReconciler reconciler = new DeletionReconciler(local, remote,
        baselineStore, request -> broken);
    BaselineLedger ledger = ledger("a.txt");
    reconciler.reconcileRemoteDeletions(TreeSnapshot.of(remote), ledger,
        newContext());
    assertTrue(localExists("a.txt"));
    assertTrue(ledger.contains("a.txt"));
  }

  @Test()
  public void testDeclinedLocalDeletionKeepsRemoteFile() throws Exception {
    remote.putFile("a.txt", "a", T0);
    BaselineLedger ledger = ledger("a.txt");
    reconciler(false).reconcileLocalDeletions(TreeSnapshot.of(remote),
        ledger, Collections.<String>emptySet(), newContext());
    assertEquals(1, gate.getPromptCount());
    assertTrue(remote.hasFile("a.txt"));
    assertEquals(0, remote.getDeletes());
    assertFalse("Declined file is treated as new on the server.",
        ledger.contains("a.txt"));
  }

  @Test()
  public void testConfirmedLocalDeletionPrunesRemoteParents()
      throws Exception {
    remote.putFile("docs/old/a.txt", "a", T0);
    remote.putFile("docs/keep.txt", "k", T0);
    BaselineLedger ledger = ledger("docs/old/a.txt", "docs/keep.txt");
    Set<String> observed = new HashSet<>(Arrays.asList("docs/keep.txt"));
    localFile("docs/keep.txt", "k", T0);
    CycleContext ctx = newContext();
    reconciler(true).reconcileLocalDeletions(TreeSnapshot.of(remote), ledger,
        observed, ctx);
    assertFalse(remote.hasFile("docs/old/a.txt"));
    assertFalse(remote.hasDirectory("docs/old"));
    assertTrue(remote.hasFile("docs/keep.txt"));
    assertFalse(ledger.contains("docs/old/a.txt"));
    assertTrue(ledger.contains("docs/keep.txt"));
    assertEquals(2, ctx.report().getRemoteDeletions());
  }

  @Test()
  public void testFilesGoneOnBothSidesAreDroppedSilently() throws Exception {
    BaselineLedger ledger = ledger("gone.txt");
    reconciler(true).reconcileLocalDeletions(TreeSnapshot.of(remote), ledger,
        Collections.<String>emptySet(), newContext());
    assertEquals(0, gate.getPromptCount());
    assertTrue(ledger.isEmpty());
  }
}
