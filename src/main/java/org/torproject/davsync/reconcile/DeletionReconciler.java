/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import org.torproject.davsync.ledger.BaselineLedger;
import org.torproject.davsync.ledger.BaselineStore;
import org.torproject.davsync.store.FailureClassifier;
import org.torproject.davsync.store.LocalStore;
import org.torproject.davsync.store.RemoteStore;
import org.torproject.davsync.store.TreePaths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;

/**
 * Detects deletions on either replica by comparing both trees against the
 * baseline ledger, and applies them on the other replica once a human
 * agreed.
 *
 * <p>A remote-origin deletion is a ledger file that disappeared from the
 * remote tree but is still present locally; it is applied by deleting the
 * local copy.  A local-origin deletion is a ledger file that was not seen
 * by the upload walk but is still present on the remote side; it is applied
 * by deleting the remote copy.</p>
 *
 * <p>Declining a batch leaves both replicas untouched.  The same batch is
 * not asked for again until {@link #clearDeclined()} is called at the end of
 * the cycle.</p>
 */
public class DeletionReconciler {

  private static final Logger logger
      = LoggerFactory.getLogger(DeletionReconciler.class);

  static final String REMOTE_ORIGIN = "remote-origin";

  static final String LOCAL_ORIGIN = "local-origin";

  private static final Comparator<String> deepestFirst
      = Comparator.comparingInt(TreePaths::depth).reversed()
      .thenComparing(Comparator.naturalOrder());

  private final LocalStore local;

  private final RemoteStore remote;

  private final BaselineStore baselineStore;

  private final ConfirmationGate gate;

  private String declinedFingerprint;

  /** Initialize with both replicas, the ledger store and the gate. */
  public DeletionReconciler(LocalStore local, RemoteStore remote,
      BaselineStore baselineStore, ConfirmationGate gate) {
    this.local = local;
    this.remote = remote;
    this.baselineStore = baselineStore;
    this.gate = gate;
  }

  /**
   * Deletes local files and directories that were deleted on the remote
   * side, if confirmed, and persists the ledger afterwards.
   */
  public void reconcileRemoteDeletions(TreeSnapshot remoteTree,
      BaselineLedger ledger, CycleContext ctx) throws IOException {
    TreeSnapshot localTree = TreeSnapshot.of(local);
    SortedSet<String> files = new TreeSet<>();
    for (String path : ledger.paths()) {
      if (!remoteTree.hasFile(path) && localTree.hasFile(path)) {
        files.add(path);
      }
    }
    SortedSet<String> directories = new TreeSet<>();
    for (String directory : localTree.directories()) {
      if (!remoteTree.hasDirectory(directory)
          && !holdsOtherFiles(directory, localTree, files)) {
        directories.add(directory);
      }
    }
    if (files.isEmpty() && directories.isEmpty()) {
      return;
    }
    if (!confirm(REMOTE_ORIGIN, "Delete local copies of items deleted on the "
        + "server?", files, directories)) {
      return;
    }
    for (String path : files) {
      try {
        local.deleteFile(path);
        ledger.remove(path);
        ctx.deletedLocally();
        logger.info("Deleted local file {}.", path);
      } catch (IOException | RuntimeException e) {
        ctx.itemFailed("delete local file", path, e);
        if (FailureClassifier.isNotFound(e)) {
          ledger.remove(path);
        }
      }
    }
    List<String> ordered = new ArrayList<>(directories);
    Collections.sort(ordered, deepestFirst);
    for (String directory : ordered) {
      try {
        if (null == local.stat(directory)) {
          continue;
        }
        if (local.deleteEmptyDirectory(directory)) {
          ctx.deletedLocally();
          logger.info("Deleted local directory {}.", directory);
          pruneLocalParents(directory, remoteTree, ctx);
        } else {
          logger.info("Keeping local directory {}, it is not empty.",
              directory);
        }
      } catch (IOException | RuntimeException e) {
        ctx.itemFailed("delete local directory", directory, e);
      }
    }
    baselineStore.save(ledger);
  }

  /* A directory holding a file that stays cannot become empty. */
  private static boolean holdsOtherFiles(String directory,
      TreeSnapshot localTree, Set<String> candidates) {
    for (String file : localTree.files()) {
      if (TreePaths.isBelow(file, directory) && !candidates.contains(file)) {
        return true;
      }
    }
    return false;
  }

  private void pruneLocalParents(String directory, TreeSnapshot remoteTree,
      CycleContext ctx) throws IOException {
    String parent = TreePaths.parent(directory);
    while (!parent.isEmpty() && !remoteTree.hasDirectory(parent)) {
      if (null == local.stat(parent) || !local.deleteEmptyDirectory(parent)) {
        return;
      }
      ctx.deletedLocally();
      logger.info("Deleted empty local directory {}.", parent);
      parent = TreePaths.parent(parent);
    }
  }

  /**
   * Deletes remote files that were deleted locally, if confirmed.  Ledger
   * files that are gone from both replicas are dropped from the ledger
   * without asking.  A declined file is dropped from the ledger, too, so
   * that it is treated as new on the remote side from now on.
   *
   * @param observed Files seen by the upload walk of this cycle.
   */
  public void reconcileLocalDeletions(TreeSnapshot remoteTree,
      BaselineLedger ledger, Set<String> observed, CycleContext ctx)
      throws IOException {
    SortedSet<String> files = new TreeSet<>();
    for (String path : new ArrayList<>(ledger.paths())) {
      if (observed.contains(path)) {
        continue;
      }
      if (remoteTree.hasFile(path)) {
        files.add(path);
      } else {
        ledger.remove(path);
      }
    }
    if (files.isEmpty()) {
      return;
    }
    boolean confirmed = confirm(LOCAL_ORIGIN, "Delete server copies of items "
        + "deleted locally?", files, Collections.<String>emptySet());
    for (String path : files) {
      if (!confirmed) {
        ledger.remove(path);
        continue;
      }
      try {
        remote.delete(path);
        ledger.remove(path);
        ctx.deletedRemotely();
        logger.info("Deleted remote file {}.", path);
      } catch (IOException | RuntimeException e) {
        ctx.itemFailed("delete remote file", path, e);
        continue;
      }
      try {
        pruneRemoteParents(path, ctx);
      } catch (IOException | RuntimeException e) {
        ctx.itemFailed("prune remote parents of", path, e);
      }
    }
  }

  private void pruneRemoteParents(String path, CycleContext ctx)
      throws IOException {
    String parent = TreePaths.parent(path);
    while (!parent.isEmpty() && null == local.stat(parent)
        && remote.list(parent).isEmpty()) {
      remote.delete(parent);
      ctx.deletedRemotely();
      logger.info("Deleted empty remote directory {}.", parent);
      parent = TreePaths.parent(parent);
    }
  }

  private boolean confirm(String scope, String title,
      Collection<String> files, Collection<String> directories) {
    String fingerprint = DeletionFingerprint.of(scope, files, directories);
    if (fingerprint.equals(declinedFingerprint)) {
      logger.debug("Not asking again about {} deletion(s) declined before.",
          files.size() + directories.size());
      return false;
    }
    List<String> preview = new ArrayList<>();
    for (String directory : directories) {
      preview.add(directory + TreePaths.SEPARATOR);
    }
    preview.addAll(files);
    ConfirmationRequest request = new ConfirmationRequest(title,
        files.size() + directories.size(), preview);
    logger.info("Asking for confirmation: {}", request);
    boolean confirmed;
    try {
      confirmed = Boolean.TRUE.equals(gate.confirm(request).get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for confirmation.");
      confirmed = false;
    } catch (ExecutionException e) {
      logger.warn("Confirmation failed, treating it as declined.",
          e.getCause());
      confirmed = false;
    }
    if (confirmed) {
      declinedFingerprint = null;
    } else {
      declinedFingerprint = fingerprint;
      logger.info("Deletion of {} item(s) declined.", request.getTotal());
    }
    return confirmed;
  }

  /** Forgets the last declined batch. */
  public void clearDeclined() {
    declinedFingerprint = null;
  }
}
