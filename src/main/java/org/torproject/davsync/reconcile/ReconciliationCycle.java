/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import org.torproject.davsync.cron.CycleReport;
import org.torproject.davsync.cron.SyncCycle;
import org.torproject.davsync.ledger.BaselineLedger;
import org.torproject.davsync.ledger.BaselineStore;
import org.torproject.davsync.store.RemoteStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One synchronization cycle in its fixed phase order: remote-origin
 * deletions, upload walk with local-origin deletions and ledger rewrite,
 * download walk.
 */
public class ReconciliationCycle implements SyncCycle {

  private static final Logger logger
      = LoggerFactory.getLogger(ReconciliationCycle.class);

  private final RemoteStore remote;

  private final BaselineStore baselineStore;

  private final DeletionReconciler deletionReconciler;

  private final UploadWalk uploadWalk;

  private final DownloadWalk downloadWalk;

  private final Clock clock;

  /** Initialize with the phases of a cycle. */
  public ReconciliationCycle(RemoteStore remote, BaselineStore baselineStore,
      DeletionReconciler deletionReconciler, UploadWalk uploadWalk,
      DownloadWalk downloadWalk, Clock clock) {
    this.remote = remote;
    this.baselineStore = baselineStore;
    this.deletionReconciler = deletionReconciler;
    this.uploadWalk = uploadWalk;
    this.downloadWalk = downloadWalk;
    this.clock = clock;
  }

  @Override
  public CycleReport run() throws IOException {
    CycleContext ctx = new CycleContext(clock.instant());
    try {
      BaselineLedger ledger = baselineStore.load();
      TreeSnapshot remoteTree = TreeSnapshot.of(remote);
      ctx.rememberRemoteDirectories(remoteTree.directories());
      logger.debug("Remote snapshot: {} files, {} directories; ledger: {} "
          + "files.", remoteTree.files().size(),
          remoteTree.directories().size(), ledger.size());

      deletionReconciler.reconcileRemoteDeletions(remoteTree, ledger, ctx);

      SortedSet<String> observed = uploadWalk.run(remoteTree, ctx);
      deletionReconciler.reconcileLocalDeletions(remoteTree, ledger, observed,
          ctx);
      ledger.replaceWith(presentOnBoth(observed, remoteTree, ctx));
      baselineStore.save(ledger);

      downloadWalk.run(ctx);
      Set<String> downloaded = ctx.downloadedPaths();
      if (!downloaded.isEmpty()) {
        for (String path : downloaded) {
          ledger.add(path);
        }
        baselineStore.save(ledger);
      }
      logger.debug("Cycle started at {} took {} ms.", ctx.getStartedAt(),
          Duration.between(ctx.getStartedAt(), clock.instant()).toMillis());
      return ctx.report();
    } finally {
      deletionReconciler.clearDeclined();
    }
  }

  private static SortedSet<String> presentOnBoth(Set<String> observed,
      TreeSnapshot remoteTree, CycleContext ctx) {
    SortedSet<String> present = new TreeSet<>();
    for (String path : observed) {
      if (remoteTree.hasFile(path) || ctx.wasUploaded(path)) {
        present.add(path);
      }
    }
    return present;
  }

  @Override
  public CycleReport runUploadOnly() throws IOException {
    CycleContext ctx = new CycleContext(clock.instant());
    TreeSnapshot remoteTree = TreeSnapshot.of(remote);
    ctx.rememberRemoteDirectories(remoteTree.directories());
    uploadWalk.run(remoteTree, ctx);
    return ctx.report();
  }
}
