/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.session;

import org.torproject.davsync.cron.Backoff;
import org.torproject.davsync.cron.CycleScheduler;
import org.torproject.davsync.cron.StatusListener;
import org.torproject.davsync.cron.SyncOrchestrator;
import org.torproject.davsync.ledger.BaselineStore;
import org.torproject.davsync.reconcile.ConfirmationGate;
import org.torproject.davsync.reconcile.ConflictResolver;
import org.torproject.davsync.reconcile.DeletionReconciler;
import org.torproject.davsync.reconcile.DownloadWalk;
import org.torproject.davsync.reconcile.ReconciliationCycle;
import org.torproject.davsync.reconcile.UploadWalk;
import org.torproject.davsync.store.LocalStore;
import org.torproject.davsync.store.RemoteStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Everything belonging to one login: both replicas, the ledger store, and
 * the sync loop.  Created on login and closed on logout.
 */
public class SyncSession {

  private static final Logger logger
      = LoggerFactory.getLogger(SyncSession.class);

  private final RemoteStore remote;

  private final CycleScheduler scheduler;

  private final SyncOrchestrator orchestrator;

  private final long graceSeconds;

  SyncSession(RemoteStore remote, CycleScheduler scheduler,
      SyncOrchestrator orchestrator, long graceSeconds) {
    this.remote = remote;
    this.scheduler = scheduler;
    this.orchestrator = orchestrator;
    this.graceSeconds = graceSeconds;
  }

  /** Wires the components of a session; nothing is started yet. */
  static SyncSession create(SessionSettings settings, LocalStore local,
      RemoteStore remote, ConfirmationGate gate, StatusListener listener,
      int intervalMinutes) {
    Clock clock = Clock.systemUTC();
    BaselineStore baselineStore = new BaselineStore(settings.ledgerPath);
    ConflictResolver resolver = new ConflictResolver(
        settings.toleranceMillis, clock);
    DeletionReconciler reconciler = new DeletionReconciler(local, remote,
        baselineStore, gate);
    ReconciliationCycle cycle = new ReconciliationCycle(remote, baselineStore,
        reconciler, new UploadWalk(local, remote, resolver),
        new DownloadWalk(local, remote, resolver), clock);
    Backoff backoff = new Backoff(intervalMinutes,
        settings.maxIntervalMinutes, settings.backoffThreshold,
        settings.backoffFactor);
    CycleScheduler scheduler = new CycleScheduler();
    SyncOrchestrator orchestrator = new SyncOrchestrator(cycle, scheduler,
        backoff, listener);
    return new SyncSession(remote, scheduler, orchestrator,
        settings.graceSeconds);
  }

  RemoteStore getRemote() {
    return remote;
  }

  CycleScheduler getScheduler() {
    return scheduler;
  }

  SyncOrchestrator getOrchestrator() {
    return orchestrator;
  }

  /** Stops the loop, waits for a running cycle, and closes the remote. */
  void close() {
    orchestrator.stop();
    scheduler.shutdownScheduler(graceSeconds);
    try {
      remote.close();
    } catch (IOException e) {
      logger.warn("Cannot close connection to {}.", remote.describe(), e);
    }
  }
}
