/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

/**
 * Work driven by the {@link SyncOrchestrator}.
 */
public interface SyncCycle {

  /**
   * Runs one full cycle: deletion reconciliation, upload walk, download walk.
   *
   * @throws Exception Thrown if a walk as a whole failed.
   */
  CycleReport run() throws Exception;

  /**
   * Runs a single upload walk without deletions and without touching the
   * baseline, as done once on shutdown.
   */
  CycleReport runUploadOnly() throws Exception;

}
