/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

/** Scheduling of sync cycles.
 * <p>The central class is {@code SyncOrchestrator}, which owns the cycle
 * state machine, the re-entrancy guard, and the {@code Backoff}; threads are
 * provided by {@code CycleScheduler}.</p>
 */
package org.torproject.davsync.cron;
