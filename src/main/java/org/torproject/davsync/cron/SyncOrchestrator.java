/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

import org.torproject.davsync.store.FailureClassifier;
import org.torproject.davsync.store.FailureKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the periodic sync loop of one session.
 *
 * <p>At most one cycle runs at a time; ticks arriving meanwhile are dropped.
 * Failed cycles are counted by a {@link Backoff}, which stretches the
 * interval once failures persist; the first successful cycle restores it.
 * Nothing raised by a cycle escapes this class: every attempt ends in a
 * {@link SyncStatus} sent to the listener.</p>
 */
public class SyncOrchestrator {

  private static final Logger logger
      = LoggerFactory.getLogger(SyncOrchestrator.class);

  private final SyncCycle cycle;

  private final CycleScheduler scheduler;

  private final Backoff backoff;

  private final StatusListener listener;

  private final AtomicBoolean running = new AtomicBoolean(false);

  private volatile boolean started;

  private volatile boolean stopped;

  /** Initialize with the cycle to run and its environment. */
  public SyncOrchestrator(SyncCycle cycle, CycleScheduler scheduler,
      Backoff backoff, StatusListener listener) {
    this.cycle = cycle;
    this.scheduler = scheduler;
    this.backoff = backoff;
    this.listener = listener;
  }

  /**
   * Arms the ticker at the current interval and runs the first cycle right
   * away.
   */
  public synchronized void start() {
    if (stopped) {
      throw new IllegalStateException("Sync loop was stopped already.");
    }
    started = true;
    arm(0L);
  }

  private synchronized void arm(long initialDelayMillis) {
    if (stopped) {
      return;
    }
    scheduler.arm(this::trigger, initialDelayMillis,
        backoff.getCurrentMillis());
  }

  /**
   * Starts a cycle on the worker unless one is in flight.
   *
   * @return {@code true} if a cycle was started, {@code false} if the tick
   *     was dropped.
   */
  public boolean trigger() {
    if (stopped) {
      return false;
    }
    if (!running.compareAndSet(false, true)) {
      logger.info("Previous cycle still running; dropping this tick.");
      return false;
    }
    try {
      scheduler.execute(this::runGuardedCycle);
      return true;
    } catch (RejectedExecutionException e) {
      running.set(false);
      logger.warn("Cannot start cycle, scheduler is shut down.");
      return false;
    }
  }

  /** Runs a cycle while holding the re-entrancy flag. */
  private void runGuardedCycle() {
    try {
      logger.info("Starting sync cycle.");
      CycleReport report = cycle.run();
      onSuccess(report);
    } catch (Throwable th) { // Catching all, the loop must survive anything.
      onFailure(th);
    } finally {
      running.set(false);
    }
  }

  private void onSuccess(CycleReport report) {
    if (backoff.recordSuccess()) {
      arm(backoff.getCurrentMillis());
      publish(SyncStatus.ok("Connection restored; sync interval back to "
          + backoff.getCurrentMinutes() + " minutes (" + report + ")."));
    } else {
      publish(SyncStatus.ok("Sync completed: " + report + "."));
    }
  }

  private void onFailure(Throwable th) {
    FailureKind kind = FailureClassifier.classify(th);
    String reason = null == th.getMessage() ? th.getClass().getSimpleName()
        : th.getMessage();
    if (FailureKind.TRANSIENT == kind) {
      logger.warn("Sync cycle failed, server not reachable: {}", reason);
    } else {
      logger.error("Sync cycle failed: {}", reason, th);
    }
    boolean intervalChanged = backoff.recordFailure();
    if (backoff.isDegraded()) {
      if (intervalChanged) {
        arm(backoff.getCurrentMillis());
      }
      publish(SyncStatus.error("Sync failed " + backoff.getConsecutiveFailures()
          + " times in a row (" + reason + "); sync slowed to "
          + backoff.getCurrentMinutes() + " minutes."));
    } else {
      publish(SyncStatus.warning((FailureKind.TRANSIENT == kind
          ? "Server not reachable" : "Sync failed") + " (attempt "
          + backoff.getConsecutiveFailures() + " of "
          + backoff.getThreshold() + "): " + reason));
    }
  }

  private void publish(SyncStatus status) {
    try {
      listener.onStatus(status);
    } catch (RuntimeException e) {
      logger.warn("Status listener failed for '{}'.", status, e);
    }
  }

  /**
   * Resets the backoff and runs a cycle immediately.
   *
   * @return {@code false} if the loop is not active.
   */
  public synchronized boolean retry() {
    if (!started || stopped) {
      return false;
    }
    backoff.reset();
    logger.info("Retry requested; interval reset to {} minutes.",
        backoff.getCurrentMinutes());
    arm(0L);
    return true;
  }

  /** Cancels the ticker; no cycle is started afterwards. */
  public synchronized void stop() {
    stopped = true;
    scheduler.cancel();
  }

  /**
   * Runs the single best-effort upload pass on shutdown, unless a cycle is
   * in flight.
   *
   * @return {@code true} if the pass completed.
   */
  public boolean runFinalUpload() {
    if (!running.compareAndSet(false, true)) {
      logger.warn("A cycle is still running; skipping the final upload.");
      return false;
    }
    try {
      CycleReport report = cycle.runUploadOnly();
      logger.info("Final upload finished: {}.", report);
      return true;
    } catch (Exception e) {
      logger.warn("Final upload failed: {}", e.getMessage(), e);
      return false;
    } finally {
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  public boolean isStopped() {
    return stopped;
  }

  public Backoff getBackoff() {
    return backoff;
  }
}
