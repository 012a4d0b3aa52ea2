/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Threads of a sync session: one ticker thread firing at the current
 * interval and one worker thread executing cycles.
 *
 * <p>The ticker never runs cycle logic itself, so that a tick firing while a
 * cycle is still busy can be dropped instead of piling up behind it.</p>
 */
public class CycleScheduler implements ThreadFactory {

  private static final Logger logger
      = LoggerFactory.getLogger(CycleScheduler.class);

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private int currentThreadNo = 0;

  private final ScheduledExecutorService ticker =
      Executors.newSingleThreadScheduledExecutor(this);

  private final ExecutorService worker =
      Executors.newSingleThreadExecutor(this);

  private ScheduledFuture<?> tick;

  /**
   * Replaces any armed ticker by one firing first after
   * {@code initialDelayMillis} and then every {@code periodMillis}.
   */
  public synchronized void arm(Runnable task, long initialDelayMillis,
      long periodMillis) {
    cancel();
    logger.info("Sync will first run in {} and then every {} minute(s).",
        initialDelayMillis < Backoff.MILLIS_IN_A_MINUTE ? "under 1 minute"
        : (initialDelayMillis / Backoff.MILLIS_IN_A_MINUTE) + " minute(s)",
        periodMillis / Backoff.MILLIS_IN_A_MINUTE);
    this.tick = this.ticker.scheduleAtFixedRate(task, initialDelayMillis,
        periodMillis, TimeUnit.MILLISECONDS);
  }

  /** Cancels the armed ticker, if any, without interrupting running work. */
  public synchronized void cancel() {
    if (null != this.tick) {
      this.tick.cancel(false);
      this.tick = null;
    }
  }

  /** Tells whether a ticker is armed. */
  public synchronized boolean isArmed() {
    return null != this.tick;
  }

  /** Hands work to the worker thread. */
  public void execute(Runnable work) {
    this.worker.execute(work);
  }

  /**
   * Runs the given task on a fresh thread outside the worker, so that it can
   * be awaited with a timeout and abandoned.
   */
  public <T> Future<T> runDetached(Callable<T> task) {
    FutureTask<T> future = new FutureTask<>(task);
    newThread(future).start();
    return future;
  }

  /**
   * Try to shutdown smoothly, i.e., wait for running tasks to terminate.
   */
  public void shutdownScheduler(long gracePeriodSeconds) {
    cancel();
    try {
      logger.debug("Waiting at most {} seconds for termination "
          + "of running tasks ... ", gracePeriodSeconds);
      ticker.shutdown();
      worker.shutdown();
      if (!worker.awaitTermination(gracePeriodSeconds, TimeUnit.SECONDS)) {
        List<Runnable> notTerminated = worker.shutdownNow();
        logger.warn("Forced shutdown of running cycle; {} task(s) not started.",
            notTerminated.size());
      } else {
        logger.debug("Shutdown of all scheduled tasks completed successfully.");
      }
    } catch (InterruptedException ie) {
      List<Runnable> notTerminated = worker.shutdownNow();
      ticker.shutdownNow();
      logger.error("Regular shutdown failed for: " + notTerminated);
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Provide a nice name for debugging and log thread creation.
   */
  @Override
  public synchronized Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("DavSync-Cycle-Thread-" + ++currentThreadNo);
    logger.debug("New Thread created: " + newThread.getName());
    return newThread;
  }
}
