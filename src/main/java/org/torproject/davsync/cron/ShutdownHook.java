/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the given shutdown action when the JVM terminates and releases the
 * main thread waiting in {@link #stayAlive()}.
 */
public final class ShutdownHook extends Thread {

  private static final Logger logger
      = LoggerFactory.getLogger(ShutdownHook.class);

  private final Runnable shutdownAction;

  private boolean stayAlive = true;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(Runnable shutdownAction) {
    super("DavSync-ShutdownThread");
    this.shutdownAction = shutdownAction;
  }

  /**
   * Stay alive until the shutdown thread gets run.
   */
  public void stayAlive() {
    synchronized (this) {
      while (this.stayAlive) {
        try {
          this.wait();
        } catch (InterruptedException e) {
          /* Nothing we can do about this. */
        }
      }
    }
  }

  /** Lets {@link #stayAlive()} return without running the action. */
  public void release() {
    synchronized (this) {
      this.stayAlive = false;
      this.notifyAll();
    }
  }

  @Override
  public void run() {
    logger.info("Shutdown in progress ... ");
    try {
      shutdownAction.run();
    } catch (RuntimeException e) {
      logger.error("Shutdown action failed: {}", e.getMessage(), e);
    }
    release();
    logger.info("Shutdown finished. Exiting.");
  }
}
