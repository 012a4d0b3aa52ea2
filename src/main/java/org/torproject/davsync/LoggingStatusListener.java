/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync;

import org.torproject.davsync.cron.StatusListener;
import org.torproject.davsync.cron.SyncStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes status events to the log at a level matching their severity. */
public class LoggingStatusListener implements StatusListener {

  private static final Logger logger
      = LoggerFactory.getLogger(LoggingStatusListener.class);

  @Override
  public void onStatus(SyncStatus status) {
    switch (status.getLevel()) {
      case ERROR:
        logger.error(status.getMessage());
        break;
      case WARNING:
        logger.warn(status.getMessage());
        break;
      default:
        logger.info(status.getMessage());
        break;
    }
  }
}
