/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.session;

import org.torproject.davsync.conf.Configuration;
import org.torproject.davsync.conf.ConfigurationException;
import org.torproject.davsync.conf.Key;

import java.nio.file.Path;

/** Configuration values a session needs, read once per login. */
final class SessionSettings {

  final String davPathTemplate;

  final Path localRoot;

  final Path ledgerPath;

  final int maxIntervalMinutes;

  final int backoffThreshold;

  final int backoffFactor;

  final long toleranceMillis;

  final long finalUploadTimeoutSeconds;

  final long graceSeconds;

  SessionSettings(Configuration config) throws ConfigurationException {
    this.davPathTemplate = config.getString(Key.DavPathTemplate);
    this.localRoot = config.getPath(Key.LocalRoot);
    this.ledgerPath = config.getPath(Key.LedgerPath);
    this.maxIntervalMinutes = config.getInt(Key.MaxSyncIntervalMinutes);
    this.backoffThreshold = config.getInt(Key.BackoffThreshold);
    this.backoffFactor = config.getInt(Key.BackoffFactor);
    this.toleranceMillis = config.getLong(Key.TimestampToleranceMillis);
    this.finalUploadTimeoutSeconds
        = config.getLong(Key.ShutdownUploadTimeoutSeconds);
    this.graceSeconds = config.getLong(Key.ShutdownGraceWaitSeconds);
  }
}
