/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

import java.util.Objects;

/** Status pushed to listeners after every cycle attempt and login. */
public final class SyncStatus {

  /** Severity of a status event. */
  public enum Level {
    OK,
    WARNING,
    ERROR
  }

  private final Level level;

  private final String message;

  private SyncStatus(Level level, String message) {
    this.level = Objects.requireNonNull(level);
    this.message = message;
  }

  public static SyncStatus ok(String message) {
    return new SyncStatus(Level.OK, message);
  }

  public static SyncStatus warning(String message) {
    return new SyncStatus(Level.WARNING, message);
  }

  public static SyncStatus error(String message) {
    return new SyncStatus(Level.ERROR, message);
  }

  public Level getLevel() {
    return level;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return level.name().toLowerCase() + ": " + message;
  }
}
