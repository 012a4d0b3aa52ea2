/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.conf;

import java.net.URL;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  ServerUrl(URL.class),
  Username(String.class),
  Password(String.class),
  DavPathTemplate(String.class),
  LocalRoot(Path.class),
  LedgerPath(Path.class),
  SyncIntervalMinutes(Integer.class),
  MaxSyncIntervalMinutes(Integer.class),
  BackoffThreshold(Integer.class),
  BackoffFactor(Integer.class),
  TimestampToleranceMillis(Long.class),
  ConfirmDeletions(Boolean.class),
  ShutdownUploadTimeoutSeconds(Long.class),
  ShutdownGraceWaitSeconds(Long.class);

  private Class clazz;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}
