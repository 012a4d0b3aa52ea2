/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import org.torproject.davsync.store.LocalStore;
import org.torproject.davsync.store.RemoteStore;
import org.torproject.davsync.store.TreeEntry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Compares modification times of the two versions of a file and produces
 * conflict artifacts when the local version wins against a newer remote one.
 */
public class ConflictResolver {

  private static final Logger logger
      = LoggerFactory.getLogger(ConflictResolver.class);

  public static final long DEFAULT_TOLERANCE_MILLIS = 2000L;

  private final long toleranceMillis;

  private final Clock clock;

  public ConflictResolver() {
    this(DEFAULT_TOLERANCE_MILLIS, Clock.systemUTC());
  }

  /**
   * Initialize with the tolerance for timestamp differences and the clock
   * used for naming artifacts.
   */
  public ConflictResolver(long toleranceMillis, Clock clock) {
    if (toleranceMillis < 0) {
      throw new IllegalArgumentException("Negative tolerance: "
          + toleranceMillis);
    }
    this.toleranceMillis = toleranceMillis;
    this.clock = clock;
  }

  /**
   * Decides what to do about a file; either entry may be {@code null}.
   */
  public Action decide(TreeEntry local, TreeEntry remote) {
    if (null == local) {
      return null == remote ? Action.NO_OP : Action.DOWNLOAD;
    }
    if (null == remote) {
      return Action.UPLOAD;
    }
    long delta = remote.getModifyTime() - local.getModifyTime();
    if (delta > toleranceMillis) {
      return Action.CONFLICT;
    } else if (delta < -toleranceMillis) {
      return Action.UPLOAD;
    }
    return Action.NO_OP;
  }

  /**
   * Copies the remote version of a file to a remote artifact next to it.
   *
   * @return Path of the artifact.
   */
  public String preserveOnRemote(RemoteStore remote, String path,
      ConflictOrigin origin) throws IOException {
    String artifact = ConflictNames.uniqueArtifactPath(remote, path, origin,
        clock.instant());
    remote.copy(path, artifact);
    logger.info("Conflict on {}: kept remote version as {} on the server.",
        path, artifact);
    return artifact;
  }

  /**
   * Fetches the remote version of a file into a local artifact next to the
   * untouched local file.
   *
   * @return Path of the artifact.
   */
  public String preserveLocally(RemoteStore remote, LocalStore local,
      TreeEntry remoteEntry, ConflictOrigin origin) throws IOException {
    String path = remoteEntry.getPath();
    String artifact = ConflictNames.uniqueArtifactPath(local, path, origin,
        clock.instant());
    byte[] content = remote.read(path);
    local.write(artifact, content);
    if (remoteEntry.getModifyTime() > 0L) {
      local.setModifyTime(artifact, remoteEntry.getModifyTime());
    }
    logger.info("Conflict on {}: kept remote version as local {}.", path,
        artifact);
    return artifact;
  }
}
