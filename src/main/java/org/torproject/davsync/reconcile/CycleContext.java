/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import org.torproject.davsync.cron.CycleReport;
import org.torproject.davsync.store.FailureClassifier;
import org.torproject.davsync.store.FailureKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * State of one cycle, shared by its phases and dropped at its end.
 */
public class CycleContext {

  private static final Logger logger
      = LoggerFactory.getLogger(CycleContext.class);

  private final Instant startedAt;

  /* Files whose remote version was preserved as an artifact. */
  private final Set<String> preserved = new HashSet<>();

  private final Set<String> uploaded = new HashSet<>();

  private final SortedSet<String> downloaded = new TreeSet<>();

  private final Set<String> remoteDirectories = new HashSet<>();

  private int localDeletions;

  private int remoteDeletions;

  private int skippedItems;

  public CycleContext(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  void rememberRemoteDirectories(Collection<String> directories) {
    remoteDirectories.addAll(directories);
  }

  void rememberRemoteDirectory(String directory) {
    remoteDirectories.add(directory);
  }

  boolean isKnownRemoteDirectory(String directory) {
    return remoteDirectories.contains(directory);
  }

  void preserved(String path) {
    preserved.add(path);
  }

  /** Tells whether this cycle already kept an artifact for the path. */
  boolean wasPreserved(String path) {
    return preserved.contains(path);
  }

  void uploaded(String path) {
    uploaded.add(path);
  }

  boolean wasUploaded(String path) {
    return uploaded.contains(path);
  }

  void downloaded(String path) {
    downloaded.add(path);
  }

  SortedSet<String> downloadedPaths() {
    return Collections.unmodifiableSortedSet(downloaded);
  }

  void deletedLocally() {
    localDeletions++;
  }

  void deletedRemotely() {
    remoteDeletions++;
  }

  /**
   * Handles a failure while processing a single item of a walk.  Transient
   * failures abort the walk, missing items are skipped quietly, and all
   * other failures are logged and skipped.
   *
   * @throws WalkException Thrown if the failure is transient.
   */
  void itemFailed(String operation, String path, Exception failure)
      throws WalkException {
    FailureKind kind = FailureClassifier.classify(failure);
    if (FailureKind.TRANSIENT == kind) {
      throw new WalkException("Aborted while trying to " + operation + " "
          + path + ": " + failure.getMessage(), failure);
    } else if (FailureKind.NOT_FOUND == kind) {
      logger.debug("Cannot {} {}, it is gone.", operation, path);
    } else {
      logger.warn("Cannot {} {}. Skipping.", operation, path, failure);
      skippedItems++;
    }
  }

  /** Summarizes what this cycle did so far. */
  public CycleReport report() {
    return new CycleReport(uploaded.size(), downloaded.size(),
        preserved.size(), localDeletions, remoteDeletions, skippedItems);
  }
}
