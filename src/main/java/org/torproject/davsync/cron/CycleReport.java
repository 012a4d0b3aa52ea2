/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

/** Counts of what a cycle changed. */
public final class CycleReport {

  private final int uploads;

  private final int downloads;

  private final int conflicts;

  private final int localDeletions;

  private final int remoteDeletions;

  private final int skippedItems;

  /** Creates a report with the given counts. */
  public CycleReport(int uploads, int downloads, int conflicts,
      int localDeletions, int remoteDeletions, int skippedItems) {
    this.uploads = uploads;
    this.downloads = downloads;
    this.conflicts = conflicts;
    this.localDeletions = localDeletions;
    this.remoteDeletions = remoteDeletions;
    this.skippedItems = skippedItems;
  }

  public int getUploads() {
    return uploads;
  }

  public int getDownloads() {
    return downloads;
  }

  public int getConflicts() {
    return conflicts;
  }

  public int getLocalDeletions() {
    return localDeletions;
  }

  public int getRemoteDeletions() {
    return remoteDeletions;
  }

  public int getSkippedItems() {
    return skippedItems;
  }

  /** Tells whether the cycle neither transferred nor deleted anything. */
  public boolean isQuiet() {
    return 0 == uploads + downloads + conflicts + localDeletions
        + remoteDeletions;
  }

  @Override
  public String toString() {
    if (isQuiet() && 0 == skippedItems) {
      return "everything up to date";
    }
    StringBuilder sb = new StringBuilder();
    sb.append(uploads).append(" uploaded, ")
        .append(downloads).append(" downloaded, ")
        .append(conflicts).append(" conflict(s) preserved, ")
        .append(localDeletions).append(" deleted locally, ")
        .append(remoteDeletions).append(" deleted remotely");
    if (skippedItems > 0) {
      sb.append(", ").append(skippedItems).append(" skipped");
    }
    return sb.toString();
  }
}
