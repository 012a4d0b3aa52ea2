/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.ledger;

import org.torproject.davsync.reconcile.ConflictNames;
import org.torproject.davsync.store.TreePaths;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * File paths known to have been present on both replicas at the end of the
 * last successful cycle.  Conflict artifacts are never recorded.
 */
public class BaselineLedger {

  private final SortedSet<String> files = new TreeSet<>();

  /** Creates an empty ledger. */
  public BaselineLedger() { /* empty */ }

  /** Creates a ledger containing the given paths. */
  public BaselineLedger(Collection<String> paths) {
    for (String path : paths) {
      add(path);
    }
  }

  /**
   * Records a path; conflict-marked paths are ignored.
   *
   * @return {@code true} if the path was newly recorded.
   */
  public boolean add(String path) {
    String key = TreePaths.normalize(path);
    if (key.isEmpty() || ConflictNames.isConflictPath(key)) {
      return false;
    }
    return files.add(key);
  }

  public boolean remove(String path) {
    return files.remove(TreePaths.normalize(path));
  }

  public boolean contains(String path) {
    return files.contains(TreePaths.normalize(path));
  }

  /** Replaces the whole content with the given paths. */
  public void replaceWith(Collection<String> paths) {
    files.clear();
    for (String path : paths) {
      add(path);
    }
  }

  /** Unmodifiable, sorted view of all recorded paths. */
  public SortedSet<String> paths() {
    return Collections.unmodifiableSortedSet(files);
  }

  public int size() {
    return files.size();
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }
}
