/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import org.torproject.davsync.store.TreeEntry;
import org.torproject.davsync.store.TreePaths;
import org.torproject.davsync.store.TreeStore;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Recursive listing of one replica, taken once per cycle.  Conflict
 * artifacts, and anything below a conflict-marked directory, are left out.
 */
public final class TreeSnapshot {

  private final SortedMap<String, TreeEntry> files = new TreeMap<>();

  private final SortedSet<String> directories = new TreeSet<>();

  private TreeSnapshot() { /* use of() */ }

  /**
   * Lists the whole tree of the given store.
   *
   * @throws WalkException Thrown if any directory listing fails.
   */
  public static TreeSnapshot of(TreeStore store) throws WalkException {
    TreeSnapshot snapshot = new TreeSnapshot();
    Deque<String> pending = new ArrayDeque<>();
    pending.push(TreePaths.ROOT);
    while (!pending.isEmpty()) {
      String directory = pending.pop();
      try {
        for (TreeEntry entry : store.list(directory)) {
          if (ConflictNames.isConflictPath(entry.getPath())) {
            continue;
          }
          if (entry.isDirectory()) {
            snapshot.directories.add(entry.getPath());
            pending.push(entry.getPath());
          } else {
            snapshot.files.put(entry.getPath(), entry);
          }
        }
      } catch (IOException | RuntimeException e) {
        throw new WalkException("Cannot list directory '" + directory
            + "': " + e.getMessage(), e);
      }
    }
    return snapshot;
  }

  public boolean hasFile(String path) {
    return files.containsKey(path);
  }

  public boolean hasDirectory(String path) {
    return directories.contains(path);
  }

  /** Returns the file entry at the given path, or {@code null}. */
  public TreeEntry file(String path) {
    return files.get(path);
  }

  public SortedSet<String> files() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(files.keySet()));
  }

  public SortedSet<String> directories() {
    return Collections.unmodifiableSortedSet(directories);
  }
}
