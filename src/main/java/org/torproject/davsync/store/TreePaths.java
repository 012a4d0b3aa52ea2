/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

/**
 * Helpers for path keys, i.e., {@code /}-separated paths relative to a
 * synchronization root, without leading or trailing slash.  The root itself
 * is the empty string.
 */
public final class TreePaths {

  public static final String ROOT = "";

  public static final String SEPARATOR = "/";

  private TreePaths() { /* static helpers only */ }

  /** Strips surrounding slashes and collapses repeated ones. */
  public static String normalize(String path) {
    if (null == path) {
      return ROOT;
    }
    String normalized = path.replace('\\', '/').replaceAll("/{2,}", SEPARATOR);
    while (normalized.startsWith(SEPARATOR)) {
      normalized = normalized.substring(1);
    }
    while (normalized.endsWith(SEPARATOR)) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }

  /** Joins a directory key and a child name. */
  public static String join(String directory, String name) {
    String dir = normalize(directory);
    String child = normalize(name);
    if (dir.isEmpty()) {
      return child;
    }
    if (child.isEmpty()) {
      return dir;
    }
    return dir + SEPARATOR + child;
  }

  /** Returns the parent key, or the root for top-level entries. */
  public static String parent(String path) {
    String normalized = normalize(path);
    int slash = normalized.lastIndexOf('/');
    return slash < 0 ? ROOT : normalized.substring(0, slash);
  }

  /** Returns the last segment of the path. */
  public static String name(String path) {
    String normalized = normalize(path);
    return normalized.substring(normalized.lastIndexOf('/') + 1);
  }

  /** Number of segments; the root has depth zero. */
  public static int depth(String path) {
    String normalized = normalize(path);
    if (normalized.isEmpty()) {
      return 0;
    }
    return normalized.split(SEPARATOR).length;
  }

  /** Tells whether {@code path} lies strictly below {@code directory}. */
  public static boolean isBelow(String path, String directory) {
    String dir = normalize(directory);
    String normalized = normalize(path);
    if (dir.isEmpty()) {
      return !normalized.isEmpty();
    }
    return normalized.startsWith(dir + SEPARATOR);
  }
}
