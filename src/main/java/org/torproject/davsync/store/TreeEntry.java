/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

import java.util.Objects;

/**
 * File or directory as seen on one side of the synchronization, identified
 * by its path key relative to that side's root.
 */
public final class TreeEntry {

  private final String path;

  private final EntryKind kind;

  private final long modifyTime;

  private TreeEntry(String path, EntryKind kind, long modifyTime) {
    this.path = TreePaths.normalize(path);
    this.kind = Objects.requireNonNull(kind);
    this.modifyTime = modifyTime;
  }

  /** Creates a file entry with the given modification time in millis. */
  public static TreeEntry file(String path, long modifyTime) {
    return new TreeEntry(path, EntryKind.FILE, modifyTime);
  }

  /** Creates a directory entry with the given modification time in millis. */
  public static TreeEntry directory(String path, long modifyTime) {
    return new TreeEntry(path, EntryKind.DIRECTORY, modifyTime);
  }

  public String getPath() {
    return path;
  }

  public EntryKind getKind() {
    return kind;
  }

  public boolean isDirectory() {
    return EntryKind.DIRECTORY == kind;
  }

  public boolean isFile() {
    return EntryKind.FILE == kind;
  }

  /** Returns the last modification time in milliseconds since the epoch. */
  public long getModifyTime() {
    return modifyTime;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TreeEntry)) {
      return false;
    }
    TreeEntry that = (TreeEntry) other;
    return modifyTime == that.modifyTime && path.equals(that.path)
        && kind == that.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, kind, modifyTime);
  }

  @Override
  public String toString() {
    return kind + ":" + path + "@" + modifyTime;
  }
}
