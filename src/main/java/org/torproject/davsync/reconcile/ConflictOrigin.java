/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

/**
 * Tag in a conflict artifact name telling which walk detected the
 * divergence: {@code local} for the upload walk, which keeps the losing
 * remote version on the server, and {@code remote} for the download walk,
 * which keeps it next to the local file.
 */
public enum ConflictOrigin {

  LOCAL("local"),
  REMOTE("remote");

  private final String tag;

  ConflictOrigin(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  @Override
  public String toString() {
    return tag;
  }
}
