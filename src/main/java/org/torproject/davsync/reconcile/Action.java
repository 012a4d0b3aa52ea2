/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

/** Outcome of comparing the two sides of a file. */
public enum Action {

  /** Push the local version; the remote one is missing or older. */
  UPLOAD,

  /** Fetch the remote version; there is no local one. */
  DOWNLOAD,

  /**
   * Both versions exist and the remote one is newer beyond tolerance.  The
   * local version wins and the remote one is kept as an artifact.
   */
  CONFLICT,

  /** Both sides agree within tolerance, or neither side has the file. */
  NO_OP

}
