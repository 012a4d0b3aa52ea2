/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import java.io.IOException;

/** A walk over one of the trees was aborted as a whole. */
public class WalkException extends IOException {

  public WalkException(String msg, Throwable cause) {
    super(msg, cause);
  }

}
