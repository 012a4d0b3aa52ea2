/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

/** Classes of failures raised by store operations. */
public enum FailureKind {

  /** Server unreachable, timed out, busy, or locked; retry later. */
  TRANSIENT,

  /** Entity missing on one side; an expected outcome. */
  NOT_FOUND,

  /** Anything else, confined to the item being processed. */
  ITEM

}
