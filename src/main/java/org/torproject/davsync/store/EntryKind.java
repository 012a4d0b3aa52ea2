/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

public enum EntryKind {
  FILE,
  DIRECTORY
}
