/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

/** Receives status events; called on the thread that produced them. */
public interface StatusListener {

  void onStatus(SyncStatus status);

}
