/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

/** Durable baseline of mutually present files.
 * <p>The baseline is what lets a cycle tell a deleted file from one that
 * never existed on the other side.</p>
 */
package org.torproject.davsync.ledger;
