/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

/** Command-line client: configuration, console, and shutdown handling. */
package org.torproject.davsync;
