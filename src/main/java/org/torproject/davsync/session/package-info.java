/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

/** Login, logout, and shutdown of sync sessions. */
package org.torproject.davsync.session;
