/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

/**
 * Decides per path whether to upload, download, preserve, or delete, and
 * runs these decisions as one cycle over both replicas.
 */
package org.torproject.davsync.reconcile;
