/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

/** Capability interfaces over the two replicas.
 * <p>The reconciliation engine only talks to {@code LocalStore} and
 * {@code RemoteStore}; concrete implementations live in the
 * {@code local} and {@code webdav} subpackages.</p>
 */
package org.torproject.davsync.store;
