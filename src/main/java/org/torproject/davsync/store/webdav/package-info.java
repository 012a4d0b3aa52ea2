/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

/** WebDAV implementation of the remote replica.
 * <p>HTTP failures reported by the client are translated into
 * {@code RemoteStoreException}s carrying the status code, so that callers
 * can tell missing resources from busy or unreachable servers.</p>
 */
package org.torproject.davsync.store.webdav;
