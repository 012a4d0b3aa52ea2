/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.session;

import org.torproject.davsync.store.RemoteStore;

import java.io.IOException;

/** Opens the remote replica for a login. */
@FunctionalInterface
public interface RemoteStoreFactory {

  RemoteStore open(LoginRequest request) throws IOException;

}
