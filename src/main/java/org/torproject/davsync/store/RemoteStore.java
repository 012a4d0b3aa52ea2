/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

import java.io.Closeable;
import java.io.IOException;

/** Capabilities of the remote replica. */
public interface RemoteStore extends TreeStore, Closeable {

  /** Creates a single directory whose parent exists. */
  void createDirectory(String directory) throws IOException;

  /** Deletes a file or a directory. */
  void delete(String path) throws IOException;

  /** Copies a file on the server without transferring its content. */
  void copy(String source, String target) throws IOException;

  /** Describes the remote end for log messages. */
  String describe();

}
