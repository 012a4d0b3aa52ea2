/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

import java.io.IOException;

/** Capabilities of the local replica. */
public interface LocalStore extends TreeStore {

  /** Sets the last modification time of a file in millis. */
  void setModifyTime(String path, long modifyTime) throws IOException;

  /** Creates a directory and all missing parents. */
  void mkdirs(String directory) throws IOException;

  /** Deletes a file. */
  void deleteFile(String path) throws IOException;

  /**
   * Deletes a directory if it is empty.
   *
   * @return {@code true} if the directory was deleted, {@code false} if it
   *     still had children.
   */
  boolean deleteEmptyDirectory(String directory) throws IOException;

}
