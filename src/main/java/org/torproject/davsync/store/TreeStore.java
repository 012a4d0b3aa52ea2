/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

import java.io.IOException;
import java.util.List;

/**
 * Operations shared by both replicas.  All paths are path keys as defined
 * by {@link TreePaths}.
 */
public interface TreeStore {

  /**
   * Lists the direct children of a directory.
   *
   * @param directory Directory key, {@link TreePaths#ROOT} for the root.
   * @return Children with full path keys.
   * @throws IOException Thrown if the listing itself fails.
   */
  List<TreeEntry> list(String directory) throws IOException;

  /**
   * Returns the entry at the given path, or {@code null} if there is none.
   */
  TreeEntry stat(String path) throws IOException;

  /** Reads the whole content of a file. */
  byte[] read(String path) throws IOException;

  /** Writes the whole content of a file, replacing any previous content. */
  void write(String path, byte[] content) throws IOException;

}
