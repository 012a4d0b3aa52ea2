/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store.local;

import org.torproject.davsync.store.LocalStore;
import org.torproject.davsync.store.TreeEntry;
import org.torproject.davsync.store.TreePaths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Local replica rooted at a directory of the default file system.
 *
 * <p>Symbolic links below the root are not part of the replica: they are
 * neither listed nor followed, and nothing is written, modified, or deleted
 * through them.</p>
 */
public class FileSystemLocalStore implements LocalStore {

  private static final Logger logger
      = LoggerFactory.getLogger(FileSystemLocalStore.class);

  private final Path root;

  /** Initialize with the root directory of the local replica. */
  public FileSystemLocalStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  /**
   * Resolves a path key below the root, refusing keys that would leave it.
   */
  Path resolve(String key) {
    Path resolved = root.resolve(TreePaths.normalize(key)).normalize();
    if (!resolved.startsWith(root)) {
      throw new IllegalArgumentException("Path escapes local root: " + key);
    }
    return resolved;
  }

  /**
   * Resolves a path key for modification, refusing keys whose nearest
   * existing ancestor, or the target itself, leads outside the root.
   */
  Path confined(String key) throws IOException {
    Path target = resolve(key);
    if (!isConfined(target)) {
      throw new IOException("Refusing to touch '" + key + "', it leads "
          + "outside the local root " + root + ".");
    }
    return target;
  }

  private boolean isConfined(Path target) throws IOException {
    Path existing = target;
    while (null != existing
        && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
      existing = existing.getParent();
    }
    return null != existing
        && existing.toRealPath().startsWith(root.toRealPath());
  }

  @Override
  public List<TreeEntry> list(String directory) throws IOException {
    List<TreeEntry> entries = new ArrayList<>();
    try (DirectoryStream<Path> children
        = Files.newDirectoryStream(resolve(directory))) {
      for (Path child : children) {
        String key = TreePaths.join(directory, child.getFileName().toString());
        TreeEntry entry = toEntry(key, child);
        if (null != entry) {
          entries.add(entry);
        }
      }
    }
    return entries;
  }

  @Override
  public TreeEntry stat(String path) throws IOException {
    Path file = resolve(path);
    Path parent = file.getParent();
    if (!file.equals(root) && null != parent && Files.exists(parent)
        && !isConfined(parent)) {
      logger.debug("Ignoring {}, it lies behind a symbolic link.", file);
      return null;
    }
    return toEntry(TreePaths.normalize(path), file);
  }

  private TreeEntry toEntry(String key, Path file) throws IOException {
    BasicFileAttributes attributes;
    try {
      attributes = key.isEmpty()
          ? Files.readAttributes(file, BasicFileAttributes.class)
          : Files.readAttributes(file, BasicFileAttributes.class,
              LinkOption.NOFOLLOW_LINKS);
    } catch (NoSuchFileException e) {
      return null;
    }
    if (attributes.isSymbolicLink()) {
      logger.debug("Ignoring symbolic link {}.", file);
      return null;
    }
    long modified = attributes.lastModifiedTime().toMillis();
    if (attributes.isDirectory()) {
      return TreeEntry.directory(key, modified);
    } else if (attributes.isRegularFile()) {
      return TreeEntry.file(key, modified);
    }
    logger.debug("Ignoring {}, neither regular file nor directory.", file);
    return null;
  }

  @Override
  public byte[] read(String path) throws IOException {
    return Files.readAllBytes(confined(path));
  }

  @Override
  public void write(String path, byte[] content) throws IOException {
    Path target = confined(path);
    Files.createDirectories(target.getParent());
    Files.write(target, content);
  }

  @Override
  public void setModifyTime(String path, long modifyTime) throws IOException {
    Files.setLastModifiedTime(confined(path), FileTime.fromMillis(modifyTime));
  }

  @Override
  public void mkdirs(String directory) throws IOException {
    Files.createDirectories(confined(directory));
  }

  @Override
  public void deleteFile(String path) throws IOException {
    Path target = confined(path);
    if (Files.isDirectory(target)) {
      throw new IOException("Not a file: " + path);
    }
    Files.delete(target);
  }

  @Override
  public boolean deleteEmptyDirectory(String directory) throws IOException {
    Path target = resolve(directory);
    if (target.equals(root)) {
      throw new IOException("Refusing to delete the local root.");
    }
    confined(directory);
    if (!Files.isDirectory(target)) {
      throw new IOException("Not a directory: " + directory);
    }
    try {
      Files.delete(target);
      return true;
    } catch (DirectoryNotEmptyException e) {
      return false;
    }
  }

  @Override
  public String toString() {
    return root.toString();
  }
}
