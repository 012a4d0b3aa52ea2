/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import org.torproject.davsync.store.FailureClassifier;
import org.torproject.davsync.store.LocalStore;
import org.torproject.davsync.store.RemoteStore;
import org.torproject.davsync.store.TreeEntry;
import org.torproject.davsync.store.TreePaths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Walks the local tree and pushes new and locally newer files to the remote
 * replica, creating missing remote directories on the way.
 */
public class UploadWalk {

  private static final Logger logger
      = LoggerFactory.getLogger(UploadWalk.class);

  private final LocalStore local;

  private final RemoteStore remote;

  private final ConflictResolver resolver;

  /** Initialize with both replicas and the resolver deciding per file. */
  public UploadWalk(LocalStore local, RemoteStore remote,
      ConflictResolver resolver) {
    this.local = local;
    this.remote = remote;
    this.resolver = resolver;
  }

  /**
   * Walks the whole local tree.
   *
   * @param remoteTree Remote snapshot taken at the start of the cycle.
   * @return All local files seen during the walk.
   * @throws WalkException Thrown if a listing fails or a transient failure
   *     occurs.
   */
  public SortedSet<String> run(TreeSnapshot remoteTree, CycleContext ctx)
      throws WalkException {
    SortedSet<String> observed = new TreeSet<>();
    Deque<String> pending = new ArrayDeque<>();
    pending.push(TreePaths.ROOT);
    while (!pending.isEmpty()) {
      String directory = pending.pop();
      List<TreeEntry> children;
      try {
        children = local.list(directory);
      } catch (IOException | RuntimeException e) {
        if (!directory.isEmpty() && FailureClassifier.isNotFound(e)) {
          logger.debug("Local directory {} vanished during the walk.",
              directory);
          continue;
        }
        throw new WalkException("Cannot list local directory '" + directory
            + "': " + e.getMessage(), e);
      }
      for (TreeEntry child : children) {
        String path = child.getPath();
        if (ConflictNames.isConflictPath(path)) {
          continue;
        }
        if (child.isDirectory()) {
          pending.push(path);
          try {
            ensureRemoteDirectory(path, ctx);
          } catch (IOException | RuntimeException e) {
            ctx.itemFailed("create remote directory", path, e);
          }
        } else {
          observed.add(path);
          try {
            syncFile(child, remoteTree.file(path), ctx);
          } catch (IOException | RuntimeException e) {
            ctx.itemFailed("upload", path, e);
          }
        }
      }
    }
    return observed;
  }

  private void ensureRemoteDirectory(String directory, CycleContext ctx)
      throws IOException {
    if (ctx.isKnownRemoteDirectory(directory)) {
      return;
    }
    String parent = TreePaths.parent(directory);
    if (!parent.isEmpty()) {
      ensureRemoteDirectory(parent, ctx);
    }
    remote.createDirectory(directory);
    ctx.rememberRemoteDirectory(directory);
    logger.info("Created remote directory {}.", directory);
  }

  private void syncFile(TreeEntry localEntry, TreeEntry remoteEntry,
      CycleContext ctx) throws IOException {
    String path = localEntry.getPath();
    switch (resolver.decide(localEntry, remoteEntry)) {
      case CONFLICT:
        resolver.preserveOnRemote(remote, path, ConflictOrigin.LOCAL);
        ctx.preserved(path);
        upload(path, ctx);
        break;
      case UPLOAD:
        upload(path, ctx);
        break;
      default:
        break;
    }
  }

  private void upload(String path, CycleContext ctx) throws IOException {
    remote.write(path, local.read(path));
    ctx.uploaded(path);
    logger.info("Uploaded {}.", path);
    try {
      TreeEntry written = remote.stat(path);
      if (null == written || written.getModifyTime() <= 0L) {
        logger.debug("Server reports no modification time for {}; keeping "
            + "the local one.", path);
      } else {
        local.setModifyTime(path, written.getModifyTime());
      }
    } catch (IOException | RuntimeException e) {
      logger.warn("Uploaded {}, but could not align its local modification "
          + "time.", path, e);
    }
  }
}
