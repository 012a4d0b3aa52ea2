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

/**
 * Walks the remote tree and fetches files that are missing locally.  An
 * existing local file is never overwritten: a remote version newer beyond
 * tolerance is kept as a local conflict artifact instead.
 */
public class DownloadWalk {

  private static final Logger logger
      = LoggerFactory.getLogger(DownloadWalk.class);

  private final LocalStore local;

  private final RemoteStore remote;

  private final ConflictResolver resolver;

  /** Initialize with both replicas and the resolver deciding per file. */
  public DownloadWalk(LocalStore local, RemoteStore remote,
      ConflictResolver resolver) {
    this.local = local;
    this.remote = remote;
    this.resolver = resolver;
  }

  /**
   * Walks the whole remote tree as it is now.
   *
   * @throws WalkException Thrown if a listing fails or a transient failure
   *     occurs.
   */
  public void run(CycleContext ctx) throws WalkException {
    Deque<String> pending = new ArrayDeque<>();
    pending.push(TreePaths.ROOT);
    while (!pending.isEmpty()) {
      String directory = pending.pop();
      List<TreeEntry> children;
      try {
        children = remote.list(directory);
      } catch (IOException | RuntimeException e) {
        if (!directory.isEmpty() && FailureClassifier.isNotFound(e)) {
          logger.debug("Remote directory {} vanished during the walk.",
              directory);
          continue;
        }
        throw new WalkException("Cannot list remote directory '" + directory
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
            if (null == local.stat(path)) {
              local.mkdirs(path);
              logger.info("Created local directory {}.", path);
            }
          } catch (IOException | RuntimeException e) {
            ctx.itemFailed("create local directory", path, e);
          }
        } else {
          try {
            syncFile(child, ctx);
          } catch (IOException | RuntimeException e) {
            ctx.itemFailed("download", path, e);
          }
        }
      }
    }
  }

  private void syncFile(TreeEntry remoteEntry, CycleContext ctx)
      throws IOException {
    String path = remoteEntry.getPath();
    TreeEntry localEntry = local.stat(path);
    switch (resolver.decide(localEntry, remoteEntry)) {
      case DOWNLOAD:
        local.write(path, remote.read(path));
        if (remoteEntry.getModifyTime() > 0L) {
          local.setModifyTime(path, remoteEntry.getModifyTime());
        }
        ctx.downloaded(path);
        logger.info("Downloaded {}.", path);
        break;
      case CONFLICT:
        if (ctx.wasPreserved(path) || ctx.wasUploaded(path)) {
          logger.debug("Not preserving {} again, it was handled by the "
              + "upload walk.", path);
          break;
        }
        resolver.preserveLocally(remote, local, remoteEntry,
            ConflictOrigin.REMOTE);
        ctx.preserved(path);
        break;
      default:
        break;
    }
  }
}
