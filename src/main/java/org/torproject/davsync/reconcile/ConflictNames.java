/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import org.torproject.davsync.store.TreePaths;
import org.torproject.davsync.store.TreeStore;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Naming of conflict artifacts.
 *
 * <p>An artifact of {@code docs/report.txt} is named like
 * {@code docs/report.conflict-remote-20240101-120000.txt}, optionally
 * followed by {@code -2}, {@code -3}, etc. before the extension if that name
 * is taken.  Any path containing {@link #MARKER} is excluded from
 * synchronization.</p>
 */
public final class ConflictNames {

  public static final String MARKER = ".conflict-";

  private static final int MAX_DISAMBIGUATOR = 1000;

  private static final DateTimeFormatter timestampFormatter = DateTimeFormatter
      .ofPattern("uuuuMMdd-HHmmss").withZone(ZoneOffset.UTC);

  private ConflictNames() { /* static helpers only */ }

  /** Tells whether the path or one of its ancestors is conflict-marked. */
  public static boolean isConflictPath(String path) {
    return null != path && path.contains(MARKER);
  }

  /**
   * Builds the artifact path for the given original.
   *
   * @param path Path key of the original file.
   * @param origin Walk that detected the divergence.
   * @param when Detection time.
   * @param disambiguator Zero for the plain name, a positive number
   *     otherwise.
   */
  public static String artifactPath(String path, ConflictOrigin origin,
      Instant when, int disambiguator) {
    String name = TreePaths.name(path);
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String extension = dot > 0 ? name.substring(dot) : "";
    StringBuilder sb = new StringBuilder(stem).append(MARKER)
        .append(origin.tag()).append('-')
        .append(timestampFormatter.format(when));
    if (disambiguator > 0) {
      sb.append('-').append(disambiguator);
    }
    sb.append(extension);
    return TreePaths.join(TreePaths.parent(path), sb.toString());
  }

  /**
   * Returns the first artifact path not yet taken in the given store.
   */
  public static String uniqueArtifactPath(TreeStore store, String path,
      ConflictOrigin origin, Instant when) throws IOException {
    for (int i = 0; i < MAX_DISAMBIGUATOR; i++) {
      String candidate = artifactPath(path, origin, when, i == 0 ? 0 : i + 1);
      if (null == store.stat(candidate)) {
        return candidate;
      }
    }
    throw new IOException("No free conflict artifact name for " + path);
  }
}
