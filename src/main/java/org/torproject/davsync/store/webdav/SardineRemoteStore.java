/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store.webdav;

import org.torproject.davsync.store.RemoteStore;
import org.torproject.davsync.store.RemoteStoreException;
import org.torproject.davsync.store.TreeEntry;
import org.torproject.davsync.store.TreePaths;

import com.github.sardine.DavResource;
import com.github.sardine.Sardine;
import com.github.sardine.SardineFactory;
import com.github.sardine.impl.SardineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Remote replica on a WebDAV server, accessed through a Sardine client.
 *
 * <p>Path keys are appended, segment by segment URL-encoded, to a base URL
 * such as {@code https://cloud.example.org/remote.php/dav/files/alice/}.</p>
 */
public class SardineRemoteStore implements RemoteStore {

  private static final Logger logger
      = LoggerFactory.getLogger(SardineRemoteStore.class);

  private final Sardine sardine;

  private final String baseUrl;

  private final String basePath;

  /**
   * Initialize with an existing client and the base URL of the remote tree.
   */
  public SardineRemoteStore(Sardine sardine, String baseUrl) {
    this.sardine = sardine;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    this.basePath = URI.create(this.baseUrl).getPath();
  }

  /**
   * Opens a client for the given account.
   *
   * @param serverAddress Server address, e.g.
   *     {@code https://cloud.example.org}.
   * @param principal User name.
   * @param credential Password.
   * @param davPathTemplate Path below the server address, {@code %s} being
   *     replaced by the encoded user name.
   */
  public static SardineRemoteStore open(String serverAddress, String principal,
      String credential, String davPathTemplate) {
    String server = serverAddress.trim().replaceAll("/+$", "");
    String davPath = String.format(davPathTemplate, encode(principal))
        .replaceAll("^/+", "");
    Sardine sardine = SardineFactory.begin(principal, credential);
    sardine.enablePreemptiveAuthentication(URI.create(server).getHost());
    return new SardineRemoteStore(sardine, server + "/" + davPath);
  }

  static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8)
        .replace("+", "%20");
  }

  String urlFor(String path, boolean directory) {
    String key = TreePaths.normalize(path);
    StringBuilder url = new StringBuilder(baseUrl);
    if (!key.isEmpty()) {
      String[] segments = key.split(TreePaths.SEPARATOR);
      for (int i = 0; i < segments.length; i++) {
        if (i > 0) {
          url.append('/');
        }
        url.append(encode(segments[i]));
      }
      if (directory) {
        url.append('/');
      }
    }
    return url.toString();
  }

  /** Turns the decoded href path of a resource into a path key. */
  String keyOf(DavResource resource) {
    String path = resource.getPath();
    if (path.startsWith(basePath)) {
      path = path.substring(basePath.length());
    } else if (basePath.startsWith(path)) {
      path = TreePaths.ROOT;
    }
    return TreePaths.normalize(path);
  }

  private TreeEntry toEntry(DavResource resource) {
    Date modified = resource.getModified();
    long modifyTime = null == modified ? 0L : modified.getTime();
    String key = keyOf(resource);
    return resource.isDirectory() ? TreeEntry.directory(key, modifyTime)
        : TreeEntry.file(key, modifyTime);
  }

  @Override
  public List<TreeEntry> list(String directory) throws IOException {
    String dirKey = TreePaths.normalize(directory);
    List<TreeEntry> entries = new ArrayList<>();
    try {
      for (DavResource resource : sardine.list(urlFor(dirKey, true), 1)) {
        TreeEntry entry = toEntry(resource);
        if (!entry.getPath().equals(dirKey)) { /* first entry is the dir */
          entries.add(entry);
        }
      }
    } catch (SardineException e) {
      throw translate("Listing", dirKey, e);
    }
    return entries;
  }

  @Override
  public TreeEntry stat(String path) throws IOException {
    try {
      List<DavResource> resources = sardine.list(urlFor(path, false), 0);
      return resources.isEmpty() ? null : toEntry(resources.get(0));
    } catch (SardineException e) {
      if (RemoteStoreException.NOT_FOUND == e.getStatusCode()) {
        return null;
      }
      throw translate("Stat of", path, e);
    }
  }

  @Override
  public byte[] read(String path) throws IOException {
    try (InputStream in = sardine.get(urlFor(path, false))) {
      return in.readAllBytes();
    } catch (SardineException e) {
      throw translate("Download of", path, e);
    }
  }

  @Override
  public void write(String path, byte[] content) throws IOException {
    try {
      sardine.put(urlFor(path, false), content);
    } catch (SardineException e) {
      throw translate("Upload of", path, e);
    }
  }

  @Override
  public void createDirectory(String directory) throws IOException {
    try {
      sardine.createDirectory(urlFor(directory, true));
    } catch (SardineException e) {
      throw translate("Creating directory", directory, e);
    }
  }

  @Override
  public void delete(String path) throws IOException {
    try {
      sardine.delete(urlFor(path, false));
    } catch (SardineException e) {
      throw translate("Deletion of", path, e);
    }
  }

  @Override
  public void copy(String source, String target) throws IOException {
    try {
      sardine.copy(urlFor(source, false), urlFor(target, false));
    } catch (SardineException e) {
      throw translate("Copying", source + " to " + target, e);
    }
  }

  private static RemoteStoreException translate(String action, String path,
      SardineException e) {
    return new RemoteStoreException(action + " " + path + " failed: "
        + e.getStatusCode() + " " + e.getResponsePhrase(), e.getStatusCode(),
        e);
  }

  @Override
  public String describe() {
    return baseUrl;
  }

  @Override
  public void close() throws IOException {
    logger.debug("Closing WebDAV client for {}.", baseUrl);
    sardine.shutdown();
  }
}
