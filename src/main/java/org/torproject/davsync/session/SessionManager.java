/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.session;

import org.torproject.davsync.conf.Configuration;
import org.torproject.davsync.conf.ConfigurationException;
import org.torproject.davsync.conf.Key;
import org.torproject.davsync.cron.StatusListener;
import org.torproject.davsync.cron.SyncStatus;
import org.torproject.davsync.reconcile.ConfirmationGate;
import org.torproject.davsync.store.RemoteStore;
import org.torproject.davsync.store.TreePaths;
import org.torproject.davsync.store.local.FileSystemLocalStore;
import org.torproject.davsync.store.webdav.SardineRemoteStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts and stops sync sessions.  At most one session is active at a
 * time.
 */
public class SessionManager {

  private static final Logger logger
      = LoggerFactory.getLogger(SessionManager.class);

  private final Configuration config;

  private final RemoteStoreFactory remoteStoreFactory;

  private final ConfirmationGate gate;

  private final StatusListener listener;

  private SyncSession session;

  /** Initialize with everything that outlives a single session. */
  public SessionManager(Configuration config,
      RemoteStoreFactory remoteStoreFactory, ConfirmationGate gate,
      StatusListener listener) {
    this.config = config;
    this.remoteStoreFactory = remoteStoreFactory;
    this.gate = gate;
    this.listener = listener;
  }

  /** Returns a factory opening WebDAV stores as configured. */
  public static RemoteStoreFactory webDavStores(Configuration config) {
    return request -> {
      try {
        return SardineRemoteStore.open(request.getServerAddress(),
            request.getPrincipal(), request.getCredential(),
            config.getString(Key.DavPathTemplate));
      } catch (ConfigurationException | RuntimeException e) {
        throw new IOException("Cannot open remote store: " + e.getMessage(),
            e);
      }
    };
  }

  /** Builds a login request from the configured account. */
  public LoginRequest configuredLogin() throws ConfigurationException {
    return new LoginRequest(config.getUrl(Key.ServerUrl).toString(),
        config.getString(Key.Username),
        config.getProperty(Key.Password.name(), ""),
        config.getInt(Key.SyncIntervalMinutes));
  }

  /**
   * Checks the remote root and, on success, starts a new sync loop,
   * replacing any active session.
   */
  public synchronized LoginResult login(LoginRequest request) {
    logout();
    SessionSettings settings;
    try {
      settings = new SessionSettings(config);
    } catch (ConfigurationException e) {
      return fail("Configuration problem: " + e.getMessage(), e);
    }
    RemoteStore remote;
    try {
      remote = remoteStoreFactory.open(request);
    } catch (IOException | RuntimeException e) {
      return fail("Cannot connect to " + request.getServerAddress() + ": "
          + e.getMessage(), e);
    }
    try {
      remote.list(TreePaths.ROOT);
    } catch (IOException | RuntimeException e) {
      closeQuietly(remote);
      return fail("Login to " + remote.describe() + " failed: "
          + e.getMessage(), e);
    }
    try {
      Files.createDirectories(settings.localRoot);
    } catch (IOException e) {
      closeQuietly(remote);
      return fail("Cannot create local folder " + settings.localRoot + ": "
          + e.getMessage(), e);
    }
    try {
      session = SyncSession.create(settings,
          new FileSystemLocalStore(settings.localRoot), remote, gate,
          listener, request.getIntervalMinutes());
    } catch (RuntimeException e) {
      closeQuietly(remote);
      return fail("Cannot set up sync: " + e.getMessage(), e);
    }
    session.getOrchestrator().start();
    String message = "Signed in to " + remote.describe() + "; syncing "
        + settings.localRoot + " every " + request.getIntervalMinutes()
        + " minute(s).";
    logger.info(message);
    publish(SyncStatus.ok(message));
    return LoginResult.started(message);
  }

  private LoginResult fail(String message, Exception cause) {
    logger.warn(message, cause);
    publish(SyncStatus.error(message));
    return LoginResult.failed(message);
  }

  private static void closeQuietly(RemoteStore remote) {
    try {
      remote.close();
    } catch (IOException e) {
      logger.debug("Ignoring failure to close {}.", remote.describe(), e);
    }
  }

  private void publish(SyncStatus status) {
    try {
      listener.onStatus(status);
    } catch (RuntimeException e) {
      logger.warn("Status listener failed for '{}'.", status, e);
    }
  }

  /** Stops the loop and drops the session; does nothing without one. */
  public synchronized void logout() {
    if (null == session) {
      return;
    }
    SyncSession closing = session;
    session = null;
    closing.close();
    logger.info("Signed out from {}.", closing.getRemote().describe());
  }

  /**
   * Resets the backoff and runs a cycle now.
   *
   * @return {@code false} if there is no active session.
   */
  public synchronized boolean retry() {
    if (null == session) {
      logger.info("Not signed in; nothing to retry.");
      return false;
    }
    return session.getOrchestrator().retry();
  }

  public synchronized boolean isActive() {
    return null != session;
  }

  synchronized SyncSession getSession() {
    return session;
  }

  /**
   * Stops the loop, makes one upload pass bounded by the configured
   * timeout, and logs out.
   */
  public synchronized void shutdown() {
    if (null == session) {
      return;
    }
    session.getOrchestrator().stop();
    long timeoutSeconds;
    try {
      timeoutSeconds = new SessionSettings(config).finalUploadTimeoutSeconds;
    } catch (ConfigurationException e) {
      logger.warn("Cannot read final upload timeout; skipping the final "
          + "upload.", e);
      logout();
      return;
    }
    Future<Boolean> finalUpload = session.getScheduler().runDetached(
        session.getOrchestrator()::runFinalUpload);
    try {
      finalUpload.get(timeoutSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      finalUpload.cancel(true);
      logger.warn("Final upload did not finish within {} seconds; "
          + "abandoned.", timeoutSeconds);
    } catch (InterruptedException e) {
      finalUpload.cancel(true);
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      logger.warn("Final upload failed.", e.getCause());
    }
    logout();
  }
}
