/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

import org.apache.http.NoHttpResponseException;

import java.io.FileNotFoundException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;

/**
 * Maps failures to a {@link FailureKind} by inspecting the whole cause
 * chain.
 */
public final class FailureClassifier {

  private FailureClassifier() { /* static helpers only */ }

  /** Classifies the given failure. */
  public static FailureKind classify(Throwable failure) {
    Throwable cause = failure;
    int depth = 0;
    while (null != cause && depth++ < 32) {
      if (cause instanceof RemoteStoreException) {
        RemoteStoreException rse = (RemoteStoreException) cause;
        if (rse.isNotFound()) {
          return FailureKind.NOT_FOUND;
        } else if (rse.isServerBusy()) {
          return FailureKind.TRANSIENT;
        }
      } else if (cause instanceof NoSuchFileException
          || cause instanceof FileNotFoundException) {
        return FailureKind.NOT_FOUND;
      } else if (cause instanceof ConnectException
          || cause instanceof NoRouteToHostException
          || cause instanceof UnknownHostException
          || cause instanceof SocketException
          || cause instanceof InterruptedIOException
          || cause instanceof NoHttpResponseException) {
        return FailureKind.TRANSIENT;
      }
      cause = cause.getCause();
    }
    return FailureKind.ITEM;
  }

  public static boolean isTransient(Throwable failure) {
    return FailureKind.TRANSIENT == classify(failure);
  }

  public static boolean isNotFound(Throwable failure) {
    return FailureKind.NOT_FOUND == classify(failure);
  }
}
