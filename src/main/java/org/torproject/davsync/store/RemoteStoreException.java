/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.store;

import java.io.IOException;

/**
 * Server answered a request with an unexpected HTTP status.
 */
public class RemoteStoreException extends IOException {

  public static final int NOT_FOUND = 404;

  public static final int LOCKED = 423;

  private final int statusCode;

  public RemoteStoreException(String msg, int statusCode) {
    super(msg);
    this.statusCode = statusCode;
  }

  public RemoteStoreException(String msg, int statusCode, Throwable cause) {
    super(msg, cause);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isNotFound() {
    return NOT_FOUND == statusCode;
  }

  /** Server-side trouble worth retrying later: 5xx and 423 Locked. */
  public boolean isServerBusy() {
    return statusCode >= 500 || LOCKED == statusCode;
  }
}
