/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.session;

/** Input of a session start. */
public final class LoginRequest {

  private final String serverAddress;

  private final String principal;

  private final String credential;

  private final int intervalMinutes;

  /** Creates a request; the interval must be positive. */
  public LoginRequest(String serverAddress, String principal,
      String credential, int intervalMinutes) {
    if (intervalMinutes <= 0) {
      throw new IllegalArgumentException("Interval must be positive: "
          + intervalMinutes);
    }
    this.serverAddress = serverAddress;
    this.principal = principal;
    this.credential = null == credential ? "" : credential;
    this.intervalMinutes = intervalMinutes;
  }

  public String getServerAddress() {
    return serverAddress;
  }

  public String getPrincipal() {
    return principal;
  }

  public String getCredential() {
    return credential;
  }

  public int getIntervalMinutes() {
    return intervalMinutes;
  }

  @Override
  public String toString() {
    return principal + "@" + serverAddress + " every " + intervalMinutes
        + " minute(s)";
  }
}
