/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.session;

/** Acknowledgment of a session start. */
public final class LoginResult {

  /** Whether the loop was started. */
  public enum Outcome {
    STARTED,
    FAILED
  }

  private final Outcome outcome;

  private final String message;

  private LoginResult(Outcome outcome, String message) {
    this.outcome = outcome;
    this.message = message;
  }

  static LoginResult started(String message) {
    return new LoginResult(Outcome.STARTED, message);
  }

  static LoginResult failed(String message) {
    return new LoginResult(Outcome.FAILED, message);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isStarted() {
    return Outcome.STARTED == outcome;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return outcome + ": " + message;
  }
}
