/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

/**
 * Interval bookkeeping for the sync loop.
 *
 * <p>Every failed cycle increments a counter.  From the threshold on, each
 * further failure multiplies the current interval by the factor, up to the
 * maximum.  A successful cycle resets both counter and interval.</p>
 */
public class Backoff {

  public static final long MILLIS_IN_A_MINUTE = 60_000L;

  public static final int DEFAULT_THRESHOLD = 3;

  public static final int DEFAULT_FACTOR = 2;

  public static final long DEFAULT_MAX_MINUTES = 60L;

  private final long baseMillis;

  private final long maxMillis;

  private final int threshold;

  private final int factor;

  private long currentMillis;

  private int consecutiveFailures;

  /** Creates a backoff using the default threshold, factor, and cap. */
  public Backoff(long baseMinutes) {
    this(baseMinutes, DEFAULT_MAX_MINUTES, DEFAULT_THRESHOLD, DEFAULT_FACTOR);
  }

  /**
   * Creates a backoff with the given parameters.
   *
   * @param baseMinutes Regular interval.
   * @param maxMinutes Upper bound for the stretched interval.
   * @param threshold Consecutive failures before stretching.
   * @param factor Multiplier applied per failure from the threshold on.
   */
  public Backoff(long baseMinutes, long maxMinutes, int threshold,
      int factor) {
    if (baseMinutes < 1 || threshold < 1 || factor < 1) {
      throw new IllegalArgumentException("Invalid backoff parameters: base="
          + baseMinutes + ", threshold=" + threshold + ", factor=" + factor);
    }
    this.baseMillis = baseMinutes * MILLIS_IN_A_MINUTE;
    this.maxMillis = Math.max(maxMinutes * MILLIS_IN_A_MINUTE, baseMillis);
    this.threshold = threshold;
    this.factor = factor;
    this.currentMillis = baseMillis;
  }

  /**
   * Records a failed cycle.
   *
   * @return {@code true} if the interval changed and the ticker needs to be
   *     re-armed.
   */
  public synchronized boolean recordFailure() {
    consecutiveFailures++;
    if (consecutiveFailures < threshold) {
      return false;
    }
    long next = Math.min(currentMillis * factor, maxMillis);
    boolean changed = next != currentMillis;
    currentMillis = next;
    return changed;
  }

  /**
   * Records a successful cycle.
   *
   * @return {@code true} if the interval had been stretched and is now back
   *     at its base value.
   */
  public synchronized boolean recordSuccess() {
    consecutiveFailures = 0;
    boolean changed = currentMillis != baseMillis;
    currentMillis = baseMillis;
    return changed;
  }

  /** Forgets all failures. */
  public synchronized void reset() {
    consecutiveFailures = 0;
    currentMillis = baseMillis;
  }

  /** Tells whether enough failures accumulated to stretch the interval. */
  public synchronized boolean isDegraded() {
    return consecutiveFailures >= threshold;
  }

  public synchronized int getConsecutiveFailures() {
    return consecutiveFailures;
  }

  public int getThreshold() {
    return threshold;
  }

  public synchronized long getCurrentMillis() {
    return currentMillis;
  }

  public synchronized long getCurrentMinutes() {
    return currentMillis / MILLIS_IN_A_MINUTE;
  }
}
