/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import java.util.concurrent.CompletableFuture;

/**
 * Asks for consent to a batch of deletions.  The cycle waits for the
 * returned future, however long the answer takes.
 */
public interface ConfirmationGate {

  /**
   * Presents the request.
   *
   * @return Future completing with {@code true} to proceed, {@code false} to
   *     cancel.
   */
  CompletableFuture<Boolean> confirm(ConfirmationRequest request);

}
