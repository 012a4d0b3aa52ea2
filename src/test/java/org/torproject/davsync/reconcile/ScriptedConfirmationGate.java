/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Answers prompts from a script, falling back to a default answer, and
 * records every request.
 */
public class ScriptedConfirmationGate implements ConfirmationGate {

  private final Deque<Boolean> answers = new ArrayDeque<>();

  private final List<ConfirmationRequest> requests = new ArrayList<>();

  private boolean defaultAnswer;

  public ScriptedConfirmationGate(boolean defaultAnswer) {
    this.defaultAnswer = defaultAnswer;
  }

  public ScriptedConfirmationGate thenAnswer(boolean answer) {
    answers.add(answer);
    return this;
  }

  public void setDefaultAnswer(boolean defaultAnswer) {
    this.defaultAnswer = defaultAnswer;
  }

  @Override
  public synchronized CompletableFuture<Boolean> confirm(
      ConfirmationRequest request) {
    requests.add(request);
    Boolean answer = answers.isEmpty() ? defaultAnswer : answers.poll();
    return CompletableFuture.completedFuture(answer);
  }

  public synchronized List<ConfirmationRequest> getRequests() {
    return new ArrayList<>(requests);
  }

  public synchronized int getPromptCount() {
    return requests.size();
  }
}
