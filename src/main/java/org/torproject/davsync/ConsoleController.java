/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync;

import org.torproject.davsync.conf.ConfigurationException;
import org.torproject.davsync.reconcile.ConfirmationGate;
import org.torproject.davsync.reconcile.ConfirmationRequest;
import org.torproject.davsync.session.LoginResult;
import org.torproject.davsync.session.SessionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads commands from the console and answers deletion prompts there.
 *
 * <p>While a prompt is pending, {@code y} or {@code n} answers it.  Other
 * lines are commands: {@code retry}, {@code stop}, {@code login},
 * {@code quit}.</p>
 */
public class ConsoleController implements ConfirmationGate {

  private static final Logger logger
      = LoggerFactory.getLogger(ConsoleController.class);

  static final String HELP = "Commands: retry | stop | login | quit";

  private final BufferedReader in;

  private final PrintStream out;

  private final boolean confirmDeletions;

  private final AtomicReference<CompletableFuture<Boolean>> pending
      = new AtomicReference<>();

  private SessionManager sessionManager;

  /**
   * Initialize with console streams.
   *
   * @param confirmDeletions If {@code false}, every deletion batch is
   *     declined without asking.
   */
  public ConsoleController(BufferedReader in, PrintStream out,
      boolean confirmDeletions) {
    this.in = in;
    this.out = out;
    this.confirmDeletions = confirmDeletions;
  }

  /** Sets the manager receiving console commands. */
  public void attach(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  public CompletableFuture<Boolean> confirm(ConfirmationRequest request) {
    if (!confirmDeletions) {
      logger.info("Declining without asking: {}", request);
      return CompletableFuture.completedFuture(false);
    }
    CompletableFuture<Boolean> answer = new CompletableFuture<>();
    CompletableFuture<Boolean> previous = pending.getAndSet(answer);
    if (null != previous) {
      previous.complete(false);
    }
    synchronized (out) {
      out.println(request.getTitle() + " (" + request.getTotal()
          + " item(s))");
      for (String path : request.getPreview()) {
        out.println("  " + path);
      }
      if (request.getTotal() > request.getPreview().size()) {
        out.println("  ... and " + (request.getTotal()
            - request.getPreview().size()) + " more");
      }
      out.println("Proceed? [y/n]");
    }
    return answer;
  }

  /**
   * Processes console lines until {@code quit} or the end of input.
   *
   * @return {@code true} if {@code quit} was entered.
   */
  public boolean run() {
    String line;
    try {
      while (null != (line = in.readLine())) {
        if (!handle(line.trim().toLowerCase(Locale.ROOT))) {
          return true;
        }
      }
    } catch (IOException e) {
      logger.warn("Cannot read from console; no more commands.", e);
    }
    declinePending();
    return false;
  }

  /** Handles one line; returns {@code false} on quit. */
  boolean handle(String command) {
    if (command.isEmpty()) {
      return true;
    }
    CompletableFuture<Boolean> answer = pending.get();
    if (null != answer) {
      if ("y".equals(command) || "yes".equals(command)) {
        pending.compareAndSet(answer, null);
        answer.complete(true);
        return true;
      } else if ("n".equals(command) || "no".equals(command)) {
        pending.compareAndSet(answer, null);
        answer.complete(false);
        return true;
      }
    }
    switch (command) {
      case "retry":
        if (!sessionManager.retry()) {
          out.println("Not signed in.");
        }
        break;
      case "stop":
        declinePending();
        sessionManager.logout();
        out.println("Sync stopped.");
        break;
      case "login":
        declinePending();
        login();
        break;
      case "quit":
        declinePending();
        return false;
      default:
        out.println(HELP);
        break;
    }
    return true;
  }

  private void login() {
    try {
      LoginResult result = sessionManager.login(
          sessionManager.configuredLogin());
      out.println(result.getMessage());
    } catch (ConfigurationException e) {
      out.println("Cannot sign in: " + e.getMessage());
    }
  }

  private void declinePending() {
    CompletableFuture<Boolean> answer = pending.getAndSet(null);
    if (null != answer) {
      answer.complete(false);
    }
  }

  /** Tells whether a prompt awaits an answer. */
  boolean isPromptPending() {
    return null != pending.get();
  }
}
