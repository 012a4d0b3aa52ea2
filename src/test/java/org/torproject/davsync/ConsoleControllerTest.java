/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.torproject.davsync.conf.Configuration;
import org.torproject.davsync.reconcile.ConfirmationRequest;
import org.torproject.davsync.session.SessionManager;

import org.junit.Before;
import org.junit.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

public class ConsoleControllerTest {

  private ByteArrayOutputStream output;

  private ConfirmationRequest request = new ConfirmationRequest(
      "Delete local copies?", 12, Arrays.asList("docs/", "docs/a.txt"));

  @Before
  public void setUp() {
    output = new ByteArrayOutputStream();
  }

  private ConsoleController console(String input, boolean confirm) {
    ConsoleController console = new ConsoleController(
        new BufferedReader(new StringReader(input)),
        new PrintStream(output, true), confirm);
    console.attach(new SessionManager(new Configuration(),
        loginRequest -> {
          throw new java.io.IOException("offline");
        }, console, status -> { }));
    return console;
  }

  private String printed() {
    return new String(output.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test()
  public void testPromptIsAnswered() throws Exception {
    ConsoleController console = console("", true);
    CompletableFuture<Boolean> answer = console.confirm(request);
    assertThat(printed(), containsString("Delete local copies? (12 item(s))"));
    assertThat(printed(), containsString("  docs/a.txt"));
    assertThat(printed(), containsString("... and 10 more"));
    assertTrue(console.isPromptPending());
    assertTrue(console.handle("y"));
    assertTrue(answer.get());
    assertFalse(console.isPromptPending());
  }

  @Test()
  public void testDeclineFromInput() throws Exception {
    ConsoleController console = console("no\nquit\n", true);
    CompletableFuture<Boolean> answer = console.confirm(request);
    assertTrue("quit ends the console.", console.run());
    assertFalse(answer.get());
  }

  @Test()
  public void testAutomaticDecline() throws Exception {
    ConsoleController console = console("", false);
    assertFalse(console.confirm(request).get());
    assertFalse(console.isPromptPending());
  }

  @Test()
  public void testEndOfInputDeclinesPendingPrompt() throws Exception {
    ConsoleController console = console("", true);
    CompletableFuture<Boolean> answer = console.confirm(request);
    assertFalse(console.run());
    assertFalse(answer.get());
  }

  @Test()
  public void testCommandsWithoutSession() {
    ConsoleController console = console("", true);
    assertTrue(console.handle("retry"));
    assertThat(printed(), containsString("Not signed in."));
    assertTrue(console.handle("stop"));
    assertThat(printed(), containsString("Sync stopped."));
    assertTrue(console.handle("help"));
    assertThat(printed(), containsString(ConsoleController.HELP));
    assertTrue(console.handle("login"));
    assertThat(printed(), containsString("Cannot sign in"));
    assertFalse(console.handle("quit"));
  }
}
