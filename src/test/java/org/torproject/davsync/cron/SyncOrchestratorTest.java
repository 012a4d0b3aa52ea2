/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.atomic.AtomicBoolean;

public class SyncOrchestratorTest {

  private Counter cycle;

  private ManualCycleScheduler scheduler;

  private RecordingStatusListener listener;

  private SyncOrchestrator orchestrator;

  /** Creates a started orchestrator with a 5 minute base interval. */
  @Before
  public void setUp() {
    cycle = new Counter();
    scheduler = new ManualCycleScheduler();
    listener = new RecordingStatusListener();
    orchestrator = new SyncOrchestrator(cycle, scheduler, new Backoff(5),
        listener);
    orchestrator.start();
  }

  @Test()
  public void testStartArmsWithImmediateFirstRun() {
    assertTrue(scheduler.isArmed());
    assertEquals(0L, scheduler.getLastInitialDelayMillis());
    assertEquals(5L, scheduler.getLastPeriodMinutes());
    scheduler.tick();
    assertEquals(1, cycle.getRuns());
    assertEquals(SyncStatus.Level.OK, listener.last().getLevel());
    assertFalse(orchestrator.isRunning());
  }

  @Test()
  public void testTickDroppedWhileCycleRuns() {
    final AtomicBoolean nestedTrigger = new AtomicBoolean(true);
    cycle.setDuringRun(() -> nestedTrigger.set(orchestrator.trigger()));
    scheduler.tick();
    assertFalse("Second cycle started while the first one ran.",
        nestedTrigger.get());
    assertEquals(1, cycle.getRuns());
    cycle.setDuringRun(null);
    assertTrue(orchestrator.trigger());
    assertEquals(2, cycle.getRuns());
  }

  @Test()
  public void testBackoffAfterRepeatedFailures() {
    for (int i = 0; i < 4; i++) {
      cycle.failWith(new ConnectException("Connection refused"));
    }
    scheduler.tick();
    assertEquals(SyncStatus.Level.WARNING, listener.last().getLevel());
    assertThat(listener.last().getMessage(),
        containsString("Server not reachable (attempt 1 of 3)"));
    scheduler.tick();
    assertEquals(SyncStatus.Level.WARNING, listener.last().getLevel());
    assertEquals(5L, scheduler.getLastPeriodMinutes());
    scheduler.tick();
    assertEquals(SyncStatus.Level.ERROR, listener.last().getLevel());
    assertThat(listener.last().getMessage(),
        containsString("sync slowed to 10 minutes"));
    assertEquals(10L, scheduler.getLastPeriodMinutes());
    scheduler.tick();
    assertEquals(20L, scheduler.getLastPeriodMinutes());
    scheduler.tick();
    assertEquals(SyncStatus.Level.OK, listener.last().getLevel());
    assertThat(listener.last().getMessage(),
        containsString("interval back to 5 minutes"));
    assertEquals(5L, scheduler.getLastPeriodMinutes());
    assertEquals(5, cycle.getRuns());
  }

  @Test()
  public void testNonTransientFailuresCountAsWell() {
    cycle.failWith(new IOException("Disk full"))
        .failWith(new IllegalStateException("Broken"))
        .failWith(new IOException("Disk full"));
    scheduler.tick();
    assertThat(listener.last().getMessage(),
        containsString("Sync failed (attempt 1 of 3): Disk full"));
    scheduler.tick();
    scheduler.tick();
    assertEquals(3, orchestrator.getBackoff().getConsecutiveFailures());
    assertEquals(10L, scheduler.getLastPeriodMinutes());
  }

  @Test()
  public void testRetryResetsBackoffAndRunsNow() {
    for (int i = 0; i < 3; i++) {
      cycle.failWith(new ConnectException("Connection refused"));
      scheduler.tick();
    }
    assertEquals(10L, scheduler.getLastPeriodMinutes());
    assertTrue(orchestrator.retry());
    assertEquals(0, orchestrator.getBackoff().getConsecutiveFailures());
    assertEquals(0L, scheduler.getLastInitialDelayMillis());
    assertEquals(5L, scheduler.getLastPeriodMinutes());
  }

  @Test()
  public void testStopRefusesFurtherCycles() {
    orchestrator.stop();
    assertTrue(orchestrator.isStopped());
    assertFalse(scheduler.isArmed());
    assertFalse(orchestrator.trigger());
    assertFalse(orchestrator.retry());
    assertEquals(0, cycle.getRuns());
  }

  @Test()
  public void testRetryBeforeStart() {
    SyncOrchestrator notStarted = new SyncOrchestrator(cycle,
        new ManualCycleScheduler(), new Backoff(5), listener);
    assertFalse(notStarted.retry());
  }

  @Test()
  public void testFinalUpload() {
    assertTrue(orchestrator.runFinalUpload());
    assertEquals(1, cycle.getUploadOnlyRuns());
  }

  @Test()
  public void testFinalUploadSkippedWhileCycleRuns() {
    final AtomicBoolean finalUpload = new AtomicBoolean(true);
    cycle.setDuringRun(() -> finalUpload.set(
        orchestrator.runFinalUpload()));
    scheduler.tick();
    assertFalse(finalUpload.get());
    assertEquals(0, cycle.getUploadOnlyRuns());
  }

  @Test()
  public void testBrokenListenerDoesNotStopTheLoop() {
    SyncOrchestrator withBrokenListener = new SyncOrchestrator(cycle,
        scheduler, new Backoff(5), status -> {
          throw new IllegalStateException("Listener broken");
        });
    withBrokenListener.start();
    scheduler.tick();
    scheduler.tick();
    assertEquals(2, cycle.getRuns());
    assertFalse(withBrokenListener.isRunning());
  }
}
