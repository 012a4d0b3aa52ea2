/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.cron;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class CycleSchedulerTest {

  private CycleScheduler scheduler = new CycleScheduler();

  @After
  public void tearDown() {
    scheduler.shutdownScheduler(1L);
  }

  @Test()
  public void testArmedTaskRunsRepeatedly() throws Exception {
    final CountDownLatch ticks = new CountDownLatch(3);
    scheduler.arm(ticks::countDown, 0L, 10L);
    assertTrue(scheduler.isArmed());
    assertTrue(ticks.await(5, TimeUnit.SECONDS));
    scheduler.cancel();
    assertFalse(scheduler.isArmed());
  }

  @Test()
  public void testWorkerThreadsAreNamedDaemons() throws Exception {
    final CountDownLatch done = new CountDownLatch(1);
    final StringBuilder name = new StringBuilder();
    final boolean[] daemon = new boolean[1];
    scheduler.execute(() -> {
      name.append(Thread.currentThread().getName());
      daemon[0] = Thread.currentThread().isDaemon();
      done.countDown();
    });
    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertTrue(name.toString().startsWith("DavSync-Cycle-Thread-"));
    assertTrue(daemon[0]);
  }

  @Test()
  public void testRunDetached() throws Exception {
    Future<Integer> future = scheduler.runDetached(() -> 42);
    assertEquals(Integer.valueOf(42), future.get(5, TimeUnit.SECONDS));
  }
}
