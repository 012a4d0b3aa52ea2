/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.conf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;

public class ConfigurationTest {

  private Random randomSource = new Random();

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  @Test()
  public void testKeyCount() throws Exception {
    assertEquals("The number of properties keys in enum Key changed."
        + "\n This test class should be adapted.",
        14, Key.values().length);
  }

  @Test()
  public void testDefaultPropertiesCoverAllKeys() throws Exception {
    Configuration conf = new Configuration();
    try (InputStream defaults = getClass().getClassLoader()
        .getResourceAsStream("davsync.properties")) {
      conf.load(defaults);
    }
    for (Key key : Key.values()) {
      assertTrue("Missing default for " + key,
          conf.getPropertiesCopy().containsKey(key.name()));
    }
    for (String name : conf.getPropertiesCopy().stringPropertyNames()) {
      assertTrue("Unknown key " + name, Key.has(name));
    }
    assertEquals(5, conf.getInt(Key.SyncIntervalMinutes));
    assertEquals(2000L, conf.getLong(Key.TimestampToleranceMillis));
    assertTrue(conf.getBool(Key.ConfirmDeletions));
  }

  @Test()
  public void testConfiguration() throws Exception {
    Configuration conf = new Configuration();
    String val = "xyz";
    conf.setProperty(Key.Username.name(), val);
    assertEquals(1, conf.size());
    assertEquals(val, conf.getProperty(Key.Username.name()));
    assertEquals(val, conf.getString(Key.Username));
  }

  private String propLine(Key key, String val) {
    return key.name() + " = " + val + "\n";
  }

  @Test()
  public void testBoolValues() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.ConfirmDeletions.name(), "trUe");
    assertTrue(conf.getBool(Key.ConfirmDeletions));
    conf.setProperty(Key.ConfirmDeletions.name(), "false");
    assertFalse(conf.getBool(Key.ConfirmDeletions));
  }

  @Test()
  public void testIntValues() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.MaxSyncIntervalMinutes.name(), "inf");
    assertEquals(Integer.MAX_VALUE,
        conf.getInt(Key.MaxSyncIntervalMinutes));
    int randomInt = randomSource.nextInt(Integer.MAX_VALUE);
    conf.clear();
    conf.load(new ByteArrayInputStream(
        propLine(Key.SyncIntervalMinutes, "" + randomInt).getBytes()));
    assertEquals(randomInt, conf.getInt(Key.SyncIntervalMinutes));
  }

  @Test()
  public void testFileValues() throws Exception {
    String[] files = new String[] { "/the/path/ledger.json", "another/path"};
    Configuration conf = new Configuration();
    for (String file : files) {
      conf.clear();
      conf.setProperty(Key.LedgerPath.name(), file);
      assertEquals(new File(file), conf.getPath(Key.LedgerPath).toFile());
    }
  }

  @Test()
  public void testHomeRelativePath() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.LocalRoot.name(), "~/Nextcloud-Temp");
    assertEquals(Paths.get(System.getProperty("user.home"),
        "Nextcloud-Temp"), conf.getPath(Key.LocalRoot));
  }

  @Test()
  public void testUrlValue() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.ServerUrl.name(), " https://cloud.example.org ");
    assertEquals(new URL("https://cloud.example.org"),
        conf.getUrl(Key.ServerUrl));
  }

  @Test(expected = ConfigurationException.class)
  public void testBoolValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.Username.name(), "someone");
    conf.getBool(Key.Username);
  }

  @Test(expected = ConfigurationException.class)
  public void testPathValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.LocalRoot.name(), "\\\u0000:");
    conf.getPath(Key.LocalRoot);
  }

  @Test(expected = ConfigurationException.class)
  public void testUrlValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.ServerUrl.name(), "xxx://y.y.y");
    conf.getUrl(Key.ServerUrl);
  }

  @Test(expected = ConfigurationException.class)
  public void testIntValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.SyncIntervalMinutes.name(), "y7");
    conf.getInt(Key.SyncIntervalMinutes);
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingValueException() throws Exception {
    new Configuration().getLong(Key.ShutdownUploadTimeoutSeconds);
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingFile() throws Exception {
    new Configuration().loadAndCheckConfiguration(
        Paths.get("/tmp/phantom.path"));
  }

  @Test(expected = ConfigurationException.class)
  public void testNoAccountConfigured() throws Exception {
    Path confFile = tmpf.newFile("davsync.properties").toPath();
    Files.write(confFile, (propLine(Key.ServerUrl, "https://x.y")
        + propLine(Key.Username, "")).getBytes());
    new Configuration().loadAndCheckConfiguration(confFile);
  }

  @Test()
  public void testAccountConfigured() throws Exception {
    Path confFile = tmpf.newFile("davsync.properties").toPath();
    Files.write(confFile, (propLine(Key.ServerUrl, "https://x.y")
        + propLine(Key.Username, "alex")).getBytes());
    Configuration conf = new Configuration();
    conf.loadAndCheckConfiguration(confFile);
    assertEquals("alex", conf.getString(Key.Username));
  }
}
