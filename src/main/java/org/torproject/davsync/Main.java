/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync;

import org.torproject.davsync.conf.Configuration;
import org.torproject.davsync.conf.ConfigurationException;
import org.torproject.davsync.conf.Key;
import org.torproject.davsync.cron.ShutdownHook;
import org.torproject.davsync.session.LoginResult;
import org.torproject.davsync.session.SessionManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Main class for starting a DavSync instance.
 * <br>
 * Run without arguments in order to use {@code davsync.properties} in the
 * working directory, i.e.
 * <br>
 * <code>java -jar davsync.jar</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "davsync.properties";

  private static Configuration conf = new Configuration();

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) {
    Path confPath;
    if (args == null || args.length == 0) {
      confPath = Paths.get(CONF_FILE);
    } else if (args.length == 1) {
      confPath = Paths.get(args[0]);
    } else {
      printUsage("DavSync takes at most one argument.");
      return;
    }
    ConsoleController console;
    SessionManager sessionManager;
    LoginResult result;
    try {
      if (!confPath.toFile().exists() || confPath.toFile().length() < 1L) {
        writeDefaultConfig(confPath);
        return;
      }
      conf.loadAndCheckConfiguration(confPath);
      console = new ConsoleController(new BufferedReader(
          new InputStreamReader(System.in, StandardCharsets.UTF_8)),
          System.out, conf.getBool(Key.ConfirmDeletions));
      sessionManager = new SessionManager(conf,
          SessionManager.webDavStores(conf), console,
          new LoggingStatusListener());
      console.attach(sessionManager);
      result = sessionManager.login(sessionManager.configuredLogin());
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
      return;
    }
    if (!result.isStarted()) {
      System.out.println(result.getMessage()
          + "\nType 'login' to try again or 'quit' to exit.");
    }
    ShutdownHook shutdownHook = new ShutdownHook(sessionManager::shutdown);
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    Thread consoleThread = new Thread(() -> {
      if (console.run()) {
        System.exit(0);
      }
    }, "DavSync-Console");
    consoleThread.setDaemon(true);
    consoleThread.start();
    System.out.println(ConsoleController.HELP);
    shutdownHook.stayAlive();
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar davsync.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try (InputStream defaults = Main.class.getClassLoader()
        .getResourceAsStream(CONF_FILE)) {
      Files.copy(defaults, confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. A default configuration was "
          + "written to " + confPath + ". Set at least ServerUrl and "
          + "Username there and start again.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
