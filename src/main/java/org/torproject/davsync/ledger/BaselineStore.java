/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.ledger;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Durable home of the {@link BaselineLedger}.
 *
 * <p>Loading never fails: a missing, unreadable, or unparseable file yields an
 * empty ledger, which makes the next cycle treat every path as newly
 * discovered.  Saving writes a temporary sibling file first and then moves it
 * over the previous ledger.</p>
 */
public class BaselineStore {

  private static final Logger logger
      = LoggerFactory.getLogger(BaselineStore.class);

  private static final String TEMP_SUFFIX = ".tmp";

  private static ObjectMapper objectMapper = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT)
      .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

  private final Path ledgerPath;

  public BaselineStore(Path ledgerPath) {
    this.ledgerPath = ledgerPath;
  }

  public Path getLedgerPath() {
    return ledgerPath;
  }

  /**
   * Reads the ledger, substituting an empty one for anything unusable.
   */
  public BaselineLedger load() {
    BaselineLedger ledger = new BaselineLedger();
    if (!Files.exists(ledgerPath)) {
      logger.info("No ledger at {} yet; starting with an empty one.",
          ledgerPath);
      return ledger;
    }
    LedgerDocument document;
    try {
      document = objectMapper.readValue(ledgerPath.toFile(),
          LedgerDocument.class);
    } catch (IOException | RuntimeException e) {
      logger.warn("Ignoring unreadable ledger {}; starting with an empty one. "
          + "Reason: {}", ledgerPath, e.getMessage());
      return ledger;
    }
    if (null == document || null == document.files) {
      logger.warn("Ledger {} has no file map; starting with an empty one.",
          ledgerPath);
      return ledger;
    }
    for (Map.Entry<String, Boolean> entry : document.files.entrySet()) {
      if (null != entry.getKey() && Boolean.TRUE.equals(entry.getValue())) {
        ledger.add(entry.getKey());
      }
    }
    logger.debug("Loaded {} ledger entries from {}.", ledger.size(),
        ledgerPath);
    return ledger;
  }

  /**
   * Writes the full ledger.
   *
   * @throws IOException Thrown if the ledger could not be written; the
   *     previous ledger file is left in place in that case.
   */
  public void save(BaselineLedger ledger) throws IOException {
    LedgerDocument document = new LedgerDocument();
    for (String path : ledger.paths()) {
      document.files.put(path, Boolean.TRUE);
    }
    Path parent = ledgerPath.toAbsolutePath().getParent();
    if (null != parent) {
      Files.createDirectories(parent);
    }
    Path temp = ledgerPath.resolveSibling(ledgerPath.getFileName()
        + TEMP_SUFFIX);
    objectMapper.writeValue(temp.toFile(), document);
    try {
      Files.move(temp, ledgerPath, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, ledgerPath, StandardCopyOption.REPLACE_EXISTING);
    }
    logger.debug("Saved {} ledger entries to {}.", ledger.size(), ledgerPath);
  }
}
