/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Document written to the ledger file, mapping each path to a presence
 * marker, e.g. {@code {"files":{"docs/a.txt":true}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class LedgerDocument {

  @JsonProperty("files")
  SortedMap<String, Boolean> files = new TreeMap<>();

}
