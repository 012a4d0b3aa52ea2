/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stable identity of a set of deletion candidates, used to avoid asking
 * twice about the same set.
 */
public final class DeletionFingerprint {

  private static ObjectMapper objectMapper = new ObjectMapper();

  private DeletionFingerprint() { /* static helpers only */ }

  /**
   * Computes the SHA-256 hex digest of the sorted candidates, serialized as
   * {@code {"scope":..,"files":[..],"directories":[..]}}.
   */
  public static String of(String scope, Collection<String> files,
      Collection<String> directories) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("scope", scope);
    document.put("files", sorted(files));
    document.put("directories", sorted(directories));
    try {
      return DigestUtils.sha256Hex(objectMapper.writeValueAsString(document));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize deletion candidates.",
          e);
    }
  }

  private static List<String> sorted(Collection<String> paths) {
    List<String> list = new ArrayList<>(paths);
    Collections.sort(list);
    return list;
  }
}
