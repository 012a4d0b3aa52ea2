/* Copyright 2016--2020 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.davsync.reconcile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Question put to a human before a batch of destructive operations.
 */
public final class ConfirmationRequest {

  /** Most example paths shown with a request. */
  public static final int MAX_PREVIEW = 10;

  private final String title;

  private final int total;

  private final List<String> preview;

  /**
   * Creates a request; the preview is cut to {@link #MAX_PREVIEW} entries.
   */
  public ConfirmationRequest(String title, int total, List<String> preview) {
    this.title = title;
    this.total = total;
    List<String> cut = new ArrayList<>(preview.subList(0,
        Math.min(MAX_PREVIEW, preview.size())));
    this.preview = Collections.unmodifiableList(cut);
  }

  public String getTitle() {
    return title;
  }

  public int getTotal() {
    return total;
  }

  public List<String> getPreview() {
    return preview;
  }

  @Override
  public String toString() {
    return title + " (" + total + " item(s), e.g. " + preview + ")";
  }
}
