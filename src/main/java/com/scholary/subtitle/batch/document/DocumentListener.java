package com.scholary.subtitle.batch.document;

import java.util.Set;

/**
 * Receives change notifications from a {@link SubtitleDocument}.
 *
 * <p>Notifications are delivered synchronously on the thread that mutated the document.
 */
public interface DocumentListener {

  /**
   * Called after point edits. Keys are unchanged.
   *
   * @param keys the keys of the entries whose content changed
   */
  void entriesChanged(Set<Integer> keys);

  /** Called after a structural change. All keys were re-issued. */
  void entriesReplaced();
}
