package com.scholary.subtitle.batch.document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Editable, ordered collection of subtitle entries.
 *
 * <p>Entries are keyed by a sequence number that conveys document order. Every structural change
 * (load, merge, bulk replace) re-issues the keys as a dense {@code 1..N} sequence. Point edits
 * through {@link #setCell} keep the keys as they are.
 *
 * <p>Not thread-safe. A document is owned by one consumer and mutated on the control thread only.
 */
public class SubtitleDocument {

  private final Map<Integer, SubtitleEntry> entries = new LinkedHashMap<>();
  private final List<DocumentListener> listeners = new ArrayList<>();

  public SubtitleDocument() {}

  public SubtitleDocument(List<SubtitleEntry> initial) {
    reindex(initial);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public Optional<SubtitleEntry> get(int key) {
    return Optional.ofNullable(entries.get(key));
  }

  /** Read-only view in document order. */
  public Map<Integer, SubtitleEntry> entries() {
    return Collections.unmodifiableMap(entries);
  }

  /** Snapshot of the entries in document order. */
  public List<SubtitleEntry> entryList() {
    return List.copyOf(entries.values());
  }

  public SubtitleDocument copy() {
    return new SubtitleDocument(entryList());
  }

  public void addListener(DocumentListener listener) {
    listeners.add(listener);
  }

  public void removeListener(DocumentListener listener) {
    listeners.remove(listener);
  }

  /**
   * Edit one cell of an existing entry.
   *
   * <p>Time columns take {@code HH:mm:ss.SSS}. The edit is rejected, and the entry left as it was,
   * if the value does not parse or the entry would no longer end after it starts.
   *
   * @param key the entry key
   * @param column the column to edit
   * @param value the new cell text
   * @throws IllegalArgumentException if no entry has this key
   * @throws MalformedTimestampException if a time value does not parse
   * @throws InvalidTimeRangeException if the edit would break the start/end ordering
   */
  public void setCell(int key, SubtitleColumn column, String value) {
    SubtitleEntry current = entries.get(key);
    if (current == null) {
      throw new IllegalArgumentException("No subtitle entry with key " + key);
    }

    SubtitleEntry updated =
        switch (column) {
          case START_TIME -> retimed(key, current, Timestamps.parse(value), current.endMillis());
          case END_TIME -> retimed(key, current, current.startMillis(), Timestamps.parse(value));
          case ORIGINAL_TEXT -> current.withOriginalText(value);
          case TRANSLATED_TEXT -> current.withTranslatedText(value);
        };

    entries.put(key, updated);
    fireChanged(Set.of(key));
  }

  /**
   * Merge the selected entries into one.
   *
   * <p>The merged entry starts where the first selected entry starts, ends where the last one
   * ends, and joins the texts with a single space in document order. A selection with gaps is
   * widened to the contiguous span between its first and last key, so the entries in between are
   * merged as well and the document stays chronological. Keys are re-issued afterwards.
   *
   * @param keys the keys of the selected entries
   * @return true if entries were merged, false if fewer than two distinct entries were selected
   * @throws IllegalArgumentException if a key does not exist
   */
  public boolean merge(Collection<Integer> keys) {
    TreeSet<Integer> selected = new TreeSet<>(keys);
    if (selected.size() < 2) {
      return false;
    }
    for (Integer key : selected) {
      if (!entries.containsKey(key)) {
        throw new IllegalArgumentException("No subtitle entry with key " + key);
      }
    }

    List<Integer> order = new ArrayList<>(entries.keySet());
    int first = order.indexOf(selected.first());
    int last = order.indexOf(selected.last());
    List<SubtitleEntry> all = entryList();
    List<SubtitleEntry> span = all.subList(first, last + 1);

    SubtitleEntry merged =
        new SubtitleEntry(
            span.get(0).startMillis(),
            span.get(span.size() - 1).endMillis(),
            joinTexts(span, SubtitleEntry::originalText),
            joinTexts(span, SubtitleEntry::translatedText));

    List<SubtitleEntry> result = new ArrayList<>(all.size() - span.size() + 1);
    result.addAll(all.subList(0, first));
    result.add(merged);
    result.addAll(all.subList(last + 1, all.size()));

    reindex(result);
    fireReplaced();
    return true;
  }

  /** Replace every entry and re-issue keys. */
  public void replaceAll(List<SubtitleEntry> newEntries) {
    reindex(newEntries);
    fireReplaced();
  }

  /**
   * Apply text updates produced by an optimizer.
   *
   * <p>A value containing a line break carries both texts: the first line replaces the original
   * text, the remainder the translated text. Any other value replaces the translated text only.
   * Unknown keys are ignored.
   *
   * @param updates new texts by entry key
   * @return the keys that were updated
   */
  public Set<Integer> applyTextUpdates(Map<Integer, String> updates) {
    Set<Integer> changed = new LinkedHashSet<>();
    for (Map.Entry<Integer, String> update : updates.entrySet()) {
      SubtitleEntry current = entries.get(update.getKey());
      if (current == null) {
        continue;
      }
      String value = update.getValue() == null ? "" : update.getValue();
      int lineBreak = value.indexOf('\n');
      SubtitleEntry updated =
          lineBreak >= 0
              ? new SubtitleEntry(
                  current.startMillis(),
                  current.endMillis(),
                  value.substring(0, lineBreak),
                  value.substring(lineBreak + 1))
              : current.withTranslatedText(value);
      entries.put(update.getKey(), updated);
      changed.add(update.getKey());
    }

    if (!changed.isEmpty()) {
      fireChanged(changed);
    }
    return changed;
  }

  private static SubtitleEntry retimed(
      int key, SubtitleEntry current, long startMillis, long endMillis) {
    if (endMillis <= startMillis) {
      throw new InvalidTimeRangeException(key, startMillis, endMillis);
    }
    return new SubtitleEntry(
        startMillis, endMillis, current.originalText(), current.translatedText());
  }

  private void reindex(List<SubtitleEntry> ordered) {
    List<SubtitleEntry> copy = List.copyOf(ordered);
    entries.clear();
    int key = 1;
    for (SubtitleEntry entry : copy) {
      entries.put(key++, entry);
    }
  }

  private static String joinTexts(
      List<SubtitleEntry> span, Function<SubtitleEntry, String> text) {
    return span.stream().map(text).collect(Collectors.joining(" "));
  }

  private void fireChanged(Set<Integer> keys) {
    Set<Integer> view = Collections.unmodifiableSet(keys);
    for (DocumentListener listener : List.copyOf(listeners)) {
      listener.entriesChanged(view);
    }
  }

  private void fireReplaced() {
    for (DocumentListener listener : List.copyOf(listeners)) {
      listener.entriesReplaced();
    }
  }
}
