package com.scholary.subtitle.batch.intake;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * FIFO buffer of files waiting to be processed.
 *
 * <p>The queue never advances on its own; its consumer pulls the next file when it is ready. Not
 * thread-safe.
 */
public class FileIntakeQueue {

  private final Deque<Path> pending = new ArrayDeque<>();

  public void enqueue(Collection<Path> files) {
    pending.addAll(files);
  }

  /** Pop the head of the queue; empty if nothing is waiting. */
  public Optional<Path> dequeueNext() {
    return Optional.ofNullable(pending.pollFirst());
  }

  public int size() {
    return pending.size();
  }

  public boolean isEmpty() {
    return pending.isEmpty();
  }

  public void clear() {
    pending.clear();
  }

  public List<Path> pending() {
    return List.copyOf(pending);
  }
}
