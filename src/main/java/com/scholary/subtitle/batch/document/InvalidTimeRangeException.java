package com.scholary.subtitle.batch.document;

/** Thrown when an edit would leave an entry whose end is not after its start. */
public class InvalidTimeRangeException extends DocumentEditException {

  public InvalidTimeRangeException(int key, long startMillis, long endMillis) {
    super(
        String.format(
            "Entry %d would end at %s, which is not after its start %s",
            key, Timestamps.format(endMillis), Timestamps.format(startMillis)));
  }
}
