package com.scholary.subtitle.batch.document;

/** Editable columns of a subtitle entry. */
public enum SubtitleColumn {
  START_TIME,
  END_TIME,
  ORIGINAL_TEXT,
  TRANSLATED_TEXT;

  public boolean isTime() {
    return this == START_TIME || this == END_TIME;
  }
}
