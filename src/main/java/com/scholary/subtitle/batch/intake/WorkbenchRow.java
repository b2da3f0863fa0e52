package com.scholary.subtitle.batch.intake;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.document.Timestamps;

/** One document entry as shown in the editor. Times are {@code HH:mm:ss.SSS}. */
public record WorkbenchRow(
    int key, String startTime, String endTime, String originalText, String translatedText) {

  static WorkbenchRow of(int key, SubtitleEntry entry) {
    return new WorkbenchRow(
        key,
        Timestamps.format(entry.startMillis()),
        Timestamps.format(entry.endMillis()),
        entry.originalText(),
        entry.translatedText());
  }
}
