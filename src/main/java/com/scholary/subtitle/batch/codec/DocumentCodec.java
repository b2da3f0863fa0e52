package com.scholary.subtitle.batch.codec;

import com.scholary.subtitle.batch.document.SubtitleDocument;
import java.nio.file.Path;

/** Loads and saves subtitle documents. */
public interface DocumentCodec {

  /**
   * Load a subtitle file. The format is taken from the file extension.
   *
   * @throws UnsupportedFormatException if the extension is unknown
   * @throws CodecException if the file cannot be read or parsed
   */
  SubtitleDocument load(Path path);

  /**
   * Save a document.
   *
   * @param style ASS style payload, ignored by the other formats; null selects the default style
   * @throws CodecException if the file cannot be written
   */
  void save(
      SubtitleDocument document,
      Path path,
      SubtitleFormat format,
      SubtitleLayout layout,
      String style);
}
