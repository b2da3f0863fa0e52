package com.scholary.subtitle.batch.codec;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.util.List;

/**
 * Text encoding of one subtitle format.
 *
 * <p>Implementations are stateless and work on in-memory strings; file handling lives in {@link
 * FileDocumentCodec}.
 */
public interface FormatCodec {

  SubtitleFormat format();

  /**
   * Parse file content into entries in file order.
   *
   * @throws CodecException if the content is not valid for this format
   */
  List<SubtitleEntry> read(String content);

  /**
   * Render entries.
   *
   * @param entries entries in document order
   * @param layout arrangement of the two texts
   * @param style optional format-specific style payload, may be null
   */
  String write(List<SubtitleEntry> entries, SubtitleLayout layout, String style);
}
