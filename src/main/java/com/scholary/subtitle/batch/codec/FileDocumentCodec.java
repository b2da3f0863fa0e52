package com.scholary.subtitle.batch.codec;

import com.scholary.subtitle.batch.document.SubtitleDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** {@link DocumentCodec} over UTF-8 files, dispatching to the codec of each format. */
@Component
public class FileDocumentCodec implements DocumentCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileDocumentCodec.class);

  private static final char BOM = '\uFEFF';

  private final Map<SubtitleFormat, FormatCodec> codecs = new EnumMap<>(SubtitleFormat.class);

  public FileDocumentCodec(List<FormatCodec> formatCodecs) {
    for (FormatCodec codec : formatCodecs) {
      codecs.put(codec.format(), codec);
    }
  }

  @Override
  public SubtitleDocument load(Path path) {
    SubtitleFormat format = SubtitleFormat.fromPath(path);
    String content;
    try {
      content = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CodecException("Failed to read subtitle file: " + path, e);
    }
    if (!content.isEmpty() && content.charAt(0) == BOM) {
      content = content.substring(1);
    }

    SubtitleDocument document = new SubtitleDocument(codecFor(format).read(content));
    LOGGER.info(
        "Loaded subtitle file: path={}, format={}, entries={}", path, format, document.size());
    return document;
  }

  @Override
  public void save(
      SubtitleDocument document,
      Path path,
      SubtitleFormat format,
      SubtitleLayout layout,
      String style) {
    String content = codecFor(format).write(document.entryList(), layout, style);
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(path, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CodecException("Failed to write subtitle file: " + path, e);
    }
    LOGGER.info(
        "Saved subtitle file: path={}, format={}, layout={}, entries={}",
        path,
        format,
        layout,
        document.size());
  }

  private FormatCodec codecFor(SubtitleFormat format) {
    FormatCodec codec = codecs.get(format);
    if (codec == null) {
      throw new UnsupportedFormatException("No codec registered for " + format);
    }
    return codec;
  }
}
