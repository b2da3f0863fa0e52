package com.scholary.subtitle.batch.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class FileDocumentCodecTest {

  @TempDir Path tempDir;

  private FileDocumentCodec codec;

  @BeforeEach
  void setUp() {
    codec =
        new FileDocumentCodec(
            List.of(
                new SrtFormatCodec(),
                new AssFormatCodec(),
                new JsonFormatCodec(new ObjectMapper())));
  }

  @Test
  void load_shouldStripByteOrderMark() throws Exception {
    Path file = tempDir.resolve("bom.srt");
    Files.writeString(
        file, "\uFEFF1\n00:00:00,000 --> 00:00:01,000\nHello\n", StandardCharsets.UTF_8);

    SubtitleDocument document = codec.load(file);

    assertThat(document.entryList()).containsExactly(SubtitleEntry.of(0, 1000, "Hello"));
  }

  @Test
  void load_shouldRejectUnknownExtension() throws Exception {
    Path file = tempDir.resolve("notes.txt");
    Files.writeString(file, "x");

    assertThatThrownBy(() -> codec.load(file)).isInstanceOf(UnsupportedFormatException.class);
  }

  @Test
  void load_shouldWrapMissingFile() {
    assertThatThrownBy(() -> codec.load(tempDir.resolve("missing.srt")))
        .isInstanceOf(CodecException.class)
        .hasMessageContaining("Failed to read");
  }

  @Test
  void save_shouldCreateParentDirectories() {
    SubtitleDocument document =
        new SubtitleDocument(List.of(new SubtitleEntry(0, 1000, "Hello", "Hallo")));
    Path target = tempDir.resolve("out/nested/result.json");

    codec.save(document, target, SubtitleFormat.JSON, SubtitleLayout.ORIGINAL_ABOVE, null);

    assertThat(target).exists();
    assertThat(codec.load(target).entryList()).isEqualTo(document.entryList());
  }

  @ParameterizedTest
  @EnumSource(SubtitleFormat.class)
  void save_shouldKeepEntriesOfLoadedDocument(SubtitleFormat format) throws Exception {
    Path source = tempDir.resolve("source.srt");
    Files.writeString(
        source,
        "1\n00:00:00,000 --> 00:00:01,500\nHello\nHallo\n\n"
            + "2\n00:00:01,500 --> 00:01:02,250\nWorld\n");
    SubtitleDocument loaded = codec.load(source);

    Path target = tempDir.resolve("copy." + format.extension());
    codec.save(loaded, target, format, SubtitleLayout.ORIGINAL_ABOVE, null);

    assertThat(codec.load(target).entryList())
        .containsExactly(
            new SubtitleEntry(0, 1500, "Hello", "Hallo"), SubtitleEntry.of(1500, 62250, "World"));
  }
}
