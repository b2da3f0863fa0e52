package com.scholary.subtitle.batch.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class AssFormatCodecTest {

  private final AssFormatCodec codec = new AssFormatCodec();

  @Test
  void read_shouldParseDialoguesUsingFormatLine() {
    String ass =
        "[Script Info]\nTitle: test\n\n"
            + "[Events]\n"
            + "Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n"
            + "Dialogue: 0,0:00:01.50,0:00:03.00,Default,,0,0,0,,{\\an8}Hello, world\\NHallo\n";

    List<SubtitleEntry> entries = codec.read(ass);

    assertThat(entries).containsExactly(new SubtitleEntry(1500, 3000, "Hello, world", "Hallo"));
  }

  @Test
  void read_shouldRejectDialogueBeforeFormat() {
    assertThatThrownBy(() -> codec.read("[Events]\nDialogue: 0,0:00:01.00,0:00:02.00,,,,,,,x\n"))
        .isInstanceOf(CodecException.class);
  }

  @Test
  void read_shouldRejectMalformedTime() {
    String ass =
        "[Events]\nFormat: Start, End, Text\nDialogue: 00:01,0:00:02.00,text\n";

    assertThatThrownBy(() -> codec.read(ass))
        .isInstanceOf(CodecException.class)
        .hasMessageContaining("timestamp");
  }

  @Test
  void write_shouldUseDefaultStyleAndCentiseconds() {
    String ass =
        codec.write(
            List.of(new SubtitleEntry(1234, 3_601_005, "Hello", "Hallo")),
            SubtitleLayout.ORIGINAL_ABOVE,
            null);

    assertThat(ass).contains(AssFormatCodec.DEFAULT_STYLE);
    assertThat(ass).contains("Dialogue: 0,0:00:01.23,1:00:01.00,Default,,0,0,0,,Hello\\NHallo");
  }

  @Test
  void write_shouldPrefixStylesHeaderWhenMissing() {
    String ass =
        codec.write(
            List.of(SubtitleEntry.of(0, 1000, "x")),
            SubtitleLayout.ORIGINAL_ONLY,
            "Style: Custom,Arial,30");

    assertThat(ass).contains("[V4+ Styles]\nStyle: Custom,Arial,30\n");
    assertThat(ass).doesNotContain("Style: Default");
  }

  @Test
  void read_shouldLoadWhatWriteProduced() {
    List<SubtitleEntry> entries =
        List.of(new SubtitleEntry(0, 2500, "One", "Eins"), SubtitleEntry.of(2500, 4000, "Two"));

    String ass = codec.write(entries, SubtitleLayout.ORIGINAL_ABOVE, null);

    assertThat(codec.read(ass)).isEqualTo(entries);
  }
}
