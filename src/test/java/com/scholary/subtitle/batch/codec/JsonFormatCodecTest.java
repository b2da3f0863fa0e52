package com.scholary.subtitle.batch.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonFormatCodecTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final JsonFormatCodec codec = new JsonFormatCodec(objectMapper);

  @Test
  void read_shouldOrderEntriesByNumericKey() {
    String json =
        "{\"10\":{\"start_time\":9000,\"end_time\":9500,\"original_subtitle\":\"ten\"},"
            + "\"2\":{\"start_time\":1000,\"end_time\":2000,\"original_subtitle\":\"two\","
            + "\"translated_subtitle\":\"zwei\"}}";

    List<SubtitleEntry> entries = codec.read(json);

    assertThat(entries)
        .containsExactly(
            new SubtitleEntry(1000, 2000, "two", "zwei"), SubtitleEntry.of(9000, 9500, "ten"));
  }

  @Test
  void read_shouldRejectNonNumericKey() {
    assertThatThrownBy(() -> codec.read("{\"a\":{\"start_time\":0,\"end_time\":1}}"))
        .isInstanceOf(CodecException.class);
  }

  @Test
  void read_shouldRejectInvalidJson() {
    assertThatThrownBy(() -> codec.read("{not json")).isInstanceOf(CodecException.class);
  }

  @Test
  void write_shouldKeepBothTextsRegardlessOfLayout() throws Exception {
    String json =
        codec.write(
            List.of(new SubtitleEntry(0, 5200, "Hello", "Hallo")),
            SubtitleLayout.ORIGINAL_ONLY,
            null);

    JsonNode first = objectMapper.readTree(json).get("1");
    assertThat(first.get("start_time").asLong()).isZero();
    assertThat(first.get("end_time").asLong()).isEqualTo(5200);
    assertThat(first.get("original_subtitle").asText()).isEqualTo("Hello");
    assertThat(first.get("translated_subtitle").asText()).isEqualTo("Hallo");
  }
}
