package com.scholary.subtitle.batch.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * JSON codec.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "1": {
 *     "start_time": 0,
 *     "end_time": 5200,
 *     "original_subtitle": "Hello world",
 *     "translated_subtitle": "Hallo Welt"
 *   }
 * }
 * </pre>
 *
 * <p>Times are milliseconds. Entries are read in numeric key order and the layout is ignored: both
 * texts are always written.
 */
@Component
public class JsonFormatCodec implements FormatCodec {

  private static final TypeReference<Map<String, JsonEntry>> DOCUMENT_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public JsonFormatCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public SubtitleFormat format() {
    return SubtitleFormat.JSON;
  }

  @Override
  public List<SubtitleEntry> read(String content) {
    Map<String, JsonEntry> raw;
    try {
      raw = objectMapper.readValue(content, DOCUMENT_TYPE);
    } catch (JsonProcessingException e) {
      throw new CodecException("Invalid JSON subtitle document: " + e.getOriginalMessage(), e);
    }
    if (raw == null) {
      return List.of();
    }

    TreeMap<Integer, JsonEntry> ordered = new TreeMap<>();
    for (Map.Entry<String, JsonEntry> item : raw.entrySet()) {
      try {
        ordered.put(Integer.parseInt(item.getKey().strip()), item.getValue());
      } catch (NumberFormatException e) {
        throw new CodecException("JSON subtitle key is not a number: " + item.getKey(), e);
      }
    }

    List<SubtitleEntry> entries = new ArrayList<>(ordered.size());
    for (Map.Entry<Integer, JsonEntry> item : ordered.entrySet()) {
      JsonEntry json = item.getValue();
      if (json == null || json.endTime() < json.startTime() || json.startTime() < 0) {
        throw new CodecException("Invalid JSON subtitle entry " + item.getKey());
      }
      entries.add(
          new SubtitleEntry(
              json.startTime(),
              json.endTime(),
              json.originalSubtitle(),
              json.translatedSubtitle()));
    }
    return entries;
  }

  @Override
  public String write(List<SubtitleEntry> entries, SubtitleLayout layout, String style) {
    Map<String, JsonEntry> document = new LinkedHashMap<>();
    for (int i = 0; i < entries.size(); i++) {
      SubtitleEntry entry = entries.get(i);
      document.put(
          String.valueOf(i + 1),
          new JsonEntry(
              entry.startMillis(),
              entry.endMillis(),
              entry.originalText(),
              entry.translatedText()));
    }
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to encode JSON subtitle document", e);
    }
  }

  record JsonEntry(
      @JsonProperty("start_time") long startTime,
      @JsonProperty("end_time") long endTime,
      @JsonProperty("original_subtitle") String originalSubtitle,
      @JsonProperty("translated_subtitle") String translatedSubtitle) {}
}
