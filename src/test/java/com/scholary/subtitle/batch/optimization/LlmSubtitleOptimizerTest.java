package com.scholary.subtitle.batch.optimization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitle.batch.codec.SubtitleFormat;
import com.scholary.subtitle.batch.codec.SubtitleLayout;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.execution.WorkerContext;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.media.MediaInfo;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LlmSubtitleOptimizerTest {

  private static LlmProperties properties(String apiKey) {
    return new LlmProperties("http://localhost:9999/v1", apiKey, "gpt-4o-mini", 5, 30, 1);
  }

  private static JobParameters translating(String language) {
    return new JobParameters(
        language,
        true,
        true,
        false,
        2,
        0,
        "",
        SubtitleLayout.ORIGINAL_ABOVE,
        SubtitleFormat.SRT,
        0,
        0,
        "",
        false);
  }

  private final SubtitleDocument document =
      new SubtitleDocument(
          List.of(
              new SubtitleEntry(0, 1000, "helo", "hallo"),
              SubtitleEntry.of(1000, 2000, "wrld"),
              SubtitleEntry.of(2000, 3000, "again")));

  @Test
  void batches_shouldGroupOriginalTextsByKey() {
    List<Map<Integer, String>> batches = LlmSubtitleOptimizer.batches(document, 2);

    assertThat(batches).hasSize(2);
    assertThat(batches.get(0)).containsExactly(Map.entry(1, "helo"), Map.entry(2, "wrld"));
    assertThat(batches.get(1)).containsExactly(Map.entry(3, "again"));
  }

  @Test
  void toUpdates_shouldKeepTranslationWhenCorrecting() {
    Map<Integer, String> updates =
        LlmSubtitleOptimizer.toUpdates(document, Map.of(1, "hello\n", 9, "unknown"), false);

    assertThat(updates).containsExactly(Map.entry(1, "hello\nhallo"));
    document.applyTextUpdates(updates);
    assertThat(document.get(1).orElseThrow())
        .isEqualTo(new SubtitleEntry(0, 1000, "hello", "hallo"));
  }

  @Test
  void toUpdates_shouldSendTranslationsAsSingleLine() {
    Map<Integer, String> updates =
        LlmSubtitleOptimizer.toUpdates(document, Map.of(2, "Welt\nheute"), true);

    assertThat(updates).containsExactly(Map.entry(2, "Welt heute"));
  }

  @Test
  void buildSystemPrompt_shouldMentionTargetLanguageAndExtraInstructions() {
    String prompt = LlmSubtitleOptimizer.buildSystemPrompt(translating("German"), "Keep names");

    assertThat(prompt).contains("translate each subtitle into German");
    assertThat(prompt).endsWith("Additional instructions:\nKeep names");
  }

  @Test
  void buildSystemPrompt_shouldOnlyCorrectWithoutTargetLanguage() {
    String prompt = LlmSubtitleOptimizer.buildSystemPrompt(JobParameters.defaults(), "");

    assertThat(prompt).doesNotContain("translate").doesNotContain("Additional instructions");
  }

  @Test
  void parseAnswer_shouldStripCodeFenceAndUnknownKeys() throws Exception {
    LlmSubtitleOptimizer optimizer =
        new LlmSubtitleOptimizer(properties("key"), new ObjectMapper());

    Map<Integer, String> answer =
        optimizer.parseAnswer(
            "```json\n{\"1\": \"hello\", \"x\": \"skip\", \"7\": \"not asked\"}\n```",
            Map.of(1, "helo", 2, "wrld"));

    assertThat(answer).containsExactly(Map.entry(1, "hello"));
  }

  @Test
  void optimize_shouldFailWithoutApiKey() {
    LlmSubtitleOptimizer optimizer = new LlmSubtitleOptimizer(properties(" "), new ObjectMapper());
    SubtitleJob job =
        new SubtitleJob(
            Path.of("/subs/a.srt"),
            JobKind.OPTIMIZATION_ONLY,
            translating("German"),
            MediaInfo.ofSubtitle("a.srt", 1));

    assertThatThrownBy(() -> optimizer.optimize(job, document, "", mock(WorkerContext.class)))
        .isInstanceOf(OptimizationException.class)
        .hasMessageContaining("API key");
  }
}
