package com.scholary.subtitle.batch.transcription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper API client.
 *
 * <p>Timeouts are seconds. The read timeout has to cover a whole file, not a chunk.
 *
 * @param transcribePath endpoint path appended to the base URL
 * @param language spoken language hint such as {@code en}, blank to let the service detect it
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @NotBlank String transcribePath,
    String language,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {

  public WhisperProperties {
    language = language == null ? "" : language.strip();
  }
}
