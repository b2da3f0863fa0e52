package com.scholary.subtitle.batch.optimization;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the OpenAI-compatible chat completion backend.
 *
 * <p>The API key may be left empty; optimization jobs then fail with a clear message instead of
 * the application refusing to start.
 */
@ConfigurationProperties(prefix = "llm")
@Validated
public record LlmProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
