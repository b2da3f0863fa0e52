package com.scholary.subtitle.batch.config;

import com.scholary.subtitle.batch.codec.SubtitleFormat;
import com.scholary.subtitle.batch.codec.SubtitleLayout;
import com.scholary.subtitle.batch.completion.CompletionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch processing.
 *
 * <p>Controls the default completion policy, worker pool sizing, and how the subtitle workbench
 * treats queued files.
 */
@ConfigurationProperties(prefix = "batch")
@Validated
public record BatchProperties(
    @NotNull CompletionPolicy completionPolicy,
    @Positive int workerThreads,
    @Positive int workerQueueSize,
    @Valid @NotNull IntakeProperties intake) {

  public record IntakeProperties(
      boolean autoOptimize,
      @NotNull SubtitleFormat outputFormat,
      @NotNull SubtitleLayout outputLayout) {}
}
