package com.scholary.subtitle.batch.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>Binary names are resolved through {@code PATH} unless absolute.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegBinary,
    @NotBlank String ffprobeBinary,
    @NotBlank String videoCodec,
    @PositiveOrZero int crf) {}
