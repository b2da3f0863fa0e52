package com.scholary.subtitle.batch.config;

import com.scholary.subtitle.batch.media.FfmpegProperties;
import com.scholary.subtitle.batch.optimization.LlmProperties;
import com.scholary.subtitle.batch.transcription.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the configuration property records to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties({
  BatchProperties.class,
  WhisperProperties.class,
  LlmProperties.class,
  FfmpegProperties.class
})
public class PropertiesConfig {}
