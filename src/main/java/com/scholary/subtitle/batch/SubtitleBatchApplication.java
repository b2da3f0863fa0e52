package com.scholary.subtitle.batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the subtitle batch service.
 *
 * <p>Transcribes, optimizes and renders subtitles for a list of media files, one job at a time,
 * and runs a configurable action once the batch is done.
 */
@SpringBootApplication
public class SubtitleBatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(SubtitleBatchApplication.class, args);
  }
}
