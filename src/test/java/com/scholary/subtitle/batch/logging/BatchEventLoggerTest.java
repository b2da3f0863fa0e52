package com.scholary.subtitle.batch.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.scholary.subtitle.batch.completion.CompletionPolicy;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.media.MediaInfo;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class BatchEventLoggerTest {

  private final BatchEventLogger eventLogger = new BatchEventLogger();
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(BatchEventLogger.class);
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void jobFailed_shouldLogJobFieldsInMdc() {
    SubtitleJob job =
        new SubtitleJob(
            Path.of("talk.mp4"),
            JobKind.SUBTITLE_PIPELINE,
            JobParameters.defaults(),
            new MediaInfo("talk.mp4", 1024, Duration.ofMinutes(3), true));

    eventLogger.jobFailed(job.snapshot(), "ffmpeg exited with 1");

    assertThat(appender.list).hasSize(1);
    ILoggingEvent event = appender.list.get(0);
    assertThat(event.getLevel()).isEqualTo(Level.ERROR);
    assertThat(event.getMDCPropertyMap())
        .containsEntry("event_type", "job_failed")
        .containsEntry("jobId", job.getId())
        .containsEntry("jobKind", "SUBTITLE_PIPELINE")
        .containsEntry("errorMessage", "ffmpeg exited with 1");
  }

  @Test
  void completionAction_shouldClearMdcAfterLogging() {
    eventLogger.completionAction(CompletionPolicy.SUSPEND_HOST, Instant.EPOCH);

    assertThat(appender.list.get(0).getMDCPropertyMap())
        .containsEntry("event_type", "completion_action")
        .containsEntry("policy", "SUSPEND_HOST");
    assertThat(MDC.get("event_type")).isNull();
    assertThat(MDC.get("policy")).isNull();
  }
}
