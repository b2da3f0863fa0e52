package com.scholary.subtitle.batch.job;

import com.scholary.subtitle.batch.codec.SubtitleFormat;
import com.scholary.subtitle.batch.media.MediaInfo;
import com.scholary.subtitle.batch.media.MediaProbeException;
import com.scholary.subtitle.batch.media.MediaProber;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates jobs from source files.
 *
 * <p>Media sources are probed with ffprobe, which can take a moment, so callers run this off the
 * control thread. Subtitle sources for optimization jobs are only checked for a known extension.
 */
@Component
public class JobFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobFactory.class);

  private final MediaProber mediaProber;

  public JobFactory(MediaProber mediaProber) {
    this.mediaProber = mediaProber;
  }

  /**
   * Create a PENDING job.
   *
   * @throws IllegalArgumentException if the source is not a readable file
   * @throws com.scholary.subtitle.batch.codec.UnsupportedFormatException if an optimization source
   *     is not a subtitle file
   * @throws MediaProbeException if a media source cannot be probed
   */
  public SubtitleJob create(Path source, JobKind kind, JobParameters parameters) {
    Path file = source.toAbsolutePath().normalize();
    if (!Files.isRegularFile(file)) {
      throw new IllegalArgumentException("Source file does not exist: " + file);
    }

    MediaInfo info =
        kind == JobKind.OPTIMIZATION_ONLY ? subtitleInfo(file) : mediaProber.probe(file);
    JobParameters effective = parameters == null ? JobParameters.defaults() : parameters;
    SubtitleJob job = new SubtitleJob(file, kind, effective, info);

    LOGGER.debug("Created job: id={}, kind={}", job.getId(), kind);
    return job;
  }

  private static MediaInfo subtitleInfo(Path file) {
    SubtitleFormat.fromPath(file);
    try {
      return MediaInfo.ofSubtitle(file.getFileName().toString(), Files.size(file));
    } catch (IOException e) {
      throw new IllegalArgumentException("Cannot read source file: " + file, e);
    }
  }
}
