package com.scholary.subtitle.batch.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Probes source files with ffprobe.
 *
 * <p>Runs:
 *
 * <pre>
 * ffprobe -v error -show_entries format=duration:stream=codec_type -of json FILE
 * </pre>
 */
@Component
public class FfprobeMediaProber implements MediaProber {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeMediaProber.class);

  private final FfmpegProperties properties;
  private final ObjectMapper objectMapper;
  private final MediaInfoCache cache;

  public FfprobeMediaProber(
      FfmpegProperties properties, ObjectMapper objectMapper, MediaInfoCache cache) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.cache = cache;
  }

  @Override
  public MediaInfo probe(Path file) {
    var cached = cache.get(file);
    if (cached.isPresent()) {
      return cached.get();
    }

    MediaInfo info = runProbe(file);
    cache.put(file, info);
    return info;
  }

  private MediaInfo runProbe(Path file) {
    LOGGER.debug("Probing media with ffprobe: file={}", file);

    ProcessBuilder pb =
        new ProcessBuilder(
            properties.ffprobeBinary(),
            "-v", "error",
            "-show_entries", "format=duration:stream=codec_type",
            "-of", "json",
            file.toString());
    pb.redirectErrorStream(true);

    try {
      Process process = pb.start();
      String output =
          new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
      int exitCode = process.waitFor();

      if (exitCode != 0) {
        LOGGER.error("ffprobe failed: file={}, output={}", file, output);
        throw new MediaProbeException(
            "ffprobe failed with exit code: " + exitCode + ", output: " + output);
      }

      MediaInfo info = parse(file, output);
      LOGGER.info(
          "Probed media: file={}, duration={}s, video={}",
          info.fileName(),
          info.duration() == null ? "?" : info.duration().toSeconds(),
          info.hasVideo());
      return info;

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaProbeException("ffprobe interrupted", e);
    } catch (IOException e) {
      throw new MediaProbeException("Failed to run ffprobe on " + file, e);
    }
  }

  MediaInfo parse(Path file, String output) throws IOException {
    JsonNode root = objectMapper.readTree(output);

    Duration duration = null;
    String rawDuration = root.path("format").path("duration").asText("");
    if (!rawDuration.isBlank()) {
      try {
        duration = Duration.ofMillis(Math.round(Double.parseDouble(rawDuration) * 1000));
      } catch (NumberFormatException e) {
        LOGGER.warn("Unparseable ffprobe duration: file={}, value={}", file, rawDuration);
      }
    }

    boolean hasVideo = false;
    for (JsonNode stream : root.path("streams")) {
      if ("video".equals(stream.path("codec_type").asText())) {
        hasVideo = true;
        break;
      }
    }

    return new MediaInfo(file.getFileName().toString(), Files.size(file), duration, hasVideo);
  }
}
