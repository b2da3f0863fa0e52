package com.scholary.subtitle.batch.render;

import com.scholary.subtitle.batch.execution.JobCancelledException;
import com.scholary.subtitle.batch.execution.SubtitleOutputs;
import com.scholary.subtitle.batch.execution.WorkerContext;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.media.FfmpegProperties;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders subtitles into the video with ffmpeg's {@code subtitles} filter.
 *
 * <p>ffmpeg prints a status line about twice a second; each one is used to report progress and to
 * check for cancellation, in which case the process is destroyed.
 */
@Component
public class FfmpegSubtitleRenderer implements SubtitleRenderer {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegSubtitleRenderer.class);

  private static final Pattern TIME = Pattern.compile("time=(\\d+):(\\d{2}):(\\d{2})\\.(\\d{2})");
  private static final int TAIL_LINES = 20;

  private final FfmpegProperties properties;

  public FfmpegSubtitleRenderer(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public Path render(SubtitleJob job, Path subtitleFile, WorkerContext context) {
    Path output = SubtitleOutputs.renderedVideoPath(job);
    List<String> command = buildCommand(job.getSource(), subtitleFile, output);
    Duration total = job.getMediaInfo() == null ? null : job.getMediaInfo().duration();

    LOGGER.info(
        "Rendering video: source={}, subtitles={}, output={}",
        job.getSource(),
        subtitleFile,
        output);

    Process process;
    try {
      process = new ProcessBuilder(command).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new RenderException("Failed to start ffmpeg", e);
    }

    Deque<String> tail = new ArrayDeque<>(TAIL_LINES);
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (context.token().isCancelled() || Thread.currentThread().isInterrupted()) {
          process.destroyForcibly();
          throw new JobCancelledException();
        }
        if (tail.size() == TAIL_LINES) {
          tail.removeFirst();
        }
        tail.addLast(line);
        reportProgress(line, total, context);
      }

      int exitCode = process.waitFor();
      if (exitCode != 0) {
        LOGGER.error("ffmpeg failed: exitCode={}, output={}", exitCode, String.join("\n", tail));
        throw new RenderException("ffmpeg failed with exit code " + exitCode);
      }
    } catch (IOException e) {
      process.destroyForcibly();
      throw new RenderException("Failed to read ffmpeg output", e);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new JobCancelledException();
    }

    context.progress(100, "Rendered " + output.getFileName());
    return output;
  }

  List<String> buildCommand(Path source, Path subtitleFile, Path output) {
    return List.of(
        properties.ffmpegBinary(),
        "-y",
        "-i", source.toAbsolutePath().toString(),
        "-vf", "subtitles='" + escapeForFilter(subtitleFile.toAbsolutePath().toString()) + "'",
        "-c:v", properties.videoCodec(),
        "-crf", String.valueOf(properties.crf()),
        "-c:a", "copy",
        output.toAbsolutePath().toString());
  }

  /** Escape a path for use inside a quoted filter argument. */
  static String escapeForFilter(String path) {
    return path.replace("\\", "/").replace(":", "\\:").replace("'", "\\'");
  }

  private static void reportProgress(String line, Duration total, WorkerContext context) {
    if (total == null || total.isZero()) {
      return;
    }
    Matcher m = TIME.matcher(line);
    if (m.find()) {
      long millis =
          Long.parseLong(m.group(1)) * 3_600_000
              + Long.parseLong(m.group(2)) * 60_000
              + Long.parseLong(m.group(3)) * 1000
              + Long.parseLong(m.group(4)) * 10;
      int percent = (int) Math.min(99, millis * 100 / total.toMillis());
      context.progress(percent, "Rendering video");
    }
  }
}
