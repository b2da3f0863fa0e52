package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.job.SubtitleJob;
import java.nio.file.Path;

/**
 * Output file locations of a job, next to its source file.
 *
 * <pre>
 * talk.mp4  ->  talk.srt, talk_optimized.srt, talk_subtitled.mp4
 * </pre>
 */
public final class SubtitleOutputs {

  private SubtitleOutputs() {}

  public static Path subtitlePath(SubtitleJob job) {
    return sibling(job, "", "." + job.getParameters().outputFormat().extension());
  }

  public static Path optimizedSubtitlePath(SubtitleJob job) {
    return optimizedSubtitlePath(
        job.getSource(), "." + job.getParameters().outputFormat().extension());
  }

  /** {@code <base>_optimized<extension>} next to the given file. */
  public static Path optimizedSubtitlePath(Path file, String extension) {
    return file.resolveSibling(baseName(file) + "_optimized" + extension);
  }

  public static Path renderedVideoPath(SubtitleJob job) {
    String name = job.getSource().getFileName().toString();
    int dot = name.lastIndexOf('.');
    return sibling(job, "_subtitled", dot < 0 ? ".mp4" : name.substring(dot));
  }

  static String baseName(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot <= 0 ? name : name.substring(0, dot);
  }

  private static Path sibling(SubtitleJob job, String suffix, String extension) {
    return job.getSource().resolveSibling(baseName(job.getSource()) + suffix + extension);
  }
}
