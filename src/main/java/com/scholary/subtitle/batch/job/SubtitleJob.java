package com.scholary.subtitle.batch.job;

import com.scholary.subtitle.batch.media.MediaInfo;
import java.nio.file.Path;
import java.time.Instant;

/**
 * A unit of batch work on one source file.
 *
 * <p>The job id is the normalized absolute path of the source, so a file can be in a job list at
 * most once.
 *
 * <p>Not thread-safe. State is mutated on the control thread only, by the lifecycle when a job
 * starts or is cancelled and by worker notifications marshaled onto that thread.
 */
public class SubtitleJob {

  private final String id;
  private final Path source;
  private final JobKind kind;
  private final JobParameters parameters;
  private final MediaInfo mediaInfo;
  private final Instant createdAt;

  private JobStatus status;
  private int progress; // 0-100
  private String progressMessage;
  private String error;
  private Path subtitlePath;
  private Path optimizedSubtitlePath;
  private Path renderedVideoPath;

  public SubtitleJob(Path source, JobKind kind, JobParameters parameters, MediaInfo mediaInfo) {
    this.source = source.toAbsolutePath().normalize();
    this.id = this.source.toString();
    this.kind = kind;
    this.parameters = parameters;
    this.mediaInfo = mediaInfo;
    this.createdAt = Instant.now();
    this.status = JobStatus.PENDING;
    this.progressMessage = "";
  }

  /** The id a job for this file would get. */
  public static String idFor(Path source) {
    return source.toAbsolutePath().normalize().toString();
  }

  /**
   * Enter the first in-progress state of this job's kind.
   *
   * @throws IllegalStateException if the job is already running or completed
   */
  public void markStarted() {
    if (status.isRunning() || status == JobStatus.COMPLETED) {
      throw new IllegalStateException("Cannot start job " + id + " in state " + status);
    }
    status = kind.initialStatus();
    progress = 0;
    progressMessage = "";
    error = null;
  }

  /**
   * Move a running job to another pipeline stage.
   *
   * @throws IllegalStateException if the job is not running or the target is not a running state
   */
  public void advanceTo(JobStatus stage) {
    if (!status.isRunning() || !stage.isRunning()) {
      throw new IllegalStateException(
          "Cannot move job " + id + " from " + status + " to " + stage);
    }
    status = stage;
  }

  public void markCompleted() {
    if (!status.isRunning()) {
      throw new IllegalStateException("Cannot complete job " + id + " in state " + status);
    }
    status = JobStatus.COMPLETED;
    progress = 100;
    progressMessage = "";
  }

  public void markFailed(String message) {
    if (status.isTerminal()) {
      throw new IllegalStateException("Cannot fail job " + id + " in state " + status);
    }
    status = JobStatus.FAILED;
    error = message;
    progressMessage = "";
  }

  /** Back to PENDING from any state, clearing progress and error. */
  public void resetToPending() {
    status = JobStatus.PENDING;
    progress = 0;
    progressMessage = "";
    error = null;
  }

  public void updateProgress(int percent, String message) {
    this.progress = Math.max(0, Math.min(100, percent));
    this.progressMessage = message == null ? "" : message;
  }

  public JobSnapshot snapshot() {
    return new JobSnapshot(
        id,
        mediaInfo == null ? source.getFileName().toString() : mediaInfo.fileName(),
        kind,
        status,
        progress,
        progressMessage,
        error,
        mediaInfo,
        subtitlePath == null ? null : subtitlePath.toString(),
        optimizedSubtitlePath == null ? null : optimizedSubtitlePath.toString(),
        renderedVideoPath == null ? null : renderedVideoPath.toString(),
        createdAt);
  }

  public String getId() {
    return id;
  }

  public Path getSource() {
    return source;
  }

  public JobKind getKind() {
    return kind;
  }

  public JobParameters getParameters() {
    return parameters;
  }

  public MediaInfo getMediaInfo() {
    return mediaInfo;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public JobStatus getStatus() {
    return status;
  }

  public int getProgress() {
    return progress;
  }

  public String getProgressMessage() {
    return progressMessage;
  }

  public String getError() {
    return error;
  }

  public Path getSubtitlePath() {
    return subtitlePath;
  }

  public void setSubtitlePath(Path subtitlePath) {
    this.subtitlePath = subtitlePath;
  }

  public Path getOptimizedSubtitlePath() {
    return optimizedSubtitlePath;
  }

  public void setOptimizedSubtitlePath(Path optimizedSubtitlePath) {
    this.optimizedSubtitlePath = optimizedSubtitlePath;
  }

  public Path getRenderedVideoPath() {
    return renderedVideoPath;
  }

  public void setRenderedVideoPath(Path renderedVideoPath) {
    this.renderedVideoPath = renderedVideoPath;
  }

  @Override
  public String toString() {
    return "SubtitleJob[" + id + ", " + kind + ", " + status + "]";
  }
}
