package com.scholary.subtitle.batch.job;

import com.scholary.subtitle.batch.media.MediaInfo;
import java.time.Instant;

/** Immutable view of a job, safe to hand to other threads. */
public record JobSnapshot(
    String id,
    String fileName,
    JobKind kind,
    JobStatus status,
    int progress,
    String progressMessage,
    String error,
    MediaInfo mediaInfo,
    String subtitlePath,
    String optimizedSubtitlePath,
    String renderedVideoPath,
    Instant createdAt) {}
