package com.scholary.subtitle.batch.execution;

import com.scholary.subtitle.batch.document.SubtitleDocument;
import java.nio.file.Path;

/**
 * Result of a finished worker. Paths are null for outputs the job did not produce.
 *
 * @param document the final document, handed over to the control thread
 */
public record JobOutcome(
    Path subtitlePath,
    Path optimizedSubtitlePath,
    Path renderedVideoPath,
    SubtitleDocument document) {}
