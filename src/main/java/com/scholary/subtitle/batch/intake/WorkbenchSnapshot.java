package com.scholary.subtitle.batch.intake;

import java.util.List;

/**
 * State of the subtitle workbench.
 *
 * @param currentFile the loaded file, or null
 * @param revision increases with every change to the document
 * @param queuedFiles files waiting in the intake queue, in order
 */
public record WorkbenchSnapshot(
    String currentFile,
    boolean optimizing,
    int progress,
    String message,
    String lastError,
    String lastSavedFile,
    long revision,
    List<String> queuedFiles,
    List<WorkbenchRow> rows) {}
