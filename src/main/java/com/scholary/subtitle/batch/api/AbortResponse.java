package com.scholary.subtitle.batch.api;

/** Whether a pending suspend or shutdown was aborted. */
public record AbortResponse(boolean aborted) {}
