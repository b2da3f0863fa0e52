package com.scholary.subtitle.batch.completion;

import java.time.Instant;

/** A suspend or shutdown waiting out its grace period. */
public record PendingHostAction(CompletionPolicy policy, Instant executeAt) {}
