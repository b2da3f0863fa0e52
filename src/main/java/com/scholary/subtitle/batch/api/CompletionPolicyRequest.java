package com.scholary.subtitle.batch.api;

import com.scholary.subtitle.batch.completion.CompletionPolicy;
import jakarta.validation.constraints.NotNull;

public record CompletionPolicyRequest(@NotNull CompletionPolicy policy) {}
