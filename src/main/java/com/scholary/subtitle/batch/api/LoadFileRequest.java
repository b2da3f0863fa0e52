package com.scholary.subtitle.batch.api;

import jakarta.validation.constraints.NotBlank;

public record LoadFileRequest(@NotBlank String path) {}
