package com.scholary.subtitle.batch.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/** Subtitle files to queue for the workbench. */
public record FilesRequest(@NotEmpty List<@NotBlank String> paths) {}
