package com.scholary.subtitle.batch.api;

import com.scholary.subtitle.batch.document.SubtitleColumn;
import jakarta.validation.constraints.NotNull;

/**
 * Edit of one cell.
 *
 * @param value new text, or {@code HH:mm:ss.SSS} for time columns
 */
public record SetCellRequest(@NotNull SubtitleColumn column, @NotNull String value) {}
