package com.scholary.subtitle.batch.api;

import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Keys of the rows to merge. Rows in between are merged as well. */
public record MergeRowsRequest(@NotNull List<@NotNull Integer> keys) {}
