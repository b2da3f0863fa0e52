package com.scholary.subtitle.batch.api;

import com.scholary.subtitle.batch.intake.WorkbenchSnapshot;

public record MergeRowsResponse(boolean merged, WorkbenchSnapshot workbench) {}
