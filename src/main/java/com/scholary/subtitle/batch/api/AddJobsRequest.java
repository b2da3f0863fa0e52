package com.scholary.subtitle.batch.api;

import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobParameters;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request to add jobs to the list.
 *
 * @param paths source files on the server's file system
 * @param parameters processing options, defaults when omitted
 */
public record AddJobsRequest(
    @NotEmpty List<@NotBlank String> paths, @NotNull JobKind kind, JobParameters parameters) {}
