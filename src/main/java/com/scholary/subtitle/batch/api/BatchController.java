package com.scholary.subtitle.batch.api;

import com.scholary.subtitle.batch.batch.BatchService;
import com.scholary.subtitle.batch.batch.BatchStatus;
import com.scholary.subtitle.batch.batch.JobStartResult;
import com.scholary.subtitle.batch.job.JobSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the job list and the batch scheduler.
 *
 * <p>Job ids are file paths, so single-job endpoints take the id as the {@code id} query
 * parameter.
 */
@RestController
@Tag(name = "Batch", description = "Job list and sequential batch processing")
public class BatchController {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchController.class);

  private final BatchService batchService;

  public BatchController(BatchService batchService) {
    this.batchService = batchService;
  }

  @GetMapping("/api/jobs")
  @Operation(summary = "List jobs", description = "All jobs in batch order")
  public List<JobSnapshot> listJobs() {
    return batchService.listJobs();
  }

  @PostMapping("/api/jobs")
  @Operation(
      summary = "Add jobs",
      description = "Probe the files and append one PENDING job per file. All or nothing.")
  public ResponseEntity<List<JobSnapshot>> addJobs(@Valid @RequestBody AddJobsRequest request) {
    LOGGER.info("Add jobs request: files={}, kind={}", request.paths().size(), request.kind());
    List<Path> paths = request.paths().stream().map(Path::of).toList();
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(batchService.addJobs(paths, request.kind(), request.parameters()));
  }

  @DeleteMapping("/api/jobs")
  @Operation(summary = "Clear jobs", description = "Remove every job. Rejected while a batch runs.")
  public ResponseEntity<Void> clearAll() {
    batchService.clearAll();
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/job")
  @Operation(summary = "Get job")
  public JobSnapshot getJob(@RequestParam String id) {
    return batchService.getJob(id);
  }

  @DeleteMapping("/api/job")
  @Operation(summary = "Remove job", description = "Rejected while a batch runs")
  public ResponseEntity<Void> removeJob(@RequestParam String id) {
    batchService.removeJob(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/job/start")
  @Operation(
      summary = "Start job",
      description =
          "Run one job on its own, for instance to reprocess a failed one. A completed job is"
              + " left alone and answered with 200 and started=false.")
  public ResponseEntity<JobStartResult> startJob(@RequestParam String id) {
    JobStartResult result = batchService.startJob(id);
    if (!result.started()) {
      LOGGER.warn("Start request ignored: id={}, reason={}", id, result.message());
      return ResponseEntity.ok(result);
    }
    return ResponseEntity.accepted().body(result);
  }

  @PostMapping("/api/job/cancel")
  @Operation(summary = "Cancel job", description = "Stop a job running on its own")
  public JobSnapshot cancelJob(@RequestParam String id) {
    return batchService.cancelJob(id);
  }

  @PostMapping("/api/job/reset")
  @Operation(summary = "Reset job", description = "Put a job back to PENDING so it runs again")
  public JobSnapshot resetJob(@RequestParam String id) {
    return batchService.resetJob(id);
  }

  @GetMapping("/api/batch")
  @Operation(summary = "Batch status")
  public BatchStatus status() {
    return batchService.status();
  }

  @PostMapping("/api/batch/start")
  @Operation(
      summary = "Start batch",
      description = "Run every job that has not ended, one at a time, in list order")
  public ResponseEntity<BatchStatus> startBatch() {
    batchService.startBatch();
    return ResponseEntity.accepted().body(batchService.status());
  }

  @PostMapping("/api/batch/cancel")
  @Operation(summary = "Cancel batch", description = "Stop the batch and every running job")
  public BatchStatus cancelBatch() {
    batchService.cancelBatch();
    return batchService.status();
  }

  @PutMapping("/api/batch/completion-policy")
  @Operation(summary = "Set completion policy", description = "Action to run when a batch ends")
  public BatchStatus setCompletionPolicy(@Valid @RequestBody CompletionPolicyRequest request) {
    batchService.setCompletionPolicy(request.policy());
    return batchService.status();
  }

  @PostMapping("/api/batch/completion-action/abort")
  @Operation(
      summary = "Abort completion action",
      description = "Abort a pending suspend or shutdown")
  public AbortResponse abortCompletionAction() {
    return new AbortResponse(batchService.abortCompletionAction());
  }
}
