package com.scholary.subtitle.batch.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.subtitle.batch.batch.BatchService;
import com.scholary.subtitle.batch.batch.BatchStatus;
import com.scholary.subtitle.batch.batch.BusyBatchException;
import com.scholary.subtitle.batch.batch.EmptyBatchException;
import com.scholary.subtitle.batch.batch.JobStartResult;
import com.scholary.subtitle.batch.batch.SchedulerState;
import com.scholary.subtitle.batch.completion.CompletionPolicy;
import com.scholary.subtitle.batch.job.DuplicateJobException;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobNotFoundException;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.media.MediaInfo;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class BatchControllerTest {

  private BatchService batchService;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    batchService = mock(BatchService.class);
    mockMvc =
        MockMvcBuilders.standaloneSetup(new BatchController(batchService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  private static SubtitleJob job() {
    return new SubtitleJob(
        Path.of("/videos/talk.mp4"),
        JobKind.SUBTITLE_PIPELINE,
        JobParameters.defaults(),
        new MediaInfo("talk.mp4", 100, null, true));
  }

  @Test
  void addJobs_shouldReturnCreatedJobs() throws Exception {
    when(batchService.addJobs(anyList(), eq(JobKind.SUBTITLE_PIPELINE), isNull()))
        .thenReturn(List.of(job().snapshot()));

    mockMvc
        .perform(
            post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paths\":[\"/videos/talk.mp4\"],\"kind\":\"SUBTITLE_PIPELINE\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$[0].fileName").value("talk.mp4"))
        .andExpect(jsonPath("$[0].status").value("PENDING"));

    verify(batchService)
        .addJobs(List.of(Path.of("/videos/talk.mp4")), JobKind.SUBTITLE_PIPELINE, null);
  }

  @Test
  void addJobs_shouldRejectEmptyPathList() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paths\":[],\"kind\":\"SUBTITLE_PIPELINE\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("ValidationFailed"));
  }

  @Test
  void addJobs_shouldMapDuplicateToConflict() throws Exception {
    when(batchService.addJobs(anyList(), any(), any()))
        .thenThrow(new DuplicateJobException("/videos/talk.mp4"));

    mockMvc
        .perform(
            post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paths\":[\"/videos/talk.mp4\"],\"kind\":\"TRANSCRIPTION_ONLY\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("DuplicateJobException"));
  }

  @Test
  void getJob_shouldMapUnknownIdToNotFound() throws Exception {
    when(batchService.getJob("/missing.mp4")).thenThrow(new JobNotFoundException("/missing.mp4"));

    mockMvc
        .perform(get("/api/job").param("id", "/missing.mp4"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Job not found: /missing.mp4"));
  }

  @Test
  void startJob_shouldReturnAcceptedWhenStarted() throws Exception {
    when(batchService.startJob("/videos/talk.mp4"))
        .thenReturn(new JobStartResult(true, null, job().snapshot()));

    mockMvc
        .perform(post("/api/job/start").param("id", "/videos/talk.mp4"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.started").value(true))
        .andExpect(jsonPath("$.job.fileName").value("talk.mp4"));
  }

  @Test
  void startJob_shouldReportCompletedJobAsNotStarted() throws Exception {
    when(batchService.startJob("/videos/talk.mp4"))
        .thenReturn(
            new JobStartResult(false, "Job already completed; reset it", job().snapshot()));

    mockMvc
        .perform(post("/api/job/start").param("id", "/videos/talk.mp4"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.started").value(false))
        .andExpect(jsonPath("$.message").value("Job already completed; reset it"));
  }

  @Test
  void startBatch_shouldReturnAcceptedStatus() throws Exception {
    when(batchService.status())
        .thenReturn(
            new BatchStatus(
                SchedulerState.ACTIVE,
                CompletionPolicy.DO_NOTHING,
                null,
                List.of(job().snapshot())));

    mockMvc
        .perform(post("/api/batch/start"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.state").value("ACTIVE"))
        .andExpect(jsonPath("$.jobs.length()").value(1));
  }

  @Test
  void startBatch_shouldMapEmptyListToBadRequest() throws Exception {
    doThrow(new EmptyBatchException()).when(batchService).startBatch();

    mockMvc.perform(post("/api/batch/start")).andExpect(status().isBadRequest());
  }

  @Test
  void removeJob_shouldMapBusyBatchToConflict() throws Exception {
    doThrow(new BusyBatchException("Cannot remove jobs while a batch is running"))
        .when(batchService)
        .removeJob("/videos/talk.mp4");

    mockMvc
        .perform(delete("/api/job").param("id", "/videos/talk.mp4"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("BusyBatchException"));
  }

  @Test
  void setCompletionPolicy_shouldUpdatePolicy() throws Exception {
    when(batchService.status())
        .thenReturn(
            new BatchStatus(SchedulerState.IDLE, CompletionPolicy.SHUTDOWN_HOST, null, List.of()));

    mockMvc
        .perform(
            put("/api/batch/completion-policy")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"policy\":\"SHUTDOWN_HOST\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.completionPolicy").value("SHUTDOWN_HOST"));

    verify(batchService).setCompletionPolicy(CompletionPolicy.SHUTDOWN_HOST);
  }

  @Test
  void setCompletionPolicy_shouldRejectUnknownPolicy() throws Exception {
    mockMvc
        .perform(
            put("/api/batch/completion-policy")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"policy\":\"REBOOT\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("MalformedRequest"));
  }

  @Test
  void abortCompletionAction_shouldReportResult() throws Exception {
    when(batchService.abortCompletionAction()).thenReturn(true);

    mockMvc
        .perform(post("/api/batch/completion-action/abort"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.aborted").value(true));
  }
}
