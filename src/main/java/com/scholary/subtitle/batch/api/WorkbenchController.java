package com.scholary.subtitle.batch.api;

import com.scholary.subtitle.batch.intake.SubtitleWorkbench;
import com.scholary.subtitle.batch.intake.WorkbenchSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for editing and optimizing one subtitle document at a time. */
@RestController
@RequestMapping("/api/workbench")
@Tag(name = "Workbench", description = "Subtitle editing, optimization and file intake")
public class WorkbenchController {

  private final SubtitleWorkbench workbench;

  public WorkbenchController(SubtitleWorkbench workbench) {
    this.workbench = workbench;
  }

  @GetMapping
  @Operation(summary = "Workbench state", description = "Loaded document, progress and queue")
  public WorkbenchSnapshot snapshot() {
    return workbench.snapshot();
  }

  @PostMapping("/queue")
  @Operation(
      summary = "Queue files",
      description = "Queue subtitle files; the first is loaded at once if nothing is optimizing")
  public WorkbenchSnapshot enqueueFiles(@Valid @RequestBody FilesRequest request) {
    return workbench.enqueueFiles(request.paths().stream().map(Path::of).toList());
  }

  @DeleteMapping("/queue")
  @Operation(summary = "Clear queue")
  public WorkbenchSnapshot clearQueue() {
    workbench.clearQueue();
    return workbench.snapshot();
  }

  @PostMapping("/next")
  @Operation(summary = "Process next file", description = "Load the next queued file")
  public WorkbenchSnapshot processNextFile() {
    workbench.processNextFile();
    return workbench.snapshot();
  }

  @PostMapping("/load")
  @Operation(summary = "Load file")
  public WorkbenchSnapshot loadFile(@Valid @RequestBody LoadFileRequest request) {
    return workbench.loadFile(Path.of(request.path()));
  }

  @PostMapping("/optimize")
  @Operation(summary = "Optimize", description = "Optimize the loaded document in the background")
  public ResponseEntity<WorkbenchSnapshot> optimize(@RequestBody OptimizeRequest request) {
    return ResponseEntity.accepted()
        .body(workbench.optimize(request.prompt(), request.targetLanguage()));
  }

  @PostMapping("/optimize/cancel")
  @Operation(summary = "Cancel optimization")
  public WorkbenchSnapshot cancelOptimization() {
    workbench.cancelOptimization();
    return workbench.snapshot();
  }

  @PostMapping("/merge")
  @Operation(summary = "Merge rows", description = "Merge the selected rows into one")
  public MergeRowsResponse mergeRows(@Valid @RequestBody MergeRowsRequest request) {
    boolean merged = workbench.mergeRows(request.keys());
    return new MergeRowsResponse(merged, workbench.snapshot());
  }

  @PutMapping("/cells/{key}")
  @Operation(summary = "Edit cell", description = "Time values use HH:mm:ss.SSS")
  public WorkbenchSnapshot setCell(
      @PathVariable int key, @Valid @RequestBody SetCellRequest request) {
    workbench.setCell(key, request.column(), request.value());
    return workbench.snapshot();
  }

  @PostMapping("/save")
  @Operation(summary = "Save document", description = "Save as SRT, ASS or JSON")
  public SaveDocumentResponse saveDocument(@RequestBody SaveDocumentRequest request) {
    Path target =
        request.path() == null || request.path().isBlank() ? null : Path.of(request.path());
    Path saved =
        workbench.saveDocument(target, request.format(), request.layout(), request.style());
    return new SaveDocumentResponse(saved.toString());
  }
}
