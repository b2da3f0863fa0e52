package com.scholary.subtitle.batch.intake;

import com.scholary.subtitle.batch.batch.BusyBatchException;
import com.scholary.subtitle.batch.codec.CodecException;
import com.scholary.subtitle.batch.codec.DocumentCodec;
import com.scholary.subtitle.batch.codec.SubtitleFormat;
import com.scholary.subtitle.batch.codec.SubtitleLayout;
import com.scholary.subtitle.batch.config.BatchProperties;
import com.scholary.subtitle.batch.control.ControlThread;
import com.scholary.subtitle.batch.document.DocumentListener;
import com.scholary.subtitle.batch.document.SubtitleColumn;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.execution.JobEventSink;
import com.scholary.subtitle.batch.execution.JobOutcome;
import com.scholary.subtitle.batch.execution.JobRunner;
import com.scholary.subtitle.batch.execution.RunningJob;
import com.scholary.subtitle.batch.execution.SubtitleOutputs;
import com.scholary.subtitle.batch.job.JobKind;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.SubtitleJob;
import com.scholary.subtitle.batch.media.MediaInfo;
import com.scholary.subtitle.batch.optimization.SubtitleOptimizer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Editor for one subtitle document, fed by a queue of files.
 *
 * <p>A loaded document can be edited cell by cell, merged, optimized in the background and saved.
 * When an optimization ends, successfully or not, the next queued file is loaded and, with
 * auto-optimize on, optimized with the last prompt used. Successful results are saved next to the
 * source as {@code <name>_optimized}.
 *
 * <p>Callable from any thread; state lives on the control thread.
 */
@Service
public class SubtitleWorkbench {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleWorkbench.class);

  private final ControlThread controlThread;
  private final JobRunner runner;
  private final DocumentCodec codec;
  private final SubtitleOptimizer optimizer;
  private final BatchProperties.IntakeProperties intake;
  private final FileIntakeQueue queue = new FileIntakeQueue();

  private Path currentFile;
  private SubtitleDocument document;
  private RunningJob optimization;
  private long revision;
  private int progress;
  private String message = "";
  private String lastError;
  private Path lastSavedFile;
  private String lastPrompt = "";
  private String lastTargetLanguage = "";

  private final DocumentListener revisionCounter =
      new DocumentListener() {
        @Override
        public void entriesChanged(Set<Integer> keys) {
          revision++;
        }

        @Override
        public void entriesReplaced() {
          revision++;
        }
      };

  public SubtitleWorkbench(
      ControlThread controlThread,
      JobRunner runner,
      DocumentCodec codec,
      SubtitleOptimizer optimizer,
      BatchProperties properties) {
    this.controlThread = controlThread;
    this.runner = runner;
    this.codec = codec;
    this.optimizer = optimizer;
    this.intake = properties.intake();
  }

  /**
   * Queue subtitle files. If nothing is being optimized, the first queued file is loaded and
   * processed right away.
   *
   * @throws IllegalArgumentException if a file does not exist
   * @throws com.scholary.subtitle.batch.codec.UnsupportedFormatException if a file is not a
   *     subtitle file
   */
  public WorkbenchSnapshot enqueueFiles(List<Path> files) {
    List<Path> normalized = new ArrayList<>(files.size());
    for (Path file : files) {
      Path path = file.toAbsolutePath().normalize();
      SubtitleFormat.fromPath(path);
      if (!Files.isRegularFile(path)) {
        throw new IllegalArgumentException("Subtitle file does not exist: " + path);
      }
      normalized.add(path);
    }

    return controlThread.call(
        () -> {
          queue.enqueue(normalized);
          LOGGER.info("Queued {} file(s), {} waiting", normalized.size(), queue.size());
          if (optimization == null) {
            advanceQueue();
          }
          return buildSnapshot();
        });
  }

  /**
   * Load the next queued file and, with auto-optimize on, start optimizing it.
   *
   * @return false if the queue was empty
   * @throws BusyBatchException while an optimization runs
   */
  public boolean processNextFile() {
    return controlThread.call(
        () -> {
          requireNoOptimization();
          return advanceQueue();
        });
  }

  /**
   * Load a subtitle file into the editor, replacing the current document.
   *
   * @throws BusyBatchException while an optimization runs
   */
  public WorkbenchSnapshot loadFile(Path file) {
    Path path = file.toAbsolutePath().normalize();
    return controlThread.call(
        () -> {
          requireNoOptimization();
          load(path);
          return buildSnapshot();
        });
  }

  /**
   * Optimize the loaded document in the background.
   *
   * @param prompt extra instructions for the optimizer, may be blank
   * @param targetLanguage language to translate into, blank to only correct the text
   * @throws IllegalStateException if no document is loaded
   * @throws BusyBatchException while another optimization runs
   */
  public WorkbenchSnapshot optimize(String prompt, String targetLanguage) {
    return controlThread.call(
        () -> {
          requireDocument();
          requireNoOptimization();
          startOptimization(
              prompt == null ? "" : prompt, targetLanguage == null ? "" : targetLanguage);
          return buildSnapshot();
        });
  }

  /**
   * Stop the running optimization. Texts already applied stay in the document; the queue does not
   * advance.
   *
   * @return true if an optimization was running
   */
  public boolean cancelOptimization() {
    return controlThread.call(
        () -> {
          if (optimization == null) {
            return false;
          }
          optimization.cancel();
          optimization = null;
          progress = 0;
          message = "Optimization cancelled";
          LOGGER.info("Optimization cancelled: file={}", currentFile);
          return true;
        });
  }

  /**
   * Merge the selected rows of the loaded document.
   *
   * @return false if fewer than two rows were selected
   * @throws BusyBatchException while an optimization runs
   */
  public boolean mergeRows(Collection<Integer> keys) {
    return controlThread.call(
        () -> {
          requireDocument();
          requireNoOptimization();
          return document.merge(keys);
        });
  }

  /**
   * Edit one cell of the loaded document.
   *
   * @throws BusyBatchException while an optimization runs, since its result replaces the document
   */
  public void setCell(int key, SubtitleColumn column, String value) {
    controlThread.run(
        () -> {
          requireDocument();
          requireNoOptimization();
          document.setCell(key, column, value);
        });
  }

  /**
   * Save the loaded document.
   *
   * @param target destination; null saves next to the loaded file as {@code <name>_optimized}
   * @param format output format; null takes it from the target's extension
   * @param layout text arrangement; null uses the configured layout
   * @param style ASS style payload, may be null
   * @return the file written
   */
  public Path saveDocument(
      Path target, SubtitleFormat format, SubtitleLayout layout, String style) {
    return controlThread.call(
        () -> {
          requireDocument();
          SubtitleFormat outputFormat =
              format != null
                  ? format
                  : target != null ? SubtitleFormat.fromPath(target) : intake.outputFormat();
          Path output =
              target != null
                  ? target
                  : SubtitleOutputs.optimizedSubtitlePath(
                      currentFile, "." + outputFormat.extension());
          SubtitleLayout outputLayout = layout != null ? layout : intake.outputLayout();
          codec.save(document, output, outputFormat, outputLayout, style);
          lastSavedFile = output;
          return output;
        });
  }

  public WorkbenchSnapshot snapshot() {
    return controlThread.call(this::buildSnapshot);
  }

  /** Drop queued files that have not been loaded yet. */
  public void clearQueue() {
    controlThread.run(queue::clear);
  }

  private boolean advanceQueue() {
    Optional<Path> next = queue.dequeueNext();
    while (next.isPresent()) {
      try {
        load(next.get());
        if (intake.autoOptimize()) {
          startOptimization(lastPrompt, lastTargetLanguage);
        }
        return true;
      } catch (CodecException e) {
        LOGGER.error("Skipping queued file: file={}, error={}", next.get(), e.getMessage());
        lastError = e.getMessage();
        next = queue.dequeueNext();
      }
    }
    LOGGER.info("Intake queue is empty");
    return false;
  }

  private void load(Path file) {
    SubtitleDocument loaded = codec.load(file);
    if (document != null) {
      document.removeListener(revisionCounter);
    }
    document = loaded;
    document.addListener(revisionCounter);
    currentFile = file;
    revision++;
    progress = 0;
    message = "Loaded " + document.size() + " entries";
  }

  private void startOptimization(String prompt, String targetLanguage) {
    lastPrompt = prompt;
    lastTargetLanguage = targetLanguage;

    JobParameters parameters =
        new JobParameters(
            targetLanguage,
            true,
            !targetLanguage.isBlank(),
            false,
            0,
            0,
            prompt,
            intake.outputLayout(),
            intake.outputFormat(),
            0,
            0,
            "",
            false);
    SubtitleJob job =
        new SubtitleJob(
            currentFile,
            JobKind.OPTIMIZATION_ONLY,
            parameters,
            MediaInfo.ofSubtitle(currentFile.getFileName().toString(), 0));
    SubtitleDocument input = document.copy();

    RunningJob handle = new RunningJob(job);
    optimization = handle;
    progress = 0;
    message = "Optimizing";
    lastError = null;
    LOGGER.info("Optimization started: file={}, entries={}", currentFile, input.size());

    runner.launch(
        handle,
        new WorkbenchSink(handle),
        context ->
            new JobOutcome(null, null, null, optimizer.optimize(job, input, prompt, context)));
  }

  private void requireDocument() {
    if (document == null) {
      throw new IllegalStateException("No subtitle file loaded");
    }
  }

  private void requireNoOptimization() {
    if (optimization != null) {
      throw new BusyBatchException("An optimization is already running");
    }
  }

  private WorkbenchSnapshot buildSnapshot() {
    List<WorkbenchRow> rows = new ArrayList<>();
    if (document != null) {
      for (Map.Entry<Integer, SubtitleEntry> entry : document.entries().entrySet()) {
        rows.add(WorkbenchRow.of(entry.getKey(), entry.getValue()));
      }
    }
    return new WorkbenchSnapshot(
        currentFile == null ? null : currentFile.toString(),
        optimization != null,
        progress,
        message,
        lastError,
        lastSavedFile == null ? null : lastSavedFile.toString(),
        revision,
        queue.pending().stream().map(Path::toString).toList(),
        rows);
  }

  private final class WorkbenchSink implements JobEventSink {

    private final RunningJob handle;

    WorkbenchSink(RunningJob handle) {
      this.handle = handle;
    }

    private boolean isCurrent() {
      return optimization == handle;
    }

    @Override
    public void onProgress(int percent, String text) {
      if (isCurrent()) {
        progress = percent;
        message = text;
      }
    }

    @Override
    public void onPartialUpdate(Map<Integer, String> texts) {
      if (isCurrent()) {
        document.applyTextUpdates(texts);
      }
    }

    @Override
    public void onFullUpdate(List<SubtitleEntry> entries) {
      if (isCurrent()) {
        document.replaceAll(entries);
      }
    }

    @Override
    public void onSuccess(JobOutcome outcome) {
      if (!isCurrent()) {
        return;
      }
      optimization = null;
      document.replaceAll(outcome.document().entryList());
      progress = 100;
      message = "Optimization finished";
      try {
        Path output =
            SubtitleOutputs.optimizedSubtitlePath(
                currentFile, "." + intake.outputFormat().extension());
        codec.save(document, output, intake.outputFormat(), intake.outputLayout(), null);
        lastSavedFile = output;
      } catch (CodecException e) {
        LOGGER.error("Failed to save optimized subtitle: file={}", currentFile, e);
        lastError = e.getMessage();
      }
      LOGGER.info("Optimization finished: file={}", currentFile);
      advanceQueue();
    }

    @Override
    public void onError(String error, Throwable cause) {
      if (!isCurrent()) {
        return;
      }
      optimization = null;
      progress = 0;
      message = "Optimization failed";
      lastError = error;
      LOGGER.error("Optimization failed: file={}, error={}", currentFile, error);
      advanceQueue();
    }
  }
}
