package com.scholary.subtitle.batch.job;

import com.scholary.subtitle.batch.codec.SubtitleFormat;
import com.scholary.subtitle.batch.codec.SubtitleLayout;

/**
 * Processing options of a job. Interpreted by the executors only; the scheduler never looks
 * inside.
 *
 * @param targetLanguage language to translate into, blank for none
 * @param optimize run the optimizer over the transcript
 * @param translate ask the optimizer to translate
 * @param split ask the optimizer to re-split long sentences
 * @param batchSize entries per optimizer request
 * @param threadCount optimizer parallelism hint passed to the backend
 * @param prompt extra instructions for the optimizer
 * @param layout text arrangement of exported subtitles
 * @param outputFormat format of the saved subtitle files
 * @param maxWordCountCjk split threshold for CJK text
 * @param maxWordCountEnglish split threshold for space-delimited text
 * @param llmModel optimizer model, blank for the configured default
 * @param burnSubtitles render the subtitle into the video after optimization
 */
public record JobParameters(
    String targetLanguage,
    boolean optimize,
    boolean translate,
    boolean split,
    int batchSize,
    int threadCount,
    String prompt,
    SubtitleLayout layout,
    SubtitleFormat outputFormat,
    int maxWordCountCjk,
    int maxWordCountEnglish,
    String llmModel,
    boolean burnSubtitles) {

  public static final int DEFAULT_BATCH_SIZE = 10;
  public static final int DEFAULT_THREAD_COUNT = 4;
  public static final int DEFAULT_MAX_WORD_COUNT_CJK = 18;
  public static final int DEFAULT_MAX_WORD_COUNT_ENGLISH = 12;

  public JobParameters {
    targetLanguage = targetLanguage == null ? "" : targetLanguage;
    prompt = prompt == null ? "" : prompt;
    llmModel = llmModel == null ? "" : llmModel;
    layout = layout == null ? SubtitleLayout.ORIGINAL_ABOVE : layout;
    outputFormat = outputFormat == null ? SubtitleFormat.SRT : outputFormat;
    batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
    threadCount = threadCount > 0 ? threadCount : DEFAULT_THREAD_COUNT;
    maxWordCountCjk = maxWordCountCjk > 0 ? maxWordCountCjk : DEFAULT_MAX_WORD_COUNT_CJK;
    maxWordCountEnglish =
        maxWordCountEnglish > 0 ? maxWordCountEnglish : DEFAULT_MAX_WORD_COUNT_ENGLISH;
  }

  public static JobParameters defaults() {
    return new JobParameters("", true, false, false, 0, 0, "", null, null, 0, 0, "", true);
  }

  public JobParameters withPrompt(String newPrompt) {
    return new JobParameters(
        targetLanguage,
        optimize,
        translate,
        split,
        batchSize,
        threadCount,
        newPrompt,
        layout,
        outputFormat,
        maxWordCountCjk,
        maxWordCountEnglish,
        llmModel,
        burnSubtitles);
  }
}
