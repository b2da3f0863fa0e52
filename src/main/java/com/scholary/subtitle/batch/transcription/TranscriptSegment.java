package com.scholary.subtitle.batch.transcription;

/**
 * A single segment of transcribed audio, as returned by the Whisper service. Times are seconds.
 */
public record TranscriptSegment(double start, double end, String text) {}
