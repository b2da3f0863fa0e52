package com.scholary.subtitle.batch.transcription;

import java.util.List;

/** Response from the Whisper transcription API. */
public record WhisperResponse(List<TranscriptSegment> segments, String language) {}
