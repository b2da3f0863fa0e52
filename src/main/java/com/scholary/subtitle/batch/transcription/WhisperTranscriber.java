package com.scholary.subtitle.batch.transcription;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.execution.JobCancelledException;
import com.scholary.subtitle.batch.execution.WorkerContext;
import com.scholary.subtitle.batch.job.SubtitleJob;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link Transcriber} calling the faster-whisper transcription API.
 *
 * <p>Sends the whole source file as multipart/form-data and retries transient failures with
 * exponential backoff. The cancellation token is checked before every attempt.
 */
@Component
public class WhisperTranscriber implements Transcriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperTranscriber.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperTranscriber(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, language={}",
        properties.baseUrl(),
        properties.language().isEmpty() ? "auto" : properties.language());
  }

  @Override
  public SubtitleDocument transcribe(SubtitleJob job, WorkerContext context) {
    Path audioFile = job.getSource();
    LOGGER.info("Transcribing: file={}", audioFile.getFileName());

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      context.checkCancelled();
      try {
        context.progress(5, "Uploading " + audioFile.getFileName());
        WhisperResponse response = attemptTranscribe(audioFile);
        SubtitleDocument document = toDocument(response);
        context.progress(100, "Transcribed " + document.size() + " segments");
        return document;
      } catch (IOException | InterruptedException e) {
        if (e instanceof InterruptedException || context.token().isCancelled()) {
          Thread.currentThread().interrupt();
          throw new JobCancelledException();
        }
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      }
    }

    throw new TranscriptionException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  /** Whisper segments to document entries, dropping empty and zero-length segments. */
  static SubtitleDocument toDocument(WhisperResponse response) {
    List<SubtitleEntry> entries = new ArrayList<>();
    if (response.segments() != null) {
      for (TranscriptSegment segment : response.segments()) {
        long start = Math.round(Math.max(0, segment.start()) * 1000);
        long end = Math.round(segment.end() * 1000);
        String text = segment.text() == null ? "" : segment.text().strip();
        if (end <= start || text.isEmpty()) {
          continue;
        }
        entries.add(SubtitleEntry.of(start, end, text));
      }
    }
    return new SubtitleDocument(entries);
  }

  private WhisperResponse attemptTranscribe(Path audioFile)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + properties.transcribePath()))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(audioFile, properties.language(), boundary))
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        whisperResponse.segments() == null ? 0 : whisperResponse.segments().size(),
        whisperResponse.language());

    return whisperResponse;
  }

  /**
   * Build a multipart/form-data body. The file part is streamed from disk.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="language"
   *
   * en
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="talk.mp4"
   * Content-Type: application/octet-stream
   *
   * [binary data]
   * --boundary--
   * </pre>
   */
  static BodyPublisher buildMultipartBody(Path audioFile, String language, String boundary)
      throws IOException {

    StringBuilder sb = new StringBuilder();
    if (!language.isEmpty()) {
      sb.append("--").append(boundary).append("\r\n");
      sb.append("Content-Disposition: form-data; name=\"language\"\r\n\r\n");
      sb.append(language).append("\r\n");
    }
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(audioFile.getFileName())
        .append("\"\r\n");
    sb.append("Content-Type: application/octet-stream\r\n\r\n");
    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] suffix = ("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8);

    return BodyPublishers.concat(
        BodyPublishers.ofByteArray(prefix),
        BodyPublishers.ofFile(audioFile),
        BodyPublishers.ofByteArray(suffix));
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new JobCancelledException();
    }
  }
}
