package com.scholary.subtitle.batch.optimization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.subtitle.batch.document.SubtitleDocument;
import com.scholary.subtitle.batch.document.SubtitleEntry;
import com.scholary.subtitle.batch.execution.JobCancelledException;
import com.scholary.subtitle.batch.execution.WorkerContext;
import com.scholary.subtitle.batch.job.JobParameters;
import com.scholary.subtitle.batch.job.SubtitleJob;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link SubtitleOptimizer} backed by an OpenAI-compatible chat completion API.
 *
 * <p>Entries are sent in batches of {@code batchSize} as a JSON object of key to text, and the
 * model answers with the same keys. Batches run one after another; each answered batch is applied
 * to the working copy and reported as a partial update.
 */
@Component
public class LlmSubtitleOptimizer implements SubtitleOptimizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(LlmSubtitleOptimizer.class);

  private final HttpClient httpClient;
  private final LlmProperties properties;
  private final ObjectMapper objectMapper;

  public LlmSubtitleOptimizer(LlmProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized LLM client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public SubtitleDocument optimize(
      SubtitleJob job, SubtitleDocument document, String prompt, WorkerContext context) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new OptimizationException("No LLM API key configured (llm.apiKey)");
    }

    JobParameters parameters = job.getParameters();
    SubtitleDocument working = document.copy();

    if (parameters.split()) {
      SentenceSplitter splitter =
          new SentenceSplitter(parameters.maxWordCountCjk(), parameters.maxWordCountEnglish());
      List<SubtitleEntry> split = splitter.split(working.entryList());
      if (split.size() != working.size()) {
        LOGGER.info("Split long entries: {} -> {}", working.size(), split.size());
        working.replaceAll(split);
        context.fullUpdate(working.entryList());
      }
    }

    String model = parameters.llmModel().isBlank() ? properties.model() : parameters.llmModel();
    String systemPrompt = buildSystemPrompt(parameters, prompt);
    List<Map<Integer, String>> batches = batches(working, parameters.batchSize());

    int done = 0;
    for (Map<Integer, String> batch : batches) {
      context.checkCancelled();
      Map<Integer, String> answer = complete(model, systemPrompt, batch);
      Map<Integer, String> updates = toUpdates(working, answer, parameters.translate());
      working.applyTextUpdates(updates);
      context.partialUpdate(updates);

      done++;
      context.progress(
          done * 100 / batches.size(),
          String.format("Optimized batch %d/%d", done, batches.size()));
    }

    LOGGER.info(
        "Optimization finished: id={}, entries={}, batches={}",
        job.getId(),
        working.size(),
        batches.size());
    return working;
  }

  static String buildSystemPrompt(JobParameters parameters, String prompt) {
    StringBuilder sb = new StringBuilder();
    sb.append("You correct subtitles produced by speech recognition. ");
    sb.append("Fix recognition errors, punctuation and obvious typos without changing meaning. ");
    if (parameters.translate() && !parameters.targetLanguage().isBlank()) {
      sb.append("Then translate each subtitle into ")
          .append(parameters.targetLanguage())
          .append(" and return only the translation. ");
    }
    sb.append("The input is a JSON object mapping subtitle numbers to text. ");
    sb.append("Answer with a JSON object with exactly the same keys and one line of text per key.");
    if (prompt != null && !prompt.isBlank()) {
      sb.append("\n\nAdditional instructions:\n").append(prompt.strip());
    }
    return sb.toString();
  }

  static List<Map<Integer, String>> batches(SubtitleDocument document, int batchSize) {
    List<Map<Integer, String>> batches = new ArrayList<>();
    Map<Integer, String> current = new LinkedHashMap<>();
    for (Map.Entry<Integer, SubtitleEntry> entry : document.entries().entrySet()) {
      current.put(entry.getKey(), entry.getValue().originalText());
      if (current.size() == batchSize) {
        batches.add(current);
        current = new LinkedHashMap<>();
      }
    }
    if (!current.isEmpty()) {
      batches.add(current);
    }
    return batches;
  }

  /**
   * Turn model answers into document text updates. A translation replaces the translated text; a
   * correction replaces the original text and keeps the existing translation.
   */
  static Map<Integer, String> toUpdates(
      SubtitleDocument document, Map<Integer, String> answer, boolean translate) {
    Map<Integer, String> updates = new LinkedHashMap<>();
    for (Map.Entry<Integer, String> item : answer.entrySet()) {
      var entry = document.get(item.getKey());
      if (entry.isEmpty()) {
        continue;
      }
      String text = item.getValue().replaceAll("\\s*\\R\\s*", " ").strip();
      updates.put(
          item.getKey(), translate ? text : text + "\n" + entry.get().translatedText());
    }
    return updates;
  }

  private Map<Integer, String> complete(
      String model, String systemPrompt, Map<Integer, String> batch) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptComplete(model, systemPrompt, batch);
      } catch (IOException | InterruptedException e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          throw new JobCancelledException();
        }
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "LLM request attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException();
          }
        }
      }
    }

    throw new OptimizationException(
        String.format("LLM request failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private Map<Integer, String> attemptComplete(
      String model, String systemPrompt, Map<Integer, String> batch)
      throws IOException, InterruptedException {

    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", model);
    body.putObject("response_format").put("type", "json_object");
    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", systemPrompt);
    messages.addObject().put("role", "user").put("content", toJson(batch));

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + properties.apiKey())
            .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
            .build();

    LOGGER.debug("Sending chat completion request: entries={}", batch.size());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format("LLM API returned status %d: %s", response.statusCode(), response.body()));
    }

    JsonNode content =
        objectMapper
            .readTree(response.body())
            .path("choices")
            .path(0)
            .path("message")
            .path("content");
    if (!content.isTextual()) {
      throw new IOException("LLM response has no message content");
    }
    return parseAnswer(content.asText(), batch);
  }

  Map<Integer, String> parseAnswer(String content, Map<Integer, String> batch) throws IOException {
    String json = content.strip();
    if (json.startsWith("```")) {
      json = json.replaceFirst("^```(?:json)?\\s*", "").replaceFirst("\\s*```$", "");
    }

    JsonNode node = objectMapper.readTree(json);
    Map<Integer, String> answer = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      try {
        int key = Integer.parseInt(field.getKey().strip());
        if (batch.containsKey(key) && field.getValue().isTextual()) {
          answer.put(key, field.getValue().asText());
        }
      } catch (NumberFormatException e) {
        LOGGER.debug("Ignoring non-numeric key in LLM answer: {}", field.getKey());
      }
    }
    if (answer.size() < batch.size()) {
      LOGGER.warn("LLM answered {} of {} entries", answer.size(), batch.size());
    }
    return answer;
  }

  private String toJson(Map<Integer, String> batch) throws JsonProcessingException {
    Map<String, String> keyed = new LinkedHashMap<>();
    batch.forEach((key, text) -> keyed.put(String.valueOf(key), text));
    return objectMapper.writeValueAsString(keyed);
  }
}
