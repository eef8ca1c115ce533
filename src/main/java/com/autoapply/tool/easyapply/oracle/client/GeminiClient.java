package com.autoapply.tool.easyapply.oracle.client;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import com.autoapply.common.model.ErrorCode;
import com.autoapply.config.OracleConfig.GeminiProperties;
import com.autoapply.config.OracleConfig.OracleProperties;
import com.autoapply.tool.easyapply.oracle.OracleException;
import com.autoapply.tool.easyapply.oracle.OracleQuotaExceededException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Gemini generateContent client. Transient failures are retried with exponential backoff; the
 * last failure propagates to the caller.
 */
@Component
@Slf4j
public class GeminiClient {

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final OracleProperties oracleProperties;

  public GeminiClient(RestTemplate oracleRestTemplate, ObjectMapper objectMapper,
      OracleProperties oracleProperties) {
    this.restTemplate = oracleRestTemplate;
    this.objectMapper = objectMapper;
    this.oracleProperties = oracleProperties;
  }

  public boolean isConfigured() {
    String apiKey = oracleProperties.getGemini().getApiKey();
    return apiKey != null && !apiKey.isBlank();
  }

  /**
   * Send one prompt and return the text of the first candidate
   *
   * @param prompt the full prompt
   * @return generated text, trimmed
   * @throws OracleException when the service is unavailable or the response is malformed
   */
  @Retryable(retryFor = {RestClientException.class, OracleException.class},
      maxAttemptsExpression = "${easy-apply.oracle.retry.max-attempts:3}",
      backoff = @Backoff(delayExpression = "${easy-apply.oracle.retry.delay-ms:1000}",
          multiplierExpression = "${easy-apply.oracle.retry.multiplier:2.0}"))
  public String generate(String prompt) {
    if (!isConfigured()) {
      throw new OracleException(ErrorCode.CONFIGURATION_ERROR, "Gemini API key is not configured");
    }
    GeminiProperties gemini = oracleProperties.getGemini();
    log.debug("Calling Gemini model {} with prompt of {} characters", gemini.getModel(),
        prompt.length());

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<Map<String, Object>> httpEntity =
        new HttpEntity<>(createRequestPayload(prompt, gemini), headers);

    // API key goes in the query string, no Authorization header
    String url = gemini.getBaseUrl() + "/" + gemini.getModel() + ":generateContent?key="
        + gemini.getApiKey();

    ResponseEntity<String> response;
    try {
      response = restTemplate.exchange(url, HttpMethod.POST, httpEntity, String.class);
    } catch (HttpClientErrorException.TooManyRequests e) {
      throw new OracleQuotaExceededException("Gemini quota exceeded: " + e.getStatusText(),
          e.getStatusCode().value());
    }

    if (response.getStatusCode() != HttpStatus.OK) {
      throw new OracleException("Gemini request failed with status: " + response.getStatusCode());
    }
    return extractText(response.getBody());
  }

  private Map<String, Object> createRequestPayload(String prompt, GeminiProperties gemini) {
    Map<String, Object> payload = new HashMap<>();

    List<Map<String, Object>> contents = new ArrayList<>();
    Map<String, Object> content = new HashMap<>();

    List<Map<String, String>> parts = new ArrayList<>();
    Map<String, String> part = new HashMap<>();
    part.put("text", prompt);
    parts.add(part);

    content.put("parts", parts);
    contents.add(content);

    payload.put("contents", contents);

    Map<String, Object> generationConfig = new HashMap<>();
    generationConfig.put("temperature", gemini.getTemperature());
    generationConfig.put("topP", 0.8);
    generationConfig.put("topK", 40);
    generationConfig.put("maxOutputTokens", gemini.getMaxOutputTokens());

    payload.put("generationConfig", generationConfig);

    return payload;
  }

  String extractText(String body) {
    if (body == null || body.isBlank()) {
      throw new OracleException(ErrorCode.ORACLE_MALFORMED_RESPONSE, "Empty Gemini response");
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0)
          .path("text");
      if (text.isMissingNode() || text.asText().isBlank()) {
        String finishReason = root.path("candidates").path(0).path("finishReason").asText("");
        throw new OracleException(ErrorCode.ORACLE_MALFORMED_RESPONSE,
            "Gemini response has no text (finishReason=" + finishReason + ")");
      }
      return text.asText().trim();
    } catch (JsonProcessingException e) {
      throw new OracleException(ErrorCode.ORACLE_MALFORMED_RESPONSE,
          "Gemini response is not JSON: " + e.getOriginalMessage());
    }
  }
}
