package com.autoapply.tool.easyapply.oracle.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import com.autoapply.common.model.ErrorCode;
import com.autoapply.config.OracleConfig.OracleProperties;
import com.autoapply.tool.easyapply.oracle.OracleException;
import com.autoapply.tool.easyapply.oracle.OracleQuotaExceededException;
import com.fasterxml.jackson.databind.ObjectMapper;

class GeminiClientTest {

  private static final String REPLY = "{\"candidates\":[{\"content\":{\"parts\":"
      + "[{\"text\":\"  Berlin \\n\"}]},\"finishReason\":\"STOP\"}]}";

  private MockRestServiceServer server;
  private OracleProperties properties;
  private GeminiClient client;

  @BeforeEach
  void setUp() {
    RestTemplate restTemplate = new RestTemplate();
    server = MockRestServiceServer.bindTo(restTemplate).build();
    properties = new OracleProperties();
    properties.getGemini().setApiKey("test-key");
    client = new GeminiClient(restTemplate, new ObjectMapper(), properties);
  }

  @Test
  void postsPromptAndReturnsFirstCandidateText() {
    server.expect(requestTo(containsString("gemini-2.0-flash:generateContent?key=test-key")))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.contents[0].parts[0].text").value("Which city?"))
        .andRespond(withSuccess(REPLY, MediaType.APPLICATION_JSON));

    assertThat(client.generate("Which city?")).isEqualTo("Berlin");
    server.verify();
  }

  @Test
  void rateLimitIsAQuotaError() {
    server.expect(requestTo(containsString(":generateContent")))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(() -> client.generate("Which city?"))
        .isInstanceOf(OracleQuotaExceededException.class)
        .satisfies(e -> assertThat(((OracleQuotaExceededException) e).getStatusCode())
            .isEqualTo(429));
  }

  @Test
  void missingKeyIsAConfigurationError() {
    properties.getGemini().setApiKey(" ");

    assertThat(client.isConfigured()).isFalse();
    assertThatThrownBy(() -> client.generate("Which city?"))
        .isInstanceOf(OracleException.class)
        .satisfies(e -> assertThat(((OracleException) e).getErrorCode())
            .isEqualTo(ErrorCode.CONFIGURATION_ERROR));
  }

  @Test
  void responseWithoutTextIsMalformed() {
    String blocked = "{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}";

    assertThatThrownBy(() -> client.extractText(blocked))
        .isInstanceOf(OracleException.class)
        .hasMessageContaining("finishReason=SAFETY");
    assertThatThrownBy(() -> client.extractText("<html>"))
        .isInstanceOf(OracleException.class)
        .hasMessageContaining("not JSON");
  }
}
