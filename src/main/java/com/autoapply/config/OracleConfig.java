package com.autoapply.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.web.client.RestTemplate;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import com.autoapply.tool.easyapply.oracle.client.GeminiClient;
import com.autoapply.tool.easyapply.oracle.impl.ChainedAnswerOracle;
import com.autoapply.tool.easyapply.oracle.impl.ConsoleAnswerOracle;
import com.autoapply.tool.easyapply.oracle.impl.GeminiAnswerOracle;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Configuration for the answer oracle and the language-model client behind it
 */
@Slf4j
@Configuration
@EnableRetry
public class OracleConfig {

  @Data
  public static class GeminiProperties {
    private String apiKey;
    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/models";
    private String model = "gemini-2.0-flash";
    private Integer maxOutputTokens = 1024;
    private Double temperature = 0.4;
    private Duration timeout = Duration.ofSeconds(30);
  }

  @Data
  public static class RetryProperties {
    private int maxAttempts = 3;
    private long delayMs = 1000;
    private double multiplier = 2.0;
  }

  @Data
  public static class OracleProperties {
    /**
     * Oracles consulted in order until one resolves the question
     */
    private List<String> providers = new ArrayList<>(List.of("gemini", "console"));

    /**
     * Profile text given to the language model as applicant background
     */
    private String applicantProfile = "";

    private GeminiProperties gemini = new GeminiProperties();
    private RetryProperties retry = new RetryProperties();
  }

  @Bean
  @ConfigurationProperties(prefix = "easy-apply.oracle")
  public OracleProperties oracleProperties() {
    return new OracleProperties();
  }

  @Bean
  public RestTemplate oracleRestTemplate(RestTemplateBuilder builder,
      OracleProperties oracleProperties) {
    Duration timeout = oracleProperties.getGemini().getTimeout();
    RestTemplate restTemplate =
        builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();

    restTemplate.getInterceptors().add((request, body, execution) -> {
      request.getHeaders().add("User-Agent", "EasyApply-Bot/1.0");
      return execution.execute(request, body);
    });

    return restTemplate;
  }

  @Bean
  public GeminiAnswerOracle geminiAnswerOracle(GeminiClient geminiClient,
      OracleProperties oracleProperties) {
    return new GeminiAnswerOracle(geminiClient, oracleProperties);
  }

  @Bean
  public ConsoleAnswerOracle consoleAnswerOracle() {
    return new ConsoleAnswerOracle(System.in, System.out);
  }

  @Bean
  @Primary
  public AnswerOracle answerOracle(OracleProperties oracleProperties,
      GeminiAnswerOracle geminiAnswerOracle, ConsoleAnswerOracle consoleAnswerOracle) {
    Map<String, AnswerOracle> available = new LinkedHashMap<>();
    available.put(geminiAnswerOracle.getName(), geminiAnswerOracle);
    available.put(consoleAnswerOracle.getName(), consoleAnswerOracle);

    List<AnswerOracle> chain = new ArrayList<>();
    for (String provider : oracleProperties.getProviders()) {
      AnswerOracle oracle = available.get(provider.trim().toLowerCase());
      if (oracle == null) {
        log.warn("Unknown answer oracle provider '{}' ignored, known: {}", provider,
            available.keySet());
        continue;
      }
      chain.add(oracle);
    }
    log.info("Answer oracle chain: {}", chain.stream().map(AnswerOracle::getName).toList());
    return new ChainedAnswerOracle(chain);
  }
}
