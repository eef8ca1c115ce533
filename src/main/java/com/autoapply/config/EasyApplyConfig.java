package com.autoapply.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Configuration for the application wizard, its storage and the browser session
 */
@Configuration
public class EasyApplyConfig {

  @Data
  public static class WizardProperties {
    /**
     * Step advances allowed before the attempt is abandoned
     */
    @Min(1)
    private int maxSteps = 8;

    /**
     * Consecutive identical step fingerprints before the loop breaker runs
     */
    @Min(1)
    private int duplicateThreshold = 2;

    /**
     * Iterations in which every continue control failed before the attempt is abandoned
     */
    @Min(1)
    private int stuckThreshold = 5;

    /**
     * When false the wizard stops at the Submit step and reports the attempt as incomplete
     */
    private boolean autoSubmit = true;

    private Duration clickTimeout = Duration.ofSeconds(3);
    private Duration entryRenderWait = Duration.ofMillis(1500);
    private Duration fieldSettleWait = Duration.ofMillis(800);
    private Duration stepTransitionWait = Duration.ofMillis(1500);
    private Duration submitWait = Duration.ofSeconds(2);
    private Duration closeWait = Duration.ofSeconds(1);

    /**
     * Substring the page URL must keep after the entry click; empty disables the redirect guard
     */
    private String allowedUrlFragment = "linkedin.com";

    /**
     * URL substrings that count as a redirect even on the job board host, such as upsell pages
     */
    private List<String> blockedUrlPatterns = new ArrayList<>(List.of("linkedin.com/premium"));
  }

  @Data
  public static class StorageProperties {
    @NotBlank
    private String answersFile = "answers/default.json";

    @NotBlank
    private String dataDir = "data";
  }

  @Data
  public static class DefaultAnswerProperties {
    private String yearsOfExperience = "2";
    private String noticePeriod = "2 weeks";
    private String salary = "50000";
    private String checkbox = "Yes";

    /**
     * Filled into free-text fields when no answer could be resolved; never stored
     */
    private String fallbackText = "N/A";
  }

  @Data
  public static class SessionProperties {
    private boolean enabled = true;
    private String cookieFile = "cookies/session.json";
    private Duration saveInterval = Duration.ofMinutes(5);

    /**
     * Minimum gap between two non-forced saves
     */
    private Duration minSaveGap = Duration.ofSeconds(30);
  }

  @Data
  public static class BrowserProperties {
    private boolean headless = false;
    private Duration pageLoadTimeout = Duration.ofSeconds(60);
    private String homeUrl = "https://www.linkedin.com/feed/";
  }

  @Data
  public static class RunnerProperties {
    private boolean enabled = false;
    private String jobsFile = "data/jobs.json";
    private Duration pauseBetweenJobs = Duration.ofSeconds(3);
  }

  @Data
  @Validated
  public static class EasyApplyProperties {
    @Valid
    private WizardProperties wizard = new WizardProperties();
    @Valid
    private StorageProperties storage = new StorageProperties();
    private DefaultAnswerProperties defaults = new DefaultAnswerProperties();
    private SessionProperties session = new SessionProperties();
    private BrowserProperties browser = new BrowserProperties();
    private RunnerProperties runner = new RunnerProperties();
  }

  @Bean
  @ConfigurationProperties(prefix = "easy-apply")
  public EasyApplyProperties easyApplyProperties() {
    return new EasyApplyProperties();
  }
}
