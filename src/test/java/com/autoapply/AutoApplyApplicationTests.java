package com.autoapply;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.config.OracleConfig.OracleProperties;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;

@SpringBootTest(properties = {
    "easy-apply.oracle.providers=console,unknown",
    "easy-apply.wizard.max-steps=12",
    "easy-apply.session.enabled=false"})
class AutoApplyApplicationTests {

  @Autowired
  private EasyApplyProperties easyApplyProperties;

  @Autowired
  private OracleProperties oracleProperties;

  @Autowired
  private AnswerOracle answerOracle;

  @Test
  void contextLoadsWithoutStartingTheBrowser() {
    assertThat(easyApplyProperties.getWizard().getMaxSteps()).isEqualTo(12);
    assertThat(easyApplyProperties.getWizard().getClickTimeout()).isEqualTo(Duration.ofSeconds(3));
    assertThat(easyApplyProperties.getRunner().isEnabled()).isFalse();
    assertThat(oracleProperties.getProviders()).containsExactly("console", "unknown");
    assertThat(answerOracle.getName()).isEqualTo("chain");
  }
}
