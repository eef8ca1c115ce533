package com.autoapply.tool.easyapply.fieldprocessor.impl;

import java.time.Duration;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.fieldprocessor.rule.AnswerRuleTable;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import lombok.extern.slf4j.Slf4j;

/**
 * Radio groups. The chosen radio is clicked through its label, then directly, then from a
 * script, since styled radios often hide the input behind the label.
 */
@Slf4j
@Component
public class RadioGroupFieldProcessor extends AbstractChoiceFieldProcessor {

  private final EasyApplyProperties properties;

  public RadioGroupFieldProcessor(AnswerRuleTable ruleTable, AnswerOracle answerOracle,
      EasyApplyProperties properties) {
    super(ruleTable, answerOracle);
    this.properties = properties;
  }

  @Override
  public FieldKind supportedKind() {
    return FieldKind.RADIO;
  }

  @Override
  protected boolean apply(FieldDescriptor field, int index) {
    if (index >= field.getOptionHandles().size()) {
      log.error("No handle for option {} of '{}'", index, field.getLabel());
      return false;
    }
    UiElement radio = field.getOptionHandles().get(index);
    Duration timeout = properties.getWizard().getClickTimeout();

    String id = safeAttribute(radio, "id");
    if (StringUtils.isNotBlank(id) && field.getScope() != null) {
      try {
        ElementSet labels = field.getScope().locate("label[for=\"" + cssEscape(id) + "\"]");
        if (!labels.isEmpty()) {
          labels.first().click(timeout);
          return true;
        }
      } catch (UiInteractionException e) {
        log.debug("Label click failed for '{}': {}", field.getLabel(), e.getMessage());
      }
    }

    try {
      radio.click(timeout);
      return true;
    } catch (UiInteractionException e) {
      log.debug("Direct radio click failed for '{}': {}", field.getLabel(), e.getMessage());
    }

    try {
      radio.scriptClick();
      return true;
    } catch (UiInteractionException e) {
      log.error("All click strategies failed for radio '{}': {}", field.getLabel(),
          e.getMessage());
      return false;
    }
  }

  private static String safeAttribute(UiElement element, String name) {
    try {
      return element.getAttribute(name);
    } catch (UiInteractionException e) {
      return null;
    }
  }

  static String cssEscape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
