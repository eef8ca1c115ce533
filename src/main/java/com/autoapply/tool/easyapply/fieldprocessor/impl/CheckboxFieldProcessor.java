package com.autoapply.tool.easyapply.fieldprocessor.impl;

import java.time.Duration;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.fieldprocessor.FieldProcessor;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checkbox groups are treated as one boolean on the first box. Best effort: always succeeds.
 * Styled checkboxes hide the input, so the associated label is clicked first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckboxFieldProcessor implements FieldProcessor {

  private final EasyApplyProperties properties;

  @Override
  public FieldKind supportedKind() {
    return FieldKind.CHECKBOX;
  }

  @Override
  public boolean process(FieldDescriptor field, AnswerStore answerStore) {
    String label = field.getLabel();
    String answer = answerStore.get(label).orElse(properties.getDefaults().getCheckbox());
    UiElement box = field.getHandle();
    Duration timeout = properties.getWizard().getClickTimeout();

    try {
      boolean checked = box.isChecked();
      if (LabelUtils.isYes(answer) && !checked) {
        toggle(field, box, timeout);
        log.info("Checked checkbox '{}'", label);
      } else if (LabelUtils.isNo(answer) && checked) {
        toggle(field, box, timeout);
        log.info("Unchecked checkbox '{}'", label);
      } else {
        log.debug("Checkbox '{}' already in state '{}'", label, answer);
      }
    } catch (UiInteractionException e) {
      log.warn("Could not set checkbox '{}': {}", label, e.getMessage());
    }
    return true;
  }

  private void toggle(FieldDescriptor field, UiElement box, Duration timeout) {
    if (clickLabel(field, box, timeout)) {
      return;
    }
    try {
      box.click(timeout);
    } catch (UiInteractionException e) {
      log.debug("Direct checkbox click failed, using script click: {}", e.getMessage());
      box.scriptClick();
    }
  }

  private boolean clickLabel(FieldDescriptor field, UiElement box, Duration timeout) {
    if (field.getScope() == null) {
      return false;
    }
    try {
      String id = box.getAttribute("id");
      if (StringUtils.isBlank(id)) {
        return false;
      }
      ElementSet labels = field.getScope()
          .locate("label[for=\"" + RadioGroupFieldProcessor.cssEscape(id) + "\"]");
      if (labels.isEmpty()) {
        return false;
      }
      labels.first().click(timeout);
      return true;
    } catch (UiInteractionException e) {
      log.debug("Label click failed for checkbox '{}': {}", field.getLabel(), e.getMessage());
      return false;
    }
  }
}
