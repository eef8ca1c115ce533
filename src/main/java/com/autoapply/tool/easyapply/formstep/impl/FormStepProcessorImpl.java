package com.autoapply.tool.easyapply.formstep.impl;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import com.autoapply.common.util.Constants;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.fieldprocessor.FieldProcessor;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.formstep.FieldLabelResolver;
import com.autoapply.tool.easyapply.formstep.FormStepProcessor;
import com.autoapply.tool.easyapply.formstep.RadioGroupDiscovery;
import com.autoapply.tool.easyapply.formstep.dto.RadioGroup;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class FormStepProcessorImpl implements FormStepProcessor {

  static final String RESUME_SELECTOR = "[data-test-resume-selector-resume-card]";
  static final String TEXT_INPUT_SELECTOR = "input[type='text'], input:not([type])";
  static final String TEXTAREA_SELECTOR = "textarea";
  static final String SELECT_SELECTOR = "select";
  static final String CHECKBOX_SELECTOR = "input[type='checkbox']";

  private static final Pattern RESUME_LABEL = Pattern.compile("\\b(resume|résumé|cv)\\b");

  private final Map<FieldKind, FieldProcessor> processors = new EnumMap<>(FieldKind.class);
  private final AnswerStore answerStore;
  private final FieldLabelResolver labelResolver;
  private final RadioGroupDiscovery radioGroupDiscovery;

  public FormStepProcessorImpl(List<FieldProcessor> fieldProcessors, AnswerStore answerStore,
      FieldLabelResolver labelResolver, RadioGroupDiscovery radioGroupDiscovery) {
    for (FieldProcessor processor : fieldProcessors) {
      processors.put(processor.supportedKind(), processor);
    }
    this.answerStore = answerStore;
    this.labelResolver = labelResolver;
    this.radioGroupDiscovery = radioGroupDiscovery;
  }

  @Override
  public boolean processFields(UiElement modal, JobContext jobContext) {
    List<FieldDescriptor> fields = discoverFields(modal, jobContext);
    log.info("Processing {} fields", fields.size());

    boolean allProcessed = true;
    for (FieldDescriptor field : fields) {
      FieldProcessor processor = processors.get(field.getKind());
      if (processor == null) {
        log.warn("No processor for {} field '{}'", field.getKind(), field.getLabel());
        allProcessed = false;
        continue;
      }
      try {
        if (!processor.process(field, answerStore)) {
          log.warn("Field '{}' ({}) was not filled", field.getLabel(),
              field.getKind().getValue());
          allProcessed = false;
        }
      } catch (RuntimeException e) {
        log.error("Error processing field '{}': {}", field.getLabel(), e.getMessage(), e);
        allProcessed = false;
      }
    }
    return allProcessed;
  }

  @Override
  public List<FieldDescriptor> discoverFields(UiElement modal, JobContext jobContext) {
    List<FieldDescriptor> fields = new ArrayList<>();
    discoverResume(modal, jobContext, fields);
    discoverSingles(modal, jobContext, TEXT_INPUT_SELECTOR, FieldKind.TEXT, fields);
    discoverSingles(modal, jobContext, TEXTAREA_SELECTOR, FieldKind.TEXTAREA, fields);
    discoverSelects(modal, jobContext, fields);
    discoverRadios(modal, jobContext, fields);
    discoverCheckboxes(modal, jobContext, fields);
    return fields;
  }

  private void discoverResume(UiElement modal, JobContext jobContext,
      List<FieldDescriptor> fields) {
    try {
      ElementSet cards = modal.locate(RESUME_SELECTOR);
      if (!cards.isEmpty()) {
        fields.add(FieldDescriptor.builder()
            .label("Resume")
            .kind(FieldKind.RESUME)
            .handle(cards.first())
            .scope(modal)
            .jobContext(jobContext)
            .build());
      }
    } catch (UiInteractionException e) {
      log.warn("Resume discovery failed: {}", e.getMessage());
    }
  }

  private void discoverSingles(UiElement modal, JobContext jobContext, String selector,
      FieldKind kind, List<FieldDescriptor> fields) {
    try {
      for (UiElement element : modal.locate(selector).visible()) {
        fields.add(FieldDescriptor.builder()
            .label(labelResolver.resolve(element, modal, kind.getValue()))
            .kind(kind)
            .handle(element)
            .scope(modal)
            .jobContext(jobContext)
            .build());
      }
    } catch (UiInteractionException e) {
      log.warn("{} discovery failed: {}", kind.getValue(), e.getMessage());
    }
  }

  private void discoverSelects(UiElement modal, JobContext jobContext,
      List<FieldDescriptor> fields) {
    try {
      for (UiElement select : modal.locate(SELECT_SELECTOR).visible()) {
        fields.add(FieldDescriptor.builder()
            .label(labelResolver.resolve(select, modal, Constants.FIELD_KIND_SELECT))
            .kind(FieldKind.SELECT)
            .options(selectOptions(select))
            .handle(select)
            .scope(modal)
            .jobContext(jobContext)
            .build());
      }
    } catch (UiInteractionException e) {
      log.warn("Select discovery failed: {}", e.getMessage());
    }
  }

  static List<String> selectOptions(UiElement select) {
    List<String> options = new ArrayList<>();
    for (UiElement option : select.locate("option")) {
      String text = StringUtils.normalizeSpace(option.innerText());
      if (StringUtils.isBlank(text) || isPlaceholder(text)) {
        continue;
      }
      options.add(text);
    }
    return options;
  }

  static boolean isPlaceholder(String optionText) {
    String normalized = LabelUtils.normalize(optionText);
    return normalized.equals("select an option") || normalized.equals("select");
  }

  private void discoverRadios(UiElement modal, JobContext jobContext,
      List<FieldDescriptor> fields) {
    try {
      for (RadioGroup group : radioGroupDiscovery.discover(modal)) {
        boolean resume = RESUME_LABEL.matcher(LabelUtils.normalize(group.getLabel())).find();
        fields.add(FieldDescriptor.builder()
            .label(group.getLabel())
            .kind(resume ? FieldKind.RESUME : FieldKind.RADIO)
            .options(group.getOptions())
            .handle(group.getHandles().get(0))
            .optionHandles(group.getHandles())
            .groupKey(group.getKey())
            .scope(modal)
            .jobContext(jobContext)
            .build());
      }
    } catch (UiInteractionException e) {
      log.warn("Radio discovery failed: {}", e.getMessage());
    }
  }

  /**
   * A fieldset of checkboxes is one group labelled by its legend; other checkboxes stand alone
   */
  private void discoverCheckboxes(UiElement modal, JobContext jobContext,
      List<FieldDescriptor> fields) {
    try {
      ElementSet fieldsets = modal.locate("fieldset");
      for (int i = 0; i < fieldsets.count(); i++) {
        UiElement fieldset = fieldsets.nth(i);
        ElementSet boxes = fieldset.locate(CHECKBOX_SELECTOR);
        if (boxes.isEmpty()) {
          continue;
        }
        String label = labelResolver.legendText(fieldset);
        fields.add(FieldDescriptor.builder()
            .label(label != null ? label
                : labelResolver.resolveGroup(boxes.first(), Constants.FIELD_KIND_CHECKBOX))
            .kind(FieldKind.CHECKBOX)
            .handle(boxes.first())
            .optionHandles(boxes.all())
            .groupKey("fieldset:" + i)
            .scope(modal)
            .jobContext(jobContext)
            .build());
      }

      ElementSet boxes = modal.locate(CHECKBOX_SELECTOR);
      for (UiElement box : boxes) {
        if (!box.locate(FieldLabelResolver.ANCESTOR_FIELDSET).isEmpty()) {
          continue;
        }
        fields.add(FieldDescriptor.builder()
            .label(labelResolver.resolve(box, modal, Constants.FIELD_KIND_CHECKBOX))
            .kind(FieldKind.CHECKBOX)
            .handle(box)
            .scope(modal)
            .jobContext(jobContext)
            .build());
      }
    } catch (UiInteractionException e) {
      log.warn("Checkbox discovery failed: {}", e.getMessage());
    }
  }
}
