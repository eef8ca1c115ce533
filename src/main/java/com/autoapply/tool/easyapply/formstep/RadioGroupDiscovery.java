package com.autoapply.tool.easyapply.formstep;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import com.autoapply.common.util.Constants;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.formstep.dto.RadioGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups the radios of a form step into questions.
 *
 * <p>
 * Radios inside a fieldset form one group labelled by its legend. Other radios are grouped by
 * shared {@code name}, then by id with the trailing ordinal stripped, then by the id of the
 * enclosing form component; a radio matching none of these is its own group.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RadioGroupDiscovery {

  public static final String RADIO_SELECTOR = "input[type='radio'], div[role='radio']";

  private final FieldLabelResolver labelResolver;

  public List<RadioGroup> discover(UiElement scope) {
    List<RadioGroup> groups = new ArrayList<>();

    ElementSet fieldsets = scope.locate("fieldset");
    for (int i = 0; i < fieldsets.count(); i++) {
      UiElement fieldset = fieldsets.nth(i);
      ElementSet radios = fieldset.locate(RADIO_SELECTOR);
      if (radios.isEmpty()) {
        continue;
      }
      String label = labelResolver.legendText(fieldset);
      RadioGroup group = RadioGroup.builder()
          .key("fieldset:" + i)
          .label(label != null ? label : labelResolver.resolveGroup(radios.first(),
              Constants.FIELD_KIND_RADIO))
          .build();
      for (UiElement radio : radios) {
        addMember(group, radio, scope);
      }
      groups.add(group);
    }

    Map<String, RadioGroup> loose = new LinkedHashMap<>();
    ElementSet radios = scope.locate(RADIO_SELECTOR);
    for (int i = 0; i < radios.count(); i++) {
      UiElement radio = radios.nth(i);
      if (insideFieldset(radio)) {
        continue;
      }
      String key = groupKey(radio, i);
      RadioGroup group = loose.computeIfAbsent(key, k -> RadioGroup.builder()
          .key(k)
          .label(labelResolver.resolveGroup(radio, Constants.FIELD_KIND_RADIO))
          .build());
      addMember(group, radio, scope);
    }
    groups.addAll(loose.values());

    log.debug("Discovered {} radio groups", groups.size());
    return groups;
  }

  /**
   * Grouping key for a radio outside any fieldset
   */
  String groupKey(UiElement radio, int index) {
    String name = attribute(radio, "name");
    if (StringUtils.isNotBlank(name)) {
      return "name:" + name;
    }
    String id = attribute(radio, "id");
    if (StringUtils.isNotBlank(id) && id.matches(".*-\\d+$")) {
      return "id:" + id.replaceFirst("-\\d+$", "");
    }
    try {
      ElementSet component = radio.locate(FieldLabelResolver.ANCESTOR_FORM_COMPONENT);
      if (!component.isEmpty()) {
        String containerId = component.first().getAttribute("id");
        if (StringUtils.isNotBlank(containerId)) {
          return "container:" + containerId;
        }
      }
    } catch (UiInteractionException e) {
      log.debug("Container lookup failed for radio {}: {}", index, e.getMessage());
    }
    return "single:" + index;
  }

  private void addMember(RadioGroup group, UiElement radio, UiElement scope) {
    group.getHandles().add(radio);
    group.getOptions().add(optionText(radio, scope, group.getOptions().size() + 1));
  }

  String optionText(UiElement radio, UiElement scope, int position) {
    String id = attribute(radio, "id");
    if (StringUtils.isNotBlank(id)) {
      try {
        ElementSet labels = scope.locate("label[for=\"" + id.replace("\"", "\\\"") + "\"]");
        if (!labels.isEmpty()) {
          String text = LabelUtils.clean(labels.first().innerText());
          if (StringUtils.isNotBlank(text)) {
            return text;
          }
        }
      } catch (UiInteractionException e) {
        log.debug("Option label lookup failed: {}", e.getMessage());
      }
    }
    String aria = attribute(radio, "aria-label");
    if (StringUtils.isNotBlank(aria)) {
      return LabelUtils.clean(aria);
    }
    String value = attribute(radio, "value");
    if (StringUtils.isNotBlank(value)) {
      return LabelUtils.clean(value);
    }
    try {
      String text = LabelUtils.clean(radio.innerText());
      if (StringUtils.isNotBlank(text)) {
        return text;
      }
    } catch (UiInteractionException e) {
      log.debug("Option text lookup failed: {}", e.getMessage());
    }
    return "Option " + position;
  }

  private static boolean insideFieldset(UiElement radio) {
    try {
      return !radio.locate(FieldLabelResolver.ANCESTOR_FIELDSET).isEmpty();
    } catch (UiInteractionException e) {
      return false;
    }
  }

  private static String attribute(UiElement element, String name) {
    try {
      return element.getAttribute(name);
    } catch (UiInteractionException e) {
      return null;
    }
  }
}
