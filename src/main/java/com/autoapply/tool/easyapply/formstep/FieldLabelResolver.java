package com.autoapply.tool.easyapply.formstep;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds the question text of a form field.
 *
 * <p>
 * Single fields try, in order: the label pointing at the field id, a label next to the field,
 * the enclosing form component heading and the structured container id. Grouped fields start
 * with the enclosing fieldset legend instead of the first two, which would yield an option text.
 */
@Slf4j
@Component
public class FieldLabelResolver {

  public static final String PARENT = "xpath=./..";
  public static final String ANCESTOR_FIELDSET = "xpath=ancestor::fieldset[1]";
  public static final String ANCESTOR_FORM_COMPONENT =
      "xpath=ancestor::div[contains(@class, 'form-component')][1]";
  public static final String ANCESTOR_FORM_ELEMENT =
      "xpath=ancestor::div[contains(@class, 'fb-dash-form-element')][1]";
  static final String SIBLING_LABELS =
      "label, .fb-form-element__label, .fb-dash-form-element__label";
  static final String COMPONENT_LABELS =
      "label, .fb-form-element__label, legend, h3, h4, .fb-dash-form-element__label";

  public String resolve(UiElement field, UiElement scope, String kindName) {
    String label = byLabelFor(field, scope);
    if (label == null) {
      label = byParentLabel(field);
    }
    if (label == null) {
      label = byFormComponent(field);
    }
    if (label == null) {
      label = byFormElementId(field);
    }
    return label != null ? label : unlabeled(field, kindName);
  }

  public String resolveGroup(UiElement firstMember, String kindName) {
    String label = resolveGroupLabel(firstMember);
    return label != null ? label : "Unlabeled " + kindName;
  }

  private String resolveGroupLabel(UiElement field) {
    String label = byFieldsetLegend(field);
    if (label == null) {
      label = byFormComponent(field);
    }
    if (label == null) {
      label = byFormElementId(field);
    }
    return label;
  }

  /**
   * Text of the legend of a fieldset, preferring the nested span LinkedIn renders the question
   * in
   */
  public String legendText(UiElement fieldset) {
    ElementSet legends = fieldset.locate("legend");
    if (legends.isEmpty()) {
      return null;
    }
    UiElement legend = legends.first();
    ElementSet spans = legend.locate("span span");
    String text = !spans.isEmpty() ? spans.first().innerText() : legend.innerText();
    return blankToNull(LabelUtils.clean(text));
  }

  String byLabelFor(UiElement field, UiElement scope) {
    if (scope == null) {
      return null;
    }
    try {
      String id = field.getAttribute("id");
      if (StringUtils.isBlank(id)) {
        return null;
      }
      ElementSet labels = scope.locate("label[for=\"" + id.replace("\"", "\\\"") + "\"]");
      return labels.isEmpty() ? null : blankToNull(LabelUtils.clean(labels.first().innerText()));
    } catch (UiInteractionException e) {
      log.debug("label[for] lookup failed: {}", e.getMessage());
      return null;
    }
  }

  String byParentLabel(UiElement field) {
    try {
      ElementSet parent = field.locate(PARENT);
      if (parent.isEmpty()) {
        return null;
      }
      ElementSet labels = parent.first().locate(SIBLING_LABELS);
      return labels.isEmpty() ? null : blankToNull(LabelUtils.clean(labels.first().innerText()));
    } catch (UiInteractionException e) {
      log.debug("Parent label lookup failed: {}", e.getMessage());
      return null;
    }
  }

  String byFieldsetLegend(UiElement field) {
    try {
      ElementSet fieldset = field.locate(ANCESTOR_FIELDSET);
      return fieldset.isEmpty() ? null : legendText(fieldset.first());
    } catch (UiInteractionException e) {
      log.debug("Fieldset legend lookup failed: {}", e.getMessage());
      return null;
    }
  }

  String byFormComponent(UiElement field) {
    try {
      ElementSet component = field.locate(ANCESTOR_FORM_COMPONENT);
      if (component.isEmpty()) {
        return null;
      }
      ElementSet labels = component.first().locate(COMPONENT_LABELS);
      if (!labels.isEmpty()) {
        return blankToNull(LabelUtils.clean(labels.first().innerText()));
      }
      ElementSet spans = component.first().locate("span span");
      return spans.isEmpty() ? null : blankToNull(LabelUtils.clean(spans.first().innerText()));
    } catch (UiInteractionException e) {
      log.debug("Form component label lookup failed: {}", e.getMessage());
      return null;
    }
  }

  /**
   * {@code urn:li:...formElement-...-yearsExperience} style ids end with the field name
   */
  String byFormElementId(UiElement field) {
    try {
      ElementSet container = field.locate(ANCESTOR_FORM_ELEMENT);
      if (container.isEmpty()) {
        return null;
      }
      String id = container.first().getAttribute("id");
      if (id == null || !id.contains("formElement") || !id.contains("-")) {
        return null;
      }
      String name = id.substring(id.lastIndexOf('-') + 1);
      if (StringUtils.isBlank(name) || name.matches("\\d+")) {
        return null;
      }
      String words = StringUtils.join(StringUtils.splitByCharacterTypeCamelCase(name), ' ');
      return blankToNull(StringUtils.capitalize(words.replace('_', ' ').trim()));
    } catch (UiInteractionException e) {
      log.debug("Form element id lookup failed: {}", e.getMessage());
      return null;
    }
  }

  private static String unlabeled(UiElement field, String kindName) {
    String type = null;
    try {
      type = field.getAttribute("type");
    } catch (UiInteractionException e) {
      log.debug("Could not read type attribute: {}", e.getMessage());
    }
    return "Unlabeled " + (StringUtils.isNotBlank(type) ? type : kindName);
  }

  private static String blankToNull(String text) {
    return StringUtils.isBlank(text) ? null : text;
  }
}
