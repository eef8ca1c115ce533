package com.autoapply.tool.easyapply.formstep;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import com.autoapply.tool.easyapply.browser.fake.FakeElement;
import com.autoapply.tool.easyapply.formstep.dto.RadioGroup;

class RadioGroupDiscoveryTest {

  private final RadioGroupDiscovery discovery = new RadioGroupDiscovery(new FieldLabelResolver());
  private FakeElement scope;

  @BeforeEach
  void setUp() {
    scope = FakeElement.of("div");
  }

  private static FakeElement radio() {
    return FakeElement.of("input").attr("type", "radio");
  }

  @Test
  void fieldsetBecomesOneGroupLabelledByLegend() {
    FakeElement fieldset = FakeElement.of("fieldset");
    FakeElement yes = radio().attr("id", "disability-yes")
        .with(FieldLabelResolver.ANCESTOR_FIELDSET, fieldset);
    FakeElement no = radio().attr("aria-label", "No")
        .with(FieldLabelResolver.ANCESTOR_FIELDSET, fieldset);
    fieldset.with(RadioGroupDiscovery.RADIO_SELECTOR, yes, no)
        .with("legend", FakeElement.of("legend")
            .with("span span", FakeElement.of("span").text("Do you have a disability?")));
    scope.with("fieldset", fieldset)
        .with(RadioGroupDiscovery.RADIO_SELECTOR, yes, no)
        .with("label[for=\"disability-yes\"]", FakeElement.of("label").text("Yes"));

    List<RadioGroup> groups = discovery.discover(scope);

    assertThat(groups).hasSize(1);
    assertThat(groups.get(0).getLabel()).isEqualTo("Do you have a disability?");
    assertThat(groups.get(0).getOptions()).containsExactly("Yes", "No");
    assertThat(groups.get(0).getHandles()).containsExactly(yes, no);
  }

  @Test
  void looseRadiosGroupByName() {
    FakeElement component = FakeElement.of("div")
        .with(FieldLabelResolver.COMPONENT_LABELS, FakeElement.of("label").text("Preferred shift"));
    FakeElement day = radio().attr("name", "shift").attr("value", "Day")
        .with(FieldLabelResolver.ANCESTOR_FORM_COMPONENT, component);
    FakeElement night = radio().attr("name", "shift").attr("value", "Night");
    FakeElement other = radio().attr("name", "remote").attr("value", "Yes");
    scope.with(RadioGroupDiscovery.RADIO_SELECTOR, day, night, other);

    List<RadioGroup> groups = discovery.discover(scope);

    assertThat(groups).extracting(RadioGroup::getKey).containsExactly("name:shift", "name:remote");
    assertThat(groups.get(0).getLabel()).isEqualTo("Preferred shift");
    assertThat(groups.get(0).getOptions()).containsExactly("Day", "Night");
    assertThat(groups.get(1).getLabel()).isEqualTo("Unlabeled radio");
  }

  @Test
  void idOrdinalIsStrippedForGrouping() {
    FakeElement first = radio().attr("id", "urn-travel-0");
    FakeElement second = radio().attr("id", "urn-travel-1");
    scope.with(RadioGroupDiscovery.RADIO_SELECTOR, first, second);

    List<RadioGroup> groups = discovery.discover(scope);

    assertThat(groups).hasSize(1);
    assertThat(groups.get(0).getKey()).isEqualTo("id:urn-travel");
    assertThat(groups.get(0).getOptions()).containsExactly("Option 1", "Option 2");
  }

  @Test
  void containerIdGroupsRadiosWithoutNameOrId() {
    FakeElement component = FakeElement.of("div").attr("id", "question-7");
    FakeElement yes = FakeElement.of("div").attr("role", "radio").text("Yes")
        .with(FieldLabelResolver.ANCESTOR_FORM_COMPONENT, component);
    FakeElement no = FakeElement.of("div").attr("role", "radio").text("No")
        .with(FieldLabelResolver.ANCESTOR_FORM_COMPONENT, component);
    FakeElement lone = radio();
    scope.with(RadioGroupDiscovery.RADIO_SELECTOR, yes, no, lone);

    List<RadioGroup> groups = discovery.discover(scope);

    assertThat(groups).extracting(RadioGroup::getKey)
        .containsExactly("container:question-7", "single:2");
    assertThat(groups.get(0).getOptions()).containsExactly("Yes", "No");
  }
}
