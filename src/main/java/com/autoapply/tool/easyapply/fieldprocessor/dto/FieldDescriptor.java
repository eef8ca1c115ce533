package com.autoapply.tool.easyapply.fieldprocessor.dto;

import java.util.ArrayList;
import java.util.List;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One field or choice group discovered on the current form step. Rebuilt on every step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDescriptor {
  private String label;
  private FieldKind kind;

  /**
   * Option texts of choice fields, in document order
   */
  @Builder.Default
  private List<String> options = new ArrayList<>();

  /**
   * The input element itself, or the first element of a group
   */
  private UiElement handle;

  /**
   * One handle per option, aligned with {@link #options}; radio and checkbox groups only
   */
  @Builder.Default
  private List<UiElement> optionHandles = new ArrayList<>();

  private String groupKey;

  /**
   * Form container the field was found in, used to reach associated labels
   */
  private UiElement scope;

  private JobContext jobContext;
}
