package com.autoapply.tool.easyapply.formstep.dto;

import java.util.ArrayList;
import java.util.List;
import com.autoapply.tool.easyapply.browser.UiElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RadioGroup {
  private String key;
  private String label;

  @Builder.Default
  private List<String> options = new ArrayList<>();

  @Builder.Default
  private List<UiElement> handles = new ArrayList<>();
}
