package com.autoapply.tool.easyapply.formstep;

import java.util.List;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.job.dto.JobContext;

public interface FormStepProcessor {

  /**
   * Fill every supported field of the current step
   *
   * @param modal the form container
   * @param jobContext the job being applied to
   * @return true only if every field was filled; advisory
   */
  boolean processFields(UiElement modal, JobContext jobContext);

  /**
   * The fields of the current step, in dispatch order
   */
  List<FieldDescriptor> discoverFields(UiElement modal, JobContext jobContext);
}
