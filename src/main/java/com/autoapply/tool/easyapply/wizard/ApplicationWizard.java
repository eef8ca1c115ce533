package com.autoapply.tool.easyapply.wizard;

import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.wizard.dto.ApplicationOutcome;

public interface ApplicationWizard {

  /**
   * Drive one application form from the entry control to a terminal outcome. Never throws; the
   * outcome is recorded before it is returned.
   */
  ApplicationOutcome startApplication(JobContext jobContext);
}
