package com.autoapply.tool.easyapply.wizard;

public interface EmergencyExitService {

  /**
   * Close the application form and discard the draft. Never throws.
   *
   * @return true when the form is verified gone
   */
  boolean close();
}
