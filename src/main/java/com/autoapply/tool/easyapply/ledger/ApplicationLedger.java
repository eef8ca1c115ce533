package com.autoapply.tool.easyapply.ledger;

import java.util.List;
import com.autoapply.tool.easyapply.wizard.dto.ApplicationOutcome;

/**
 * Durable record of application attempts. Success goes to the successful list and archives the
 * job description; failure and incomplete go to the failed list. Both lists hold each job id at
 * most once.
 */
public interface ApplicationLedger {

  void record(ApplicationOutcome outcome);

  /**
   * True when the job id is in the successful list
   */
  boolean isApplied(String jobId);

  List<String> getSuccessfulIds();

  List<String> getFailedIds();
}
