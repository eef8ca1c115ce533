package com.autoapply.tool.easyapply.runner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import com.autoapply.common.exception.StorageException;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a prepared JSON array of jobs. Entries without an id or a URL are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobListLoader {

  private final ObjectMapper objectMapper;

  public List<JobContext> load(Path file) {
    if (!Files.exists(file)) {
      throw new StorageException(file.toString(), "Job list not found: " + file, null);
    }
    List<JobContext> jobs;
    try {
      jobs = objectMapper.readValue(file.toFile(), new TypeReference<List<JobContext>>() {});
    } catch (IOException e) {
      throw new StorageException(file.toString(), "Could not read job list: " + e.getMessage(), e);
    }

    List<JobContext> valid = new ArrayList<>();
    for (JobContext job : jobs) {
      if (job == null || StringUtils.isBlank(job.getId()) || StringUtils.isBlank(job.getUrl())) {
        log.warn("Skipping job list entry without id or url: {}", job);
        continue;
      }
      valid.add(job);
    }
    log.info("Loaded {} jobs from {}", valid.size(), file);
    return valid;
  }
}
