package com.autoapply.tool.easyapply.ledger.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import com.autoapply.common.exception.StorageException;
import com.autoapply.common.util.Constants;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.ledger.ApplicationLedger;
import com.autoapply.tool.easyapply.ledger.dto.JobDescriptionEntry;
import com.autoapply.tool.easyapply.wizard.dto.ApplicationOutcome;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class JsonFileApplicationLedger implements ApplicationLedger {

  private final Path dataDir;
  private final ObjectMapper objectMapper;
  private final Set<String> successful;
  private final Set<String> failed;
  private final List<JobDescriptionEntry> descriptions;

  @Autowired
  public JsonFileApplicationLedger(EasyApplyProperties properties, ObjectMapper objectMapper) {
    this(Paths.get(properties.getStorage().getDataDir()), objectMapper);
  }

  public JsonFileApplicationLedger(Path dataDir, ObjectMapper objectMapper) {
    this.dataDir = dataDir;
    this.objectMapper = objectMapper;
    this.successful = new LinkedHashSet<>(
        read(Constants.SUCCESSFUL_APPLICATIONS_FILE, new TypeReference<List<String>>() {}));
    this.failed = new LinkedHashSet<>(
        read(Constants.FAILED_APPLICATIONS_FILE, new TypeReference<List<String>>() {}));
    this.descriptions = new ArrayList<>(
        read(Constants.JOB_DESCRIPTIONS_FILE, new TypeReference<List<JobDescriptionEntry>>() {}));
    log.info("Ledger loaded: {} successful, {} failed, {} archived descriptions",
        successful.size(), failed.size(), descriptions.size());
  }

  @Override
  public synchronized void record(ApplicationOutcome outcome) {
    JobContext job = outcome.getJob();
    String jobId = job != null && StringUtils.isNotBlank(job.getId()) ? job.getId()
        : Constants.UNKNOWN_JOB_ID;

    if (outcome.isSuccess()) {
      append(successful, Constants.SUCCESSFUL_APPLICATIONS_FILE, jobId, "successful");
      archiveDescription(jobId, job);
    } else {
      append(failed, Constants.FAILED_APPLICATIONS_FILE, jobId, "failed");
    }
  }

  @Override
  public synchronized boolean isApplied(String jobId) {
    return successful.contains(jobId);
  }

  @Override
  public synchronized List<String> getSuccessfulIds() {
    return Collections.unmodifiableList(new ArrayList<>(successful));
  }

  @Override
  public synchronized List<String> getFailedIds() {
    return Collections.unmodifiableList(new ArrayList<>(failed));
  }

  private void append(Set<String> ids, String fileName, String jobId, String resultType) {
    if (!ids.add(jobId)) {
      log.info("Job ID {} already in {} applications list", jobId, resultType);
      return;
    }
    write(fileName, new ArrayList<>(ids));
    log.info("Updated {} applications list with job ID {} (total: {})", resultType, jobId,
        ids.size());
  }

  private void archiveDescription(String jobId, JobContext job) {
    boolean exists = descriptions.stream().anyMatch(entry -> jobId.equals(entry.getJobId()));
    if (exists) {
      log.info("Job description for ID {} already saved", jobId);
      return;
    }
    descriptions.add(JobDescriptionEntry.builder()
        .jobId(jobId)
        .title(job != null && job.getTitle() != null ? job.getTitle() : "Unknown Title")
        .company(job != null && job.getCompany() != null ? job.getCompany() : "Unknown Company")
        .description(job != null ? StringUtils.defaultString(job.getDescription()) : "")
        .timestamp(LocalDateTime.now().toString())
        .build());
    write(Constants.JOB_DESCRIPTIONS_FILE, descriptions);
  }

  private <T> List<T> read(String fileName, TypeReference<List<T>> type) {
    Path file = dataDir.resolve(fileName);
    if (!Files.exists(file)) {
      return Collections.emptyList();
    }
    try {
      List<T> values = objectMapper.readValue(file.toFile(), type);
      return values != null ? values : Collections.emptyList();
    } catch (IOException e) {
      log.warn("Could not read {}, starting with an empty list: {}", file, e.getMessage());
      return Collections.emptyList();
    }
  }

  private void write(String fileName, Object value) {
    Path file = dataDir.resolve(fileName);
    try {
      Files.createDirectories(dataDir);
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
    } catch (IOException e) {
      throw new StorageException(file.toString(), "Could not write " + fileName + ": "
          + e.getMessage(), e);
    }
  }
}
