package com.autoapply.tool.easyapply.answer.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import com.autoapply.common.exception.StorageException;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Answer store backed by a pretty-printed JSON object file. The file is loaded once and
 * rewritten after every change.
 */
@Slf4j
@Service
public class JsonFileAnswerStore implements AnswerStore {

  @Value
  private static class Entry {
    String label;
    String value;
  }

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Map<String, Entry> entries = new LinkedHashMap<>();

  @Autowired
  public JsonFileAnswerStore(EasyApplyProperties properties, ObjectMapper objectMapper) {
    this(Paths.get(properties.getStorage().getAnswersFile()), objectMapper);
  }

  public JsonFileAnswerStore(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
    load();
  }

  private void load() {
    if (!Files.exists(file)) {
      log.info("No answers file at {}, starting empty", file.toAbsolutePath());
      return;
    }
    try {
      Map<String, String> stored = objectMapper.readValue(file.toFile(),
          new TypeReference<LinkedHashMap<String, String>>() {});
      stored.forEach((label, value) -> {
        if (StringUtils.isNotBlank(label) && value != null) {
          entries.put(LabelUtils.normalize(label), new Entry(label, value));
        }
      });
      log.info("Loaded {} stored answers from {}", entries.size(), file);
    } catch (IOException e) {
      throw new StorageException(file.toString(), "Could not read answers file: " + e.getMessage(),
          e);
    }
  }

  @Override
  public synchronized Optional<String> get(String label) {
    Entry entry = entries.get(LabelUtils.normalize(label));
    return entry == null ? Optional.empty() : Optional.of(entry.getValue());
  }

  @Override
  public synchronized void set(String label, String value) {
    if (StringUtils.isBlank(label) || value == null) {
      log.warn("Ignoring answer with blank label or null value: '{}'", label);
      return;
    }
    entries.put(LabelUtils.normalize(label), new Entry(label.trim(), value));
    log.debug("Stored answer for '{}'", label);
    save();
  }

  @Override
  public synchronized Map<String, String> snapshot() {
    Map<String, String> copy = new LinkedHashMap<>();
    entries.values().forEach(entry -> copy.put(entry.getLabel(), entry.getValue()));
    return Collections.unmodifiableMap(copy);
  }

  @Override
  public synchronized boolean save() {
    try {
      write();
      return true;
    } catch (StorageException e) {
      log.error("Failed to persist answers to {}: {}", e.getPath(), e.getMessage());
      return false;
    }
  }

  private void write() {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot());
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new StorageException(file.toString(), "Could not write answers file: " + e.getMessage(),
          e);
    }
  }
}
