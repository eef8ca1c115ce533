package com.autoapply.tool.easyapply.session.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.openqa.selenium.Cookie;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import com.autoapply.common.exception.StorageException;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.config.EasyApplyConfig.SessionProperties;
import com.autoapply.tool.easyapply.session.SessionPersistence;
import com.autoapply.tool.easyapply.session.dto.StoredCookie;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Saves the browser cookies to a JSON file, on demand and on a fixed schedule.
 */
@Slf4j
@Service
public class BrowserSessionPersistence implements SessionPersistence {

  private final WebDriver webDriver;
  private final TaskScheduler taskScheduler;
  private final ObjectMapper objectMapper;
  private final SessionProperties sessionProperties;
  private final String homeUrl;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile long lastSaveMillis;
  private ScheduledFuture<?> periodicSave;

  public BrowserSessionPersistence(WebDriver webDriver,
      @Qualifier("sessionTaskScheduler") TaskScheduler taskScheduler, ObjectMapper objectMapper,
      EasyApplyProperties properties) {
    this.webDriver = webDriver;
    this.taskScheduler = taskScheduler;
    this.objectMapper = objectMapper;
    this.sessionProperties = properties.getSession();
    this.homeUrl = properties.getBrowser().getHomeUrl();
  }

  @Override
  public boolean saveNow(boolean force) {
    if (!sessionProperties.isEnabled()) {
      return false;
    }
    long now = System.currentTimeMillis();
    if (!force && now - lastSaveMillis < sessionProperties.getMinSaveGap().toMillis()) {
      log.debug("Skipping session save, last save {}ms ago", now - lastSaveMillis);
      return false;
    }
    if (!lock.tryLock()) {
      log.debug("Session save already in progress");
      return false;
    }
    try {
      List<StoredCookie> cookies = new ArrayList<>();
      for (Cookie cookie : webDriver.manage().getCookies()) {
        cookies.add(StoredCookie.from(cookie));
      }
      write(cookies);
      lastSaveMillis = now;
      log.info("Saved {} session cookies", cookies.size());
      return true;
    } catch (WebDriverException e) {
      log.warn("Could not read browser cookies: {}", e.getMessage());
      return false;
    } catch (StorageException e) {
      log.error("Could not save session to {}: {}", e.getPath(), e.getMessage());
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int restore() {
    Path file = cookieFile();
    if (!sessionProperties.isEnabled() || !Files.exists(file)) {
      log.info("No saved session to restore");
      return 0;
    }
    lock.lock();
    try {
      List<StoredCookie> cookies =
          objectMapper.readValue(file.toFile(), new TypeReference<List<StoredCookie>>() {});
      // cookies can only be added for the domain currently loaded
      webDriver.get(homeUrl);
      int restored = 0;
      for (StoredCookie cookie : cookies) {
        try {
          webDriver.manage().addCookie(cookie.toCookie());
          restored++;
        } catch (WebDriverException e) {
          log.debug("Skipping cookie {} for {}: {}", cookie.getName(), cookie.getDomain(),
              e.getMessage());
        }
      }
      webDriver.navigate().refresh();
      log.info("Restored {} of {} session cookies", restored, cookies.size());
      return restored;
    } catch (IOException e) {
      log.warn("Could not read saved session {}: {}", file, e.getMessage());
      return 0;
    } catch (WebDriverException e) {
      log.warn("Could not restore session: {}", e.getMessage());
      return 0;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public synchronized void start() {
    if (!sessionProperties.isEnabled() || periodicSave != null) {
      return;
    }
    periodicSave = taskScheduler.scheduleAtFixedRate(() -> saveNow(false),
        sessionProperties.getSaveInterval());
    log.info("Periodic session save every {}", sessionProperties.getSaveInterval());
  }

  @Override
  @PreDestroy
  public synchronized void stop() {
    if (periodicSave == null) {
      return;
    }
    periodicSave.cancel(false);
    periodicSave = null;
    log.info("Periodic session save stopped");
    saveNow(true);
  }

  private void write(List<StoredCookie> cookies) {
    Path file = cookieFile();
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), cookies);
    } catch (IOException e) {
      throw new StorageException(file.toString(), "Could not write cookies: " + e.getMessage(), e);
    }
  }

  private Path cookieFile() {
    return Paths.get(sessionProperties.getCookieFile());
  }
}
