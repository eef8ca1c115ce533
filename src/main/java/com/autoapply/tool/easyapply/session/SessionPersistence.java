package com.autoapply.tool.easyapply.session;

/**
 * Keeps the browser's login session on disk so later runs skip the login.
 */
public interface SessionPersistence {

  /**
   * Save the session cookies
   *
   * @param force ignore the minimum gap between saves
   * @return true when the cookies were written
   */
  boolean saveNow(boolean force);

  /**
   * Load saved cookies into the browser
   *
   * @return number of cookies restored
   */
  int restore();

  /**
   * Start periodic saving
   */
  void start();

  /**
   * Cancel periodic saving and save one last time
   */
  void stop();
}
