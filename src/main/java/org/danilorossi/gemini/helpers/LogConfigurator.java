package org.danilorossi.gemini.helpers;

import java.io.IOException;
import java.util.HashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

/**
 * Shared JUL setup: every {@code @Log} class hands its logger to {@link #configLog(Logger)} from a
 * static block, so all of them write to the same rotating file under the data directory.
 */
@UtilityClass
public class LogConfigurator {

  private static final String LOG_FILE = "gemini-client.log";
  private static final Handler LOG_HANDLER;
  private static final AtomicBoolean ONCE = new AtomicBoolean(false);

  static {
    Handler handler;
    try {
      handler =
          new FileHandler(
              FileSystemUtils.getDataFile(LOG_FILE).getAbsolutePath(),
              1_000_000,
              5,
              true); // 1MB, 5 files
    } catch (IOException | RuntimeException ex) {
      System.err.println(
          LangUtils.s("Cannot open log file, logging to console: {}", LangUtils.exMsg(ex)));
      handler = new ConsoleHandler();
    }
    handler.setFormatter(new SimpleFormatter());
    try {
      handler.setEncoding("UTF-8");
    } catch (IOException ex) {
      System.err.println(LangUtils.s("Cannot set log encoding: {}", LangUtils.exMsg(ex)));
    }

    LOG_HANDLER = handler;
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  LOG_HANDLER.flush();
                  LOG_HANDLER.close();
                }));
  }

  public static void configLog(@NonNull final Logger logger) {
    for (val h : logger.getHandlers()) logger.removeHandler(h);
    logger.addHandler(LOG_HANDLER);
    logger.setLevel(resolveLogLevel(System.getProperty("LOG_LEVEL", "INFO")));
    logger.setUseParentHandlers(false);
    if (ONCE.compareAndSet(false, true))
      LogManager.getLogManager().getLogger("").setLevel(logger.getLevel());
  }

  static Level resolveLogLevel(@NonNull final String levelName) {
    // friendly names -> JUL Level
    val map = new HashMap<String, Level>();
    map.put("DEBUG", Level.FINE);
    map.put("TRACE", Level.FINEST);

    val key = levelName.trim().toUpperCase();
    if (map.containsKey(key)) return map.get(key);

    try {
      return Level.parse(key);
    } catch (IllegalArgumentException e) {
      return Level.INFO;
    }
  }
}
