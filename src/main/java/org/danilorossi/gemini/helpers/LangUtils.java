package org.danilorossi.gemini.helpers;

import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

@UtilityClass
public class LangUtils {

  public static boolean emptyString(final String content) {
    return content == null || content.isBlank();
  }

  public static String normalize(final String s) {
    return s == null ? "" : s.trim();
  }

  public static int parseIntOr(final String s, final int def) {
    try {
      return Integer.parseInt(s == null ? "" : s.trim());
    } catch (NumberFormatException ignored) {
      return def;
    }
  }

  public static String exMsg(@NonNull final Throwable t) {
    return emptyString(t.getMessage()) ? t.toString() : t.getMessage();
  }

  public static String rootCauseMsg(final Throwable t) {
    if (t == null) return "Null Throwable";
    if (t.getCause() != null) return rootCauseMsg(t.getCause());
    return exMsg(t);
  }

  /** Formats {@code format} replacing each "{}" with the next value. */
  public static String s(final String format, final Object... values) {
    if (values == null || values.length == 0) return normalize(format);
    return String.format(format.replace("%", "%%").replace("{}", "%s"), values);
  }

  public static void l(Logger logger, Level level, String format, Throwable t, Object... values) {
    if (logger == null || level == null) return;
    if (!logger.isLoggable(level)) return;
    val msg = values == null || values.length == 0 ? normalize(format) : s(format, values);
    if (t == null) logger.log(level, msg);
    else logger.log(level, msg, t);
  }

  public static void l(Logger logger, Level level, String format, Object... values) {
    l(logger, level, format, null, values);
  }

  public static void info(Logger logger, String format, Object... values) {
    l(logger, Level.INFO, format, values);
  }

  public static void warn(Logger logger, String format, Object... values) {
    l(logger, Level.WARNING, format, values);
  }

  public static void err(Logger logger, String format, Object... values) {
    l(logger, Level.SEVERE, format, values);
  }

  public static void debug(Logger logger, String format, Object... values) {
    l(logger, Level.FINE, format, values);
  }

  public static void warn(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.WARNING, format, t, values);
  }

  public static void err(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.SEVERE, format, t, values);
  }
}
