package org.danilorossi.gemini.protocol;

import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

/** Formats the single request line of a Gemini exchange. */
@UtilityClass
public class RequestBuilder {

  public static final String SCHEME = "gemini://";
  public static final String CRLF = "\r\n";

  /**
   * Builds {@code gemini://<host><resource>\r\n}. A host that already carries the scheme is used
   * as-is.
   *
   * @throws GeminiException with {@link ErrorKind#MALFORMED_REQUEST} when the host is empty or
   *     either argument contains CR or LF
   */
  public static String build(@NonNull final String host, final String resource)
      throws GeminiException {
    val path = resource == null ? "" : resource;
    ensureSingleLine("host", host);
    ensureSingleLine("resource", path);
    if (hostName(host).isEmpty())
      throw new GeminiException(ErrorKind.MALFORMED_REQUEST, "Empty host");

    val scheme = host.startsWith(SCHEME) ? "" : SCHEME;
    return scheme + host + path + CRLF;
  }

  /** Host part usable for a socket connect: no scheme, no path. */
  public static String hostName(@NonNull final String host) {
    String h = host.startsWith(SCHEME) ? host.substring(SCHEME.length()) : host;
    val slash = h.indexOf('/');
    if (slash >= 0) h = h.substring(0, slash);
    return h.trim();
  }

  private static void ensureSingleLine(final String what, final String value)
      throws GeminiException {
    if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0)
      throw new GeminiException(
          ErrorKind.MALFORMED_REQUEST, "Line terminator in " + what + ": " + value.strip());
  }
}
