package org.danilorossi.gemini.protocol;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.gemini.helpers.LangUtils;
import org.danilorossi.gemini.helpers.LogConfigurator;
import org.danilorossi.gemini.transport.GeminiConnection;

/**
 * Turns a decoded header into a {@link DispatchOutcome}. Only a 2x response with a {@code text/*}
 * media type has its body read; every other branch leaves the remaining bytes unread for the
 * caller to discard when it closes the connection.
 */
@Log
public class ResponseDispatcher {

  static {
    LogConfigurator.configLog(log);
  }

  private static final String TEXT_PREFIX = "text/";

  public DispatchOutcome dispatch(
      @NonNull final ResponseHeader header, @NonNull final GeminiConnection connection)
      throws GeminiException {
    val status = header.getStatus();
    val meta = header.getMeta();

    if (status.isSuccess()) return readBody(meta, connection);
    if (status.isRedirect()) return DispatchOutcome.redirect(status, meta);
    if (status.isInputRequired()) return DispatchOutcome.inputRequested(status, meta);
    if (status.isTemporaryFailure() || status.isPermanentFailure() || status.isCertError())
      return DispatchOutcome.failure(status, meta);

    LangUtils.warn(log, "No handling for status {}", status);
    return DispatchOutcome.unhandledStatus(status);
  }

  private DispatchOutcome readBody(final String meta, final GeminiConnection connection)
      throws GeminiException {
    if (!isText(meta)) {
      LangUtils.info(log, "Refusing non-text body: {}", meta);
      return DispatchOutcome.unsupportedMediaType(meta);
    }

    val charset = charsetOf(meta);
    byte[] bytes;
    try {
      bytes = connection.readToEnd();
    } catch (GeminiException e) {
      throw e;
    } catch (IOException e) {
      throw new GeminiException(
          ErrorKind.BODY_READ_ERROR, "Failed reading body: " + LangUtils.exMsg(e), e);
    }

    try {
      val text =
          charset
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString();
      LangUtils.debug(log, "Read {} byte body ({})", bytes.length, charset.name());
      return DispatchOutcome.body(meta, text);
    } catch (CharacterCodingException e) {
      throw new GeminiException(
          ErrorKind.INVALID_ENCODING, "Body is not valid " + charset.name(), e);
    }
  }

  static boolean isText(final String meta) {
    return meta.regionMatches(true, 0, TEXT_PREFIX, 0, TEXT_PREFIX.length());
  }

  /** The {@code charset} parameter of a media type, UTF-8 when absent. */
  static Charset charsetOf(final String meta) throws GeminiException {
    val params = meta.split(";");
    for (int i = 1; i < params.length; i++) {
      val param = params[i].trim();
      val eq = param.indexOf('=');
      if (eq < 0) continue;
      if (!param.substring(0, eq).trim().toLowerCase(Locale.ROOT).equals("charset")) continue;

      val name = unquote(param.substring(eq + 1).trim());
      try {
        return Charset.forName(name);
      } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
        throw new GeminiException(ErrorKind.INVALID_ENCODING, "Unsupported charset: " + name, e);
      }
    }
    return StandardCharsets.UTF_8;
  }

  private static String unquote(final String s) {
    if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\""))
      return s.substring(1, s.length() - 1);
    return s;
  }
}
