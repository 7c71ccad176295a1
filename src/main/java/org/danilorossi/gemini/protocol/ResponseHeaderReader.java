package org.danilorossi.gemini.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.gemini.helpers.LangUtils;
import org.danilorossi.gemini.helpers.LogConfigurator;
import org.danilorossi.gemini.transport.GeminiConnection;

/**
 * Decodes the response header {@code <2 digits><space><meta>\r\n}, consuming exactly the header
 * bytes: on return the connection is positioned on the first body byte.
 *
 * <p>The meta line is capped at {@link #getMaxMetaLength()} bytes (1024 by default, the limit the
 * protocol gives servers); a longer line fails with {@link ErrorKind#HEADER_TOO_LONG} instead of
 * being buffered without bound. The meta must be valid UTF-8, otherwise the header fails with
 * {@link ErrorKind#MALFORMED_HEADER}.
 */
@Log
public class ResponseHeaderReader {

  static {
    LogConfigurator.configLog(log);
  }

  public static final int DEFAULT_MAX_META_LENGTH = 1024;

  @Getter private final int maxMetaLength;

  public ResponseHeaderReader() {
    this(DEFAULT_MAX_META_LENGTH);
  }

  public ResponseHeaderReader(final int maxMetaLength) {
    if (maxMetaLength <= 0)
      throw new IllegalArgumentException("maxMetaLength must be positive: " + maxMetaLength);
    this.maxMetaLength = maxMetaLength;
  }

  public ResponseHeader read(@NonNull final GeminiConnection connection) throws GeminiException {
    try {
      val status = readStatus(connection);
      readSeparator(connection);
      val meta = readMeta(connection);
      LangUtils.debug(log, "Header: {} '{}'", status, meta);
      return new ResponseHeader(status, meta);
    } catch (GeminiException e) {
      throw e;
    } catch (IOException e) {
      throw new GeminiException(
          ErrorKind.TRUNCATED_HEADER,
          "Connection failed while reading header: " + LangUtils.exMsg(e),
          e);
    }
  }

  private static StatusCode readStatus(final GeminiConnection connection) throws IOException {
    val digits = connection.read(2);
    if (digits.length < 2)
      throw new GeminiException(
          ErrorKind.TRUNCATED_HEADER,
          "Stream closed after " + digits.length + " byte(s) of status");
    if (!isDigit(digits[0]) || !isDigit(digits[1]))
      throw new GeminiException(
          ErrorKind.MALFORMED_STATUS,
          "Status is not two ASCII digits: '" + printable(digits) + "'");
    return StatusCode.decode((digits[0] - '0') * 10 + (digits[1] - '0'));
  }

  private static void readSeparator(final GeminiConnection connection) throws IOException {
    val b = connection.read();
    if (b == -1)
      throw new GeminiException(ErrorKind.TRUNCATED_HEADER, "Stream closed after status");
    if (b != ' ')
      throw new GeminiException(
          ErrorKind.MALFORMED_HEADER,
          "Expected a space after status, got '" + printable(new byte[] {(byte) b}) + "'");
  }

  private String readMeta(final GeminiConnection connection) throws IOException {
    val line = new ByteArrayOutputStream(64);
    int b;
    while ((b = connection.read()) != '\n') {
      if (b == -1)
        throw new GeminiException(
            ErrorKind.TRUNCATED_HEADER, "Stream closed before end of header line");
      // one extra byte allowed for the '\r' preceding '\n'
      if (line.size() >= maxMetaLength + 1)
        throw new GeminiException(
            ErrorKind.HEADER_TOO_LONG, "Meta exceeds " + maxMetaLength + " bytes");
      line.write(b);
    }

    val bytes = line.toByteArray();
    int len = bytes.length;
    if (len > 0 && bytes[len - 1] == '\r') len--;
    if (len > maxMetaLength)
      throw new GeminiException(
          ErrorKind.HEADER_TOO_LONG, "Meta exceeds " + maxMetaLength + " bytes");
    return decodeMeta(bytes, len);
  }

  private static String decodeMeta(final byte[] bytes, final int len) throws GeminiException {
    val decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(bytes, 0, len)).toString();
    } catch (CharacterCodingException e) {
      throw new GeminiException(
          ErrorKind.MALFORMED_HEADER, "Meta is not valid UTF-8: '" + printable(bytes) + "'", e);
    }
  }

  private static boolean isDigit(final byte b) {
    return b >= '0' && b <= '9';
  }

  private static String printable(final byte[] bytes) {
    val sb = new StringBuilder();
    for (val b : bytes) {
      if (b >= 0x20 && b < 0x7f) sb.append((char) b);
      else sb.append(String.format("\\x%02x", b & 0xff));
    }
    return sb.toString();
  }
}
