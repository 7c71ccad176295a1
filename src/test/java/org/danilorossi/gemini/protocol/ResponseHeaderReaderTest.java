package org.danilorossi.gemini.protocol;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.net.SocketTimeoutException;
import org.danilorossi.gemini.transport.GeminiConnection;
import org.junit.jupiter.api.Test;

public class ResponseHeaderReaderTest {

  private final ResponseHeaderReader reader = new ResponseHeaderReader();

  static GeminiConnection connection(String wire) {
    return connection(new ByteArrayInputStream(wire.getBytes(UTF_8)));
  }

  static GeminiConnection connection(InputStream in) {
    return GeminiConnection.of(in, new ByteArrayOutputStream());
  }

  private ErrorKind failureOf(String wire) {
    return assertThrows(GeminiException.class, () -> reader.read(connection(wire))).getKind();
  }

  @Test
  public void readsStatusAndMeta() throws IOException {
    ResponseHeader header = reader.read(connection("20 text/gemini; lang=en\r\n"));
    assertEquals(StatusCode.SUCCESS, header.getStatus());
    assertEquals("text/gemini; lang=en", header.getMeta());
  }

  @Test
  public void acceptsBareLineFeed() throws IOException {
    ResponseHeader header = reader.read(connection("51 not found\n"));
    assertEquals(StatusCode.NOT_FOUND, header.getStatus());
    assertEquals("not found", header.getMeta());
  }

  @Test
  public void emptyMetaIsAllowed() throws IOException {
    assertEquals("", reader.read(connection("40 \r\n")).getMeta());
  }

  /** The header is consumed exactly: the next byte read is the first body byte. */
  @Test
  public void leavesCursorOnBody() throws IOException {
    GeminiConnection conn = connection("20 text/plain\r\nline one\r\nline two");
    reader.read(conn);
    assertEquals("line one\r\nline two", new String(conn.readToEnd(), UTF_8));
  }

  @Test
  public void metaIsUtf8() throws IOException {
    assertEquals("Inserisci città", reader.read(connection("10 Inserisci città\r\n")).getMeta());
  }

  @Test
  public void truncatedStatus() {
    assertEquals(ErrorKind.TRUNCATED_HEADER, failureOf(""));
    assertEquals(ErrorKind.TRUNCATED_HEADER, failureOf("2"));
  }

  @Test
  public void truncatedAfterStatus() {
    assertEquals(ErrorKind.TRUNCATED_HEADER, failureOf("20"));
  }

  @Test
  public void truncatedMeta() {
    assertEquals(ErrorKind.TRUNCATED_HEADER, failureOf("20 text/gemini"));
    assertEquals(ErrorKind.TRUNCATED_HEADER, failureOf("20 text/gemini\r"));
  }

  @Test
  public void nonDigitStatus() {
    assertEquals(ErrorKind.MALFORMED_STATUS, failureOf("ab text/gemini\r\n"));
    assertEquals(ErrorKind.MALFORMED_STATUS, failureOf("2x text/gemini\r\n"));
    assertEquals(ErrorKind.MALFORMED_STATUS, failureOf(" 2 text/gemini\r\n"));
  }

  @Test
  public void unknownStatus() {
    assertEquals(ErrorKind.UNKNOWN_STATUS, failureOf("25 text/gemini\r\n"));
    assertEquals(ErrorKind.UNKNOWN_STATUS, failureOf("00 \r\n"));
  }

  @Test
  public void missingSpace() {
    assertEquals(ErrorKind.MALFORMED_HEADER, failureOf("20\ttext/gemini\r\n"));
    assertEquals(ErrorKind.MALFORMED_HEADER, failureOf("200 text/gemini\r\n"));
    assertEquals(ErrorKind.MALFORMED_HEADER, failureOf("20\r\n"));
  }

  @Test
  public void metaAtLimitIsAccepted() throws IOException {
    String meta = "x".repeat(ResponseHeaderReader.DEFAULT_MAX_META_LENGTH);
    assertEquals(meta, reader.read(connection("20 " + meta + "\r\n")).getMeta());
    assertEquals(meta, reader.read(connection("20 " + meta + "\n")).getMeta());
  }

  @Test
  public void metaOverLimitIsRejected() {
    String meta = "x".repeat(ResponseHeaderReader.DEFAULT_MAX_META_LENGTH + 1);
    assertEquals(ErrorKind.HEADER_TOO_LONG, failureOf("20 " + meta + "\r\n"));
    assertEquals(ErrorKind.HEADER_TOO_LONG, failureOf("20 " + meta + "\n"));
  }

  /** An endless line must be cut off at the cap, not read until memory runs out. */
  @Test
  public void unterminatedLineStopsAtLimit() {
    InputStream endless =
        new InputStream() {
          int served;

          @Override
          public int read() {
            served++;
            if (served > 100_000) throw new AssertionError("read past the cap");
            return served <= 3 ? "20 ".charAt(served - 1) : 'x';
          }
        };
    ResponseHeaderReader small = new ResponseHeaderReader(16);
    GeminiException e =
        assertThrows(GeminiException.class, () -> small.read(connection(endless)));
    assertEquals(ErrorKind.HEADER_TOO_LONG, e.getKind());
  }

  @Test
  public void customLimit() throws IOException {
    ResponseHeaderReader small = new ResponseHeaderReader(4);
    assertEquals("abcd", small.read(connection("30 abcd\r\n")).getMeta());
    assertEquals(
        ErrorKind.HEADER_TOO_LONG,
        assertThrows(GeminiException.class, () -> small.read(connection("30 abcde\r\n")))
            .getKind());
    assertThrows(IllegalArgumentException.class, () -> new ResponseHeaderReader(0));
  }

  @Test
  public void timeoutIsDistinguishable() {
    InputStream slow =
        new SequenceInputStream(
            new ByteArrayInputStream("20 text/".getBytes(UTF_8)),
            new InputStream() {
              @Override
              public int read() throws IOException {
                throw new SocketTimeoutException("Read timed out");
              }
            });
    GeminiException e = assertThrows(GeminiException.class, () -> reader.read(connection(slow)));
    assertEquals(ErrorKind.TIMEOUT, e.getKind());
  }

  @Test
  public void brokenStreamIsTruncatedHeader() {
    InputStream broken =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("Connection reset");
          }
        };
    GeminiException e = assertThrows(GeminiException.class, () -> reader.read(connection(broken)));
    assertEquals(ErrorKind.TRUNCATED_HEADER, e.getKind());
    assertEquals("Connection reset", e.getCause().getMessage());
  }

  @Test
  public void invalidUtf8MetaIsMalformedHeader() {
    byte[] wire = {'5', '1', ' ', 'n', 'o', (byte) 0xC3, (byte) 0x28, '\r', '\n'};
    GeminiException e =
        assertThrows(
            GeminiException.class, () -> reader.read(connection(new ByteArrayInputStream(wire))));
    assertEquals(ErrorKind.MALFORMED_HEADER, e.getKind());
  }
}
