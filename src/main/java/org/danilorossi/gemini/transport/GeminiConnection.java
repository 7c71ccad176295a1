package org.danilorossi.gemini.transport;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import lombok.NonNull;
import lombok.val;
import org.danilorossi.gemini.protocol.ErrorKind;
import org.danilorossi.gemini.protocol.GeminiException;

/**
 * One end of a single Gemini exchange: a byte stream in each direction. Used once and closed; the
 * protocol never sends a second request over the same connection.
 *
 * <p>Read timeouts of the underlying stream are reported as {@link ErrorKind#TIMEOUT}; every other
 * I/O failure is propagated unchanged so that the caller can classify it.
 */
public class GeminiConnection implements Closeable {

  private static final int BUFFER_SIZE = 8192;

  private final InputStream in;
  private final OutputStream out;
  private final Closeable resource;
  private boolean closed;

  public GeminiConnection(
      @NonNull final InputStream in,
      @NonNull final OutputStream out,
      @NonNull final Closeable resource) {
    this.in = new BufferedInputStream(in, BUFFER_SIZE);
    this.out = out;
    this.resource = resource;
  }

  /** Connection over arbitrary streams; closing it closes both. */
  public static GeminiConnection of(
      @NonNull final InputStream in, @NonNull final OutputStream out) {
    return new GeminiConnection(
        in,
        out,
        () -> {
          try {
            in.close();
          } finally {
            out.close();
          }
        });
  }

  /** Sends {@code bytes} and flushes. */
  public void write(@NonNull final byte[] bytes) throws IOException {
    ensureOpen();
    try {
      out.write(bytes);
      out.flush();
    } catch (SocketTimeoutException e) {
      throw timeout("write", e);
    }
  }

  /** Next byte, or -1 at end of stream. */
  public int read() throws IOException {
    ensureOpen();
    try {
      return in.read();
    } catch (SocketTimeoutException e) {
      throw timeout("read", e);
    }
  }

  /** Up to {@code n} bytes; fewer only when the stream ends first. */
  public byte[] read(final int n) throws IOException {
    ensureOpen();
    try {
      return in.readNBytes(n);
    } catch (SocketTimeoutException e) {
      throw timeout("read", e);
    }
  }

  /** Everything left until end of stream. */
  public byte[] readToEnd() throws IOException {
    ensureOpen();
    try {
      val buf = new ByteArrayOutputStream(BUFFER_SIZE);
      in.transferTo(buf);
      return buf.toByteArray();
    } catch (SocketTimeoutException e) {
      throw timeout("read", e);
    }
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() throws IOException {
    if (closed) return;
    closed = true;
    resource.close();
  }

  private void ensureOpen() throws IOException {
    if (closed) throw new IOException("Connection already closed");
  }

  private static GeminiException timeout(final String op, final SocketTimeoutException e) {
    return new GeminiException(ErrorKind.TIMEOUT, "Timed out during " + op, e);
  }
}
