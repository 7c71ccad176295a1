package org.danilorossi.gemini.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.security.GeneralSecurityException;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.gemini.helpers.LangUtils;
import org.danilorossi.gemini.helpers.LogConfigurator;
import org.danilorossi.gemini.protocol.ErrorKind;
import org.danilorossi.gemini.protocol.GeminiException;

/**
 * TLS transport over JSSE sockets. The TCP connect honours {@code connectTimeoutMillis}; reads
 * honour {@code readTimeoutMillis} (0 means wait forever). SNI is sent for the requested host.
 */
@Log
@Builder
public class TlsTransport implements Transport {

  static {
    LogConfigurator.configLog(log);
  }

  private static final int MAX_PORT = 0xFFFF;

  @Getter @Builder.Default private int connectTimeoutMillis = 5000;

  @Getter @Builder.Default private int readTimeoutMillis = 10000;

  @Getter @NonNull @Builder.Default private TrustPolicy trustPolicy = TrustPolicy.ACCEPT_ANY;

  @Override
  public GeminiConnection connect(@NonNull final String host, final int port)
      throws GeminiException {
    if (port < 1 || port > MAX_PORT)
      throw new GeminiException(
          ErrorKind.CONNECTION_FAILED, LangUtils.s("Port out of range: {}", port));
    val factory = socketFactory();
    val raw = new Socket();
    try {
      raw.connect(new InetSocketAddress(host, port), connectTimeoutMillis);
      raw.setSoTimeout(readTimeoutMillis);

      val socket = (SSLSocket) factory.createSocket(raw, host, port, true);
      if (trustPolicy == TrustPolicy.SYSTEM) {
        val params = socket.getSSLParameters();
        params.setEndpointIdentificationAlgorithm("HTTPS");
        socket.setSSLParameters(params);
      }
      socket.startHandshake();
      LangUtils.debug(
          log, "TLS session with {}:{} ({})", host, port, socket.getSession().getProtocol());

      return new GeminiConnection(socket.getInputStream(), socket.getOutputStream(), socket);
    } catch (IOException e) {
      closeQuietly(raw, e);
      if (isTimeout(e))
        throw new GeminiException(
            ErrorKind.TIMEOUT, LangUtils.s("Timed out connecting to {}:{}", host, port), e);
      throw new GeminiException(
          ErrorKind.CONNECTION_FAILED,
          LangUtils.s("Cannot connect to {}:{}: {}", host, port, LangUtils.exMsg(e)),
          e);
    }
  }

  private SSLSocketFactory socketFactory() throws GeminiException {
    if (trustPolicy == TrustPolicy.SYSTEM) return (SSLSocketFactory) SSLSocketFactory.getDefault();
    try {
      val ctx = SSLContext.getInstance("TLS");
      ctx.init(null, new TrustManager[] {new InsecureTrustManager()}, null);
      return ctx.getSocketFactory();
    } catch (GeneralSecurityException e) {
      throw new GeminiException(ErrorKind.CONNECTION_FAILED, "Cannot initialise TLS context", e);
    }
  }

  /** JSSE may report a handshake timeout wrapped in an {@code SSLException}. */
  private static boolean isTimeout(final Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SocketTimeoutException) return true;
    }
    return false;
  }

  private static void closeQuietly(final Socket socket, final IOException primary) {
    try {
      socket.close();
    } catch (IOException suppressed) {
      primary.addSuppressed(suppressed);
    }
  }
}
