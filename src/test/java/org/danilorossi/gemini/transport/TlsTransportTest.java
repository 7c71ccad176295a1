package org.danilorossi.gemini.transport;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import org.danilorossi.gemini.protocol.ErrorKind;
import org.danilorossi.gemini.protocol.GeminiException;
import org.junit.jupiter.api.Test;

public class TlsTransportTest {

  private final TlsTransport transport =
      TlsTransport.builder().connectTimeoutMillis(2000).readTimeoutMillis(2000).build();

  @Test
  public void defaults() {
    TlsTransport t = TlsTransport.builder().build();
    assertEquals(TrustPolicy.ACCEPT_ANY, t.getTrustPolicy());
    assertEquals(5000, t.getConnectTimeoutMillis());
    assertEquals(10000, t.getReadTimeoutMillis());
  }

  /** Nothing listening on the port. */
  @Test
  public void refusedConnectionIsConnectionFailed() throws IOException {
    int port;
    try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      port = probe.getLocalPort();
    }
    final int closedPort = port;
    GeminiException e =
        assertThrows(GeminiException.class, () -> transport.connect("127.0.0.1", closedPort));
    assertEquals(ErrorKind.CONNECTION_FAILED, e.getKind());
  }

  /** A peer that does not speak TLS fails the handshake. */
  @Test
  public void plainTextPeerIsConnectionFailed() throws Exception {
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Thread peer =
          new Thread(
              () -> {
                try (Socket s = server.accept()) {
                  s.getOutputStream().write("20 text/gemini\r\nnot tls\r\n".getBytes(UTF_8));
                  s.getOutputStream().flush();
                } catch (IOException ignored) {
                  // the client hanging up mid-handshake is expected
                }
              });
      peer.start();

      GeminiException e =
          assertThrows(
              GeminiException.class, () -> transport.connect("127.0.0.1", server.getLocalPort()));
      assertEquals(ErrorKind.CONNECTION_FAILED, e.getKind());
      peer.join(5000);
    }
  }

  @Test
  public void portOutOfRangeIsConnectionFailed() {
    GeminiException e =
        assertThrows(GeminiException.class, () -> transport.connect("127.0.0.1", 70000));
    assertEquals(ErrorKind.CONNECTION_FAILED, e.getKind());
    assertNull(e.getCause());
  }

  /** A peer that accepts and never answers the ClientHello. */
  @Test
  public void silentPeerIsTimeout() throws Exception {
    TlsTransport impatient =
        TlsTransport.builder().connectTimeoutMillis(2000).readTimeoutMillis(200).build();
    try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      Thread peer =
          new Thread(
              () -> {
                try (Socket s = server.accept()) {
                  // drain until the client gives up and closes
                  while (s.getInputStream().read(new byte[512]) != -1) {}
                } catch (IOException ignored) {
                  // client reset is fine here
                }
              });
      peer.start();

      GeminiException e =
          assertThrows(
              GeminiException.class, () -> impatient.connect("127.0.0.1", server.getLocalPort()));
      assertEquals(ErrorKind.TIMEOUT, e.getKind());
      peer.join(5000);
    }
  }
}
