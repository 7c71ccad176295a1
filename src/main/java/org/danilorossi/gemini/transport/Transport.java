package org.danilorossi.gemini.transport;

import org.danilorossi.gemini.protocol.GeminiException;

/**
 * Supplies the encrypted byte stream for one exchange. Certificate and hostname checks, if any,
 * are the implementation's business: the protocol code above never validates the peer itself.
 */
public interface Transport {

  /**
   * Opens a connection to {@code host:port}.
   *
   * @throws GeminiException {@code CONNECTION_FAILED} or {@code TIMEOUT}
   */
  GeminiConnection connect(String host, int port) throws GeminiException;
}
