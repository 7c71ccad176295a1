package org.danilorossi.gemini.client;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import lombok.*;
import lombok.extern.java.Log;
import org.danilorossi.gemini.helpers.LangUtils;
import org.danilorossi.gemini.helpers.LogConfigurator;
import org.danilorossi.gemini.model.GeminiConfig;
import org.danilorossi.gemini.protocol.DispatchOutcome;
import org.danilorossi.gemini.protocol.ErrorKind;
import org.danilorossi.gemini.protocol.GeminiException;
import org.danilorossi.gemini.protocol.RequestBuilder;
import org.danilorossi.gemini.protocol.ResponseDispatcher;
import org.danilorossi.gemini.protocol.ResponseHeaderReader;
import org.danilorossi.gemini.transport.GeminiConnection;
import org.danilorossi.gemini.transport.TlsTransport;
import org.danilorossi.gemini.transport.Transport;

/**
 * Gemini client: one request per connection, no retries, no caching.
 *
 * <p>Each exchange is connect, write the request line, read the header, dispatch on the status and
 * close. Any failure ends the exchange and is thrown to the caller as a {@link GeminiException};
 * redirects, input prompts, failure statuses and refused media types come back as {@link
 * DispatchOutcome}s.
 *
 * <p>This class does no certificate or hostname validation of its own: that is configured on the
 * {@link Transport}.
 */
@Log
@Builder
public class GeminiClient {

  static {
    LogConfigurator.configLog(log);
  }

  @Getter @NonNull private final Transport transport;

  @Getter @Builder.Default
  private final int maxMetaLength = ResponseHeaderReader.DEFAULT_MAX_META_LENGTH;

  @Getter @Builder.Default private final int maxRedirects = 5;

  // --------------------------------------------------------------------------------------------
  // Public API
  // --------------------------------------------------------------------------------------------

  /** Runs a single exchange against {@code host:port} for {@code resource}. */
  public DispatchOutcome performRequest(
      @NonNull final String host, final int port, final String resource) throws GeminiException {
    val request = RequestBuilder.build(host, resource);
    LangUtils.info(log, "Requesting {}", request.trim());

    try {
      val connection = transport.connect(RequestBuilder.hostName(host), port);
      final DispatchOutcome outcome;
      try {
        outcome = exchange(connection, request);
      } catch (GeminiException e) {
        closeAfterFailure(connection, e);
        throw e;
      }
      close(connection, host, port);
      return outcome;
    } catch (GeminiException e) {
      LangUtils.warn(log, "Exchange with {}:{} failed: {}", host, port, e);
      throw e;
    }
  }

  /**
   * Like {@link #performRequest} but follows redirects to other gemini URLs, up to {@link
   * #getMaxRedirects()} hops. A redirect to another scheme is returned as is.
   *
   * @throws GeminiException {@code TOO_MANY_REDIRECTS} when the hop limit is exceeded
   */
  public DispatchOutcome follow(@NonNull final String host, final int port, final String resource)
      throws GeminiException {
    Target current = Target.of(host, port, resource);
    for (int hops = 0; ; hops++) {
      val outcome = performRequest(current.getHost(), current.getPort(), current.getResource());
      if (outcome.getKind() != DispatchOutcome.Kind.REDIRECT) return outcome;

      val next = current.resolve(outcome.getMeta());
      if (next == null) {
        LangUtils.info(log, "Not following redirect to {}", outcome.getMeta());
        return outcome;
      }
      if (hops >= maxRedirects)
        throw new GeminiException(
            ErrorKind.TOO_MANY_REDIRECTS,
            LangUtils.s("More than {} redirects, last target {}", maxRedirects, outcome.getMeta()));

      LangUtils.info(log, "{} -> {}", outcome.getStatus(), next.toUri());
      current = next;
    }
  }

  public static GeminiClient newFromConfig(@NonNull final GeminiConfig config) {
    val transport =
        TlsTransport.builder()
            .connectTimeoutMillis(config.getConnectTimeoutMillis())
            .readTimeoutMillis(config.getReadTimeoutMillis())
            .trustPolicy(config.getTrustPolicy())
            .build();
    return GeminiClient.builder()
        .transport(transport)
        .maxMetaLength(config.getMaxMetaLength())
        .maxRedirects(config.getMaxRedirects())
        .build();
  }

  // --------------------------------------------------------------------------------------------
  // Exchange
  // --------------------------------------------------------------------------------------------

  private DispatchOutcome exchange(final GeminiConnection connection, final String request)
      throws GeminiException {
    try {
      connection.write(request.getBytes(StandardCharsets.UTF_8));
    } catch (GeminiException e) {
      throw e;
    } catch (IOException e) {
      throw new GeminiException(
          ErrorKind.CONNECTION_FAILED, "Cannot send request: " + LangUtils.exMsg(e), e);
    }

    val header = new ResponseHeaderReader(maxMetaLength).read(connection);
    val outcome = new ResponseDispatcher().dispatch(header, connection);
    LangUtils.info(log, "{} -> {}", header.getStatus(), outcome.getKind());
    return outcome;
  }

  /** The outcome is already complete, so a failing close is only logged. */
  private static void close(final GeminiConnection connection, final String host, final int port) {
    try {
      connection.close();
    } catch (IOException e) {
      LangUtils.warn(
          log, "Closing connection to {}:{} failed: {}", host, port, LangUtils.exMsg(e));
    }
  }

  private static void closeAfterFailure(
      final GeminiConnection connection, final GeminiException primary) {
    try {
      connection.close();
    } catch (IOException suppressed) {
      primary.addSuppressed(suppressed);
    }
  }

  /** Where a request goes; resolves redirect targets against itself. */
  @Value
  static class Target {
    String host;
    int port;
    String resource;

    static Target of(final String host, final int port, final String resource) {
      return new Target(RequestBuilder.hostName(host), port, resourceOf(host, resource));
    }

    URI toUri() throws GeminiException {
      try {
        val portPart = port == GeminiConfig.GEMINI_PORT ? "" : ":" + port;
        return new URI(RequestBuilder.SCHEME + host + portPart + resource);
      } catch (URISyntaxException e) {
        throw new GeminiException(ErrorKind.MALFORMED_REQUEST, "Invalid URL: " + e.getInput(), e);
      }
    }

    /** Next target for a redirect, or null when it leaves the gemini scheme. */
    Target resolve(final String location) throws GeminiException {
      final URI next;
      try {
        next = toUri().resolve(new URI(LangUtils.normalize(location)));
      } catch (URISyntaxException | IllegalArgumentException e) {
        throw new GeminiException(
            ErrorKind.MALFORMED_REQUEST, "Invalid redirect target: " + location, e);
      }
      if (!"gemini".equalsIgnoreCase(next.getScheme()) || next.getHost() == null) return null;

      val path = LangUtils.emptyString(next.getRawPath()) ? "/" : next.getRawPath();
      val query = next.getRawQuery() == null ? "" : "?" + next.getRawQuery();
      val nextPort = next.getPort() == -1 ? GeminiConfig.GEMINI_PORT : next.getPort();
      return new Target(next.getHost(), nextPort, path + query);
    }

    private static String resourceOf(final String host, final String resource) {
      // "gemini://host/path" passed as host carries its own path
      val scheme = RequestBuilder.SCHEME;
      val h = host.startsWith(scheme) ? host.substring(scheme.length()) : host;
      val slash = h.indexOf('/');
      val prefix = slash >= 0 ? h.substring(slash) : "";
      return prefix + (resource == null ? "" : resource);
    }
  }
}
