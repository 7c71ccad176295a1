package org.danilorossi.gemini;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.gemini.client.GeminiClient;
import org.danilorossi.gemini.db.JsonConfigStore;
import org.danilorossi.gemini.helpers.LangUtils;
import org.danilorossi.gemini.helpers.LogConfigurator;
import org.danilorossi.gemini.model.GeminiConfig;
import org.danilorossi.gemini.protocol.DispatchOutcome;
import org.danilorossi.gemini.protocol.GeminiException;

/** Command line entry point: asks for a resource on a host and prints what the server returns. */
@Log
public class GeminiLauncher {

  static {
    LogConfigurator.configLog(log);
  }

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }

  static int run(
      @NonNull final String[] args,
      @NonNull final InputStream stdin,
      @NonNull final PrintStream out,
      @NonNull final PrintStream err) {

    if (Arrays.asList(args).contains("-help")
        || Arrays.asList(args).contains("--help")
        || Arrays.asList(args).contains("-h")
        || Arrays.asList(args).contains("/?")) {
      out.println("Usage: java -jar gemini-client.jar [host] [port]");
      out.println("  host   the capsule to connect to (default from gemini-client.json)");
      out.println("  port   the port the server listens on (default 1965)");
      return 0;
    }

    val config = loadConfig();
    val host = args.length > 0 ? args[0] : config.getDefaultHost();
    val port = args.length > 1 ? LangUtils.parseIntOr(args[1], -1) : config.getPort();
    if (port < 1 || port > 65535) {
      err.println("Invalid port: " + (args.length > 1 ? args[1] : String.valueOf(port)));
      return 2;
    }

    out.println(LangUtils.s("What resource do you want to access on {}?: ", host));
    final String resource;
    try {
      resource = readResource(stdin);
    } catch (IOException e) {
      err.println("Cannot read resource: " + LangUtils.exMsg(e));
      return 1;
    }

    val client = GeminiClient.newFromConfig(config);
    try {
      val outcome =
          config.getMaxRedirects() > 0
              ? client.follow(host, port, resource)
              : client.performRequest(host, port, resource);
      val rendered = render(outcome);
      if (outcome.hasBody()) out.println(rendered);
      else err.println(rendered);
      return outcome.hasBody() ? 0 : 1;
    } catch (GeminiException e) {
      LangUtils.err(log, "Request failed: {}", e, e);
      err.println(describe(e));
      return 1;
    }
  }

  /** User-facing text for an outcome. */
  static String render(@NonNull final DispatchOutcome outcome) {
    val status = outcome.getStatus();
    return switch (outcome.getKind()) {
      case BODY -> "Server returned:\n" + outcome.getBody();
      case UNSUPPORTED_MEDIA_TYPE -> LangUtils.s(
          "I only know how to handle text MIME types, got {}", outcome.getMeta());
      case REDIRECT -> LangUtils.s("Redirected to {}", outcome.getMeta());
      case INPUT_REQUESTED -> LangUtils.s("The server asks for input: {}", outcome.getMeta());
      case FAILURE -> switch (status) {
        case NOT_FOUND -> "Page not found!";
        case BAD_REQUEST -> "Oops! Looks like we made a bad request :( please try again.";
        default -> status.isTemporaryFailure()
            ? LangUtils.s("We failed - but only for now. The server said: {}", outcome.getMeta())
            : status.isCertError()
                ? LangUtils.s("Client certificate problem ({}): {}", status, outcome.getMeta())
                : LangUtils.s("We failed - big time. The server said: {}", outcome.getMeta());
      };
      case UNHANDLED_STATUS -> LangUtils.s("I don't know how to handle {}", status);
    };
  }

  static String describe(@NonNull final GeminiException e) {
    return switch (e.getKind()) {
      case CONNECTION_FAILED -> "Could not reach the server: " + e.getMessage();
      case TIMEOUT -> "The server took too long to answer.";
      case MALFORMED_REQUEST -> "That is not a valid request: " + e.getMessage();
      default -> "The exchange failed (" + e.getKind() + "): " + e.getMessage();
    };
  }

  private static String readResource(final InputStream stdin) throws IOException {
    val reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
    val line = reader.readLine();
    return LangUtils.emptyString(line) ? "/" : line.trim();
  }

  /** Loads gemini-client.json, writing the defaults on first run. */
  private static GeminiConfig loadConfig() {
    val store = new JsonConfigStore();
    if (Files.exists(store.getFile())) {
      val cfg = store.load();
      LangUtils.info(log, "Loaded configuration from {}", store.getFile());
      return cfg;
    }
    val cfg = GeminiConfig.builder().build();
    try {
      store.save(cfg);
      LangUtils.info(log, "Wrote default configuration to {}", store.getFile());
    } catch (RuntimeException e) {
      LangUtils.warn(log, "Cannot write default configuration: {}", LangUtils.exMsg(e));
    }
    return cfg;
  }
}
