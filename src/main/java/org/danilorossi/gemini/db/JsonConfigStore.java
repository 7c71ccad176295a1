package org.danilorossi.gemini.db;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.NonNull;
import lombok.Synchronized;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.gemini.helpers.FileSystemUtils;
import org.danilorossi.gemini.helpers.LangUtils;
import org.danilorossi.gemini.helpers.LogConfigurator;
import org.danilorossi.gemini.model.GeminiConfig;
import org.danilorossi.gemini.transport.TrustPolicy;

/**
 * JSON persistence for {@link GeminiConfig}. A missing or unreadable file yields the defaults (and
 * a warning in the log); so does each out-of-range value in a readable file. Writes go through a
 * temp file and an atomic move.
 */
@Log
public class JsonConfigStore {

  private static final Gson GSON =
      new GsonBuilder()
          .setPrettyPrinting()
          .serializeNulls()
          .disableHtmlEscaping()
          .registerTypeAdapter(
              TrustPolicy.class,
              (JsonDeserializer<TrustPolicy>)
                  (json, type, ctx) ->
                      json.isJsonPrimitive() ? TrustPolicy.parse(json.getAsString()) : null)
          .create();

  private static final Object CONFIG_LOCK = new Object();

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final Path file;

  /** Store on the standard {@code gemini-client.json} under the data directory. */
  public JsonConfigStore() {
    this(FileSystemUtils.getConfigJson());
  }

  public JsonConfigStore(@NonNull final Path file) {
    this.file = file;
  }

  public static Gson gson() {
    return GSON;
  }

  @Synchronized("CONFIG_LOCK")
  public GeminiConfig load() {
    return normalize(
        readOrDefault(file, GeminiConfig.class, () -> GeminiConfig.builder().build()));
  }

  @Synchronized("CONFIG_LOCK")
  public void save(@NonNull final GeminiConfig cfg) {
    writeAtomic(file, cfg);
  }

  /** Replaces values the client cannot run with by their defaults. */
  private GeminiConfig normalize(final GeminiConfig cfg) {
    val def = GeminiConfig.builder().build();
    if (LangUtils.emptyString(cfg.getDefaultHost())) {
      fixed("defaultHost", cfg.getDefaultHost(), def.getDefaultHost());
      cfg.setDefaultHost(def.getDefaultHost());
    }
    if (cfg.getPort() < 1 || cfg.getPort() > 0xFFFF) {
      fixed("port", cfg.getPort(), def.getPort());
      cfg.setPort(def.getPort());
    }
    if (cfg.getConnectTimeoutMillis() < 0) {
      fixed("connectTimeoutMillis", cfg.getConnectTimeoutMillis(), def.getConnectTimeoutMillis());
      cfg.setConnectTimeoutMillis(def.getConnectTimeoutMillis());
    }
    if (cfg.getReadTimeoutMillis() < 0) {
      fixed("readTimeoutMillis", cfg.getReadTimeoutMillis(), def.getReadTimeoutMillis());
      cfg.setReadTimeoutMillis(def.getReadTimeoutMillis());
    }
    if (cfg.getMaxMetaLength() <= 0) {
      fixed("maxMetaLength", cfg.getMaxMetaLength(), def.getMaxMetaLength());
      cfg.setMaxMetaLength(def.getMaxMetaLength());
    }
    if (cfg.getMaxRedirects() < 0) {
      fixed("maxRedirects", cfg.getMaxRedirects(), def.getMaxRedirects());
      cfg.setMaxRedirects(def.getMaxRedirects());
    }
    if (cfg.getTrustPolicy() == null) {
      fixed("trustPolicy", null, def.getTrustPolicy());
      cfg.setTrustPolicy(def.getTrustPolicy());
    }
    return cfg;
  }

  private void fixed(final String key, final Object bad, final Object def) {
    LangUtils.warn(log, "Invalid {} in {}: '{}', using {}", key, file, bad, def);
  }

  private static <T> T readOrDefault(
      @NonNull final Path file, @NonNull final Class<T> type, @NonNull final Supplier<T> def) {
    try {
      if (!Files.exists(file)) return def.get();
      val json = FileSystemUtils.readUtf8(file);
      val obj = gson().fromJson(json, type);
      return obj != null ? obj : def.get();
    } catch (RuntimeException ex) {
      LangUtils.warn(log, "Cannot read {}: {}", ex, file, LangUtils.rootCauseMsg(ex));
      return def.get();
    }
  }

  private static <T> void writeAtomic(@NonNull final Path file, @NonNull final T payload) {
    try {
      val json = gson().toJson(payload);
      FileSystemUtils.writeUtf8Atomic(file, json);
    } catch (RuntimeException ex) {
      LangUtils.err(log, "Cannot write {}: {}", ex, file, LangUtils.rootCauseMsg(ex));
      throw ex;
    }
  }
}
