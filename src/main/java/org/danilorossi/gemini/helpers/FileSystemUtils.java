package org.danilorossi.gemini.helpers;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.*;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

@UtilityClass
public class FileSystemUtils {

  private static final String PROP_HOME = "gemini.home"; // optional override
  private static final String DIR_DATA = "data";

  private static final String CONFIG_JSON = "gemini-client.json";

  /** Directory holding the configuration file and the log. */
  public static Path getDataDir() {
    // 1) development: DEV env
    val dev = System.getenv("DEV");
    if (!LangUtils.emptyString(dev)) return ensureDir(cwd().resolve(DIR_DATA));

    // 2) explicit override: -Dgemini.home=/some/path
    val override = System.getProperty(PROP_HOME);
    if (!LangUtils.emptyString(override)) return ensureDir(normalize(Paths.get(override)));

    // 3) next to the jar (or target/ when running from classes/)
    try {
      val base = resolveExecutableBaseDir();
      if (base != null) return ensureDir(base.resolve(DIR_DATA));
    } catch (URISyntaxException | RuntimeException __) {
      // fallback below
    }

    // 4) CWD/data
    return ensureDir(cwd().resolve(DIR_DATA));
  }

  /** Path to gemini-client.json. */
  public static Path getConfigJson() {
    return getDataDir().resolve(CONFIG_JSON);
  }

  public static File getDataFile(@NonNull String fileName) {
    return getDataDir().resolve(fileName).toFile();
  }

  private static Path cwd() {
    return normalize(Paths.get("."));
  }

  private static Path normalize(@NonNull final Path p) {
    return p.toAbsolutePath().normalize();
  }

  private static Path ensureDir(@NonNull final Path dir) {
    try {
      Files.createDirectories(dir);
      if (!Files.isDirectory(dir))
        throw new IOException(LangUtils.s("Path exists but is not a directory: {}", dir));
      return dir;
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot create directory: {}", dir), e);
    }
  }

  /** jar ⇒ parent; .../target/classes ⇒ parent of classes; otherwise the location itself. */
  private static Path resolveExecutableBaseDir() throws URISyntaxException {
    val cs = FileSystemUtils.class.getProtectionDomain().getCodeSource();
    if (cs == null) return null;
    val loc = normalize(Paths.get(cs.getLocation().toURI()));
    if (Files.isRegularFile(loc)) return normalize(loc.getParent()); // jar
    val name = loc.getFileName() != null ? loc.getFileName().toString() : "";
    if ("classes".equals(name)) return normalize(loc.getParent()); // .../target
    return loc;
  }

  /** Writes UTF-8 text atomically (tmp file in the same directory, then move). */
  public static void writeUtf8Atomic(@NonNull final Path _target, @NonNull final String content) {
    val target = normalize(_target);
    ensureDir(target.getParent());
    try {
      val tmp =
          Files.createTempFile(target.getParent(), target.getFileName().toString() + "-", ".tmp");
      try {
        Files.writeString(tmp, content, StandardCharsets.UTF_8, CREATE, TRUNCATE_EXISTING, WRITE);
        try {
          Files.move(tmp, target, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException __) {
          Files.move(tmp, target, REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot write file: {}", target), e);
    }
  }

  public static String readUtf8(@NonNull final Path file) {
    try {
      return Files.readString(normalize(file), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot read file: {}", file), e);
    }
  }
}
