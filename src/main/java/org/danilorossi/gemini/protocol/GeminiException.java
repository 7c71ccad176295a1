package org.danilorossi.gemini.protocol;

import java.io.IOException;
import lombok.Getter;
import lombok.NonNull;

/**
 * Failure of a Gemini exchange. Extends {@link IOException} so that it travels through the same
 * {@code throws} clauses as the socket errors it usually wraps.
 */
public class GeminiException extends IOException {

  private static final long serialVersionUID = 1L;

  @Getter private final ErrorKind kind;

  public GeminiException(@NonNull final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  public GeminiException(
      @NonNull final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  @Override
  public String toString() {
    return kind + ": " + getMessage();
  }
}
