package org.danilorossi.gemini.protocol;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of a completed exchange. Only {@link Kind#BODY} carries text; the other kinds carry the
 * status and/or the header meta the caller needs to render a message.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DispatchOutcome {

  public enum Kind {
    BODY,
    UNSUPPORTED_MEDIA_TYPE,
    REDIRECT,
    INPUT_REQUESTED,
    FAILURE,
    UNHANDLED_STATUS
  }

  @NonNull Kind kind;
  StatusCode status;
  String meta; // mime type, redirect target, prompt or error detail
  String body; // only for BODY

  public static DispatchOutcome body(final String mediaType, @NonNull final String text) {
    return new DispatchOutcome(Kind.BODY, StatusCode.SUCCESS, mediaType, text);
  }

  public static DispatchOutcome unsupportedMediaType(final String mediaType) {
    return new DispatchOutcome(Kind.UNSUPPORTED_MEDIA_TYPE, StatusCode.SUCCESS, mediaType, null);
  }

  public static DispatchOutcome redirect(@NonNull final StatusCode status, final String target) {
    return new DispatchOutcome(Kind.REDIRECT, status, target, null);
  }

  public static DispatchOutcome inputRequested(
      @NonNull final StatusCode status, final String prompt) {
    return new DispatchOutcome(Kind.INPUT_REQUESTED, status, prompt, null);
  }

  public static DispatchOutcome failure(@NonNull final StatusCode status, final String detail) {
    return new DispatchOutcome(Kind.FAILURE, status, detail, null);
  }

  public static DispatchOutcome unhandledStatus(@NonNull final StatusCode status) {
    return new DispatchOutcome(Kind.UNHANDLED_STATUS, status, null, null);
  }

  public boolean hasBody() {
    return kind == Kind.BODY;
  }

  /**
   * The body text of a {@link Kind#BODY} outcome.
   *
   * @throws GeminiException {@code UNSUPPORTED_MEDIA_TYPE} for a refused body, {@code NO_BODY} for
   *     any other outcome
   */
  public String requireBody() throws GeminiException {
    return switch (kind) {
      case BODY -> body;
      case UNSUPPORTED_MEDIA_TYPE -> throw new GeminiException(
          ErrorKind.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type: " + meta);
      default -> throw new GeminiException(
          ErrorKind.NO_BODY, "No body in response: " + status + " " + meta);
    };
  }
}
