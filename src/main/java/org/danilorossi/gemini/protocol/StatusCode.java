package org.danilorossi.gemini.protocol;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * The closed set of Gemini response statuses. Constants are declared in ascending numeric order,
 * so the natural enum ordering is the numeric one.
 */
@Getter
@RequiredArgsConstructor
public enum StatusCode {
  /* 1X */
  INPUT(10, StatusBand.INPUT),
  SENSITIVE_INPUT(11, StatusBand.INPUT),
  /* 2X */
  SUCCESS(20, StatusBand.SUCCESS),
  /* 3X */
  REDIRECT_TEMPORARY(30, StatusBand.REDIRECT),
  REDIRECT_PERMANENT(31, StatusBand.REDIRECT),
  /* 4X */
  TEMPORARY_FAILURE(40, StatusBand.TEMPORARY_FAILURE),
  SERVER_UNAVAILABLE(41, StatusBand.TEMPORARY_FAILURE),
  CGI_ERROR(42, StatusBand.TEMPORARY_FAILURE),
  PROXY_ERROR(43, StatusBand.TEMPORARY_FAILURE),
  SLOW_DOWN(44, StatusBand.TEMPORARY_FAILURE),
  /* 5X */
  PERMANENT_FAILURE(50, StatusBand.PERMANENT_FAILURE),
  NOT_FOUND(51, StatusBand.PERMANENT_FAILURE),
  GONE(52, StatusBand.PERMANENT_FAILURE),
  PROXY_REQUEST_REFUSED(53, StatusBand.PERMANENT_FAILURE),
  BAD_REQUEST(59, StatusBand.PERMANENT_FAILURE),
  /* 6X */
  CLIENT_CERTIFICATE_REQUIRED(60, StatusBand.CLIENT_CERTIFICATE),
  CERTIFICATE_NOT_AUTHORISED(61, StatusBand.CLIENT_CERTIFICATE),
  CERTIFICATE_NOT_VALID(62, StatusBand.CLIENT_CERTIFICATE);

  private final int code;
  @NonNull private final StatusBand band;

  /**
   * Maps a raw two-digit status to its constant.
   *
   * @throws GeminiException with {@link ErrorKind#UNKNOWN_STATUS} for anything outside the set
   */
  public static StatusCode decode(final int raw) throws GeminiException {
    return switch (raw) {
      case 10 -> INPUT;
      case 11 -> SENSITIVE_INPUT;
      case 20 -> SUCCESS;
      case 30 -> REDIRECT_TEMPORARY;
      case 31 -> REDIRECT_PERMANENT;
      case 40 -> TEMPORARY_FAILURE;
      case 41 -> SERVER_UNAVAILABLE;
      case 42 -> CGI_ERROR;
      case 43 -> PROXY_ERROR;
      case 44 -> SLOW_DOWN;
      case 50 -> PERMANENT_FAILURE;
      case 51 -> NOT_FOUND;
      case 52 -> GONE;
      case 53 -> PROXY_REQUEST_REFUSED;
      case 59 -> BAD_REQUEST;
      case 60 -> CLIENT_CERTIFICATE_REQUIRED;
      case 61 -> CERTIFICATE_NOT_AUTHORISED;
      case 62 -> CERTIFICATE_NOT_VALID;
      default -> throw new GeminiException(ErrorKind.UNKNOWN_STATUS, "Unknown status code: " + raw);
    };
  }

  public boolean isInputRequired() {
    return band == StatusBand.INPUT;
  }

  public boolean isSuccess() {
    return band == StatusBand.SUCCESS;
  }

  public boolean isRedirect() {
    return band == StatusBand.REDIRECT;
  }

  public boolean isTemporaryFailure() {
    return band == StatusBand.TEMPORARY_FAILURE;
  }

  public boolean isPermanentFailure() {
    return band == StatusBand.PERMANENT_FAILURE;
  }

  public boolean isCertError() {
    return band == StatusBand.CLIENT_CERTIFICATE;
  }

  @Override
  public String toString() {
    return code + " " + name();
  }
}
