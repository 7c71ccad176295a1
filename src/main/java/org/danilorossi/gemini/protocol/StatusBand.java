package org.danilorossi.gemini.protocol;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Status families, keyed by the first digit of the code. */
@Getter
@RequiredArgsConstructor
public enum StatusBand {
  INPUT(1),
  SUCCESS(2),
  REDIRECT(3),
  TEMPORARY_FAILURE(4),
  PERMANENT_FAILURE(5),
  CLIENT_CERTIFICATE(6);

  private final int leadingDigit;
}
