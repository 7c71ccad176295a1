package org.danilorossi.gemini.protocol;

import lombok.NonNull;
import lombok.Value;

@Value
public class ResponseHeader {
  @NonNull StatusCode status;
  // MIME type (2x), redirect target (3x), prompt (1x), error text otherwise
  @NonNull String meta;
}
