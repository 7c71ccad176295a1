package org.danilorossi.gemini.model;

import lombok.*;
import lombok.experimental.Accessors;
import org.danilorossi.gemini.transport.TrustPolicy;

/** Client settings, stored as JSON in the data directory. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class GeminiConfig {

  public static final int GEMINI_PORT = 1965;

  /** Host used when the launcher is started without arguments. */
  @Builder.Default private String defaultHost = "gemini.circumlunar.space";

  @Builder.Default private int port = GEMINI_PORT;

  /** ms */
  @Builder.Default private int connectTimeoutMillis = 5000;

  /** ms; 0 waits forever */
  @Builder.Default private int readTimeoutMillis = 10000;

  /** Longest accepted meta field, in bytes. */
  @Builder.Default private int maxMetaLength = 1024;

  /** Redirect hops the launcher follows automatically; 0 disables following. */
  @Builder.Default private int maxRedirects = 5;

  @Builder.Default private TrustPolicy trustPolicy = TrustPolicy.ACCEPT_ANY;
}
