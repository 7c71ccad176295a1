package org.danilorossi.gemini.transport;

import lombok.val;

/** How {@link TlsTransport} treats the server certificate. */
public enum TrustPolicy {
  /** JVM default trust store plus hostname verification. */
  SYSTEM,
  /** Any certificate is accepted (self-signed capsules, trust-on-first-use left to the caller). */
  ACCEPT_ANY;

  public static TrustPolicy parse(final String s) {
    if (s == null) return null;
    val n = s.trim().replace('-', '_').toUpperCase();
    return switch (n) {
      case "SYSTEM", "DEFAULT", "STRICT" -> SYSTEM;
      case "ACCEPT_ANY", "INSECURE", "ANY" -> ACCEPT_ANY;
      default -> null;
    };
  }
}
