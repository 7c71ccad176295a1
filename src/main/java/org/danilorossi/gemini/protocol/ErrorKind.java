package org.danilorossi.gemini.protocol;

/** Ways a Gemini exchange can fail. */
public enum ErrorKind {
  CONNECTION_FAILED,
  /** Empty host, or a host/resource containing CR or LF. */
  MALFORMED_REQUEST,
  /** Stream ended (or broke) before the header line was complete. */
  TRUNCATED_HEADER,
  /** The two status bytes are not ASCII digits. */
  MALFORMED_STATUS,
  UNKNOWN_STATUS,
  /** Status not followed by a single space. */
  MALFORMED_HEADER,
  HEADER_TOO_LONG,
  UNSUPPORTED_MEDIA_TYPE,
  BODY_READ_ERROR,
  INVALID_ENCODING,
  TIMEOUT,
  TOO_MANY_REDIRECTS,
  /** A body was required but the outcome carries none. */
  NO_BODY
}
