package com.meshtopo.gateway.support;

/** Makes untrusted values safe to embed in a single log line. */
public final class LogSanitizer {
  private LogSanitizer() {}

  /**
   * Escapes CR and LF so a value taken from a packet or an HTTP body cannot forge extra log lines.
   *
   * @return the escaped text, or {@code "null"} for null input
   */
  public static String sanitize(Object value) {
    if (value == null) {
      return "null";
    }
    return value.toString().replace("\r", "\\r").replace("\n", "\\n");
  }
}
