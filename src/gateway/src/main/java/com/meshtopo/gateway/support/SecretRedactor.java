package com.meshtopo.gateway.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Replaces known secret identifiers (CalTopo connect keys and group ids) inside log text.
 *
 * <p>Longer secrets are replaced first so that a secret containing another one is fully masked.
 */
public final class SecretRedactor {
  public static final String PLACEHOLDER = "<REDACTED>";

  private final List<String> secrets;

  public SecretRedactor(Collection<String> secrets) {
    List<String> sorted = new ArrayList<>();
    for (String secret : secrets) {
      if (secret != null && !secret.isBlank()) {
        sorted.add(secret.trim());
      }
    }
    sorted.sort(Comparator.comparingInt(String::length).reversed());
    this.secrets = List.copyOf(sorted);
  }

  /** Sanitizes {@code value} for logging and masks every configured secret in it. */
  public String redact(Object value) {
    String text = LogSanitizer.sanitize(value);
    for (String secret : secrets) {
      text = text.replace(secret, PLACEHOLDER);
    }
    return text;
  }
}
