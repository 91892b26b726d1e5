package com.meshtopo.gateway.caltopo;

import java.util.regex.Pattern;

/**
 * A CalTopo report target: the secret path identifier (connect key or group id) and its kind.
 *
 * <p>The identifier becomes a URL path segment, so only {@code [A-Za-z0-9_]} is accepted.
 */
public record Destination(DestinationKind kind, String identifier) {
  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_]+$");

  public static boolean isValidIdentifier(String identifier) {
    return identifier != null && IDENTIFIER.matcher(identifier).matches();
  }

  public boolean hasValidIdentifier() {
    return isValidIdentifier(identifier);
  }

  public String label() {
    return kind.label();
  }

  @Override
  public String toString() {
    return "Destination[" + kind.label() + "]";
  }
}
