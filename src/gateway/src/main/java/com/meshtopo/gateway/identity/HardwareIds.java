package com.meshtopo.gateway.identity;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** Helpers for Meshtastic hardware ids ({@code "!" + 8 lowercase hex digits}). */
public final class HardwareIds {
  private static final Pattern FORMAT = Pattern.compile("^![0-9a-f]{8}$");
  private static final long MAX_NODE_NUM = 0xFFFFFFFFL;

  private HardwareIds() {}

  /**
   * Derives the hardware id a node reports for itself from its numeric node number.
   *
   * @param numericId node number in {@code 0..0xFFFFFFFF}
   * @return e.g. {@code !1234abcd} for {@code 305419896}
   */
  public static String fromNumericId(long numericId) {
    if (numericId < 0 || numericId > MAX_NODE_NUM) {
      throw new IllegalArgumentException("Node number out of 32-bit range: " + numericId);
    }
    return String.format(Locale.ROOT, "!%08x", numericId);
  }

  public static boolean isValid(String hardwareId) {
    return hardwareId != null && FORMAT.matcher(hardwareId).matches();
  }

  /** Trims and lower-cases a candidate id, returning it only when it has the canonical shape. */
  public static Optional<String> normalize(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String candidate = raw.trim().toLowerCase(Locale.ROOT);
    return isValid(candidate) ? Optional.of(candidate) : Optional.empty();
  }
}
