package com.meshtopo.gateway.caltopo;

import com.meshtopo.gateway.config.GatewayProperties;

/**
 * Bounded exponential backoff: {@code min(maxDelay, baseDelay * 2^attempt) + jitter}.
 *
 * <p>Delays for one delivery never shrink: a capped delay with a smaller jitter sample keeps the
 * previous delay.
 *
 * @param maxAttempts total attempts including the first one (at least 1)
 * @param baseDelayMs delay before the second attempt, before jitter
 * @param maxDelayMs cap applied before jitter
 * @param jitterMs upper bound (exclusive) of the random jitter
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, long jitterMs) {
  public RetryPolicy {
    maxAttempts = Math.max(1, maxAttempts);
    baseDelayMs = Math.max(0L, baseDelayMs);
    maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
    jitterMs = Math.max(0L, jitterMs);
  }

  public static RetryPolicy from(GatewayProperties.Retry retry) {
    return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitterMs());
  }

  /** Capped exponential part of the delay after the zero-based {@code attempt} failed. */
  public long backoffMillis(int attempt) {
    if (attempt >= 62 || baseDelayMs == 0) {
      return attempt >= 62 ? maxDelayMs : 0L;
    }
    long factor = 1L << attempt;
    if (baseDelayMs > maxDelayMs / factor) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * factor);
  }

  /**
   * Delay to wait after the zero-based {@code attempt} failed.
   *
   * @param previousDelayMs the delay used before this attempt (0 for the first)
   * @param jitterFraction sample in {@code [0, 1)}
   */
  public long delayMillis(int attempt, long previousDelayMs, double jitterFraction) {
    double fraction = Math.min(Math.max(jitterFraction, 0.0), 1.0);
    long delay = backoffMillis(attempt) + (long) (fraction * jitterMs);
    return Math.max(previousDelayMs, delay);
  }

  public boolean hasAttemptAfter(int attempt) {
    return attempt + 1 < maxAttempts;
  }
}
