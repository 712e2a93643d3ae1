/*
 * Where: Shared retry policy
 * What: Exponential backoff with a cap, a floor and multiplicative jitter
 * Why: Outbox retries, consumer naks and provider retries share one delay formula
 */
package com.mysocial.common.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public record BackoffPolicy(
    Duration base,
    Duration max,
    double exponentBase,
    double jitterMin,
    double jitterMax,
    Duration min) {

  public BackoffPolicy {
    if (base == null || max == null || min == null) {
      throw new IllegalArgumentException("backoff base, max and min are required");
    }
    if (base.isNegative() || max.isNegative() || min.isNegative()) {
      throw new IllegalArgumentException("backoff durations must not be negative");
    }
    if (exponentBase < 1.0d) {
      throw new IllegalArgumentException("backoff exponent base must be >= 1.0");
    }
    if (jitterMin <= 0.0d || jitterMax < jitterMin) {
      throw new IllegalArgumentException("backoff jitter range is invalid");
    }
  }

  public static BackoffPolicy fixed(Duration delay) {
    return new BackoffPolicy(delay, delay, 1.0d, 1.0d, 1.0d, delay);
  }

  /** Delay before the given attempt, where attempt 1 is the first retry. */
  public Duration delayFor(int attempt) {
    return delayFor(attempt, ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Deterministic variant: {@code random} in [0, 1) selects the jitter factor between
   * {@code jitterMin} and {@code jitterMax}.
   */
  public Duration delayFor(int attempt, double random) {
    final int exponent = Math.max(attempt, 1) - 1;
    final double exp = base.toMillis() * Math.pow(exponentBase, exponent);
    final double capped = Math.min(exp, max.toMillis());
    final double jitter = jitterMin + random * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(min.toMillis(), backoffMillis));
  }
}
