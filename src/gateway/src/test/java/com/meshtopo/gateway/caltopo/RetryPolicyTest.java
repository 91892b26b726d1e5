package com.meshtopo.gateway.caltopo;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void backoffDoublesUpToTheCap() {
    RetryPolicy policy = new RetryPolicy(6, 1000, 5000, 0);

    assertThat(policy.backoffMillis(0)).isEqualTo(1000);
    assertThat(policy.backoffMillis(1)).isEqualTo(2000);
    assertThat(policy.backoffMillis(2)).isEqualTo(4000);
    assertThat(policy.backoffMillis(3)).isEqualTo(5000);
    assertThat(policy.backoffMillis(80)).isEqualTo(5000);
  }

  @Test
  void jitterIsAddedOnTopOfBackoff() {
    RetryPolicy policy = new RetryPolicy(4, 1000, 30000, 500);

    assertThat(policy.delayMillis(0, 0, 0.0)).isEqualTo(1000);
    assertThat(policy.delayMillis(0, 0, 0.5)).isEqualTo(1250);
    assertThat(policy.delayMillis(1, 0, 0.999)).isLessThan(2500);
  }

  @Test
  void delaysNeverShrinkWithinOneDelivery() {
    RetryPolicy policy = new RetryPolicy(10, 1000, 2000, 500);
    long previous = 0;
    double[] jitter = {0.9, 0.1, 0.8, 0.0, 0.3};
    for (int attempt = 0; attempt < jitter.length; attempt++) {
      long delay = policy.delayMillis(attempt, previous, jitter[attempt]);
      assertThat(delay).isGreaterThanOrEqualTo(previous);
      previous = delay;
    }
  }

  @Test
  void attemptBudgetCountsTheFirstTry() {
    RetryPolicy policy = new RetryPolicy(3, 1, 1, 0);

    assertThat(policy.hasAttemptAfter(0)).isTrue();
    assertThat(policy.hasAttemptAfter(1)).isTrue();
    assertThat(policy.hasAttemptAfter(2)).isFalse();
    assertThat(new RetryPolicy(0, 1, 1, 0).maxAttempts()).isEqualTo(1);
  }
}
