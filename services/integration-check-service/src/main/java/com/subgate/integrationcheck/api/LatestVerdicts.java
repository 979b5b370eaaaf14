package com.subgate.integrationcheck.api;

import com.subgate.integrationcheck.common.concurrency.LatestCallTracker;
import com.subgate.integrationcheck.stripe.KeyCheckVerdict;
import com.subgate.integrationcheck.telegram.ValidationVerdict;
import java.time.Duration;
import org.springframework.stereotype.Component;

/** Newest verdict per user for each kind of check, as shown by the dashboard. */
@Component
public class LatestVerdicts {

  private static final Duration IDLE_TTL = Duration.ofHours(1);

  private final LatestCallTracker<String, ValidationVerdict> botChecks =
      new LatestCallTracker<>(IDLE_TTL);
  private final LatestCallTracker<String, KeyCheckVerdict> keyChecks =
      new LatestCallTracker<>(IDLE_TTL);

  public LatestCallTracker<String, ValidationVerdict> botChecks() {
    return botChecks;
  }

  public LatestCallTracker<String, KeyCheckVerdict> keyChecks() {
    return keyChecks;
  }
}
