package com.subgate.integrationcheck.common.concurrency;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class LatestCallTrackerTest {

  private final LatestCallTracker<String, String> tracker =
      new LatestCallTracker<>(Duration.ofMinutes(5));

  @Test
  void staleResultArrivingAfterNewerCallIsDropped() {
    LatestCallTracker.Ticket<String> older = tracker.begin("user-1");
    LatestCallTracker.Ticket<String> newer = tracker.begin("user-1");

    assertThat(tracker.publish(newer, "newer")).isTrue();
    assertThat(tracker.publish(older, "older")).isFalse();

    assertThat(tracker.latest("user-1")).contains("newer");
  }

  @Test
  void resultOfSupersededCallIsDroppedEvenIfNewerIsStillRunning() {
    LatestCallTracker.Ticket<String> older = tracker.begin("user-1");
    tracker.begin("user-1");

    assertThat(tracker.publish(older, "older")).isFalse();
    assertThat(tracker.latest("user-1")).isEmpty();
  }

  @Test
  void keysAreIndependent() {
    LatestCallTracker.Ticket<String> a = tracker.begin("user-1");
    LatestCallTracker.Ticket<String> b = tracker.begin("user-2");

    assertThat(tracker.publish(a, "a")).isTrue();
    assertThat(tracker.publish(b, "b")).isTrue();

    assertThat(tracker.latest("user-1")).contains("a");
    assertThat(tracker.latest("user-2")).contains("b");
    assertThat(tracker.latest("user-3")).isEmpty();
  }

  @Test
  void sequentialCallsEachReplaceTheLatest() {
    tracker.publish(tracker.begin("user-1"), "first");
    tracker.publish(tracker.begin("user-1"), "second");

    assertThat(tracker.latest("user-1")).contains("second");
  }

  @Test
  void callStartedBeforeSlotExpiredCannotOverwriteNewerResult() {
    AtomicLong nanos = new AtomicLong();
    LatestCallTracker<String, String> expiring =
        new LatestCallTracker<>(Duration.ofMillis(50), nanos::get);

    LatestCallTracker.Ticket<String> older = expiring.begin("user-1");
    nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(200));
    LatestCallTracker.Ticket<String> newer = expiring.begin("user-1");

    assertThat(newer.generation()).isNotEqualTo(older.generation());
    assertThat(expiring.publish(newer, "newer")).isTrue();
    assertThat(expiring.publish(older, "older")).isFalse();
    assertThat(expiring.latest("user-1")).contains("newer");
  }
}
