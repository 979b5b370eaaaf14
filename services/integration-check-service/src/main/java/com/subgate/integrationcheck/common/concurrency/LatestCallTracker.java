package com.subgate.integrationcheck.common.concurrency;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the result of the newest call per key. Every call takes a ticket before it starts; a
 * result is only kept if no newer ticket was issued for the same key in the meantime, so a slow
 * response that arrives after a newer request has started is dropped.
 *
 * <p>Generations come from one sequence shared by all keys, so a ticket issued before its slot
 * expired can never match the slot that replaced it.
 */
@Slf4j
public final class LatestCallTracker<K, V> {

  private final Cache<K, Slot<V>> slots;
  private final AtomicLong sequence = new AtomicLong();

  public LatestCallTracker(Duration idleTtl) {
    this(idleTtl, Ticker.systemTicker());
  }

  LatestCallTracker(Duration idleTtl, Ticker ticker) {
    this.slots =
        Caffeine.newBuilder()
            .expireAfterAccess(idleTtl)
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
  }

  public Ticket<K> begin(K key) {
    Slot<V> slot = slots.get(key, k -> new Slot<>());
    synchronized (slot) {
      slot.generation = sequence.incrementAndGet();
      return new Ticket<>(key, slot.generation);
    }
  }

  /** Returns {@code false} when the ticket has been superseded and the value was discarded. */
  public boolean publish(Ticket<K> ticket, V value) {
    Slot<V> slot = slots.getIfPresent(ticket.key());
    if (slot == null) {
      log.debug("Dropping result for expired key {}", ticket.key());
      return false;
    }
    synchronized (slot) {
      if (slot.generation != ticket.generation()) {
        log.debug(
            "Dropping stale result for key {} (generation {}, current {})",
            ticket.key(),
            ticket.generation(),
            slot.generation);
        return false;
      }
      slot.latest = value;
      return true;
    }
  }

  public Optional<V> latest(K key) {
    Slot<V> slot = slots.getIfPresent(key);
    if (slot == null) {
      return Optional.empty();
    }
    synchronized (slot) {
      return Optional.ofNullable(slot.latest);
    }
  }

  public record Ticket<K>(K key, long generation) {}

  private static final class Slot<V> {
    private long generation;
    private V latest;
  }
}
