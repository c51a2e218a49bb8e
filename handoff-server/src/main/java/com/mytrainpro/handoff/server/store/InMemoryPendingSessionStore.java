package com.mytrainpro.handoff.server.store;

import com.mytrainpro.handoff.model.LogMasks;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link PendingSessionStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * Per-handle atomicity comes from {@link ConcurrentHashMap#computeIfPresent}, which runs the
 * remapping function exactly once per key at a time. Per-device supersede runs inside
 * {@link ConcurrentHashMap#compute} on the device index, so two concurrent logins for one device
 * leave exactly one live record. The record cap is a hard limit: slots are reserved atomically
 * before insertion.
 * <p>
 * All records are lost on server restart. Suitable for development, tests and single-node
 * deployments where a lost pending session only means the user signs in again.
 */
public class InMemoryPendingSessionStore implements PendingSessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPendingSessionStore.class);
  private static final int HANDLE_BYTES = 32;
  private static final Base64.Encoder HANDLE_ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final ConcurrentHashMap<String, PendingSession> byHandle = new ConcurrentHashMap<>();
  // deviceId -> handle of the newest record created for that device
  private final ConcurrentHashMap<String, String> latestHandleByDevice = new ConcurrentHashMap<>();
  // slots reserved against maxRecords; taken before insert, released on purge
  private final AtomicInteger reserved = new AtomicInteger();

  private final Clock clock;
  private final Duration ttl;
  private final int maxRecords;
  private final SecureRandom random;

  /**
   * Creates a store.
   *
   * @param clock      time source for TTL decisions
   * @param ttl        lifetime of a new record
   * @param maxRecords cap on retained records, live or not
   * @param random     source for session handles
   */
  public InMemoryPendingSessionStore(Clock clock, Duration ttl, int maxRecords, SecureRandom random) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    this.clock = clock;
    this.ttl = ttl;
    this.maxRecords = maxRecords;
    this.random = random;
  }

  /**
   * Creates a store using the system clock and a fresh {@link SecureRandom}.
   *
   * @param ttl        lifetime of a new record
   * @param maxRecords cap on retained records
   */
  public InMemoryPendingSessionStore(Duration ttl, int maxRecords) {
    this(Clock.systemUTC(), ttl, maxRecords, new SecureRandom());
  }

  @Override
  public PendingSession create(String deviceId, String userId) {
    reserveSlot();
    Instant now = clock.instant();
    PendingSession created = new PendingSession(deviceId, newHandle(), userId, now, now.plus(ttl), null);
    latestHandleByDevice.compute(deviceId, (device, previousHandle) -> {
      if (previousHandle != null) {
        byHandle.computeIfPresent(previousHandle, (handle, previous) -> {
          if (previous.isLive(now)) {
            log.debug("Superseding pending session handle={} for device", LogMasks.mask(handle));
            return previous.withExpiresAt(now);
          }
          return previous;
        });
      }
      byHandle.put(created.sessionHandle(), created);
      return created.sessionHandle();
    });
    log.debug("Created pending session handle={} expiresAt={}",
        LogMasks.mask(created.sessionHandle()), created.expiresAt());
    return created;
  }

  @Override
  public Optional<PendingSession> lookup(String deviceId) {
    String handle = latestHandleByDevice.get(deviceId);
    if (handle == null) {
      return Optional.empty();
    }
    PendingSession record = byHandle.get(handle);
    if (record == null || !record.isLive(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(record);
  }

  @Override
  public ConsumeResult consume(String sessionHandle) {
    Instant now = clock.instant();
    AtomicReference<ConsumeResult> result = new AtomicReference<>(ConsumeResult.notFound());
    byHandle.computeIfPresent(sessionHandle, (handle, record) -> {
      if (record.isConsumed()) {
        result.set(ConsumeResult.alreadyConsumed(record));
        return record;
      }
      if (record.isExpired(now)) {
        result.set(ConsumeResult.expired(record));
        return record;
      }
      PendingSession consumed = record.withConsumedAt(now);
      result.set(ConsumeResult.consumed(consumed));
      return consumed;
    });
    return result.get();
  }

  @Override
  public int purgeExpired(Instant cutoff) {
    int removed = 0;
    for (Map.Entry<String, PendingSession> entry : byHandle.entrySet()) {
      if (entry.getValue().expiresAt().isBefore(cutoff)
          && byHandle.remove(entry.getKey(), entry.getValue())) {
        reserved.decrementAndGet();
        removed++;
      }
    }
    latestHandleByDevice.entrySet().removeIf(e -> !byHandle.containsKey(e.getValue()));
    if (removed > 0) {
      log.debug("Purged {} pending session(s)", removed);
    }
    return removed;
  }

  @Override
  public int size() {
    return byHandle.size();
  }

  private void reserveSlot() {
    int current;
    do {
      current = reserved.get();
      if (current >= maxRecords) {
        throw new IllegalStateException("Too many pending sessions");
      }
    } while (!reserved.compareAndSet(current, current + 1));
  }

  private String newHandle() {
    byte[] bytes = new byte[HANDLE_BYTES];
    random.nextBytes(bytes);
    return HANDLE_ENCODER.encodeToString(bytes);
  }
}
