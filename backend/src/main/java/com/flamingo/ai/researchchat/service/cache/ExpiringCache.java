package com.flamingo.ai.researchchat.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Keyed store where every entry carries its own time-to-live.
 *
 * <p>Backed by Caffeine; the {@link Ticker} is injectable so tests can advance time
 * deterministically.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ExpiringCache<K, V> {

  private final Cache<K, Entry<V>> cache;

  public ExpiringCache(long maximumSize, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .executor(Runnable::run)
            .expireAfter(new PerEntryExpiry<K, V>())
            .build();
  }

  public static <K, V> ExpiringCache<K, V> create(long maximumSize) {
    return new ExpiringCache<>(maximumSize, Ticker.systemTicker());
  }

  public Optional<V> get(K key) {
    Entry<V> entry = cache.getIfPresent(key);
    return entry != null ? Optional.of(entry.value()) : Optional.empty();
  }

  public void put(K key, V value, Duration ttl) {
    cache.put(key, new Entry<>(value, ttl.toNanos()));
  }

  public void invalidate(K key) {
    cache.invalidate(key);
  }

  /** Removes every entry whose key matches {@code predicate}. Returns the number removed. */
  public int invalidateIf(Predicate<K> predicate) {
    int before = cache.asMap().size();
    cache.asMap().keySet().removeIf(predicate);
    return before - cache.asMap().size();
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private record Entry<V>(V value, long ttlNanos) {}

  private static final class PerEntryExpiry<K, V> implements Expiry<K, Entry<V>> {

    @Override
    public long expireAfterCreate(K key, Entry<V> entry, long currentTime) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterUpdate(
        K key, Entry<V> entry, long currentTime, long currentDuration) {
      return entry.ttlNanos();
    }

    @Override
    public long expireAfterRead(
        K key, Entry<V> entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
