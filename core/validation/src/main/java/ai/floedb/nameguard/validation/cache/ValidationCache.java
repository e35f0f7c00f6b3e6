/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.nameguard.validation.cache;

import ai.floedb.nameguard.validation.model.ValidationResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cache-aside store for validation results, keyed by resource type then resource name under the
 * {@value #KEY_PREFIX} namespace. Each entry carries its own TTL; expired entries simply miss.
 */
public class ValidationCache {
  public static final String KEY_PREFIX = "name-validation:";

  private final Cache<String, CacheEntry> cache;
  private final Clock clock;

  public ValidationCache(long maxEntries) {
    this(maxEntries, Ticker.systemTicker(), Clock.systemUTC());
  }

  ValidationCache(long maxEntries, Ticker ticker, Clock clock) {
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .expireAfter(new EntryExpiry())
            .ticker(ticker)
            .build();
  }

  /**
   * Builds the cache key. The type is length-prefixed so that no (type, name) pair can collide
   * with another even when either part contains the separator.
   */
  public static String key(String resourceType, String resourceName) {
    return KEY_PREFIX + resourceType.length() + ":" + resourceType + ":" + resourceName;
  }

  public Optional<ValidationResult> get(String resourceType, String resourceName) {
    CacheEntry entry = cache.getIfPresent(key(resourceType, resourceName));
    return entry == null ? Optional.empty() : Optional.of(entry.value());
  }

  public void set(
      String resourceType, String resourceName, ValidationResult result, int ttlMinutes) {
    if (result == null || ttlMinutes <= 0) {
      return;
    }
    String key = key(resourceType, resourceName);
    Duration ttl = Duration.ofMinutes(ttlMinutes);
    cache.put(key, new CacheEntry(key, result, Instant.now(clock).plus(ttl), ttl));
  }

  /**
   * Removes every entry whose key starts with {@code prefix}. A trailing {@code *} is accepted
   * and ignored.
   *
   * @return number of entries removed
   */
  public int invalidateAll(String prefix) {
    String match = prefix.endsWith("*") ? prefix.substring(0, prefix.length() - 1) : prefix;
    int[] removed = {0};
    cache
        .asMap()
        .keySet()
        .removeIf(
            key -> {
              boolean hit = key.startsWith(match);
              if (hit) {
                removed[0]++;
              }
              return hit;
            });
    return removed[0];
  }

  public long estimatedSize() {
    return cache.estimatedSize();
  }

  private static final class EntryExpiry implements Expiry<String, CacheEntry> {
    @Override
    public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, CacheEntry value, long currentTime, long currentDuration) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(
        String key, CacheEntry value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
