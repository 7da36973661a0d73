/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dbmsampler.mysql.cache;

import com.google.common.base.Ticker;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Bounded map with a per-entry time-to-live.
 *
 * <p>Entries expire lazily: an expired entry is removed when it is read, not by
 * a background sweep. When the cache is full, inserting a new key evicts the
 * least-recently-inserted entry. Re-inserting an existing key refreshes both
 * its value and its insertion time.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. Each instance is owned by a single
 * sampler and only touched from the collection context holding the cycle lock.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public class ExpiringCache<K, V> {

    private final String name;
    private final int maxSize;
    private final long ttlNanos;
    private final Ticker ticker;
    private final LinkedHashMap<K, Entry<V>> entries = new LinkedHashMap<>();

    public ExpiringCache(String name, int maxSize, Duration ttl) {
        this(name, maxSize, ttl, Ticker.systemTicker());
    }

    public ExpiringCache(String name, int maxSize, Duration ttl, Ticker ticker) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache '" + name + "' max size must be positive: " + maxSize);
        }
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache '" + name + "' TTL must be positive: " + ttl);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.ttlNanos = ttl.toNanos();
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    /**
     * Build a TTL from a "per hour per query" rate, e.g. 60 per hour gives one minute.
     *
     * @param perHour Allowed occurrences per hour (must be positive)
     * @return TTL that admits at most {@code perHour} entries per key per hour
     */
    public static Duration ttlFromHourlyRate(double perHour) {
        if (perHour <= 0) {
            throw new IllegalArgumentException("Hourly rate must be positive: " + perHour);
        }
        return Duration.ofNanos((long) (Duration.ofHours(1).toNanos() / perHour));
    }

    /**
     * @return the cached value, or null if absent or expired
     */
    public V get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, ticker.read())) {
            entries.remove(key);
            return null;
        }
        return entry.value();
    }

    public boolean containsKey(K key) {
        return get(key) != null;
    }

    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long now = ticker.read();
        // re-insertion moves the key to the newest position
        entries.remove(key);
        if (entries.size() >= maxSize) {
            purgeExpired(now);
        }
        while (entries.size() >= maxSize) {
            Iterator<K> oldest = entries.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        entries.put(key, new Entry<>(value, now));
    }

    public void remove(K key) {
        entries.remove(key);
    }

    /**
     * Number of stored entries. May include expired entries not yet read.
     */
    public int size() {
        return entries.size();
    }

    public String getName() {
        return name;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getTtl() {
        return Duration.ofNanos(ttlNanos);
    }

    private void purgeExpired(long now) {
        entries.entrySet().removeIf(e -> isExpired(e.getValue(), now));
    }

    private boolean isExpired(Entry<V> entry, long now) {
        return now - entry.insertedAtNanos() >= ttlNanos;
    }

    @Override
    public String toString() {
        return "ExpiringCache{name=" + name + ", size=" + entries.size() + "/" + maxSize
                + ", ttl=" + getTtl() + "}";
    }

    private record Entry<V>(V value, long insertedAtNanos) {
    }
}
