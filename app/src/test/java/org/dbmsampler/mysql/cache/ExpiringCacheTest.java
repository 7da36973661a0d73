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

import com.google.common.testing.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExpiringCacheTest {

    private FakeTicker ticker;
    private ExpiringCache<String, String> cache;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        cache = new ExpiringCache<>("test", 3, Duration.ofSeconds(10), ticker);
    }

    @Test
    void testGet_WithinTtl_ReturnsValue() {
        cache.put("a", "1");
        ticker.advance(9, TimeUnit.SECONDS);

        assertEquals("1", cache.get("a"));
        assertTrue(cache.containsKey("a"));
    }

    @Test
    void testGet_Expired_ReturnsNullAndRemovesEntry() {
        cache.put("a", "1");
        ticker.advance(10, TimeUnit.SECONDS);

        assertEquals(1, cache.size(), "Expiry is lazy");
        assertNull(cache.get("a"));
        assertEquals(0, cache.size());
    }

    @Test
    void testPut_AtCapacity_EvictsOldestInserted() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");

        // Reading does not refresh insertion order
        cache.get("a");
        cache.put("d", "4");

        assertNull(cache.get("a"));
        assertEquals("2", cache.get("b"));
        assertEquals("4", cache.get("d"));
        assertEquals(3, cache.size());
    }

    @Test
    void testPut_AtCapacity_PurgesExpiredBeforeEvicting() {
        cache.put("a", "1");
        ticker.advance(6, TimeUnit.SECONDS);
        cache.put("b", "2");
        cache.put("c", "3");
        ticker.advance(5, TimeUnit.SECONDS);

        cache.put("d", "4");

        // Only "a" had expired, so nothing live was evicted
        assertEquals("2", cache.get("b"));
        assertEquals("3", cache.get("c"));
        assertEquals("4", cache.get("d"));
    }

    @Test
    void testPut_ExistingKey_RefreshesTtl() {
        cache.put("a", "1");
        ticker.advance(8, TimeUnit.SECONDS);
        cache.put("a", "2");
        ticker.advance(8, TimeUnit.SECONDS);

        assertEquals("2", cache.get("a"));
    }

    @Test
    void testRemove_DropsEntry() {
        cache.put("a", "1");

        cache.remove("a");

        assertNull(cache.get("a"));
    }

    @Test
    void testPut_NullValue_ThrowsException() {
        assertThrows(NullPointerException.class, () -> cache.put("a", null));
    }

    @Test
    void testConstructor_InvalidArguments_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExpiringCache<String, String>("bad", 0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new ExpiringCache<String, String>("bad", 1, Duration.ZERO));
    }

    @Test
    void testTtlFromHourlyRate() {
        assertEquals(Duration.ofMinutes(1), ExpiringCache.ttlFromHourlyRate(60));
        assertEquals(Duration.ofMinutes(4), ExpiringCache.ttlFromHourlyRate(15));
        assertThrows(IllegalArgumentException.class, () -> ExpiringCache.ttlFromHourlyRate(0));
        assertThrows(IllegalArgumentException.class, () -> ExpiringCache.ttlFromHourlyRate(-1));
    }
}
