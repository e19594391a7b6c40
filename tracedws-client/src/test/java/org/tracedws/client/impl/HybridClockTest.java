/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.tracedws.client.impl;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import org.testng.annotations.Test;
import org.tracedws.client.api.Timestamp;

public class HybridClockTest {

    @Test
    public void testStrictlyIncreasingOnFrozenClock() {
        HybridClock clock = new HybridClock(Clock.fixed(Instant.ofEpochSecond(100), ZoneOffset.UTC), "s1");
        Timestamp first = clock.now();
        Timestamp second = clock.now();
        assertEquals(first.getTimeNanos(), 100_000_000_000L);
        assertEquals(second.getTimeNanos(), 100_000_000_001L);
        assertEquals(second.getSourceId(), "s1");
    }

    @Test
    public void testNeverGoesBackwards() {
        MutableClock wall = new MutableClock(Instant.ofEpochSecond(200));
        HybridClock clock = new HybridClock(wall, "s1");
        Timestamp before = clock.now();
        wall.instant = Instant.ofEpochSecond(150);
        Timestamp after = clock.now();
        assertTrue(after.compareTo(before) > 0);
    }

    @Test
    public void testObserveRemote() {
        HybridClock clock = new HybridClock(Clock.fixed(Instant.ofEpochSecond(100), ZoneOffset.UTC), "s1");
        clock.observe(new Timestamp(500_000_000_000L, "s2"));
        assertEquals(clock.now().getTimeNanos(), 500_000_000_001L);
        // an older remote timestamp does not move the clock back
        clock.observe(new Timestamp(1L, "s3"));
        assertEquals(clock.now().getTimeNanos(), 500_000_000_002L);
    }

    @Test
    public void testMonotonicAcrossThreads() throws Exception {
        HybridClock clock = new HybridClock("s1");
        long[][] results = new long[4][1000];
        Thread[] threads = new Thread[results.length];
        for (int t = 0; t < threads.length; t++) {
            long[] mine = results[t];
            threads[t] = new Thread(() -> {
                for (int i = 0; i < mine.length; i++) {
                    mine[i] = clock.now().getTimeNanos();
                }
            });
            threads[t].start();
        }
        Set<Long> all = new HashSet<>();
        for (int t = 0; t < threads.length; t++) {
            threads[t].join();
            for (int i = 0; i < results[t].length; i++) {
                if (i > 0) {
                    assertTrue(results[t][i] > results[t][i - 1]);
                }
                all.add(results[t][i]);
            }
        }
        assertEquals(all.size(), 4000);
    }

    private static class MutableClock extends Clock {
        private volatile Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
