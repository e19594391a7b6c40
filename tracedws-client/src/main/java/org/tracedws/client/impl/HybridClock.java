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

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.tracedws.client.api.Timestamp;

/**
 * Issues strictly increasing {@link Timestamp timestamps} for one session, even if the wall clock
 * goes backwards or two changes happen within the same nanosecond.
 */
class HybridClock {

    private final Clock clock;
    private final String sourceId;
    private final AtomicLong last = new AtomicLong();

    HybridClock(String sourceId) {
        this(Clock.systemUTC(), sourceId);
    }

    HybridClock(Clock clock, String sourceId) {
        this.clock = clock;
        this.sourceId = sourceId;
    }

    Timestamp now() {
        Instant instant = clock.instant();
        long wall = instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
        long time = last.updateAndGet(prev -> Math.max(wall, prev + 1));
        return new Timestamp(time, sourceId);
    }

    /**
     * Moves the clock past a timestamp observed from another source.
     */
    void observe(Timestamp remote) {
        last.accumulateAndGet(remote.getTimeNanos(), Math::max);
    }
}
