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
package org.tracedws.client.api;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Time of a change, as issued by the hybrid logical clock of the session that produced it.
 * Ties between sessions are broken by the source id so that timestamps are totally ordered.
 */
public final class Timestamp implements Comparable<Timestamp> {

    private static final Comparator<Timestamp> ORDER = Comparator
            .comparingLong(Timestamp::getTimeNanos)
            .thenComparing(Timestamp::getSourceId);

    private final long timeNanos;
    private final String sourceId;

    public Timestamp(long timeNanos, String sourceId) {
        this.timeNanos = timeNanos;
        this.sourceId = Objects.requireNonNull(sourceId);
    }

    /**
     * Nanoseconds since the epoch.
     */
    public long getTimeNanos() {
        return timeNanos;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(0, timeNanos);
    }

    @Override
    public int compareTo(Timestamp other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Timestamp)) {
            return false;
        }
        Timestamp other = (Timestamp) o;
        return timeNanos == other.timeNanos && sourceId.equals(other.sourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeNanos, sourceId);
    }

    @Override
    public String toString() {
        return toInstant() + "/" + sourceId;
    }
}
