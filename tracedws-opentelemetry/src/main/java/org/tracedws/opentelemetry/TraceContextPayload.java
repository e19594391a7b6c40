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
package org.tracedws.opentelemetry;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.tracedws.client.api.Encoding;
import org.tracedws.client.api.Value;

/**
 * Carries a W3C trace context inside the payload of a workspace value. The payload is the bare
 * {@code traceparent} header.
 */
@UtilityClass
public class TraceContextPayload {

    public static final String TRACEPARENT = "traceparent";

    /**
     * What a receiver extracts from when the value is not a string.
     */
    public static final String NON_STRING_PAYLOAD = "other data type";

    private static final TextMapPropagator PROPAGATOR = W3CTraceContextPropagator.getInstance();

    private static final TextMapGetter<Map<String, String>> MAP_GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(Map<String, String> carrier) {
            return carrier.keySet();
        }

        @Override
        public String get(Map<String, String> carrier, String key) {
            return carrier == null ? null : carrier.get(key);
        }
    };

    /**
     * @return the propagation headers of {@code context}, empty if it has no valid span
     */
    public static Map<String, String> inject(Context context) {
        Map<String, String> carrier = new HashMap<>();
        PROPAGATOR.inject(context, carrier, Map::put);
        return carrier;
    }

    public static Optional<String> traceparent(Context context) {
        return Optional.ofNullable(inject(context).get(TRACEPARENT));
    }

    /**
     * @return a context whose parent is the remote span described by {@code traceparent}, or the root
     *         context if the header is missing or invalid
     */
    public static Context extract(String traceparent) {
        Map<String, String> carrier = new HashMap<>();
        if (traceparent != null) {
            carrier.put(TRACEPARENT, traceparent.trim());
        }
        return PROPAGATOR.extract(Context.root(), carrier, MAP_GETTER);
    }

    public static Context extract(Value value) {
        return extract(payloadOf(value));
    }

    /**
     * @return the string form of {@code value} if it is a string, {@link #NON_STRING_PAYLOAD} otherwise
     */
    public static String payloadOf(Value value) {
        return value != null && value.getEncoding() == Encoding.STRING ? value.asString() : NON_STRING_PAYLOAD;
    }

    public static boolean hasRemoteParent(Context context) {
        return Span.fromContext(context).getSpanContext().isValid();
    }
}
