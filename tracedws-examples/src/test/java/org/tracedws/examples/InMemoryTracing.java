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
package org.tracedws.examples;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.SessionBuilder;
import org.tracedws.client.api.Workspace;
import org.tracedws.opentelemetry.TracingService;

/**
 * Test support: a tracing service exporting spans in memory, and mocks standing in for the session
 * opened by a command.
 */
class InMemoryTracing implements AutoCloseable {

    private final InMemorySpanExporter exporter = InMemorySpanExporter.create();
    private final KeptOpenTracingService service;

    InMemoryTracing(String serviceName) {
        service = new KeptOpenTracingService(serviceName, exporter);
    }

    /**
     * The service handed to a command. Closing it only flushes, so that the spans can still be read once
     * the command is done.
     */
    TracingService getService() {
        return service;
    }

    List<SpanData> getSpans() {
        return exporter.getFinishedSpanItems();
    }

    Optional<SpanData> findSpan(String name) {
        return getSpans().stream().filter(span -> span.getName().equals(name)).findFirst();
    }

    @Override
    public void close() {
        service.closeForReal();
    }

    static PrintStream printStream(ByteArrayOutputStream bytes) {
        return new PrintStream(bytes, true, StandardCharsets.UTF_8);
    }

    static String output(ByteArrayOutputStream bytes) {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    /**
     * @return a session builder whose sessions hand out {@code workspace}
     */
    static SessionBuilder mockSessionBuilder(Session session, Workspace workspace) throws Exception {
        SessionBuilder builder = mock(SessionBuilder.class);
        when(builder.loadConf(any())).thenReturn(builder);
        when(builder.build()).thenReturn(session);
        when(session.getId()).thenReturn("test-session");
        when(session.workspace()).thenReturn(workspace);
        return builder;
    }

    private static class KeptOpenTracingService extends TracingService {

        KeptOpenTracingService(String serviceName, InMemorySpanExporter exporter) {
            super(serviceName, null, sdkBuilder -> {
                sdkBuilder.addTracerProviderCustomizer((tracerProviderBuilder, __) ->
                        tracerProviderBuilder.addSpanProcessor(SimpleSpanProcessor.create(exporter)));
                sdkBuilder.disableShutdownHook();
                sdkBuilder.addPropertiesSupplier(() -> Map.of(
                        "otel.metrics.exporter", "none",
                        "otel.traces.exporter", "none",
                        "otel.logs.exporter", "none"));
            });
        }

        @Override
        public void close() {
            forceFlush(1, TimeUnit.SECONDS);
        }

        void closeForReal() {
            super.close();
        }
    }
}
