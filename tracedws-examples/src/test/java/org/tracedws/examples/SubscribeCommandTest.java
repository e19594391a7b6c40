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

import static io.opentelemetry.sdk.testing.assertj.OpenTelemetryAssertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.stream.Collectors;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import org.tracedws.client.api.Change;
import org.tracedws.client.api.ChangeKind;
import org.tracedws.client.api.ChangeStream;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.SessionBuilder;
import org.tracedws.client.api.Timestamp;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException.AlreadyClosedException;
import org.tracedws.opentelemetry.TracingAttributes;
import org.tracedws.opentelemetry.TracingService;

public class SubscribeCommandTest {

    private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";
    private static final String SPAN_ID = "00f067aa0ba902b7";
    private static final String TRACEPARENT = "00-" + TRACE_ID + "-" + SPAN_ID + "-01";

    private InMemorySpanExporter exporter;
    private SdkTracerProvider tracerProvider;
    private Tracer tracer;
    private ByteArrayOutputStream bytes;
    private SubscribeCommand cmd;

    @BeforeMethod
    public void setup() {
        exporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(exporter)).build();
        tracer = tracerProvider.get(ExampleConstants.TRACER_SCOPE);
        bytes = new ByteArrayOutputStream();
        cmd = new SubscribeCommand();
        cmd.processingMillis = 0;
        cmd.setOut(InMemoryTracing.printStream(bytes));
    }

    @AfterMethod(alwaysRun = true)
    public void teardown() {
        tracerProvider.close();
    }

    private static Change change(String path, Value value) throws Exception {
        return new Change(Path.of(path), ChangeKind.PUT, value, new Timestamp(1_600_000_000_000_000_000L, "s1"));
    }

    @Test
    public void testSpanContinuesTheReceivedTrace() throws Exception {
        Change change = change("/demo/example/java-put", Value.ofString(TRACEPARENT));
        cmd.handleChange(change, tracer);

        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertThat(span)
                .hasName(SubscribeCommand.SPAN_NAME)
                .hasTraceId(TRACE_ID)
                .hasParentSpanId(SPAN_ID)
                .hasAttribute(TracingAttributes.MESSAGING_SYSTEM, "pulsar")
                .hasAttribute(TracingAttributes.MESSAGING_OPERATION, "receive");
        assertEquals(span.getEvents().stream().map(EventData::getName).collect(Collectors.toList()),
                List.of(SubscribeCommand.START_EVENT, SubscribeCommand.FINISH_EVENT));
        assertEquals(InMemoryTracing.output(bytes), String.format(
                ">> [Subscription listener] received PUT for /demo/example/java-put : \"%s\" with timestamp %s%n",
                TRACEPARENT, change.getTimestamp()));
    }

    @Test
    public void testNonStringValueStartsANewTrace() throws Exception {
        cmd.handleChange(change("/demo/example/number", Value.ofInteger(42)), tracer);

        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertFalse(span.getParentSpanContext().isValid());
        assertThat(InMemoryTracing.output(bytes)).contains(": \"other data type\" with timestamp");
    }

    @Test
    public void testRunUntilTheStreamIsClosed() throws Exception {
        Session session = mock(Session.class);
        Workspace workspace = mock(Workspace.class);
        ChangeStream changes = mock(ChangeStream.class);
        SessionBuilder builder = InMemoryTracing.mockSessionBuilder(session, workspace);
        when(workspace.subscribe(any(Selector.class))).thenReturn(changes);
        when(changes.receive())
                .thenReturn(change("/demo/example/a", Value.ofString(TRACEPARENT)))
                .thenThrow(new AlreadyClosedException("closed"));

        try (InMemoryTracing tracing = new InMemoryTracing(SubscribeCommand.SERVICE_NAME)) {
            SubscribeCommand command = new SubscribeCommand() {
                @Override
                protected SessionBuilder newSessionBuilder() {
                    return builder;
                }

                @Override
                protected TracingService createTracingService(String serviceName) {
                    return tracing.getService();
                }
            };
            command.processingMillis = 0;
            command.setOut(InMemoryTracing.printStream(bytes));
            command.setIn(new ByteArrayInputStream(new byte[0]));
            assertEquals(command.getCommander().execute("-s", "/demo/example/*"), 0);

            verify(workspace).subscribe(Selector.of("/demo/example/*"));
            verify(changes).close();
            verify(session).close();
            assertEquals(tracing.findSpan(SubscribeCommand.SPAN_NAME).orElseThrow().getTraceId(), TRACE_ID);
            assertThat(InMemoryTracing.output(bytes)).contains("Subscribe to '/demo/example/*'...");
        }
    }
}
