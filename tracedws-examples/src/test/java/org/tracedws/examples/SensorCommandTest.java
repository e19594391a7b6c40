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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertEquals;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.io.ByteArrayOutputStream;
import java.util.Optional;
import org.mockito.ArgumentCaptor;
import org.testng.annotations.Test;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.SessionBuilder;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.Workspace;
import org.tracedws.opentelemetry.TracingService;
import picocli.CommandLine;

public class SensorCommandTest {

    private static final String TRACEPARENT = "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01";

    @Test
    public void testPublishTraceparent() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        SensorCommand cmd = new SensorCommand();
        cmd.setOut(InMemoryTracing.printStream(bytes));
        cmd.parse(new String[] {"-p", "/demo/sensor"});
        cmd.validate();
        Workspace workspace = mock(Workspace.class);

        assertEquals(cmd.publish(workspace, Optional.of(TRACEPARENT)), TRACEPARENT);
        verify(workspace).put(Path.of("/demo/sensor"), Value.ofString(TRACEPARENT));
        assertThat(InMemoryTracing.output(bytes))
                .isEqualTo(String.format("Put Data ('/demo/sensor': '%s')...%n%n", TRACEPARENT));
    }

    @Test
    public void testPublishDefaultValueWithoutTraceContext() throws Exception {
        SensorCommand cmd = new SensorCommand();
        cmd.setOut(InMemoryTracing.printStream(new ByteArrayOutputStream()));
        cmd.parse(new String[0]);
        cmd.validate();
        Workspace workspace = mock(Workspace.class);

        cmd.publish(workspace, Optional.empty());
        verify(workspace).put(Path.of("/demo/example/java-put"), Value.ofString("Put from Java!"));
    }

    @Test(expectedExceptions = CommandLine.ParameterException.class)
    public void testInvalidPath() throws Exception {
        SensorCommand cmd = new SensorCommand();
        cmd.parse(new String[] {"--path", "relative/path"});
        cmd.validate();
    }

    @Test
    public void testRunPutsTheTraceContextOfItsSpan() throws Exception {
        Session session = mock(Session.class);
        Workspace workspace = mock(Workspace.class);
        SessionBuilder builder = InMemoryTracing.mockSessionBuilder(session, workspace);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        try (InMemoryTracing tracing = new InMemoryTracing(SensorCommand.SERVICE_NAME)) {
            SensorCommand cmd = new SensorCommand() {
                @Override
                protected SessionBuilder newSessionBuilder() {
                    return builder;
                }

                @Override
                protected TracingService createTracingService(String serviceName) {
                    return tracing.getService();
                }
            };
            cmd.setOut(InMemoryTracing.printStream(bytes));
            assertEquals(cmd.getCommander().execute("-m", "client", "-e", "tcp/localhost:6650"), 0);

            ArgumentCaptor<Value> value = ArgumentCaptor.forClass(Value.class);
            verify(workspace).put(eq(Path.of("/demo/example/java-put")), value.capture());
            verify(session).close();

            SpanData root = tracing.findSpan(SensorCommand.SPAN_NAME).orElseThrow();
            SpanData put = tracing.findSpan("put /demo/example/java-put").orElseThrow();
            assertEquals(put.getKind(), SpanKind.PRODUCER);
            assertEquals(put.getParentSpanId(), root.getSpanId());
            assertEquals(value.getValue().asString(),
                    "00-" + root.getTraceId() + "-" + root.getSpanId() + "-01");
            assertThat(InMemoryTracing.output(bytes))
                    .startsWith("New session...")
                    .contains("New workspace...")
                    .contains("Put Data ('/demo/example/java-put': '00-" + root.getTraceId());
        }
        verify(builder).loadConf(any());
    }
}
