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

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import java.util.Optional;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.opentelemetry.TraceContextPayload;
import org.tracedws.opentelemetry.TracingService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Publishes one reading whose payload is the trace context of the span that produced it.
 */
@Command(name = "sensor", description = "Put the trace context of a new span as the value of a resource.")
public class SensorCommand extends SessionArguments {

    static final String SERVICE_NAME = "sensor";
    static final String SPAN_NAME = "Put data";

    @Option(names = { "-p", "--path" }, description = "The name of the resource to put")
    public String path = "/demo/example/java-put";

    @Option(names = { "-v", "--value" },
            description = "The value of the resource to put, used only when no trace context is available")
    public String value = "Put from Java!";

    private Path parsedPath;

    public SensorCommand() {
        super("sensor");
    }

    @Override
    public void validate() throws Exception {
        super.validate();
        try {
            parsedPath = Path.of(path);
        } catch (WorkspaceException e) {
            throw new ParameterException(e.getMessage(), e);
        }
    }

    @Override
    public void run() throws Exception {
        TracingService tracing = createTracingService(SERVICE_NAME);
        Tracer tracer = tracing.getTracer(ExampleConstants.TRACER_SCOPE);
        Span span = tracer.spanBuilder(SPAN_NAME).startSpan();
        Session session = null;
        try (Scope ignored = span.makeCurrent()) {
            Optional<String> traceparent = TraceContextPayload.traceparent(Context.current());
            session = openSession();
            publish(openWorkspace(session, tracer), traceparent);
        } finally {
            ExampleClientUtils.closeSession(session);
            span.end();
            tracing.close();
        }
    }

    /**
     * @return the payload that was put
     */
    String publish(Workspace workspace, Optional<String> traceparent) throws WorkspaceException {
        String payload = traceparent.orElse(value);
        out.printf("Put Data ('%s': '%s')...%n%n", parsedPath, payload);
        workspace.put(parsedPath, Value.ofString(payload));
        return payload;
    }
}
