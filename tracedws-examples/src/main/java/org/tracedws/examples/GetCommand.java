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

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import java.util.List;
import java.util.Optional;
import org.tracedws.client.api.Data;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.opentelemetry.TraceContextPayload;
import org.tracedws.opentelemetry.TracingService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Hands the trace context of a root span to the eval, then gets the selected resources within that span.
 */
@Command(name = "get", description = "Get the selected resources within a traced root span.")
public class GetCommand extends SessionArguments {

    static final String SERVICE_NAME = "t_get";
    static final String SPAN_NAME = "Root";
    static final String DATA_EVENT = "Get the return data";

    @Option(names = { "-s", "--selector" }, description = "The selection of resources to get")
    public String selector = ExampleConstants.DEFAULT_SELECTOR;

    private Selector parsedSelector;

    public GetCommand() {
        super("get");
    }

    @Override
    public void validate() throws Exception {
        super.validate();
        try {
            parsedSelector = Selector.of(selector);
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
            query(openWorkspace(session, tracer), traceparent, span);
        } finally {
            ExampleClientUtils.closeSession(session);
            span.end();
            tracing.close();
        }
    }

    List<Data> query(Workspace workspace, Optional<String> traceparent, Span span) throws WorkspaceException {
        if (traceparent.isPresent()) {
            out.printf("Put Span Data ('%s')...%n%n", traceparent.get());
            workspace.put(Path.of(ExampleConstants.EVAL_PATH), Value.ofString(traceparent.get()));
        }

        out.printf("Get Data from '%s'...%n%n", parsedSelector);
        List<Data> results = workspace.get(parsedSelector);
        for (Data data : results) {
            out.println(formatData(data));
            span.addEvent(DATA_EVENT, Attributes.of(ExampleConstants.DATA, data.getValue().toString()));
        }
        return results;
    }

    static String formatData(Data data) {
        return String.format("  %s : %s (encoding: %s , timestamp: %s)",
                data.getPath(), data.getValue(), data.getValue().encodingDescr(), data.getTimestamp());
    }
}
