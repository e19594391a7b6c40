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
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.tracedws.client.api.Change;
import org.tracedws.client.api.ChangeStream;
import org.tracedws.client.api.Data;
import org.tracedws.client.api.Encoding;
import org.tracedws.client.api.GetRequest;
import org.tracedws.client.api.GetRequestStream;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.client.api.WorkspaceException.AlreadyClosedException;
import org.tracedws.client.api.WorkspaceException.InvalidSelectorException;
import org.tracedws.opentelemetry.TraceContextPayload;
import org.tracedws.opentelemetry.TracingService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Answers the gets on a path with a greeting.
 *
 * <p>The eval first waits for a value to be put on its path and uses it as the trace context of all the
 * requests it answers. The name in the greeting comes from the {@code name} property of the request
 * selector, for example:
 * <ul>
 *   <li>{@code /demo/example/eval}: the default name is used</li>
 *   <li>{@code /demo/example/eval?(name=Bob)}: {@code Bob} is used</li>
 *   <li>{@code /demo/example/eval?(name=/demo/example/name)}: the eval gets {@code /demo/example/name}
 *   and uses the first result</li>
 * </ul>
 */
@Command(name = "eval", description = "Register an eval answering the gets on a path.")
public class EvalCommand extends SessionArguments {

    static final String SERVICE_NAME = "t_eval";
    static final String SPAN_NAME = "Request time";
    static final String NAME_PROPERTY = "name";
    static final String DEFAULT_NAME = "Java!";

    @Option(names = { "-p", "--path" }, description = "The path the eval will respond for")
    public String path = ExampleConstants.EVAL_PATH;

    long processingMillis = 1000;

    private Path parsedPath;

    public EvalCommand() {
        super("eval");
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
        AtomicReference<Session> session = new AtomicReference<>();
        AtomicReference<ChangeStream> changes = new AtomicReference<>();
        AtomicReference<GetRequestStream> requests = new AtomicReference<>();
        Thread shutdownHook = ExampleClientUtils.addShutdownHook(() -> {
            ExampleClientUtils.closeQuietly(changes.get(), "subscription");
            ExampleClientUtils.closeQuietly(requests.get(), "eval");
            ExampleClientUtils.closeSession(session.get());
            tracing.close();
        });
        try {
            Tracer tracer = tracing.getTracer(ExampleConstants.TRACER_SCOPE);
            session.set(openSession());
            Workspace workspace = openWorkspace(session.get(), tracer);

            requests.set(workspace.registerEval(parsedPath.toPathExpr()));
            out.printf("Subscribe to '%s'...%n%n", parsedPath);
            changes.set(workspace.subscribe(Selector.of(parsedPath)));
            new ConsoleQuitWatcher(in, () -> {
                changes.get().closeAsync();
                requests.get().closeAsync();
            }).start();

            Change change;
            try {
                change = changes.get().receive();
            } catch (AlreadyClosedException e) {
                return;
            }
            out.printf(">> [Subscription listener] received %s for %s : %s with timestamp %s%n",
                    change.getKind(), change.getPath(), change.getValue(), change.getTimestamp());
            String traceparent = traceparentOf(change.getValue());
            // only the first change is used
            ExampleClientUtils.closeQuietly(changes.get(), "subscription");

            out.printf("Register eval for '%s'...%n%n", parsedPath);
            while (true) {
                GetRequest request;
                try {
                    request = requests.get().receive();
                } catch (AlreadyClosedException e) {
                    break;
                }
                handleRequest(request, workspace, tracer, traceparent);
            }
        } finally {
            ExampleClientUtils.removeAndRunShutdownHook(shutdownHook);
        }
    }

    static String traceparentOf(Value value) {
        return value != null && value.getEncoding() == Encoding.STRING ? value.asString() : null;
    }

    void handleRequest(GetRequest request, Workspace workspace, Tracer tracer, String traceparent)
            throws WorkspaceException, InterruptedException {
        Context parent = TraceContextPayload.extract(traceparent);
        Span span = tracer.spanBuilder(SPAN_NAME).setParent(parent).startSpan();
        try (Scope ignored = span.makeCurrent(); request) {
            simulateWork(processingMillis);
            out.println(">> [Eval listener] received get with selector: " + request.getSelector());

            String name = resolveName(request.getSelector(), workspace);
            String greeting = "Eval from " + name;
            out.println("   >> Returning string: \"" + greeting + "\"");
            request.reply(parsedPath, Value.ofString(greeting));
        } finally {
            span.end();
        }
    }

    /**
     * @return the {@code name} property of the selector, or the first string stored at that name if it is a
     *         path, or {@link #DEFAULT_NAME}
     */
    String resolveName(Selector selector, Workspace workspace) throws WorkspaceException {
        String name = selector.getProperties().getOrDefault(NAME_PROPERTY, DEFAULT_NAME);
        if (!name.startsWith("/")) {
            return name;
        }
        out.println("   >> Get name to use from path: " + name);
        Selector nameSelector;
        try {
            nameSelector = Selector.of(name);
        } catch (InvalidSelectorException e) {
            out.printf("Failed to get value from '%s' : this is not a valid Selector%n", name);
            return name;
        }
        List<Data> data = workspace.get(nameSelector);
        if (data.isEmpty()) {
            out.printf("Failed to get name from '%s' : not found%n", name);
        } else if (data.get(0).getValue().getEncoding() != Encoding.STRING) {
            out.printf("Failed to get name from '%s' : not a UTF-8 String%n", name);
        } else {
            name = data.get(0).getValue().asString();
        }
        return name;
    }

    void setParsedPath(Path parsedPath) {
        this.parsedPath = parsedPath;
    }
}
