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

import io.opentelemetry.api.trace.Tracer;
import java.util.concurrent.atomic.AtomicReference;
import org.tracedws.client.api.Change;
import org.tracedws.client.api.ChangeStream;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.client.api.WorkspaceException.AlreadyClosedException;
import org.tracedws.opentelemetry.TracingService;
import picocli.CommandLine.Option;

/**
 * Subscribes to a selector and handles every change until the user types {@code 'q'}.
 */
public abstract class AbstractSubscriberCommand extends SessionArguments {

    static final String RECEIVED_FORMAT =
            ">> [Subscription listener] received %s for %s : \"%s\" with timestamp %s%n";

    @Option(names = { "-s", "--selector" }, description = "The selection of resources to subscribe")
    public String selector = ExampleConstants.DEFAULT_SELECTOR;

    private Selector parsedSelector;

    public AbstractSubscriberCommand(String cmdName) {
        super(cmdName);
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

    protected abstract String getServiceName();

    protected abstract void handleChange(Change change, Tracer tracer) throws InterruptedException;

    @Override
    public void run() throws Exception {
        TracingService tracing = createTracingService(getServiceName());
        AtomicReference<Session> session = new AtomicReference<>();
        AtomicReference<ChangeStream> stream = new AtomicReference<>();
        Thread shutdownHook = ExampleClientUtils.addShutdownHook(() -> {
            ExampleClientUtils.closeQuietly(stream.get(), "subscription");
            ExampleClientUtils.closeSession(session.get());
            tracing.close();
        });
        try {
            Tracer tracer = tracing.getTracer(ExampleConstants.TRACER_SCOPE);
            session.set(openSession());
            Workspace workspace = openWorkspace(session.get(), tracer);

            out.printf("Subscribe to '%s'...%n%n", parsedSelector);
            ChangeStream changes = workspace.subscribe(parsedSelector);
            stream.set(changes);
            new ConsoleQuitWatcher(in, changes::closeAsync).start();

            while (true) {
                Change change;
                try {
                    change = changes.receive();
                } catch (AlreadyClosedException e) {
                    break;
                }
                handleChange(change, tracer);
            }
        } finally {
            ExampleClientUtils.removeAndRunShutdownHook(shutdownHook);
        }
    }
}
