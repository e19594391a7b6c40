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
import org.tracedws.client.api.Change;
import org.tracedws.opentelemetry.TraceContextPayload;
import org.tracedws.opentelemetry.TracingAttributes;
import picocli.CommandLine.Command;

@Command(name = "sub", description = "Subscribe to a selector and trace the processing of every change.")
public class SubscribeCommand extends AbstractSubscriberCommand {

    static final String SERVICE_NAME = "z_sub";
    static final String SPAN_NAME = "Get and process data";
    static final String START_EVENT = "Start process data";
    static final String FINISH_EVENT = "Finish process";

    long processingMillis = 50;

    public SubscribeCommand() {
        super("sub");
    }

    @Override
    protected String getServiceName() {
        return SERVICE_NAME;
    }

    @Override
    protected void handleChange(Change change, Tracer tracer) throws InterruptedException {
        // values that are not strings cannot carry a trace context
        String payload = TraceContextPayload.payloadOf(change.getValue());
        Context parent = TraceContextPayload.extract(payload);

        Span span = tracer.spanBuilder(SPAN_NAME)
                .setParent(parent)
                .setAttribute(TracingAttributes.MESSAGING_SYSTEM, TracingAttributes.MESSAGING_SYSTEM_VALUE)
                .setAttribute(TracingAttributes.MESSAGING_OPERATION, TracingAttributes.OPERATION_RECEIVE)
                .startSpan();
        try {
            span.addEvent(START_EVENT);
            simulateWork(processingMillis);
            span.addEvent(FINISH_EVENT);
        } finally {
            span.end();
        }
        out.printf(RECEIVED_FORMAT, change.getKind(), change.getPath(), payload, change.getTimestamp());
    }
}
