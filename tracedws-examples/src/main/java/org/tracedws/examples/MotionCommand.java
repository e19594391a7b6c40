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
import org.tracedws.client.api.Encoding;
import org.tracedws.client.api.Value;
import org.tracedws.opentelemetry.TraceContextPayload;
import picocli.CommandLine.Command;

/**
 * Reacts to sensor readings: every string value is taken as the trace context of the reading, and the
 * motion computed from it is recorded as a child span.
 */
@Command(name = "motion", description = "Subscribe to sensor data and trace the motion computed from it.")
public class MotionCommand extends AbstractSubscriberCommand {

    static final String SERVICE_NAME = "motion";
    static final String SPAN_NAME = "Get computing output and start motion";

    long processingMillis = 100;

    public MotionCommand() {
        super("motion");
    }

    @Override
    protected String getServiceName() {
        return SERVICE_NAME;
    }

    @Override
    protected void handleChange(Change change, Tracer tracer) throws InterruptedException {
        Context parent = Context.root();
        Value value = change.getValue();
        if (value != null && value.getEncoding() == Encoding.STRING) {
            out.printf(RECEIVED_FORMAT, change.getKind(), change.getPath(), value.asString(), change.getTimestamp());
            parent = TraceContextPayload.extract(value.asString());
        }
        out.println(Span.fromContext(parent).getSpanContext());

        Span span = tracer.spanBuilder(SPAN_NAME).setParent(parent).startSpan();
        try {
            simulateWork(processingMillis);
        } finally {
            span.end();
        }
    }
}
