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
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.tracedws.client.api.ChangeStream;
import org.tracedws.client.api.Data;
import org.tracedws.client.api.GetRequestStream;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.PathExpr;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException;

/**
 * A {@link Workspace} that records a span around every put, delete and get of the wrapped workspace.
 *
 * <p>Spans are parented on the current context. Subscriptions and evals are passed through untraced;
 * their consumers extract the context carried by the values they receive.
 */
public class TracedWorkspace implements Workspace {

    private final Workspace delegate;
    private final Tracer tracer;

    public TracedWorkspace(Workspace delegate, Tracer tracer) {
        this.delegate = delegate;
        this.tracer = tracer;
    }

    public Workspace getDelegate() {
        return delegate;
    }

    @Override
    public Path getPrefix() {
        return delegate.getPrefix();
    }

    @Override
    public void put(Path path, Value value) throws WorkspaceException {
        Span span = startSpan("put " + path, SpanKind.PRODUCER, TracingAttributes.OPERATION_PUBLISH, path.toString());
        try (Scope ignored = span.makeCurrent()) {
            delegate.put(path, value);
        } catch (WorkspaceException | RuntimeException e) {
            recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public CompletableFuture<Void> putAsync(Path path, Value value) {
        Span span = startSpan("put " + path, SpanKind.PRODUCER, TracingAttributes.OPERATION_PUBLISH, path.toString());
        try (Scope ignored = span.makeCurrent()) {
            return endOnCompletion(span, delegate.putAsync(path, value));
        }
    }

    @Override
    public void delete(Path path) throws WorkspaceException {
        Span span = startSpan("delete " + path, SpanKind.PRODUCER, TracingAttributes.OPERATION_PUBLISH,
                path.toString());
        try (Scope ignored = span.makeCurrent()) {
            delegate.delete(path);
        } catch (WorkspaceException | RuntimeException e) {
            recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public CompletableFuture<Void> deleteAsync(Path path) {
        Span span = startSpan("delete " + path, SpanKind.PRODUCER, TracingAttributes.OPERATION_PUBLISH,
                path.toString());
        try (Scope ignored = span.makeCurrent()) {
            return endOnCompletion(span, delegate.deleteAsync(path));
        }
    }

    @Override
    public List<Data> get(Selector selector) throws WorkspaceException {
        Span span = startSpan("get " + selector, SpanKind.CLIENT, TracingAttributes.OPERATION_RECEIVE,
                selector.toString());
        try (Scope ignored = span.makeCurrent()) {
            List<Data> result = delegate.get(selector);
            span.setAttribute(TracingAttributes.WORKSPACE_RESULT_COUNT, (long) result.size());
            return result;
        } catch (WorkspaceException | RuntimeException e) {
            recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public CompletableFuture<List<Data>> getAsync(Selector selector) {
        Span span = startSpan("get " + selector, SpanKind.CLIENT, TracingAttributes.OPERATION_RECEIVE,
                selector.toString());
        try (Scope ignored = span.makeCurrent()) {
            return endOnCompletion(span, delegate.getAsync(selector).whenComplete((result, ex) -> {
                if (result != null) {
                    span.setAttribute(TracingAttributes.WORKSPACE_RESULT_COUNT, (long) result.size());
                }
            }));
        }
    }

    @Override
    public ChangeStream subscribe(Selector selector) throws WorkspaceException {
        return delegate.subscribe(selector);
    }

    @Override
    public CompletableFuture<ChangeStream> subscribeAsync(Selector selector) {
        return delegate.subscribeAsync(selector);
    }

    @Override
    public GetRequestStream registerEval(PathExpr pathExpr) throws WorkspaceException {
        return delegate.registerEval(pathExpr);
    }

    @Override
    public CompletableFuture<GetRequestStream> registerEvalAsync(PathExpr pathExpr) {
        return delegate.registerEvalAsync(pathExpr);
    }

    private Span startSpan(String name, SpanKind kind, String operation, String destination) {
        return tracer.spanBuilder(name)
                .setSpanKind(kind)
                .setAttribute(TracingAttributes.MESSAGING_SYSTEM, TracingAttributes.MESSAGING_SYSTEM_VALUE)
                .setAttribute(TracingAttributes.MESSAGING_OPERATION, operation)
                .setAttribute(TracingAttributes.MESSAGING_DESTINATION_NAME, destination)
                .startSpan();
    }

    private static <T> CompletableFuture<T> endOnCompletion(Span span, CompletableFuture<T> future) {
        return future.whenComplete((result, ex) -> {
            if (ex != null) {
                recordFailure(span, WorkspaceException.unwrap(ex));
            }
            span.end();
        });
    }

    private static void recordFailure(Span span, Throwable t) {
        span.setStatus(StatusCode.ERROR, t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
        span.recordException(t);
    }
}
