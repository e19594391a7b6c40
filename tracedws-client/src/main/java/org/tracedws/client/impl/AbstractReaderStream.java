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
package org.tracedws.client.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.MessageId;
import org.apache.pulsar.client.api.Reader;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.client.api.WorkspaceException.AlreadyClosedException;

/**
 * A blocking stream fed by a non-durable Pulsar reader that starts at the latest message of a topic.
 *
 * <p>Messages are decoded and filtered on the Pulsar listener thread, then handed to the consuming
 * thread through an unbounded queue.
 */
@Slf4j
abstract class AbstractReaderStream<T> {

    private static final Object CLOSED = new Object();

    protected final SessionImpl session;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    // guards enqueueing against the final drain
    private final Object lock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Reader<byte[]> reader;

    AbstractReaderStream(SessionImpl session) {
        this.session = session;
    }

    CompletableFuture<Void> start(String topic, String readerName) {
        return session.getClient().newReader()
                .topic(topic)
                .startMessageId(MessageId.latest)
                .readerName(readerName)
                .readerListener((r, msg) -> {
                    if (!closed.get()) {
                        onMessage(msg);
                    }
                })
                .createAsync()
                .thenAccept(r -> {
                    this.reader = r;
                    if (closed.get()) {
                        // closed while the reader was being created
                        r.closeAsync();
                    }
                });
    }

    protected abstract void onMessage(Message<byte[]> msg);

    /**
     * Called with the items that were never received: once with the queued items when the stream is
     * closed, then for each item accepted by the listener after that.
     */
    protected void onClosed(List<T> undelivered) {
    }

    protected void enqueue(T item) {
        synchronized (lock) {
            if (!closed.get()) {
                queue.add(item);
                return;
            }
        }
        onClosed(Collections.singletonList(item));
    }

    protected T take() throws WorkspaceException {
        try {
            return unwrap(queue.take());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceException(e);
        }
    }

    protected T poll(long timeout, TimeUnit unit) throws WorkspaceException {
        try {
            Object item = queue.poll(timeout, unit);
            return item == null ? null : unwrap(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceException(e);
        }
    }

    @SuppressWarnings("unchecked")
    private T unwrap(Object item) throws AlreadyClosedException {
        if (item == CLOSED) {
            // leave the marker for other receivers
            queue.add(CLOSED);
            throw new AlreadyClosedException(getClass().getSimpleName() + " is closed");
        }
        return (T) item;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @SuppressWarnings("unchecked")
    public CompletableFuture<Void> closeAsync() {
        List<Object> drained = new ArrayList<>();
        synchronized (lock) {
            if (!closed.compareAndSet(false, true)) {
                return CompletableFuture.completedFuture(null);
            }
            queue.drainTo(drained);
            queue.add(CLOSED);
        }
        List<T> undelivered = new ArrayList<>(drained.size());
        for (Object item : drained) {
            if (item != CLOSED) {
                undelivered.add((T) item);
            }
        }
        onClosed(undelivered);
        session.streamClosed(this);

        Reader<byte[]> r = this.reader;
        if (r == null) {
            return CompletableFuture.completedFuture(null);
        }
        return r.closeAsync().exceptionally(ex -> {
            log.warn("[{}] Failed to close reader", r.getTopic(), ex);
            return null;
        });
    }

    public void close() throws WorkspaceException {
        FutureUtils.sync(closeAsync());
    }
}
