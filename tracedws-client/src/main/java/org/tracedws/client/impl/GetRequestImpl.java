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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.tracedws.client.api.GetRequest;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.client.api.WorkspaceException.AlreadyClosedException;
import org.tracedws.client.impl.data.ReplyEnvelope;

@Slf4j
class GetRequestImpl implements GetRequest {

    private final SessionImpl session;
    private final String requestId;
    private final String evaluatorId;
    private final Selector selector;
    private final AtomicBoolean finished = new AtomicBoolean();

    GetRequestImpl(SessionImpl session, String requestId, String evaluatorId, Selector selector) {
        this.session = session;
        this.requestId = requestId;
        this.evaluatorId = evaluatorId;
        this.selector = selector;
    }

    @Override
    public Selector getSelector() {
        return selector;
    }

    String getRequestId() {
        return requestId;
    }

    @Override
    public void reply(Path path, Value value) throws WorkspaceException {
        FutureUtils.sync(replyAsync(path, value));
    }

    @Override
    public CompletableFuture<Void> replyAsync(Path path, Value value) {
        if (finished.get()) {
            return FutureUtils.failed(new AlreadyClosedException("Request " + requestId + " is already closed"));
        }
        return session.sendReply(WireCodec.reply(requestId, evaluatorId, path, value, session.getClock().now()));
    }

    CompletableFuture<Void> closeAsync() {
        if (!finished.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        return session.sendReply(ReplyEnvelope.control(requestId, evaluatorId, ReplyEnvelope.Type.FINAL))
                .exceptionally(ex -> {
                    log.warn("[{}] Failed to send final for request {}", evaluatorId, requestId, ex);
                    return null;
                });
    }

    @Override
    public void close() throws WorkspaceException {
        FutureUtils.sync(closeAsync());
    }

    @Override
    public String toString() {
        return "GetRequest{" + requestId + ", " + selector + "}";
    }
}
