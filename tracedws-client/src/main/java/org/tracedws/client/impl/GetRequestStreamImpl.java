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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.client.api.Message;
import org.tracedws.client.api.GetRequest;
import org.tracedws.client.api.GetRequestStream;
import org.tracedws.client.api.PathExpr;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.client.impl.data.QueryEnvelope;
import org.tracedws.client.impl.data.ReplyEnvelope;

/**
 * Receives the get requests whose selector intersects the registered path expression.
 *
 * <p>Every accepted request is acknowledged to the querier right away, so that the querier keeps
 * waiting until this evaluator closes the request.
 */
@Slf4j
class GetRequestStreamImpl extends AbstractReaderStream<GetRequestImpl> implements GetRequestStream {

    private final PathExpr pathExpr;
    private final String evaluatorId;

    GetRequestStreamImpl(SessionImpl session, PathExpr pathExpr, String evaluatorId) {
        super(session);
        this.pathExpr = pathExpr;
        this.evaluatorId = evaluatorId;
    }

    @Override
    protected void onMessage(Message<byte[]> msg) {
        QueryEnvelope query;
        Selector selector;
        try {
            query = WireCodec.decodeQuery(msg.getData());
            selector = Selector.of(query.getSelector());
        } catch (IOException e) {
            log.warn("[{}] Skipping malformed query {}: {}", evaluatorId, msg.getMessageId(), e.getMessage());
            return;
        }
        if (!pathExpr.intersects(selector.getPathExpr())) {
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("[{}] Accepting request {} for {}", evaluatorId, query.getRequestId(), selector);
        }
        session.sendReply(ReplyEnvelope.control(query.getRequestId(), evaluatorId, ReplyEnvelope.Type.ACK))
                .exceptionally(ex -> {
                    log.warn("[{}] Failed to acknowledge request {}", evaluatorId, query.getRequestId(), ex);
                    return null;
                });
        enqueue(new GetRequestImpl(session, query.getRequestId(), evaluatorId, selector));
    }

    @Override
    protected void onClosed(List<GetRequestImpl> undelivered) {
        for (GetRequestImpl request : undelivered) {
            request.closeAsync();
        }
    }

    @Override
    public PathExpr getPathExpr() {
        return pathExpr;
    }

    String getEvaluatorId() {
        return evaluatorId;
    }

    @Override
    public GetRequest receive() throws WorkspaceException {
        return take();
    }

    @Override
    public GetRequest receive(long timeout, TimeUnit unit) throws WorkspaceException {
        return poll(timeout, unit);
    }
}
