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
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.client.api.Message;
import org.tracedws.client.api.Change;
import org.tracedws.client.api.ChangeStream;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.WorkspaceException;

@Slf4j
class ChangeStreamImpl extends AbstractReaderStream<Change> implements ChangeStream {

    private final Selector selector;

    ChangeStreamImpl(SessionImpl session, Selector selector) {
        super(session);
        this.selector = selector;
    }

    @Override
    protected void onMessage(Message<byte[]> msg) {
        Change change;
        try {
            change = WireCodec.toChange(WireCodec.decodeData(msg.getData()));
        } catch (IOException e) {
            log.warn("[{}] Skipping malformed data message {}: {}", selector, msg.getMessageId(), e.getMessage());
            return;
        }
        session.getClock().observe(change.getTimestamp());
        if (selector.getPathExpr().matches(change.getPath())) {
            enqueue(change);
        } else if (log.isDebugEnabled()) {
            log.debug("[{}] Ignoring change for {}", selector, change.getPath());
        }
    }

    @Override
    public Selector getSelector() {
        return selector;
    }

    @Override
    public Change receive() throws WorkspaceException {
        return take();
    }

    @Override
    public Change receive(long timeout, TimeUnit unit) throws WorkspaceException {
        return poll(timeout, unit);
    }
}
