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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.tracedws.client.api.ChangeStream;
import org.tracedws.client.api.Data;
import org.tracedws.client.api.GetRequestStream;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.PathExpr;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException;

@Slf4j
class WorkspaceImpl implements Workspace {

    private final SessionImpl session;
    private final Path prefix;

    WorkspaceImpl(SessionImpl session, Path prefix) {
        this.session = session;
        this.prefix = prefix;
    }

    @Override
    public Path getPrefix() {
        return prefix;
    }

    @Override
    public void put(Path path, Value value) throws WorkspaceException {
        FutureUtils.sync(putAsync(path, value));
    }

    @Override
    public CompletableFuture<Void> putAsync(Path path, Value value) {
        if (log.isDebugEnabled()) {
            log.debug("[{}] put {} : {}", session.getId(), path, value);
        }
        return session.publishData(path.toString(), WireCodec.put(path, value, session.getClock().now()));
    }

    @Override
    public void delete(Path path) throws WorkspaceException {
        FutureUtils.sync(deleteAsync(path));
    }

    @Override
    public CompletableFuture<Void> deleteAsync(Path path) {
        if (log.isDebugEnabled()) {
            log.debug("[{}] delete {}", session.getId(), path);
        }
        return session.publishData(path.toString(), WireCodec.delete(path, session.getClock().now()));
    }

    @Override
    public List<Data> get(Selector selector) throws WorkspaceException {
        return FutureUtils.sync(getAsync(selector));
    }

    @Override
    public CompletableFuture<List<Data>> getAsync(Selector selector) {
        return session.query(selector);
    }

    @Override
    public ChangeStream subscribe(Selector selector) throws WorkspaceException {
        return FutureUtils.sync(subscribeAsync(selector));
    }

    @Override
    public CompletableFuture<ChangeStream> subscribeAsync(Selector selector) {
        return session.subscribe(selector);
    }

    @Override
    public GetRequestStream registerEval(PathExpr pathExpr) throws WorkspaceException {
        return FutureUtils.sync(registerEvalAsync(pathExpr));
    }

    @Override
    public CompletableFuture<GetRequestStream> registerEvalAsync(PathExpr pathExpr) {
        return session.registerEval(pathExpr);
    }

    @Override
    public String toString() {
        return "Workspace{session=" + session.getId() + ", prefix=" + prefix + "}";
    }
}
