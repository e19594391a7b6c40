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
package org.tracedws.client.api;

import java.util.concurrent.CompletableFuture;

/**
 * A get request delivered to an eval registered with {@link Workspace#registerEval(PathExpr)}.
 *
 * <p>The eval may reply any number of times and must close the request once done, so that the
 * querier can stop waiting for it.
 */
public interface GetRequest extends AutoCloseable {

    Selector getSelector();

    void reply(Path path, Value value) throws WorkspaceException;

    CompletableFuture<Void> replyAsync(Path path, Value value);

    /**
     * Signals the querier that no more replies will be sent for this request. Idempotent.
     */
    @Override
    void close() throws WorkspaceException;
}
