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

import java.io.Closeable;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.CompletableFuture;

/**
 * A connection to the data-sharing network.
 */
public interface Session extends Closeable {

    /**
     * Get a new session builder.
     *
     * @return a {@link SessionBuilder} provided by the client implementation on the class path
     */
    static SessionBuilder builder() {
        return ServiceLoader.load(SessionBuilder.class)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No " + SessionBuilder.class.getName() + " implementation found on the class path"));
    }

    String getId();

    Workspace workspace() throws WorkspaceException;

    /**
     * @param prefix used to resolve relative paths, may be null
     */
    Workspace workspace(Path prefix) throws WorkspaceException;

    /**
     * @return descriptive facts about this session (id, mode, transport endpoint)
     */
    Map<String, String> info();

    CompletableFuture<Void> closeAsync();

    @Override
    void close() throws WorkspaceException;

    boolean isClosed();
}
