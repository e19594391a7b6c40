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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Changes matching the selector of a subscription, in publication order.
 */
public interface ChangeStream extends Closeable {

    Selector getSelector();

    /**
     * Blocks until the next change is available.
     *
     * @throws WorkspaceException.AlreadyClosedException if the stream is, or gets, closed
     */
    Change receive() throws WorkspaceException;

    /**
     * @return the next change, or null if none arrived within the timeout
     */
    Change receive(long timeout, TimeUnit unit) throws WorkspaceException;

    CompletableFuture<Void> closeAsync();

    @Override
    void close() throws WorkspaceException;

    boolean isClosed();
}
