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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Scoped handle used to put, delete, get, subscribe and register evals.
 *
 * <p>Obtained from {@link Session#workspace(Path)}. String paths and selectors that do not start
 * with {@code '/'} are resolved against the workspace prefix.
 */
public interface Workspace {

    /**
     * @return the prefix of this workspace, or null if it has none
     */
    Path getPrefix();

    void put(Path path, Value value) throws WorkspaceException;

    CompletableFuture<Void> putAsync(Path path, Value value);

    default void put(String path, Value value) throws WorkspaceException {
        put(resolvePath(path), value);
    }

    void delete(Path path) throws WorkspaceException;

    CompletableFuture<Void> deleteAsync(Path path);

    /**
     * Queries the stored values and the registered evals for the selected resources.
     *
     * @return at most one entry per path, the most recent one, sorted by path
     */
    List<Data> get(Selector selector) throws WorkspaceException;

    CompletableFuture<List<Data>> getAsync(Selector selector);

    default List<Data> get(String selector) throws WorkspaceException {
        return get(resolveSelector(selector));
    }

    ChangeStream subscribe(Selector selector) throws WorkspaceException;

    CompletableFuture<ChangeStream> subscribeAsync(Selector selector);

    default ChangeStream subscribe(String selector) throws WorkspaceException {
        return subscribe(resolveSelector(selector));
    }

    GetRequestStream registerEval(PathExpr pathExpr) throws WorkspaceException;

    CompletableFuture<GetRequestStream> registerEvalAsync(PathExpr pathExpr);

    default Path resolvePath(String path) throws WorkspaceException {
        Path prefix = getPrefix();
        return prefix == null || path.startsWith("/") ? Path.of(path) : prefix.resolve(path);
    }

    default Selector resolveSelector(String selector) throws WorkspaceException {
        Path prefix = getPrefix();
        if (prefix == null || selector.startsWith("/")) {
            return Selector.of(selector);
        }
        return Selector.of(prefix.isRoot() ? "/" + selector : prefix + "/" + selector);
    }
}
