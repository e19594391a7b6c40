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
import lombok.experimental.UtilityClass;
import org.tracedws.client.api.WorkspaceException;

@UtilityClass
class FutureUtils {

    /**
     * Waits for {@code future} and rethrows its failure as a {@link WorkspaceException}.
     */
    static <T> T sync(CompletableFuture<T> future) throws WorkspaceException {
        try {
            return future.get();
        } catch (Exception e) {
            throw WorkspaceException.unwrap(e);
        }
    }

    static <T> CompletableFuture<T> failed(Throwable t) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(t);
        return future;
    }
}
