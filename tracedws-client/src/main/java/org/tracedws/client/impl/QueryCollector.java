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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.tracedws.client.api.Change;
import org.tracedws.client.api.ChangeKind;
import org.tracedws.client.api.Data;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.Selector;

/**
 * Gathers the answers to one get: the stored values and the replies of the evaluators.
 *
 * <p>Only the most recent change per path is kept, and paths whose most recent change is a delete
 * are left out of the result. The result is completed when the timeout fires, or when the
 * discovery window is over and every evaluator that acknowledged the request has sent its final.
 */
@Slf4j
class QueryCollector {

    private final String requestId;
    private final Selector selector;
    private final CompletableFuture<List<Data>> result = new CompletableFuture<>();

    // guarded by this
    private final Map<Path, Change> latest = new HashMap<>();
    private final Set<String> pendingEvaluators = new HashSet<>();
    private boolean discoveryOver;
    private ScheduledFuture<?> discoveryTask;
    private ScheduledFuture<?> timeoutTask;

    QueryCollector(String requestId, Selector selector) {
        this.requestId = requestId;
        this.selector = selector;
    }

    String getRequestId() {
        return requestId;
    }

    Selector getSelector() {
        return selector;
    }

    CompletableFuture<List<Data>> getResult() {
        return result;
    }

    synchronized CompletableFuture<List<Data>> start(ScheduledExecutorService scheduler, long discoveryMs,
                                                     long timeoutMs) {
        if (!result.isDone()) {
            discoveryTask = scheduler.schedule(this::onDiscoveryOver, discoveryMs, TimeUnit.MILLISECONDS);
            timeoutTask = scheduler.schedule(this::onTimeout, timeoutMs, TimeUnit.MILLISECONDS);
        }
        return result;
    }

    /**
     * Offers a change for the result. Changes outside the selector are ignored.
     */
    synchronized void offer(Change change) {
        if (result.isDone() || !selector.getPathExpr().matches(change.getPath())) {
            return;
        }
        latest.merge(change.getPath(), change,
                (current, candidate) -> candidate.getTimestamp().compareTo(current.getTimestamp()) > 0
                        ? candidate : current);
    }

    synchronized void onAck(String evaluator) {
        if (!result.isDone()) {
            pendingEvaluators.add(evaluator);
        }
    }

    synchronized void onFinal(String evaluator) {
        pendingEvaluators.remove(evaluator);
        maybeComplete();
    }

    synchronized void onDiscoveryOver() {
        discoveryOver = true;
        maybeComplete();
    }

    synchronized void onTimeout() {
        if (!pendingEvaluators.isEmpty()) {
            log.info("[{}] Get on {} timed out, still waiting for evaluators {}", requestId, selector,
                    pendingEvaluators);
        }
        complete();
    }

    synchronized void fail(Throwable t) {
        cancelTasks();
        result.completeExceptionally(t);
    }

    private void maybeComplete() {
        if (discoveryOver && pendingEvaluators.isEmpty()) {
            complete();
        }
    }

    private void complete() {
        if (result.isDone()) {
            return;
        }
        cancelTasks();
        List<Data> data = new ArrayList<>(latest.size());
        for (Change change : latest.values()) {
            if (change.getKind() == ChangeKind.PUT) {
                data.add(new Data(change.getPath(), change.getValue(), change.getTimestamp()));
            }
        }
        data.sort((a, b) -> a.getPath().compareTo(b.getPath()));
        result.complete(data);
    }

    private void cancelTasks() {
        if (discoveryTask != null) {
            discoveryTask.cancel(false);
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
    }
}
