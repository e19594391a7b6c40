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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.MessageId;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.Reader;
import org.apache.pulsar.client.api.Schema;
import org.apache.pulsar.client.api.TableView;
import org.tracedws.client.api.Change;
import org.tracedws.client.api.ChangeKind;
import org.tracedws.client.api.ChangeStream;
import org.tracedws.client.api.Data;
import org.tracedws.client.api.GetRequestStream;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.PathExpr;
import org.tracedws.client.api.Selector;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.client.api.WorkspaceException.AlreadyClosedException;
import org.tracedws.client.impl.conf.SessionConfigurationData;
import org.tracedws.client.impl.data.QueryEnvelope;
import org.tracedws.client.impl.data.ReplyEnvelope;

/**
 * A session backed by a {@link PulsarClient}.
 *
 * <p>Puts and deletes go to the data topic, keyed by path. Gets publish a request on the query topic
 * and collect the answers of evaluators from the reply topic, merged with the stored values read
 * through a {@link TableView} of the data topic.
 */
@Slf4j
public class SessionImpl implements Session {

    private final SessionConfigurationData conf;
    private final String serviceUrl;
    private final PulsarClient client;
    private final String id;
    private final HybridClock clock;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong evalSequence = new AtomicLong();

    private final Map<String, CompletableFuture<Producer<byte[]>>> producers = new ConcurrentHashMap<>();
    private final Map<String, QueryCollector> pendingQueries = new ConcurrentHashMap<>();
    private final Set<AbstractReaderStream<?>> streams = ConcurrentHashMap.newKeySet();

    // guarded by this
    private CompletableFuture<TableView<byte[]>> storeView;
    private CompletableFuture<Reader<byte[]>> replyReader;

    public SessionImpl(SessionConfigurationData conf) throws WorkspaceException {
        this(conf, conf.resolveServiceUrl(), null);
    }

    @VisibleForTesting
    SessionImpl(SessionConfigurationData conf, String serviceUrl, PulsarClient client) throws WorkspaceException {
        this.conf = conf;
        this.serviceUrl = serviceUrl;
        this.id = UUID.randomUUID().toString().replace("-", "");
        this.clock = new HybridClock(id);
        if (!conf.getListeners().isEmpty()) {
            log.warn("[{}] Listener locators {} are ignored: the session connects to {} and does not listen",
                    id, conf.getListeners(), serviceUrl);
        }
        this.client = client != null ? client : createClient(conf, serviceUrl);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("tracedws-session-timer-%d")
                .setDaemon(true)
                .build());
        log.info("[{}] Session opened in {} mode on {}", id, conf.getMode(), serviceUrl);
    }

    private static PulsarClient createClient(SessionConfigurationData conf, String serviceUrl)
            throws WorkspaceException {
        try {
            return PulsarClient.builder()
                    .serviceUrl(serviceUrl)
                    .operationTimeout(conf.getOperationTimeoutMs(), TimeUnit.MILLISECONDS)
                    .build();
        } catch (PulsarClientException e) {
            throw new WorkspaceException.TransportException("Failed to create Pulsar client for " + serviceUrl, e);
        }
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Workspace workspace() throws WorkspaceException {
        return workspace(null);
    }

    @Override
    public Workspace workspace(Path prefix) throws WorkspaceException {
        checkOpen();
        return new WorkspaceImpl(this, prefix);
    }

    @Override
    public Map<String, String> info() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("id", id);
        info.put(SessionConfigurationData.MODE_KEY, conf.getMode());
        info.put(SessionConfigurationData.SERVICE_URL_KEY, serviceUrl);
        info.put(SessionConfigurationData.DATA_TOPIC_KEY, conf.getDataTopic());
        info.put(SessionConfigurationData.QUERY_TOPIC_KEY, conf.getQueryTopic());
        info.put(SessionConfigurationData.REPLY_TOPIC_KEY, conf.getReplyTopic());
        return info;
    }

    PulsarClient getClient() {
        return client;
    }

    HybridClock getClock() {
        return clock;
    }

    SessionConfigurationData getConfiguration() {
        return conf;
    }

    void checkOpen() throws AlreadyClosedException {
        if (closed.get()) {
            throw new AlreadyClosedException("Session " + id + " is closed");
        }
    }

    CompletableFuture<Void> publishData(String path, Object envelope) {
        return send(conf.getDataTopic(), path, envelope);
    }

    CompletableFuture<Void> sendReply(ReplyEnvelope envelope) {
        return send(conf.getReplyTopic(), envelope.getRequestId(), envelope);
    }

    private CompletableFuture<Void> send(String topic, String key, Object envelope) {
        if (closed.get()) {
            return FutureUtils.failed(new AlreadyClosedException("Session " + id + " is closed"));
        }
        byte[] payload;
        try {
            payload = WireCodec.encode(envelope);
        } catch (WorkspaceException e) {
            return FutureUtils.failed(e);
        }
        return producer(topic)
                .thenCompose(p -> p.newMessage().key(key).value(payload).sendAsync())
                .thenApply(messageId -> null);
    }

    private CompletableFuture<Producer<byte[]>> producer(String topic) {
        CompletableFuture<Producer<byte[]>> future =
                producers.computeIfAbsent(topic, t -> client.newProducer().topic(t).createAsync());
        future.whenComplete((p, ex) -> {
            if (ex != null) {
                log.warn("[{}] Failed to create producer on {}", id, topic, ex);
                producers.remove(topic, future);
            }
        });
        return future;
    }

    CompletableFuture<ChangeStream> subscribe(Selector selector) {
        ChangeStreamImpl stream = new ChangeStreamImpl(this, selector);
        return startStream(stream, conf.getDataTopic(), id + "-sub-" + evalSequence.incrementAndGet())
                .thenApply(s -> s);
    }

    CompletableFuture<GetRequestStream> registerEval(PathExpr pathExpr) {
        if (closed.get()) {
            return FutureUtils.failed(new AlreadyClosedException("Session " + id + " is closed"));
        }
        String evaluatorId = id + "-eval-" + evalSequence.incrementAndGet();
        GetRequestStreamImpl stream = new GetRequestStreamImpl(this, pathExpr, evaluatorId);
        // the querier must be able to receive our acknowledgements
        return producer(conf.getReplyTopic())
                .thenCompose(p -> startStream(stream, conf.getQueryTopic(), evaluatorId))
                .thenApply(s -> s);
    }

    private <S extends AbstractReaderStream<?>> CompletableFuture<S> startStream(S stream, String topic,
                                                                                String readerName) {
        if (closed.get()) {
            return FutureUtils.failed(new AlreadyClosedException("Session " + id + " is closed"));
        }
        streams.add(stream);
        return stream.start(topic, readerName)
                .thenApply(v -> stream)
                .whenComplete((s, ex) -> {
                    if (ex != null) {
                        stream.closeAsync();
                    }
                });
    }

    void streamClosed(AbstractReaderStream<?> stream) {
        streams.remove(stream);
    }

    CompletableFuture<List<Data>> query(Selector selector) {
        if (closed.get()) {
            return FutureUtils.failed(new AlreadyClosedException("Session " + id + " is closed"));
        }
        String requestId = UUID.randomUUID().toString();
        QueryCollector collector = new QueryCollector(requestId, selector);
        CompletableFuture<Void> snapshot = storeView().thenAccept(view -> view.forEach((key, bytes) -> {
            Change change = decodeStored(key, bytes);
            if (change != null) {
                collector.offer(change);
            }
        }));
        pendingQueries.put(requestId, collector);
        CompletableFuture<List<Data>> result = CompletableFuture.allOf(snapshot, replyReader())
                .thenCompose(v -> send(conf.getQueryTopic(), requestId,
                        new QueryEnvelope(requestId, selector.toString(), id)))
                .thenCompose(v -> collector.start(scheduler, conf.getQueryDiscoveryMs(), conf.getQueryTimeoutMs()));
        result.whenComplete((data, ex) -> {
            pendingQueries.remove(requestId);
            if (ex != null) {
                collector.fail(ex);
            }
        });
        return result;
    }

    private Change decodeStored(String key, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            Change change = WireCodec.toChange(WireCodec.decodeData(bytes));
            clock.observe(change.getTimestamp());
            return change;
        } catch (IOException e) {
            log.warn("[{}] Skipping malformed stored value for {}: {}", id, key, e.getMessage());
            return null;
        }
    }

    private synchronized CompletableFuture<TableView<byte[]>> storeView() {
        if (storeView == null || storeView.isCompletedExceptionally()) {
            storeView = client.newTableView(Schema.BYTES)
                    .topic(conf.getDataTopic())
                    .createAsync();
        }
        return storeView;
    }

    private synchronized CompletableFuture<Reader<byte[]>> replyReader() {
        if (replyReader == null || replyReader.isCompletedExceptionally()) {
            replyReader = client.newReader()
                    .topic(conf.getReplyTopic())
                    .startMessageId(MessageId.latest)
                    .readerName(id + "-replies")
                    .readerListener((reader, msg) -> dispatchReply(msg))
                    .createAsync();
        }
        return replyReader;
    }

    @VisibleForTesting
    void dispatchReply(Message<byte[]> msg) {
        ReplyEnvelope reply;
        try {
            reply = WireCodec.decodeReply(msg.getData());
        } catch (IOException e) {
            log.warn("[{}] Skipping malformed reply {}: {}", id, msg.getMessageId(), e.getMessage());
            return;
        }
        QueryCollector collector = reply.getRequestId() == null ? null : pendingQueries.get(reply.getRequestId());
        if (collector == null || reply.getType() == null) {
            // a reply to another session, or to a get that is already over
            return;
        }
        switch (reply.getType()) {
            case ACK:
                collector.onAck(reply.getEvaluator());
                break;
            case FINAL:
                collector.onFinal(reply.getEvaluator());
                break;
            case REPLY:
                try {
                    Data data = WireCodec.toData(reply);
                    clock.observe(data.getTimestamp());
                    collector.offer(new Change(data.getPath(), ChangeKind.PUT, data.getValue(), data.getTimestamp()));
                } catch (IOException e) {
                    log.warn("[{}] Skipping malformed reply from {} to {}: {}", id, reply.getEvaluator(),
                            reply.getRequestId(), e.getMessage());
                }
                break;
            default:
                break;
        }
    }

    @Override
    public CompletableFuture<Void> closeAsync() {
        if (!closed.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<?>> futures = new ArrayList<>();
        for (AbstractReaderStream<?> stream : new ArrayList<>(streams)) {
            futures.add(stream.closeAsync());
        }
        for (QueryCollector collector : pendingQueries.values()) {
            collector.fail(new AlreadyClosedException("Session " + id + " closed during get"));
        }
        pendingQueries.clear();
        synchronized (this) {
            if (storeView != null) {
                futures.add(storeView.thenCompose(TableView::closeAsync));
            }
            if (replyReader != null) {
                futures.add(replyReader.thenCompose(Reader::closeAsync));
            }
        }
        for (CompletableFuture<Producer<byte[]>> producer : producers.values()) {
            futures.add(producer.thenCompose(Producer::closeAsync));
        }
        producers.clear();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(ex -> {
                    log.warn("[{}] Failed to close some session resources", id, ex);
                    return null;
                })
                .thenCompose(v -> client.closeAsync())
                .whenComplete((v, ex) -> {
                    scheduler.shutdownNow();
                    if (ex != null) {
                        log.warn("[{}] Failed to close Pulsar client", id, ex);
                    } else {
                        log.info("[{}] Session closed", id);
                    }
                });
    }

    @Override
    public void close() throws WorkspaceException {
        FutureUtils.sync(closeAsync());
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }
}
