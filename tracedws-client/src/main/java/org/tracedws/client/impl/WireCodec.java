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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.experimental.UtilityClass;
import org.tracedws.client.api.Change;
import org.tracedws.client.api.ChangeKind;
import org.tracedws.client.api.Data;
import org.tracedws.client.api.Path;
import org.tracedws.client.api.Timestamp;
import org.tracedws.client.api.Value;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.client.impl.data.DataEnvelope;
import org.tracedws.client.impl.data.QueryEnvelope;
import org.tracedws.client.impl.data.ReplyEnvelope;

/**
 * JSON serialization of the envelopes exchanged on the Pulsar topics.
 */
@UtilityClass
class WireCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static byte[] encode(Object envelope) throws WorkspaceException {
        try {
            return MAPPER.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new WorkspaceException.TransportException(
                    "Failed to serialize " + envelope.getClass().getSimpleName(), e);
        }
    }

    static DataEnvelope decodeData(byte[] bytes) throws IOException {
        return MAPPER.readValue(bytes, DataEnvelope.class);
    }

    static QueryEnvelope decodeQuery(byte[] bytes) throws IOException {
        return MAPPER.readValue(bytes, QueryEnvelope.class);
    }

    static ReplyEnvelope decodeReply(byte[] bytes) throws IOException {
        return MAPPER.readValue(bytes, ReplyEnvelope.class);
    }

    static DataEnvelope put(Path path, Value value, Timestamp timestamp) {
        return new DataEnvelope(ChangeKind.PUT, path.toString(), value.getEncoding(), value.encodingDescr(),
                value.getPayload(), timestamp.getTimeNanos(), timestamp.getSourceId());
    }

    static DataEnvelope delete(Path path, Timestamp timestamp) {
        return new DataEnvelope(ChangeKind.DELETE, path.toString(), null, null, null,
                timestamp.getTimeNanos(), timestamp.getSourceId());
    }

    static ReplyEnvelope reply(String requestId, String evaluator, Path path, Value value, Timestamp timestamp) {
        return new ReplyEnvelope(requestId, evaluator, ReplyEnvelope.Type.REPLY, path.toString(),
                value.getEncoding(), value.encodingDescr(), value.getPayload(),
                timestamp.getTimeNanos(), timestamp.getSourceId());
    }

    /**
     * @throws IOException if the envelope is incomplete or its path is invalid
     */
    static Change toChange(DataEnvelope envelope) throws IOException {
        if (envelope.getKind() == null || envelope.getSource() == null) {
            throw new IOException("Incomplete data envelope for path " + envelope.getPath());
        }
        Path path = Path.of(envelope.getPath());
        Timestamp timestamp = new Timestamp(envelope.getTime(), envelope.getSource());
        if (envelope.getKind() == ChangeKind.DELETE) {
            return new Change(path, ChangeKind.DELETE, null, timestamp);
        }
        if (envelope.getEncoding() == null || envelope.getPayload() == null) {
            throw new IOException("Missing value in data envelope for path " + envelope.getPath());
        }
        Value value = Value.fromEncoded(envelope.getEncoding(), envelope.getEncodingDescr(), envelope.getPayload());
        return new Change(path, ChangeKind.PUT, value, timestamp);
    }

    static Data toData(ReplyEnvelope envelope) throws IOException {
        if (envelope.getEncoding() == null || envelope.getPayload() == null || envelope.getSource() == null) {
            throw new IOException("Incomplete reply envelope for request " + envelope.getRequestId());
        }
        Value value = Value.fromEncoded(envelope.getEncoding(), envelope.getEncodingDescr(), envelope.getPayload());
        return new Data(Path.of(envelope.getPath()), value, new Timestamp(envelope.getTime(), envelope.getSource()));
    }
}
