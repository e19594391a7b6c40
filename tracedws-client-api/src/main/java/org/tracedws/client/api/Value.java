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

import static java.nio.charset.StandardCharsets.UTF_8;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable payload together with its {@link Encoding}.
 */
public final class Value {

    private final Encoding encoding;
    private final String customDescription;
    private final byte[] payload;

    private Value(Encoding encoding, String customDescription, byte[] payload) {
        this.encoding = Objects.requireNonNull(encoding);
        this.customDescription = customDescription;
        this.payload = payload;
    }

    public static Value ofString(String s) {
        return new Value(Encoding.STRING, null, s.getBytes(UTF_8));
    }

    public static Value ofInteger(long i) {
        return new Value(Encoding.INTEGER, null, Long.toString(i).getBytes(UTF_8));
    }

    public static Value ofFloat(double f) {
        return new Value(Encoding.FLOAT, null, Double.toString(f).getBytes(UTF_8));
    }

    public static Value ofJson(String json) {
        return new Value(Encoding.JSON, null, json.getBytes(UTF_8));
    }

    /**
     * A dictionary of strings, serialized as {@code k1=v1;k2=v2}.
     */
    public static Value ofProperties(Map<String, String> properties) {
        String s = properties.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(";"));
        return new Value(Encoding.PROPERTIES, null, s.getBytes(UTF_8));
    }

    public static Value ofRaw(byte[] data) {
        return new Value(Encoding.RAW, null, data.clone());
    }

    public static Value ofCustom(String encodingDescription, byte[] data) {
        return new Value(Encoding.CUSTOM, Objects.requireNonNull(encodingDescription), data.clone());
    }

    /**
     * Rebuilds a value from its wire form.
     */
    public static Value fromEncoded(Encoding encoding, String encodingDescription, byte[] data) {
        return new Value(encoding, encoding == Encoding.CUSTOM ? encodingDescription : null, data.clone());
    }

    public Encoding getEncoding() {
        return encoding;
    }

    public String encodingDescr() {
        return encoding == Encoding.CUSTOM ? customDescription : encoding.getDescription();
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public String asString() {
        return new String(payload, UTF_8);
    }

    public long asLong() {
        return Long.parseLong(asString().trim());
    }

    public double asDouble() {
        return Double.parseDouble(asString().trim());
    }

    public Map<String, String> asProperties() {
        return Selector.parseProperties(asString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        return encoding == other.encoding
                && Objects.equals(customDescription, other.customDescription)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(encoding, customDescription) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        switch (encoding) {
            case STRING:
                return "StringUtf8(\"" + asString() + "\")";
            case INTEGER:
                return "Integer(" + asString() + ")";
            case FLOAT:
                return "Float(" + asString() + ")";
            case JSON:
                return "Json(\"" + asString() + "\")";
            case PROPERTIES:
                return "Properties(" + (payload.length == 0 ? Collections.emptyMap() : asProperties()) + ")";
            case CUSTOM:
                return "Custom(" + customDescription + ", " + payload.length + " bytes)";
            case RAW:
            default:
                return "Raw(" + payload.length + " bytes)";
        }
    }
}
