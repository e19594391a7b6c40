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
package org.tracedws.client.impl.conf;

import static org.apache.commons.lang3.StringUtils.isBlank;
import static org.apache.commons.lang3.StringUtils.isNotBlank;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.tracedws.client.api.WorkspaceException.InvalidConfigurationException;

/**
 * Configuration of a session, loaded from the flat key/value map given on the command line or in a
 * configuration file.
 */
@Data
@NoArgsConstructor
public class SessionConfigurationData {

    public static final String MODE_KEY = "mode";
    public static final String PEER_KEY = "peer";
    public static final String LISTENER_KEY = "listener";
    public static final String MULTICAST_SCOUTING_KEY = "multicast_scouting";
    public static final String SERVICE_URL_KEY = "service_url";
    public static final String DATA_TOPIC_KEY = "data_topic";
    public static final String QUERY_TOPIC_KEY = "query_topic";
    public static final String REPLY_TOPIC_KEY = "reply_topic";
    public static final String QUERY_TIMEOUT_MS_KEY = "query_timeout_ms";
    public static final String QUERY_DISCOVERY_MS_KEY = "query_discovery_ms";
    public static final String OPERATION_TIMEOUT_MS_KEY = "operation_timeout_ms";

    public static final String MODE_PEER = "peer";
    public static final String MODE_CLIENT = "client";

    /**
     * Service URL used when no peer is configured and scouting is enabled.
     */
    public static final String SCOUTED_SERVICE_URL = "pulsar://localhost:6650";

    private static final String PULSAR_SCHEME = "pulsar://";
    private static final String PULSAR_SSL_SCHEME = "pulsar+ssl://";

    private String mode = MODE_PEER;
    private List<String> peers = new ArrayList<>();
    private List<String> listeners = new ArrayList<>();
    private boolean multicastScouting = true;
    private String serviceUrl;
    private String dataTopic = "persistent://public/default/tracedws-data";
    private String queryTopic = "persistent://public/default/tracedws-queries";
    private String replyTopic = "persistent://public/default/tracedws-replies";
    private long queryTimeoutMs = 10_000;
    private long queryDiscoveryMs = 300;
    private int operationTimeoutMs = 30_000;

    /**
     * Applies the entries of {@code config} on top of the current values. Unknown keys are ignored.
     */
    public void loadFrom(Map<String, String> config) throws InvalidConfigurationException {
        for (Map.Entry<String, String> e : config.entrySet()) {
            String value = e.getValue() == null ? "" : e.getValue().trim();
            switch (e.getKey()) {
                case MODE_KEY:
                    setValidatedMode(value);
                    break;
                case PEER_KEY:
                    peers = splitLocators(value);
                    break;
                case LISTENER_KEY:
                    listeners = splitLocators(value);
                    break;
                case MULTICAST_SCOUTING_KEY:
                    multicastScouting = parseBoolean(e.getKey(), value);
                    break;
                case SERVICE_URL_KEY:
                    serviceUrl = value;
                    break;
                case DATA_TOPIC_KEY:
                    dataTopic = value;
                    break;
                case QUERY_TOPIC_KEY:
                    queryTopic = value;
                    break;
                case REPLY_TOPIC_KEY:
                    replyTopic = value;
                    break;
                case QUERY_TIMEOUT_MS_KEY:
                    queryTimeoutMs = parsePositiveLong(e.getKey(), value);
                    break;
                case QUERY_DISCOVERY_MS_KEY:
                    queryDiscoveryMs = parsePositiveLong(e.getKey(), value);
                    break;
                case OPERATION_TIMEOUT_MS_KEY:
                    operationTimeoutMs = (int) Math.min(Integer.MAX_VALUE, parsePositiveLong(e.getKey(), value));
                    break;
                default:
                    break;
            }
        }
    }

    public void setValidatedMode(String mode) throws InvalidConfigurationException {
        if (!MODE_PEER.equals(mode) && !MODE_CLIENT.equals(mode)) {
            throw new InvalidConfigurationException(
                    String.format("Invalid mode '%s', must be either '%s' or '%s'", mode, MODE_PEER, MODE_CLIENT));
        }
        this.mode = mode;
    }

    /**
     * Validates the configuration and computes the Pulsar service URL.
     *
     * <p>An explicit {@link #SERVICE_URL_KEY} wins. Otherwise peer locators are converted
     * ({@code tcp/host:port} to {@code pulsar://host:port}, {@code tls/host:port} to
     * {@code pulsar+ssl://host:port}) and joined into a multi-host URL.
     */
    public String resolveServiceUrl() throws InvalidConfigurationException {
        if (queryDiscoveryMs > queryTimeoutMs) {
            throw new InvalidConfigurationException(String.format("%s (%d) cannot be bigger than %s (%d)",
                    QUERY_DISCOVERY_MS_KEY, queryDiscoveryMs, QUERY_TIMEOUT_MS_KEY, queryTimeoutMs));
        }
        for (String topic : Arrays.asList(dataTopic, queryTopic, replyTopic)) {
            if (isBlank(topic)) {
                throw new InvalidConfigurationException("Topic names cannot be empty");
            }
        }
        if (isNotBlank(serviceUrl)) {
            return serviceUrl;
        }
        if (peers.isEmpty()) {
            if (multicastScouting) {
                return SCOUTED_SERVICE_URL;
            }
            throw new InvalidConfigurationException(
                    "No peer locator configured and multicast scouting is disabled");
        }

        String scheme = null;
        List<String> hosts = new ArrayList<>(peers.size());
        for (String locator : peers) {
            String[] converted = convertLocator(locator);
            if (scheme != null && !scheme.equals(converted[0])) {
                throw new InvalidConfigurationException("All peer locators must use the same protocol: " + peers);
            }
            scheme = converted[0];
            hosts.add(converted[1]);
        }
        return scheme + String.join(",", hosts);
    }

    /**
     * @return {scheme, host:port}
     */
    static String[] convertLocator(String locator) throws InvalidConfigurationException {
        String scheme;
        String address;
        if (locator.startsWith("tcp/")) {
            scheme = PULSAR_SCHEME;
            address = locator.substring("tcp/".length());
        } else if (locator.startsWith("tls/")) {
            scheme = PULSAR_SSL_SCHEME;
            address = locator.substring("tls/".length());
        } else if (locator.startsWith(PULSAR_SCHEME)) {
            scheme = PULSAR_SCHEME;
            address = locator.substring(PULSAR_SCHEME.length());
        } else if (locator.startsWith(PULSAR_SSL_SCHEME)) {
            scheme = PULSAR_SSL_SCHEME;
            address = locator.substring(PULSAR_SSL_SCHEME.length());
        } else {
            throw new InvalidConfigurationException("Unsupported locator '" + locator
                    + "', expected tcp/<host>:<port>, tls/<host>:<port> or a pulsar:// URL");
        }
        if (address.endsWith("/")) {
            address = address.substring(0, address.length() - 1);
        }
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new InvalidConfigurationException("Locator '" + locator + "' must have the form <host>:<port>");
        }
        try {
            Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Invalid port in locator '" + locator + "'", e);
        }
        return new String[] {scheme, address};
    }

    private static List<String> splitLocators(String value) {
        if (value.isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static boolean parseBoolean(String key, String value) throws InvalidConfigurationException {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new InvalidConfigurationException(String.format("%s must be 'true' or 'false', got '%s'", key, value));
    }

    private static long parsePositiveLong(String key, String value) throws InvalidConfigurationException {
        long parsed;
        try {
            parsed = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(String.format("%s must be a number, got '%s'", key, value), e);
        }
        if (parsed <= 0) {
            throw new InvalidConfigurationException(key + " cannot be less than or equal to <0>!");
        }
        return parsed;
    }
}
