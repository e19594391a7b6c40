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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;
import java.util.List;
import java.util.Map;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import org.tracedws.client.api.WorkspaceException.InvalidConfigurationException;

public class SessionConfigurationDataTest {

    @Test
    public void testDefaults() throws Exception {
        SessionConfigurationData conf = new SessionConfigurationData();
        assertEquals(conf.getMode(), "peer");
        assertTrue(conf.isMulticastScouting());
        assertEquals(conf.getQueryTimeoutMs(), 10_000);
        assertEquals(conf.getQueryDiscoveryMs(), 300);
        assertEquals(conf.resolveServiceUrl(), SessionConfigurationData.SCOUTED_SERVICE_URL);
    }

    @Test
    public void testLoadFrom() throws Exception {
        SessionConfigurationData conf = new SessionConfigurationData();
        conf.loadFrom(Map.of(
                "mode", "client",
                "peer", "tcp/broker-1:6650, tcp/broker-2:6650",
                "listener", "tcp/0.0.0.0:7447",
                "multicast_scouting", "false",
                "query_timeout_ms", "5000",
                "query_discovery_ms", "100",
                "operation_timeout_ms", "2000",
                "data_topic", "persistent://t/n/data",
                "some_unknown_key", "ignored"));

        assertEquals(conf.getMode(), "client");
        assertEquals(conf.getPeers(), List.of("tcp/broker-1:6650", "tcp/broker-2:6650"));
        assertEquals(conf.getListeners(), List.of("tcp/0.0.0.0:7447"));
        assertFalse(conf.isMulticastScouting());
        assertEquals(conf.getQueryTimeoutMs(), 5000);
        assertEquals(conf.getQueryDiscoveryMs(), 100);
        assertEquals(conf.getOperationTimeoutMs(), 2000);
        assertEquals(conf.getDataTopic(), "persistent://t/n/data");
        assertEquals(conf.resolveServiceUrl(), "pulsar://broker-1:6650,broker-2:6650");
    }

    @DataProvider(name = "locators")
    public Object[][] locators() {
        return new Object[][] {
                { "tcp/localhost:6650", "pulsar://localhost:6650" },
                { "tls/broker:6651", "pulsar+ssl://broker:6651" },
                { "pulsar://broker:6650/", "pulsar://broker:6650" },
                { "pulsar+ssl://broker:6651", "pulsar+ssl://broker:6651" },
        };
    }

    @Test(dataProvider = "locators")
    public void testLocatorConversion(String locator, String serviceUrl) throws Exception {
        SessionConfigurationData conf = new SessionConfigurationData();
        conf.loadFrom(Map.of("peer", locator));
        assertEquals(conf.resolveServiceUrl(), serviceUrl);
    }

    @Test
    public void testExplicitServiceUrlWins() throws Exception {
        SessionConfigurationData conf = new SessionConfigurationData();
        conf.loadFrom(Map.of("peer", "tcp/ignored:6650", "service_url", "pulsar://explicit:6650"));
        assertEquals(conf.resolveServiceUrl(), "pulsar://explicit:6650");
    }

    @DataProvider(name = "invalidConfigurations")
    public Object[][] invalidConfigurations() {
        return new Object[][] {
                { Map.of("mode", "router") },
                { Map.of("multicast_scouting", "maybe") },
                { Map.of("query_timeout_ms", "soon") },
                { Map.of("query_timeout_ms", "0") },
                { Map.of("peer", "udp/localhost:7447") },
                { Map.of("peer", "tcp/localhost") },
                { Map.of("peer", "tcp/localhost:port") },
                { Map.of("peer", "tcp/a:6650,tls/b:6651") },
                { Map.of("multicast_scouting", "false") },
                { Map.of("query_timeout_ms", "100", "query_discovery_ms", "200") },
                { Map.of("reply_topic", " ") },
        };
    }

    @Test(dataProvider = "invalidConfigurations")
    public void testInvalidConfiguration(Map<String, String> config) {
        SessionConfigurationData conf = new SessionConfigurationData();
        expectThrows(InvalidConfigurationException.class, () -> {
            conf.loadFrom(config);
            conf.resolveServiceUrl();
        });
    }

    @Test
    public void testConvertLocator() throws Exception {
        String[] converted = SessionConfigurationData.convertLocator("tls/10.0.0.1:6651");
        assertEquals(converted[0], "pulsar+ssl://");
        assertEquals(converted[1], "10.0.0.1:6651");
    }
}
