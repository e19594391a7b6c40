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
import java.util.Map;

/**
 * Builder interface used to configure and construct a {@link Session} instance.
 *
 * <p>Example:
 * <pre>{@code
 * Session session = Session.builder()
 *         .mode("client")
 *         .peers(List.of("tcp/localhost:6650"))
 *         .build();
 * }</pre>
 */
public interface SessionBuilder {

    /**
     * Load the configuration from a flat map of keys such as {@code mode}, {@code peer},
     * {@code listener} or {@code multicast_scouting}. Values set before are overridden.
     */
    SessionBuilder loadConf(Map<String, String> config) throws WorkspaceException.InvalidConfigurationException;

    /**
     * @param mode {@code peer} or {@code client}
     */
    SessionBuilder mode(String mode) throws WorkspaceException.InvalidConfigurationException;

    SessionBuilder peers(List<String> locators);

    SessionBuilder listeners(List<String> locators);

    SessionBuilder multicastScouting(boolean enabled);

    Session build() throws WorkspaceException;
}
