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
import java.util.List;
import java.util.Map;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.SessionBuilder;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.client.api.WorkspaceException.InvalidConfigurationException;
import org.tracedws.client.impl.conf.SessionConfigurationData;

public class SessionBuilderImpl implements SessionBuilder {

    private final SessionConfigurationData conf;

    public SessionBuilderImpl() {
        this(new SessionConfigurationData());
    }

    SessionBuilderImpl(SessionConfigurationData conf) {
        this.conf = conf;
    }

    @Override
    public SessionBuilder loadConf(Map<String, String> config) throws InvalidConfigurationException {
        conf.loadFrom(config);
        return this;
    }

    @Override
    public SessionBuilder mode(String mode) throws InvalidConfigurationException {
        conf.setValidatedMode(mode);
        return this;
    }

    @Override
    public SessionBuilder peers(List<String> locators) {
        conf.setPeers(new ArrayList<>(locators));
        return this;
    }

    @Override
    public SessionBuilder listeners(List<String> locators) {
        conf.setListeners(new ArrayList<>(locators));
        return this;
    }

    @Override
    public SessionBuilder multicastScouting(boolean enabled) {
        conf.setMulticastScouting(enabled);
        return this;
    }

    @Override
    public Session build() throws WorkspaceException {
        return new SessionImpl(conf);
    }

    SessionConfigurationData getConf() {
        return conf;
    }
}
