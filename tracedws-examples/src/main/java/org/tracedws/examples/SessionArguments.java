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
package org.tracedws.examples;

import io.opentelemetry.api.trace.Tracer;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.SessionBuilder;
import org.tracedws.client.api.Workspace;
import org.tracedws.client.api.WorkspaceException;
import org.tracedws.opentelemetry.TracedWorkspace;
import org.tracedws.opentelemetry.TracingService;
import picocli.CommandLine.Option;

/**
 * SessionArguments contains the CLI arguments shared by all the example programs, and turns them into the
 * flat configuration map handed to the session builder.
 */
@Slf4j
public abstract class SessionArguments extends ExampleCommand {

    static final String MODE_KEY = "mode";
    static final String PEER_KEY = "peer";
    static final String LISTENER_KEY = "listener";
    static final String MULTICAST_SCOUTING_KEY = "multicast_scouting";

    @Option(names = { "-m", "--mode" }, description = "The session mode: 'peer' (default) or 'client'")
    public String mode;

    @Option(names = { "-e", "--peer" }, split = ",",
            description = "Peer locators used to initiate the session, e.g. tcp/localhost:6650")
    public List<String> peers;

    @Option(names = { "-l", "--listener" }, split = ",", description = "Locators to listen on")
    public List<String> listeners;

    @Option(names = { "-c", "--config" }, description = "A configuration file (Java properties)")
    public File configFile;

    @Option(names = { "--no-multicast-scouting" },
            description = "Disable the multicast-based scouting mechanism")
    public boolean noMulticastScouting;

    public SessionArguments(String cmdName) {
        super(cmdName);
    }

    @Override
    public void validate() throws Exception {
        super.validate();
        if (mode != null && !"peer".equals(mode) && !"client".equals(mode)) {
            throw new ParameterException(
                    String.format("Invalid mode '%s', must be either 'peer' or 'client'", mode));
        }
        if (configFile != null && !configFile.isFile()) {
            throw new ParameterException("Configuration file " + configFile + " does not exist");
        }
    }

    /**
     * Loads the configuration file, if any, then applies the command line flags on top of it.
     */
    public Map<String, String> toConfig() throws IOException {
        Map<String, String> config = new LinkedHashMap<>();
        if (configFile != null) {
            Properties prop = new Properties();
            try (FileInputStream fis = new FileInputStream(configFile)) {
                prop.load(fis);
            }
            for (String key : prop.stringPropertyNames()) {
                config.put(key, prop.getProperty(key));
            }
        }
        if (mode != null) {
            config.put(MODE_KEY, mode);
        }
        if (peers != null && !peers.isEmpty()) {
            config.put(PEER_KEY, String.join(",", peers));
        }
        if (listeners != null && !listeners.isEmpty()) {
            config.put(LISTENER_KEY, String.join(",", listeners));
        }
        if (noMulticastScouting) {
            config.put(MULTICAST_SCOUTING_KEY, "false");
        }
        return config;
    }

    protected SessionBuilder newSessionBuilder() {
        return Session.builder();
    }

    protected Session openSession() throws IOException {
        Map<String, String> config = toConfig();
        log.info("Opening session with configuration {}", config);
        out.println("New session...");
        return newSessionBuilder().loadConf(config).build();
    }

    protected Workspace openWorkspace(Session session, Tracer tracer) throws WorkspaceException {
        out.println("New workspace...");
        return new TracedWorkspace(session.workspace(), tracer);
    }

    protected TracingService createTracingService(String serviceName) {
        return TracingService.builder()
                .serviceName(serviceName)
                .serviceVersion(SessionArguments.class.getPackage().getImplementationVersion())
                .build();
    }
}
