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
package org.tracedws.opentelemetry;

import io.opentelemetry.api.common.AttributeKey;

/**
 * OpenTelemetry attributes set by the traced workspace and the example programs.
 */
public interface TracingAttributes {

    /**
     * The messaging system carrying the workspace traffic.
     */
    AttributeKey<String> MESSAGING_SYSTEM = AttributeKey.stringKey("messaging.system");

    /**
     * The kind of messaging operation, e.g. {@code publish} or {@code receive}.
     */
    AttributeKey<String> MESSAGING_OPERATION = AttributeKey.stringKey("messaging.operation");

    /**
     * The path or selector the operation targets.
     */
    AttributeKey<String> MESSAGING_DESTINATION_NAME = AttributeKey.stringKey("messaging.destination.name");

    AttributeKey<Long> PROCESS_PID = AttributeKey.longKey("process.pid");

    AttributeKey<String> PROCESS_EXECUTABLE_PATH = AttributeKey.stringKey("process.executable.path");

    /**
     * Number of results returned by a get.
     */
    AttributeKey<Long> WORKSPACE_RESULT_COUNT = AttributeKey.longKey("workspace.result.count");

    String MESSAGING_SYSTEM_VALUE = "pulsar";
    String OPERATION_PUBLISH = "publish";
    String OPERATION_RECEIVE = "receive";
}
