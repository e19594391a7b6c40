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
package org.tracedws.client.impl.data;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.tracedws.client.api.ChangeKind;
import org.tracedws.client.api.Encoding;

/**
 * A put or a delete as carried on the data topic. The message key is the path.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DataEnvelope {
    private ChangeKind kind;
    private String path;
    private Encoding encoding;
    private String encodingDescr;
    private byte[] payload;
    private long time;
    private String source;
}
