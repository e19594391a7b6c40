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

import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import org.testng.annotations.Test;

public class WorkspaceTest {

    @Test
    public void testResolveWithoutPrefix() throws Exception {
        Workspace workspace = mock(Workspace.class, CALLS_REAL_METHODS);
        when(workspace.getPrefix()).thenReturn(null);
        assertEquals(workspace.resolvePath("/demo/a"), Path.of("/demo/a"));
        assertEquals(workspace.resolveSelector("/demo/**"), Selector.of("/demo/**"));
    }

    @Test
    public void testResolveAgainstPrefix() throws Exception {
        Workspace workspace = mock(Workspace.class, CALLS_REAL_METHODS);
        when(workspace.getPrefix()).thenReturn(Path.of("/demo/example"));
        assertEquals(workspace.resolvePath("eval"), Path.of("/demo/example/eval"));
        assertEquals(workspace.resolvePath("/other"), Path.of("/other"));
        assertEquals(workspace.resolveSelector("eval?(name=Bob)").toString(), "/demo/example/eval?(name=Bob)");
        assertEquals(workspace.resolveSelector("/x/**"), Selector.of("/x/**"));
    }

    @Test
    public void testResolveAgainstRoot() throws Exception {
        Workspace workspace = mock(Workspace.class, CALLS_REAL_METHODS);
        when(workspace.getPrefix()).thenReturn(Path.of("/"));
        assertEquals(workspace.resolveSelector("demo/**"), Selector.of("/demo/**"));
    }
}
