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

import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.testng.annotations.Test;
import org.tracedws.client.api.ChangeStream;
import org.tracedws.client.api.Session;
import org.tracedws.client.api.WorkspaceException;

public class ExampleClientUtilsTest {

    @Test
    public void testCloseSessionClearsAndRestoresInterrupt() throws Exception {
        Session session = mock(Session.class);
        AtomicBoolean interruptedWhileClosing = new AtomicBoolean(true);
        doAnswer(inv -> {
            interruptedWhileClosing.set(Thread.currentThread().isInterrupted());
            return null;
        }).when(session).close();

        Thread.currentThread().interrupt();
        try {
            ExampleClientUtils.closeSession(session);
            assertFalse(interruptedWhileClosing.get());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testCloseSessionLogsFailures() throws Exception {
        Session session = mock(Session.class);
        doThrow(new WorkspaceException.TransportException("unreachable")).when(session).close();
        ExampleClientUtils.closeSession(session);
        verify(session).close();
        ExampleClientUtils.closeSession(null);
    }

    @Test
    public void testCloseQuietly() throws Exception {
        ChangeStream stream = mock(ChangeStream.class);
        doThrow(new WorkspaceException.AlreadyClosedException("closed")).when(stream).close();
        ExampleClientUtils.closeQuietly(stream, "subscription");
        verify(stream).close();
        ExampleClientUtils.closeQuietly(null, "nothing");
    }

    @Test
    public void testRemoveAndRunShutdownHook() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        Thread hook = ExampleClientUtils.addShutdownHook(runs::incrementAndGet);
        ExampleClientUtils.removeAndRunShutdownHook(hook);
        assertEquals(runs.get(), 1);
    }
}
