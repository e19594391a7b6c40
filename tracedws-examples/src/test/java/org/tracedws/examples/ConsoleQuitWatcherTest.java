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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import java.io.ByteArrayInputStream;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.awaitility.Awaitility;
import org.testng.annotations.Test;

public class ConsoleQuitWatcherTest {

    @Test
    public void testQuitOnQ() {
        AtomicInteger quits = new AtomicInteger();
        ConsoleQuitWatcher watcher =
                new ConsoleQuitWatcher(new ByteArrayInputStream("abc\nq\nq\n".getBytes(UTF_8)), quits::incrementAndGet)
                        .start();

        Awaitility.await().atMost(5, TimeUnit.SECONDS).until(watcher::isQuitRequested);
        Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() -> quits.get() == 1);
        assertEquals(quits.get(), 1);
    }

    @Test
    public void testEndOfInputDoesNotQuit() {
        AtomicInteger quits = new AtomicInteger();
        ConsoleQuitWatcher watcher =
                new ConsoleQuitWatcher(new ByteArrayInputStream("abc\n".getBytes(UTF_8)), quits::incrementAndGet)
                        .start();

        Awaitility.await()
                .during(200, TimeUnit.MILLISECONDS)
                .atMost(2, TimeUnit.SECONDS)
                .until(() -> !watcher.isQuitRequested());
        assertEquals(quits.get(), 0);
        assertFalse(watcher.isQuitRequested());
    }
}
