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

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CountDownLatch;
import lombok.extern.slf4j.Slf4j;

/**
 * Watches an input stream on a daemon thread and runs an action when the user types {@code 'q'}.
 *
 * <p>When the input reaches its end without a {@code 'q'} the action is never run, so a program
 * started in the background keeps running until it is killed.
 */
@Slf4j
class ConsoleQuitWatcher {

    static final int QUIT_KEY = 'q';

    private final InputStream in;
    private final Runnable onQuit;
    private final CountDownLatch quit = new CountDownLatch(1);

    ConsoleQuitWatcher(InputStream in, Runnable onQuit) {
        this.in = in;
        this.onQuit = onQuit;
    }

    ConsoleQuitWatcher start() {
        Thread thread = new Thread(this::watch, "tracedws-console-quit-watcher");
        thread.setDaemon(true);
        thread.start();
        return this;
    }

    private void watch() {
        try {
            int c;
            while ((c = in.read()) >= 0) {
                if (c == QUIT_KEY) {
                    quit.countDown();
                    onQuit.run();
                    return;
                }
            }
            log.debug("Console input closed, type Ctrl-C to quit");
        } catch (IOException e) {
            log.warn("Failed to read console input, type Ctrl-C to quit", e);
        }
    }

    boolean isQuitRequested() {
        return quit.getCount() == 0;
    }
}
