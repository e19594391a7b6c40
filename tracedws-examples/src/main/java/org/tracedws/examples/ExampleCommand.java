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

import java.io.InputStream;
import java.io.PrintStream;
import java.util.concurrent.Callable;
import picocli.CommandLine;

/**
 * Base of the example programs. Output meant for the user is printed to {@link #out}; diagnostics go
 * to the log. Interactive programs read their console commands from {@link #in}.
 */
public abstract class ExampleCommand implements Callable<Integer> {
    private final CommandLine commander;
    protected PrintStream out = System.out;
    protected InputStream in = System.in;

    public ExampleCommand(String cmdName) {
        commander = new CommandLine(this);
        commander.setCommandName(cmdName);
    }

    public boolean run(String[] args) {
        return commander.execute(args) == 0;
    }

    public void parse(String[] args) {
        commander.parseArgs(args);
    }

    /**
     * Validate the CLI arguments. Subclasses should call super.validate().
     */
    public void validate() throws Exception {
    }

    // Picocli entrypoint.
    @Override
    public Integer call() throws Exception {
        validate();
        run();
        return 0;
    }

    public abstract void run() throws Exception;

    protected CommandLine getCommander() {
        return commander;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    void setIn(InputStream in) {
        this.in = in;
    }

    /**
     * Simulates some processing time.
     */
    protected static void simulateWork(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    protected class ParameterException extends CommandLine.ParameterException {
        public ParameterException(String msg) {
            super(commander, msg);
        }

        public ParameterException(String msg, Throwable e) {
            super(commander, msg, e);
        }
    }
}
