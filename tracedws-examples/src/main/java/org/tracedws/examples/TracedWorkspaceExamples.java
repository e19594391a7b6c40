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

import picocli.CommandLine;

@CommandLine.Command(name = "tracedws-examples",
        scope = CommandLine.ScopeType.INHERIT,
        mixinStandardHelpOptions = true,
        showDefaultValues = true
)
public class TracedWorkspaceExamples {

    protected final CommandLine commander;

    public TracedWorkspaceExamples() {
        this.commander = new CommandLine(this);
        addCommand("sensor", new SensorCommand());
        addCommand("motion", new MotionCommand());
        addCommand("sub", new SubscribeCommand());
        addCommand("get", new GetCommand());
        addCommand("eval", new EvalCommand());
    }

    private void addCommand(String name, ExampleCommand cmd) {
        commander.addSubcommand(name, cmd.getCommander());
    }

    public static void main(String[] args) {
        TracedWorkspaceExamples tool = new TracedWorkspaceExamples();
        if (args.length == 0) {
            System.out.println("Usage: tracedws-examples [sensor|motion|sub|get|eval] [options]");
            tool.commander.usage(System.out);
            ExampleClientUtils.exit(0);
            return;
        }

        if (tool.run(args)) {
            ExampleClientUtils.exit(0);
        } else {
            ExampleClientUtils.exit(1);
        }
    }

    protected boolean run(String[] args) {
        return commander.execute(args) == 0;
    }
}
