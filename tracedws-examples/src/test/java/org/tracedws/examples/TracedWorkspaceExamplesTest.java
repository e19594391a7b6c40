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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import picocli.CommandLine;

public class TracedWorkspaceExamplesTest {

    private final List<Integer> exitCodes = new ArrayList<>();

    @BeforeMethod
    public void setup() {
        exitCodes.clear();
        ExampleClientUtils.setExitProcedure(exitCodes::add);
    }

    @AfterMethod(alwaysRun = true)
    public void cleanup() {
        ExampleClientUtils.setExitProcedure(System::exit);
    }

    @Test
    public void testSubcommands() {
        TracedWorkspaceExamples tool = new TracedWorkspaceExamples();
        assertEquals(tool.commander.getSubcommands().keySet(), Set.of("sensor", "motion", "sub", "get",
                "eval"));
        CommandLine eval = tool.commander.getSubcommands().get("eval");
        assertTrue(eval.getCommandSpec().findOption("--path") != null);
        assertTrue(eval.getCommandSpec().findOption("--mode") != null);
    }

    @Test
    public void testNoArgumentsPrintsUsage() {
        TracedWorkspaceExamples.main(new String[0]);
        assertEquals(exitCodes, List.of(0));
    }

    @Test
    public void testHelp() {
        TracedWorkspaceExamples.main(new String[] {"--help"});
        assertEquals(exitCodes, List.of(0));
    }

    @Test
    public void testInvalidArguments() {
        TracedWorkspaceExamples.main(new String[] {"sensor", "--mode", "router"});
        assertEquals(exitCodes, List.of(1));

        exitCodes.clear();
        TracedWorkspaceExamples.main(new String[] {"unknown"});
        assertEquals(exitCodes, List.of(1));
    }
}
