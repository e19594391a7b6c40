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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import org.tracedws.client.api.WorkspaceException.InvalidPathException;

public class PathTest {

    @DataProvider(name = "invalidPaths")
    public Object[][] invalidPaths() {
        return new Object[][] {
                { null },
                { "" },
                { "demo/example" },
                { "/demo/*/example" },
                { "/demo/example?x" },
                { "/demo/example#frag" },
                { "/demo/(example)" },
                { "/demo//example" },
                { "/demo/example//" },
                { "//" },
        };
    }

    @Test(dataProvider = "invalidPaths")
    public void testInvalidPath(String path) {
        expectThrows(InvalidPathException.class, () -> Path.of(path));
    }

    @Test
    public void testValidPath() throws Exception {
        assertEquals(Path.of("/demo/example/eval").toString(), "/demo/example/eval");
        assertEquals(Path.of("/demo/example/").toString(), "/demo/example");
        assertEquals(Path.of("/demo/example/"), Path.of("/demo/example"));
        assertTrue(Path.of("/").isRoot());
        assertFalse(Path.of("/demo").isRoot());
    }

    @Test
    public void testResolve() throws Exception {
        Path prefix = Path.of("/demo");
        assertEquals(prefix.resolve("example/eval"), Path.of("/demo/example/eval"));
        assertEquals(prefix.resolve("/other"), Path.of("/other"));
        assertEquals(Path.of("/").resolve("demo"), Path.of("/demo"));
        expectThrows(InvalidPathException.class, () -> prefix.resolve("a*"));
    }

    @Test
    public void testLastChunk() throws Exception {
        assertEquals(Path.of("/demo/example/eval").lastChunk(), "eval");
        assertEquals(Path.of("/").lastChunk(), "");
    }

    @Test
    public void testOrderingAndExpression() throws Exception {
        Path a = Path.of("/demo/a");
        Path b = Path.of("/demo/b");
        assertTrue(a.compareTo(b) < 0);
        assertTrue(a.toPathExpr().isPath());
        assertTrue(a.toPathExpr().matches(a));
        assertFalse(a.toPathExpr().matches(b));
    }
}
