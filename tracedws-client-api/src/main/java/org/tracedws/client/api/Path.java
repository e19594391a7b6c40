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

import java.util.Objects;
import org.tracedws.client.api.WorkspaceException.InvalidPathException;

/**
 * An absolute resource name in the workspace namespace, such as {@code /demo/example/eval}.
 *
 * <p>A path starts with {@code '/'}, has no empty chunk and contains none of the characters reserved
 * for {@link PathExpr path expressions} and {@link Selector selectors}.
 */
public final class Path implements Comparable<Path> {

    static final String RESERVED_CHARS = "*?#()[]";

    private final String path;

    private Path(String path) {
        this.path = path;
    }

    /**
     * Parses an absolute path. A single trailing {@code '/'} is dropped.
     *
     * @throws InvalidPathException if the string is not a valid path
     */
    public static Path of(String path) throws InvalidPathException {
        if (path == null || path.isEmpty()) {
            throw new InvalidPathException("Path cannot be empty");
        }
        if (path.charAt(0) != '/') {
            throw new InvalidPathException("Path must be absolute (start with '/'): " + path);
        }
        for (int i = 0; i < path.length(); i++) {
            if (RESERVED_CHARS.indexOf(path.charAt(i)) >= 0) {
                throw new InvalidPathException("Path cannot contain '" + path.charAt(i) + "': " + path);
            }
        }
        if (path.contains("//")) {
            throw new InvalidPathException("Path cannot contain an empty chunk: " + path);
        }
        String normalized = path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return new Path(normalized);
    }

    /**
     * Resolves {@code relative} against this path. An absolute argument is returned as is.
     */
    public Path resolve(String relative) throws InvalidPathException {
        if (relative.startsWith("/")) {
            return of(relative);
        }
        return of(isRoot() ? "/" + relative : path + "/" + relative);
    }

    public boolean isRoot() {
        return path.length() == 1;
    }

    /**
     * The last chunk of this path, or the empty string for the root path.
     */
    public String lastChunk() {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    public PathExpr toPathExpr() {
        return PathExpr.ofValidated(path);
    }

    @Override
    public int compareTo(Path other) {
        return path.compareTo(other.path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Path)) {
            return false;
        }
        return path.equals(((Path) o).path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path);
    }

    @Override
    public String toString() {
        return path;
    }
}
