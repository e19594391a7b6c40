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
 * A path expression designating a set of {@link Path paths}.
 *
 * <p>Chunks are separated by {@code '/'}. Within a chunk, {@code '*'} matches any sequence of characters
 * that does not contain {@code '/'}. A chunk made of exactly {@code "**"} matches zero or more chunks.
 * For example {@code /demo/example/**} matches {@code /demo/example} and {@code /demo/example/a/b},
 * and {@code /demo/*}{@code /eval} matches {@code /demo/x/eval}.
 */
public final class PathExpr {

    private static final String RESERVED_CHARS = "?#()[]";
    private static final String MULTI_WILDCARD = "**";

    private final String expr;
    private final String[] chunks;

    private PathExpr(String expr) {
        this.expr = expr;
        this.chunks = expr.length() == 1 ? new String[0] : expr.substring(1).split("/");
    }

    public static PathExpr of(String expr) throws InvalidPathException {
        if (expr == null || expr.isEmpty()) {
            throw new InvalidPathException("Path expression cannot be empty");
        }
        if (expr.charAt(0) != '/') {
            throw new InvalidPathException("Path expression must be absolute (start with '/'): " + expr);
        }
        for (int i = 0; i < expr.length(); i++) {
            if (RESERVED_CHARS.indexOf(expr.charAt(i)) >= 0) {
                throw new InvalidPathException("Path expression cannot contain '" + expr.charAt(i) + "': " + expr);
            }
        }
        String normalized = expr.length() > 1 && expr.endsWith("/") ? expr.substring(0, expr.length() - 1) : expr;
        if (normalized.length() > 1) {
            for (String chunk : normalized.substring(1).split("/", -1)) {
                if (chunk.isEmpty()) {
                    throw new InvalidPathException("Path expression cannot contain an empty chunk: " + expr);
                }
                if (chunk.contains(MULTI_WILDCARD) && !chunk.equals(MULTI_WILDCARD)) {
                    throw new InvalidPathException("'**' must be a whole chunk: " + expr);
                }
            }
        }
        return new PathExpr(normalized);
    }

    static PathExpr ofValidated(String expr) {
        return new PathExpr(expr);
    }

    /**
     * @return true if this expression contains no wildcard, i.e. designates a single path
     */
    public boolean isPath() {
        return expr.indexOf('*') < 0;
    }

    public Path toPath() throws InvalidPathException {
        return Path.of(expr);
    }

    /**
     * @return true if {@code path} belongs to the set designated by this expression
     */
    public boolean matches(Path path) {
        return intersects(path.toPathExpr());
    }

    /**
     * @return true if at least one path is designated by both this expression and {@code other}
     */
    public boolean intersects(PathExpr other) {
        Boolean[][] memo = new Boolean[chunks.length + 1][other.chunks.length + 1];
        return intersectChunks(chunks, 0, other.chunks, 0, memo);
    }

    private static boolean intersectChunks(String[] a, int i, String[] b, int j, Boolean[][] memo) {
        if (memo[i][j] != null) {
            return memo[i][j];
        }
        boolean result;
        if (i == a.length && j == b.length) {
            result = true;
        } else if (i == a.length) {
            result = allMultiWildcards(b, j);
        } else if (j == b.length) {
            result = allMultiWildcards(a, i);
        } else if (a[i].equals(MULTI_WILDCARD)) {
            result = intersectChunks(a, i + 1, b, j, memo) || intersectChunks(a, i, b, j + 1, memo);
        } else if (b[j].equals(MULTI_WILDCARD)) {
            result = intersectChunks(a, i, b, j + 1, memo) || intersectChunks(a, i + 1, b, j, memo);
        } else {
            result = intersectChunk(a[i], b[j]) && intersectChunks(a, i + 1, b, j + 1, memo);
        }
        memo[i][j] = result;
        return result;
    }

    private static boolean allMultiWildcards(String[] chunks, int from) {
        for (int k = from; k < chunks.length; k++) {
            if (!chunks[k].equals(MULTI_WILDCARD)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Two chunks intersect if some string without {@code '/'} matches both of them.
     */
    static boolean intersectChunk(String a, String b) {
        if (a.equals(b) || a.equals("*") || b.equals("*")) {
            return true;
        }
        Boolean[][] memo = new Boolean[a.length() + 1][b.length() + 1];
        return intersectChars(a, 0, b, 0, memo);
    }

    private static boolean intersectChars(String a, int i, String b, int j, Boolean[][] memo) {
        if (memo[i][j] != null) {
            return memo[i][j];
        }
        boolean result;
        if (i == a.length() && j == b.length()) {
            result = true;
        } else if (i == a.length()) {
            result = onlyStars(b, j);
        } else if (j == b.length()) {
            result = onlyStars(a, i);
        } else if (a.charAt(i) == '*') {
            result = intersectChars(a, i + 1, b, j, memo) || intersectChars(a, i, b, j + 1, memo);
        } else if (b.charAt(j) == '*') {
            result = intersectChars(a, i, b, j + 1, memo) || intersectChars(a, i + 1, b, j, memo);
        } else {
            result = a.charAt(i) == b.charAt(j) && intersectChars(a, i + 1, b, j + 1, memo);
        }
        memo[i][j] = result;
        return result;
    }

    private static boolean onlyStars(String s, int from) {
        for (int k = from; k < s.length(); k++) {
            if (s.charAt(k) != '*') {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathExpr)) {
            return false;
        }
        return expr.equals(((PathExpr) o).expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr);
    }

    @Override
    public String toString() {
        return expr;
    }
}
