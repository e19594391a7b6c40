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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.tracedws.client.api.WorkspaceException.InvalidPathException;
import org.tracedws.client.api.WorkspaceException.InvalidSelectorException;

/**
 * Selects a set of resources, optionally with a predicate, properties and a fragment.
 *
 * <p>Syntax: {@code <pathExpr>[?<predicate>][(<properties>)][#<fragment>]} where properties are
 * {@code key=value} pairs separated by {@code ';'}, e.g. {@code /demo/example/eval?(name=Bob)}.
 */
public final class Selector {

    private final PathExpr pathExpr;
    private final String predicate;
    private final Map<String, String> properties;
    private final String fragment;
    private final String selector;

    private Selector(PathExpr pathExpr, String predicate, Map<String, String> properties, String fragment,
                     String selector) {
        this.pathExpr = pathExpr;
        this.predicate = predicate;
        this.properties = properties;
        this.fragment = fragment;
        this.selector = selector;
    }

    public static Selector of(String selector) throws InvalidSelectorException {
        if (selector == null || selector.isEmpty()) {
            throw new InvalidSelectorException("Selector cannot be empty");
        }
        String rest = selector;
        String fragment = null;
        int hash = rest.indexOf('#');
        if (hash >= 0) {
            fragment = rest.substring(hash + 1);
            rest = rest.substring(0, hash);
        }

        String predicate = "";
        Map<String, String> properties = Collections.emptyMap();
        int question = rest.indexOf('?');
        String expr = question >= 0 ? rest.substring(0, question) : rest;
        if (question >= 0) {
            String query = rest.substring(question + 1);
            int open = query.indexOf('(');
            if (open >= 0) {
                if (!query.endsWith(")")) {
                    throw new InvalidSelectorException("Unterminated properties in selector: " + selector);
                }
                predicate = query.substring(0, open);
                properties = parseProperties(query.substring(open + 1, query.length() - 1));
            } else {
                if (query.indexOf(')') >= 0) {
                    throw new InvalidSelectorException("Unbalanced ')' in selector: " + selector);
                }
                predicate = query;
            }
        }

        PathExpr pathExpr;
        try {
            pathExpr = PathExpr.of(expr);
        } catch (InvalidPathException e) {
            throw new InvalidSelectorException("Invalid path expression in selector '" + selector + "': "
                    + e.getMessage());
        }
        return new Selector(pathExpr, predicate, properties, fragment, selector);
    }

    public static Selector of(PathExpr pathExpr) {
        return new Selector(pathExpr, "", Collections.emptyMap(), null, pathExpr.toString());
    }

    public static Selector of(Path path) {
        return of(path.toPathExpr());
    }

    static Map<String, String> parseProperties(String props) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String entry : props.split(";")) {
            if (entry.isEmpty()) {
                continue;
            }
            int eq = entry.indexOf('=');
            if (eq >= 0) {
                result.put(entry.substring(0, eq), entry.substring(eq + 1));
            } else {
                result.put(entry, "");
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public PathExpr getPathExpr() {
        return pathExpr;
    }

    public String getPredicate() {
        return predicate;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public Optional<String> getFragment() {
        return Optional.ofNullable(fragment);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Selector)) {
            return false;
        }
        return selector.equals(((Selector) o).selector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector);
    }

    @Override
    public String toString() {
        return selector;
    }
}
