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

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base type of exceptions thrown by the workspace client.
 */
@SuppressWarnings("serial")
public class WorkspaceException extends IOException {

    /**
     * Constructs a {@code WorkspaceException} with the specified detail message.
     *
     * @param msg
     *        The detail message (which is saved for later retrieval
     *        by the {@link #getMessage()} method)
     */
    public WorkspaceException(String msg) {
        super(msg);
    }

    /**
     * Constructs a {@code WorkspaceException} with the specified cause.
     *
     * @param t
     *        The cause (which is saved for later retrieval by the
     *        {@link #getCause()} method).
     */
    public WorkspaceException(Throwable t) {
        super(t);
    }

    public WorkspaceException(String msg, Throwable t) {
        super(msg, t);
    }

    /**
     * Thrown when a string is not a valid {@link Path} or {@link PathExpr}.
     */
    public static class InvalidPathException extends WorkspaceException {
        public InvalidPathException(String msg) {
            super(msg);
        }
    }

    /**
     * Thrown when a string is not a valid {@link Selector}.
     */
    public static class InvalidSelectorException extends WorkspaceException {
        public InvalidSelectorException(String msg) {
            super(msg);
        }
    }

    /**
     * Thrown when the session configuration is rejected.
     */
    public static class InvalidConfigurationException extends WorkspaceException {
        public InvalidConfigurationException(String msg) {
            super(msg);
        }

        public InvalidConfigurationException(String msg, Throwable t) {
            super(msg, t);
        }
    }

    public static class TimeoutException extends WorkspaceException {
        public TimeoutException(String msg) {
            super(msg);
        }

        public TimeoutException(Throwable t) {
            super(t);
        }
    }

    /**
     * Thrown when an operation is attempted on a closed session or stream.
     */
    public static class AlreadyClosedException extends WorkspaceException {
        public AlreadyClosedException(String msg) {
            super(msg);
        }
    }

    /**
     * Wraps a failure of the underlying messaging transport.
     */
    public static class TransportException extends WorkspaceException {
        public TransportException(String msg) {
            super(msg);
        }

        public TransportException(Throwable t) {
            super(t);
        }

        public TransportException(String msg, Throwable t) {
            super(msg, t);
        }
    }

    /**
     * Converts the cause of an asynchronous failure back into a {@link WorkspaceException}.
     */
    public static WorkspaceException unwrap(Throwable t) {
        if (t instanceof WorkspaceException) {
            return (WorkspaceException) t;
        } else if (t instanceof RuntimeException && t.getCause() == null) {
            return new WorkspaceException(t);
        } else if (t instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new WorkspaceException(t);
        } else if (!(t instanceof ExecutionException) && !(t instanceof CompletionException)) {
            return new WorkspaceException(t);
        }

        Throwable cause = t.getCause();
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof WorkspaceException) {
            return (WorkspaceException) cause;
        } else if (cause instanceof java.util.concurrent.TimeoutException) {
            return new TimeoutException(cause);
        } else if (cause instanceof IOException) {
            return new TransportException(cause.getMessage(), cause);
        } else {
            return new WorkspaceException(cause);
        }
    }
}
