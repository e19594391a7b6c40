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
package org.tracedws.opentelemetry;

import static com.google.common.base.Preconditions.checkArgument;
import com.google.common.annotations.VisibleForTesting;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdkBuilder;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.semconv.ResourceAttributes;
import java.io.Closeable;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Bootstraps the OpenTelemetry SDK for one program and furnishes access to its tracers. Spans are
 * batched and exported over OTLP by default. All defaults are overridden by {@code otel.*} system
 * properties or {@code OTEL_*} environment variables.
 */
@Slf4j
public class TracingService implements Closeable {

    public static final String OTEL_SDK_DISABLED_KEY = "otel.sdk.disabled";
    public static final String OTEL_TRACES_EXPORTER_KEY = "otel.traces.exporter";
    public static final String OTEL_METRICS_EXPORTER_KEY = "otel.metrics.exporter";
    public static final String OTEL_LOGS_EXPORTER_KEY = "otel.logs.exporter";
    public static final String OTEL_PROPAGATORS_KEY = "otel.propagators";

    static final long DEFAULT_FLUSH_TIMEOUT_SECONDS = 10;

    private final AtomicReference<OpenTelemetrySdk> openTelemetrySdkReference = new AtomicReference<>();

    /**
     * Instantiates the OpenTelemetry SDK.
     *
     * @param serviceName
     *      The name of the service. Cannot be null or blank.
     * @param serviceVersion
     *      The version of the service. Optional.
     * @param builderCustomizer
     *      Allows customizing the SDK builder; for testing purposes only.
     */
    @Builder
    public TracingService(String serviceName,
                          String serviceVersion,
                          @VisibleForTesting Consumer<AutoConfiguredOpenTelemetrySdkBuilder> builderCustomizer) {
        checkArgument(StringUtils.isNotBlank(serviceName), "Service name cannot be empty");
        var sdkBuilder = AutoConfiguredOpenTelemetrySdk.builder();

        sdkBuilder.addPropertiesSupplier(() -> Map.of(
                OTEL_TRACES_EXPORTER_KEY, "otlp",
                OTEL_METRICS_EXPORTER_KEY, "none",
                OTEL_LOGS_EXPORTER_KEY, "none",
                OTEL_PROPAGATORS_KEY, "tracecontext"
        ));

        sdkBuilder.addResourceCustomizer(
                (resource, __) -> {
                    var resourceBuilder = Resource.builder();
                    // Do not override attributes if already set (via system properties or environment variables).
                    if (Objects.equals(Resource.getDefault().getAttribute(ResourceAttributes.SERVICE_NAME),
                                       resource.getAttribute(ResourceAttributes.SERVICE_NAME))) {
                        resourceBuilder.put(ResourceAttributes.SERVICE_NAME, serviceName);
                    }
                    if (StringUtils.isNotBlank(serviceVersion)
                            && resource.getAttribute(ResourceAttributes.SERVICE_VERSION) == null) {
                        resourceBuilder.put(ResourceAttributes.SERVICE_VERSION, serviceVersion);
                    }
                    var process = ProcessHandle.current();
                    if (resource.getAttribute(TracingAttributes.PROCESS_PID) == null) {
                        resourceBuilder.put(TracingAttributes.PROCESS_PID, process.pid());
                    }
                    process.info().command().ifPresent(command -> {
                        if (resource.getAttribute(TracingAttributes.PROCESS_EXECUTABLE_PATH) == null) {
                            resourceBuilder.put(TracingAttributes.PROCESS_EXECUTABLE_PATH, command);
                        }
                    });
                    return resource.merge(resourceBuilder.build());
                });

        if (builderCustomizer != null) {
            builderCustomizer.accept(sdkBuilder);
        }

        openTelemetrySdkReference.set(sdkBuilder.build().getOpenTelemetrySdk());
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetrySdkReference.get();
    }

    public Tracer getTracer(String instrumentationScope) {
        return getOpenTelemetry().getTracer(instrumentationScope);
    }

    /**
     * Exports the spans that are still buffered.
     *
     * @return true if the export completed within {@code timeout}
     */
    public boolean forceFlush(long timeout, TimeUnit unit) {
        OpenTelemetrySdk sdk = openTelemetrySdkReference.get();
        if (sdk == null) {
            return true;
        }
        CompletableResultCode result = sdk.getSdkTracerProvider().forceFlush().join(timeout, unit);
        if (!result.isSuccess()) {
            log.warn("Failed to flush spans within {} {}", timeout, unit);
        }
        return result.isSuccess();
    }

    @Override
    public void close() {
        OpenTelemetrySdk openTelemetrySdk = openTelemetrySdkReference.get();
        if (openTelemetrySdk == null) {
            return;
        }
        forceFlush(DEFAULT_FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (openTelemetrySdkReference.compareAndSet(openTelemetrySdk, null)) {
            openTelemetrySdk.close();
        }
    }
}
