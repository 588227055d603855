package com.metadata.reconciliation.tracing;

import java.util.Map;

/**
 * Opens spans around reconciliation work. The default {@link NoOpTracingService}
 * keeps the library usable without OpenTelemetry on the classpath.
 */
public interface TracingService {

    String RECONCILE_SPAN = "metadata.reconcile";
    String OVERRIDE_SPAN = "metadata.override";

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
