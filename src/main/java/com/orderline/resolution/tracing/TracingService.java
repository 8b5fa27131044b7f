package com.orderline.resolution.tracing;

import java.util.Map;

/**
 * Starts spans around pipeline stages. The default {@link NoOpTracingService} records
 * nothing; {@link OpenTelemetryTracingService} bridges to an OpenTelemetry tracer.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
