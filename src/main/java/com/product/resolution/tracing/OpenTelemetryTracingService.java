package com.product.resolution.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TracingService} backed by OpenTelemetry. Requires {@code opentelemetry-api} on the
 * classpath (optional dependency).
 *
 * <p>A run span stays registered under its run id until it is closed; phase spans of that
 * run are started as its children, so one run reads as a single trace even when phases
 * execute on pool threads.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_SCOPE = "com.product.resolution";
    static final String RUN_SPAN_NAME = "product.resolution.run";
    static final String PHASE_SPAN_PREFIX = "product.resolution.";
    static final AttributeKey<String> RUN_ID = AttributeKey.stringKey("product.run_id");
    static final AttributeKey<String> PHASE = AttributeKey.stringKey("product.phase");

    private final Tracer tracer;
    private final Map<String, io.opentelemetry.api.trace.Span> openRuns = new ConcurrentHashMap<>();

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startRun(String runId) {
        SpanBuilder builder = tracer.spanBuilder(RUN_SPAN_NAME);
        builder.setSpanKind(SpanKind.INTERNAL);
        builder.setAttribute(RUN_ID, runId);
        io.opentelemetry.api.trace.Span runSpan = builder.startSpan();
        openRuns.put(runId, runSpan);
        return new ProductSpan(runSpan, () -> openRuns.remove(runId, runSpan));
    }

    @Override
    public Span startPhase(String runId, String phase) {
        SpanBuilder builder = tracer.spanBuilder(PHASE_SPAN_PREFIX + phase);
        builder.setAttribute(RUN_ID, runId);
        builder.setAttribute(PHASE, phase);
        io.opentelemetry.api.trace.Span runSpan = openRuns.get(runId);
        if (runSpan != null) {
            builder.setParent(Context.root().with(runSpan));
        }
        return new ProductSpan(builder.startSpan(), () -> { });
    }

    int openRunCount() {
        return openRuns.size();
    }

    private static final class ProductSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;
        private final Runnable onClose;

        ProductSpan(io.opentelemetry.api.trace.Span delegate, Runnable onClose) {
            this.delegate = delegate;
            this.onClose = onClose;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            onClose.run();
            delegate.end();
        }
    }
}
