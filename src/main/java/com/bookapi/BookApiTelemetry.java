package com.bookapi;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Request-level instrumentation, applied as decorators around the router and
 * around each route handler.
 *
 * <p>Emits:
 * <ul>
 *   <li>a server span per request, continuing a W3C {@code traceparent} if present</li>
 *   <li>an internal span per handler invocation</li>
 *   <li>{@code bookapi.requests} counter and {@code bookapi.request.duration}
 *       histogram (ms), keyed by {@code operation} and {@code outcome}</li>
 * </ul>
 *
 * <p>Every call into the OpenTelemetry API is guarded: an instrumentation
 * failure is logged at debug level and the request proceeds untouched.
 */
public class BookApiTelemetry {

    private static final Logger log = LoggerFactory.getLogger(BookApiTelemetry.class);

    static final AttributeKey<String> OPERATION = AttributeKey.stringKey("operation");
    static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("outcome");

    private static final TextMapGetter<HttpRequest> HEADER_GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(HttpRequest carrier) {
            return carrier.getHeaders().keySet();
        }

        @Override
        public String get(HttpRequest carrier, String key) {
            return carrier == null || key == null ? null : carrier.getHeaders().get(key.toLowerCase());
        }
    };

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final LongCounter requests;
    private final DoubleHistogram duration;

    public BookApiTelemetry(OpenTelemetry openTelemetry, String instrumentationName) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(instrumentationName);
        Meter meter = openTelemetry.getMeter(instrumentationName);
        this.requests = meter.counterBuilder("bookapi.requests")
                .setDescription("Handled book API requests by operation and outcome")
                .setUnit("{request}")
                .build();
        this.duration = meter.histogramBuilder("bookapi.request.duration")
                .setDescription("Handler duration by operation and outcome")
                .setUnit("ms")
                .build();
    }

    public Tracer getTracer() {
        return tracer;
    }

    /** Wraps the whole dispatch in a server span, the outermost layer. */
    public Function<HttpRequest, HttpResponse> traceRequests(Function<HttpRequest, HttpResponse> next) {
        return request -> {
            Span span = startServerSpan(request);
            Scope scope = makeCurrent(span);
            HttpResponse response = null;
            try {
                response = next.apply(request);
                return response;
            } finally {
                closeQuietly(scope);
                endServerSpan(span, response);
            }
        };
    }

    /** Instruments a handler whose operation name does not depend on the request. */
    public Function<HttpRequest, HttpResponse> instrument(String operation,
                                                          Function<HttpRequest, HttpResponse> handler) {
        return instrument(request -> operation, handler);
    }

    public Function<HttpRequest, HttpResponse> instrument(Function<HttpRequest, String> operation,
                                                          Function<HttpRequest, HttpResponse> handler) {
        return request -> {
            String op = operation.apply(request);
            long start = System.nanoTime();
            Span span = startHandlerSpan(op, request);
            Scope scope = makeCurrent(span);
            HttpResponse response = null;
            try {
                response = handler.apply(request);
                return response;
            } finally {
                closeQuietly(scope);
                record(op, span, response, (System.nanoTime() - start) / 1_000_000.0);
            }
        };
    }

    private Span startServerSpan(HttpRequest request) {
        try {
            Context parent = openTelemetry.getPropagators().getTextMapPropagator()
                    .extract(Context.root(), request, HEADER_GETTER);
            Span span = tracer.spanBuilder(request.getMethod() + " " + request.getPath())
                    .setParent(parent)
                    .setSpanKind(SpanKind.SERVER)
                    .startSpan();
            span.setAttribute("http.method", request.getMethod());
            span.setAttribute("http.target", request.getPath());
            String userAgent = request.getHeaders().get("user-agent");
            if (userAgent != null) {
                span.setAttribute("http.user_agent", userAgent);
            }
            return span;
        } catch (RuntimeException e) {
            log.debug("Failed to start request span: {}", e.getMessage());
            return Span.getInvalid();
        }
    }

    private void endServerSpan(Span span, HttpResponse response) {
        try {
            if (response != null) {
                span.setAttribute("http.status_code", response.getStatusCode());
                if (response.getStatusCode() >= 400) {
                    span.setAttribute("error", response.getOutcome());
                }
                if (response.getStatusCode() >= 500) {
                    span.setStatus(StatusCode.ERROR);
                }
            } else {
                span.setStatus(StatusCode.ERROR, "unhandled exception");
            }
            span.end();
        } catch (RuntimeException e) {
            log.debug("Failed to end request span: {}", e.getMessage());
        }
    }

    private Span startHandlerSpan(String operation, HttpRequest request) {
        try {
            Span span = tracer.spanBuilder("books." + operation).startSpan();
            span.setAttribute("operation", operation);
            String id = BookHandlers.idParam(request);
            if (id != null) {
                span.setAttribute("book.query.id", id);
            }
            return span;
        } catch (RuntimeException e) {
            log.debug("Failed to start handler span: {}", e.getMessage());
            return Span.getInvalid();
        }
    }

    private void record(String operation, Span span, HttpResponse response, double millis) {
        String outcome = response != null ? response.getOutcome() : "unhandled_error";
        try {
            span.setAttribute("response.status", outcome);
            if (response == null || response.getStatusCode() >= 500) {
                span.setStatus(StatusCode.ERROR, outcome);
            }
            span.end();
        } catch (RuntimeException e) {
            log.debug("Failed to end handler span: {}", e.getMessage());
        }
        try {
            Attributes attributes = Attributes.of(OPERATION, operation, OUTCOME, outcome);
            requests.add(1, attributes);
            duration.record(millis, attributes);
        } catch (RuntimeException e) {
            log.debug("Failed to record request metrics: {}", e.getMessage());
        }
    }

    private static Scope makeCurrent(Span span) {
        try {
            return span.makeCurrent();
        } catch (RuntimeException e) {
            log.debug("Failed to activate span: {}", e.getMessage());
            return Scope.noop();
        }
    }

    private static void closeQuietly(Scope scope) {
        try {
            scope.close();
        } catch (RuntimeException e) {
            log.debug("Failed to close span scope: {}", e.getMessage());
        }
    }
}
