package com.tracelink.web;

import com.tracelink.observability.TelemetryMetrics;
import com.tracelink.trace.Span;
import com.tracelink.trace.SpanStatus;
import com.tracelink.trace.Tracer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.util.Map;

/**
 * Opens a root span for every HTTP request and records the request metrics.
 * The span is named {@code <METHOD> <route>} once the handler mapping has
 * resolved the route template, so all lookups of {@code /api/orders/{id}}
 * share one name. Requests no handler matched get a fixed route
 * ({@value #ROUTE_NOT_FOUND}, {@value #ROUTE_REDIRECTION} or
 * {@value #ROUTE_UNKNOWN}) so arbitrary paths never become metric labels.
 *
 * <p>The filter owns the request boundary: anything left on the thread's
 * context stack by an earlier request is discarded before the root opens,
 * and spans a handler leaves open are closed together with the root.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTracingFilter extends OncePerRequestFilter {

    static final String ROUTE_NOT_FOUND = "NOT_FOUND";
    static final String ROUTE_REDIRECTION = "REDIRECTION";
    static final String ROUTE_UNKNOWN = "UNKNOWN";

    private final Tracer tracer;
    private final TelemetryMetrics metrics;

    public RequestTracingFilter(Tracer tracer, TelemetryMetrics metrics) {
        this.tracer = tracer;
        this.metrics = metrics;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.equals("/health") || path.equals("/actuator") || path.startsWith("/actuator/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String method = request.getMethod();
        long started = System.nanoTime();
        metrics.requestStarted();
        tracer.resetContext();
        Span span = tracer.open(method, Map.of(
                "http.method", method,
                "http.target", request.getRequestURI()));

        boolean failed = false;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            failed = true;
            span.recordException(e);
            throw e;
        } finally {
            int status = failed && response.getStatus() < 400
                    ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR
                    : response.getStatus();
            String route = routeOf(request, status);

            span.updateName(method + " " + route);
            span.setAttribute("http.route", route);
            span.setAttribute("http.status_code", status);
            tracer.closeScope(span, status >= 500 ? SpanStatus.error("HTTP " + status) : null);
            metrics.requestFinished(route, method, status, (System.nanoTime() - started) / 1e9);
        }
    }

    static String routeOf(HttpServletRequest request, int status) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern != null) {
            return pattern.toString();
        }
        if (status == HttpServletResponse.SC_NOT_FOUND) {
            return ROUTE_NOT_FOUND;
        }
        if (status >= 300 && status < 400) {
            return ROUTE_REDIRECTION;
        }
        return ROUTE_UNKNOWN;
    }
}
