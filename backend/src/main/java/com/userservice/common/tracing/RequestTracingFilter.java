package com.userservice.common.tracing;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Wraps every request: assigns a request id, logs start and completion, and
 * times the request by route pattern and outcome.
 *
 * - Reads the request id from X-Request-Id when the caller supplies a
 *   well-formed one (up to 64 letters, digits or hyphens)
 * - Otherwise generates a UUID
 * - Exposes it in the MDC for log lines and echoes it in the response
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTracingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String TIMER_NAME = "http.requests.traced";

    static final String UNKNOWN = "UNKNOWN";

    private static final Pattern VALID_REQUEST_ID = Pattern.compile("[A-Za-z0-9-]{1,64}");

    private final MeterRegistry meterRegistry;

    public RequestTracingFilter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        MDC.put(MDC_REQUEST_ID, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        long start = System.nanoTime();
        log.debug("Started {} {}", request.getMethod(), request.getRequestURI());

        boolean failed = false;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException ex) {
            failed = true;
            throw ex;
        } finally {
            long elapsedNanos = System.nanoTime() - start;
            int status = failed ? HttpStatus.INTERNAL_SERVER_ERROR.value() : response.getStatus();
            record(request, status, elapsedNanos);
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void record(HttpServletRequest request, int status, long elapsedNanos) {
        String route = resolveRoute(request);
        String outcome = outcomeOf(status);

        Timer.builder(TIMER_NAME)
                .tag("method", request.getMethod())
                .tag("route", route)
                .tag("status", String.valueOf(status))
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
        if (status >= 500) {
            log.warn("Completed {} {} -> {} {} in {} ms",
                    request.getMethod(), request.getRequestURI(), status, outcome, elapsedMillis);
        } else {
            log.info("Completed {} {} -> {} {} in {} ms",
                    request.getMethod(), request.getRequestURI(), status, outcome, elapsedMillis);
        }
    }

    static String outcomeOf(int status) {
        HttpStatus.Series series = HttpStatus.Series.resolve(status);
        return series != null ? series.name() : UNKNOWN;
    }

    private static String resolveRoute(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : UNKNOWN;
    }

    static String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header != null) {
            String candidate = header.trim();
            if (VALID_REQUEST_ID.matcher(candidate).matches()) {
                return candidate;
            }
            log.debug("Ignoring malformed {} header", REQUEST_ID_HEADER);
        }
        return UUID.randomUUID().toString();
    }
}
