package com.fieldreport.impound.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Request-scoped logging context: trace id, span id and the acting operator.
 *
 * The trace id comes from an inbound {@code X-Trace-Id} header when present and is echoed on the
 * response. The notification executor copies these keys onto its worker threads.
 */
public final class TraceContextManager {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String OPERATOR = "operator";
    public static final String TRACE_HEADER = "X-Trace-Id";
    public static final String OPERATOR_HEADER = "X-Operator-Id";

    private static final String ANONYMOUS = "anonymous";

    private TraceContextManager() {}

    public static String ensureForHttp(HttpServletRequest request, HttpServletResponse response) {
        String traceId = firstNonBlank(request.getHeader(TRACE_HEADER), MDC.get(TRACE_ID));
        if (traceId == null) {
            traceId = generateTraceId();
        }
        MDC.put(TRACE_ID, traceId);
        if (firstNonBlank(MDC.get(SPAN_ID)) == null) {
            MDC.put(SPAN_ID, generateSpanId());
        }
        bindOperator(request.getHeader(OPERATOR_HEADER));

        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }
        return traceId;
    }

    /**
     * Record who is acting; a missing id is logged as {@code anonymous}.
     */
    public static void bindOperator(String operatorId) {
        String id = firstNonBlank(operatorId);
        MDC.put(OPERATOR, id == null ? ANONYMOUS : id.trim());
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String generateSpanId() {
        return generateTraceId().substring(0, 16);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
        MDC.remove(OPERATOR);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
