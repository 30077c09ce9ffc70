package com.phillippitts.fleetdump.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every log line written while serving a dump API call.
 *
 * <p>Keys put into Log4j2's ThreadContext:</p>
 * <ul>
 *   <li>requestId: the X-Request-ID header or a fresh UUID, echoed back on the response</li>
 *   <li>issueId: the X-Issue-ID header, when a client follows up on a known fleet dump</li>
 *   <li>deviceId: the X-Device-ID header, when the call concerns one device</li>
 *   <li>method and uri of the call</li>
 * </ul>
 *
 * <p>Coordinator work started by the call inherits these keys through the executors' task
 * decorator. Nothing survives past the call.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String ISSUE_ID_HEADER = "X-Issue-ID";
    static final String DEVICE_ID_HEADER = "X-Device-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        String requestId = present(http.getHeader(REQUEST_ID_HEADER))
                ? http.getHeader(REQUEST_ID_HEADER).trim()
                : UUID.randomUUID().toString();
        try {
            ThreadContext.put("requestId", requestId);
            ThreadContext.put("method", http.getMethod());
            ThreadContext.put("uri", http.getRequestURI());
            tagFromHeader(http, ISSUE_ID_HEADER, "issueId");
            tagFromHeader(http, DEVICE_ID_HEADER, "deviceId");
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static void tagFromHeader(HttpServletRequest http, String header, String key) {
        String value = http.getHeader(header);
        if (present(value)) {
            ThreadContext.put(key, value.trim());
        }
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
