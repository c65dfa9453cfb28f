package com.phillippitts.speaktolatex.config.logging;

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
 * Puts the request id, method and URI into Log4j2's ThreadContext for every HTTP request and
 * echoes the request id back in the {@code X-Request-ID} response header.
 *
 * <p>The context is cleared after the request so pooled threads do not leak values.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = http.getHeader(REQUEST_ID_HEADER);
                if (requestId == null || requestId.isBlank()) {
                    requestId = UUID.randomUUID().toString();
                }
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }
}
