package com.financemanager.common.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a request id into MDC so that every log line of a request carries it.
 *
 * Usage in logback pattern: %X{requestId} %X{method} %X{path}
 *
 * An incoming X-Request-Id (set by a calling service, e.g. the catalog replication
 * client) is reused; otherwise a new one is generated. The id is echoed in the
 * response header and appears as {@code traceId} in problem-details bodies.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcLoggingFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest  request,
                                    HttpServletResponse response,
                                    FilterChain         chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(MdcKeys.REQUEST_ID_HEADER);
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }
        try {
            MDC.put(MdcKeys.REQUEST_ID, requestId);
            MDC.put(MdcKeys.METHOD,     request.getMethod());
            MDC.put(MdcKeys.PATH,       request.getRequestURI());
            response.setHeader(MdcKeys.REQUEST_ID_HEADER, requestId);
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MdcKeys.REQUEST_ID);
            MDC.remove(MdcKeys.METHOD);
            MDC.remove(MdcKeys.PATH);
        }
    }
}
