package com.company.radar.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags every API request with a request id and, for account-scoped paths, the
 * account id, so pipeline polls and alert calls of one account can be followed
 * in the logs.
 */
@Component
@Slf4j
public class RequestLoggingFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID_KEY = "requestId";
    static final String MDC_ACCOUNT_ID_KEY = "accountId";

    private static final Pattern ACCOUNT_PATH = Pattern.compile("^/api/v1/accounts/([0-9a-fA-F-]{36})(/.*)?$");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String requestId = httpRequest.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        MDC.put(MDC_REQUEST_ID_KEY, requestId);
        String accountId = accountIdOf(httpRequest.getRequestURI());
        if (accountId != null) {
            MDC.put(MDC_ACCOUNT_ID_KEY, accountId);
        }
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);

        long startNanos = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            log.debug("{} {} -> {} in {} ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                    httpResponse.getStatus(), (System.nanoTime() - startNanos) / 1_000_000);
            MDC.remove(MDC_ACCOUNT_ID_KEY);
            MDC.remove(MDC_REQUEST_ID_KEY);
        }
    }

    static String accountIdOf(String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = ACCOUNT_PATH.matcher(path);
        return matcher.matches() ? matcher.group(1).toLowerCase() : null;
    }
}
