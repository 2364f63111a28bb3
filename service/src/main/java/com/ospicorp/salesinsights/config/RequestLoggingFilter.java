package com.ospicorp.salesinsights.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log with one line per request. Each request carries an id, taken from
 * {@value #REQUEST_ID_HEADER} when the caller sends one, which is echoed back and put in the
 * logging context under {@value #MDC_KEY}.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String MDC_KEY = "requestId";
  private static final int MAX_REQUEST_ID_LENGTH = 64;

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    String uri = request.getRequestURI();
    return uri.startsWith("/swagger-ui") || uri.startsWith("/v3/api-docs");
  }

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = requestId(request);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    MDC.put(MDC_KEY, requestId);
    long started = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Unhandled failure in {} {}: {}", request.getMethod(),
          RequestDescriptions.uriWithQuery(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long millis = (System.nanoTime() - started) / 1_000_000;
      log.info("HTTP {} {} from {} -> {} ({} ms)",
          request.getMethod(),
          RequestDescriptions.uriWithQuery(request),
          RequestDescriptions.clientIp(request),
          response.getStatus(),
          millis);
      MDC.remove(MDC_KEY);
    }
  }

  private static String requestId(HttpServletRequest request) {
    String supplied = request.getHeader(REQUEST_ID_HEADER);
    if (StringUtils.hasText(supplied) && supplied.length() <= MAX_REQUEST_ID_LENGTH) {
      return supplied.trim();
    }
    return UUID.randomUUID().toString();
  }
}
