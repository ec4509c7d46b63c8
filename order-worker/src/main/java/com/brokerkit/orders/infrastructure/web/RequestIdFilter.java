package com.brokerkit.orders.infrastructure.web;

import com.brokerkit.orders.infrastructure.messaging.OrderPublisher;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Puts the caller's request id in the MDC and echoes it back. The order publisher copies it into the
 * {@code X-Request-Id} message header, and the consumer restores it from there, so one id follows an
 * order from the HTTP call through every retry. Ids that would be unsafe in a log line or an AMQP
 * header are replaced with a fresh one.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {
  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String rid = request.getHeader(OrderPublisher.REQUEST_ID_HEADER);
    if (rid == null || !SAFE_ID.matcher(rid).matches()) rid = UUID.randomUUID().toString();
    MDC.put(OrderPublisher.REQUEST_ID_MDC_KEY, rid);
    response.setHeader(OrderPublisher.REQUEST_ID_HEADER, rid);
    try { chain.doFilter(request, response); }
    finally { MDC.remove(OrderPublisher.REQUEST_ID_MDC_KEY); }
  }
}
