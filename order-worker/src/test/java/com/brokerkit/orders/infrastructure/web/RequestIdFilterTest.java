package com.brokerkit.orders.infrastructure.web;

import com.brokerkit.orders.infrastructure.messaging.OrderPublisher;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

public class RequestIdFilterTest {

  private final RequestIdFilter filter = new RequestIdFilter();
  private final AtomicReference<String> seenInMdc = new AtomicReference<>();
  private final FilterChain chain = (req, res) -> seenInMdc.set(MDC.get(OrderPublisher.REQUEST_ID_MDC_KEY));

  @Test
  void callerId_isPutInMdcAndEchoed() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/orders");
    request.addHeader("X-Request-Id", "req-42");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, chain);

    assertThat(seenInMdc.get()).isEqualTo("req-42");
    assertThat(response.getHeader("X-Request-Id")).isEqualTo("req-42");
    assertThat(MDC.get(OrderPublisher.REQUEST_ID_MDC_KEY)).isNull();
  }

  @Test
  void missingId_isGenerated() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(new MockHttpServletRequest("GET", "/orders/A1"), response, chain);

    assertThat(seenInMdc.get()).isNotBlank().isEqualTo(response.getHeader("X-Request-Id"));
  }

  @Test
  void unsafeId_isReplaced() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/orders");
    request.addHeader("X-Request-Id", "abc\nforged log line");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, chain);

    assertThat(seenInMdc.get()).doesNotContain("forged").matches("[0-9a-f-]{36}");
    assertThat(response.getHeader("X-Request-Id")).isEqualTo(seenInMdc.get());
  }
}
