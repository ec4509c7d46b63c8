package com.brokerkit.orders.infrastructure.web;

import com.brokerkit.client.BrokerUnavailableException;
import com.brokerkit.client.PublishException;
import com.brokerkit.orders.infrastructure.messaging.OrderPublisher;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler({
      MethodArgumentNotValidException.class,
      BindException.class,
      ConstraintViolationException.class,
      HttpMessageNotReadableException.class,
      IllegalArgumentException.class
  })
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
    return body(HttpStatus.BAD_REQUEST, message(ex), request);
  }

  @ExceptionHandler({
      HttpRequestMethodNotSupportedException.class,
      HttpMediaTypeNotSupportedException.class
  })
  public ResponseEntity<Map<String, Object>> handleMethodOrMedia(Exception ex, HttpServletRequest request) {
    return body(HttpStatus.BAD_REQUEST, message(ex), request);
  }

  @ExceptionHandler(BrokerUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleBrokerDown(BrokerUnavailableException ex, HttpServletRequest request) {
    log.warn("Rejected {} while the broker is unavailable", request.getRequestURI());
    return body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request);
  }

  @ExceptionHandler(PublishException.class)
  public ResponseEntity<Map<String, Object>> handlePublishFailure(PublishException ex, HttpServletRequest request) {
    log.error("Publish failed for {}", request.getRequestURI(), ex);
    return body(HttpStatus.BAD_GATEWAY, ex.getMessage(), request);
  }

  @ExceptionHandler(Throwable.class)
  public ResponseEntity<Map<String, Object>> handleAny(Throwable ex, HttpServletRequest request) {
    log.error("Unhandled error for {}", request.getRequestURI(), ex);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", request);
  }

  private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String msg, HttpServletRequest request) {
    Map<String, Object> map = new HashMap<>();
    map.put("timestamp", Instant.now().toString());
    map.put("status", status.value());
    map.put("error", (msg == null || msg.isBlank()) ? status.getReasonPhrase() : msg);
    map.put("path", request.getRequestURI());
    map.put("requestId", MDC.get(OrderPublisher.REQUEST_ID_MDC_KEY));
    return ResponseEntity.status(status).body(map);
  }

  private static String message(Exception ex) {
    if (ex instanceof BindException be && be.getBindingResult() != null) {
      var sb = new StringBuilder("Validation failed: ");
      be.getBindingResult().getAllErrors().forEach(err -> sb.append(err.getDefaultMessage()).append("; "));
      return sb.toString();
    }
    if (ex instanceof ConstraintViolationException cve && !cve.getConstraintViolations().isEmpty()) {
      var sb = new StringBuilder("Validation failed: ");
      cve.getConstraintViolations().forEach(v -> sb.append(v.getMessage()).append("; "));
      return sb.toString();
    }
    if (ex instanceof HttpMessageNotReadableException) {
      return "Malformed request body";
    }
    return ex.getMessage();
  }
}
