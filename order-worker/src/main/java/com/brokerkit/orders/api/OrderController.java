package com.brokerkit.orders.api;

import com.brokerkit.orders.api.dto.OrderAcceptedResponse;
import com.brokerkit.orders.api.dto.OrderRequest;
import com.brokerkit.orders.application.OrderProcessingService;
import com.brokerkit.orders.domain.OrderCreated;
import com.brokerkit.orders.domain.OrderState;
import com.brokerkit.orders.domain.OrderStatus;
import com.brokerkit.orders.infrastructure.messaging.OrderPublisher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/orders")
@Tag(name = "Orders API")
public class OrderController {
  private final OrderPublisher publisher;
  private final OrderProcessingService processingService;

  public OrderController(OrderPublisher publisher, OrderProcessingService processingService) {
    this.publisher = publisher;
    this.processingService = processingService;
  }

  @PostMapping
  @Operation(
      summary = "Publish an order.created message",
      parameters = {
          @Parameter(name = "X-Request-Id", in = ParameterIn.HEADER, required = false,
              description = "Optional client-supplied request id; forwarded as a message header")
      },
      responses = {
          @ApiResponse(responseCode = "202", description = "Published and confirmed by the broker"),
          @ApiResponse(responseCode = "503", description = "Broker connection is down"),
          @ApiResponse(responseCode = "502", description = "Broker did not confirm the message")
      }
  )
  public ResponseEntity<OrderAcceptedResponse> create(@Valid @RequestBody OrderRequest req) {
    OrderCreated order = new OrderCreated(req.getOrderId(), req.getCustomerId(), req.getAmountCents(), req.getSimulateFailures());
    publisher.publish(order);
    processingService.accepted(order.orderId());
    return ResponseEntity.accepted()
        .location(URI.create("/orders/" + order.orderId()))
        .body(new OrderAcceptedResponse(order.orderId(), OrderStatus.ACCEPTED.name()));
  }

  @GetMapping("/{orderId}")
  @Operation(summary = "Processing status of an order")
  public ResponseEntity<OrderState> status(@PathVariable("orderId") String orderId) {
    return processingService.find(orderId)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
