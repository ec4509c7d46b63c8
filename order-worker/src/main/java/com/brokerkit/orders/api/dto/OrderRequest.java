package com.brokerkit.orders.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class OrderRequest {
  @NotBlank(message = "orderId is required")
  @Size(max = 64, message = "orderId must be up to 64 chars")
  @JsonAlias("order_id")
  @Schema(example = "A1")
  private String orderId;

  @Size(max = 64, message = "customerId must be up to 64 chars")
  private String customerId;

  @Min(0)
  private long amountCents;

  @Min(0)
  @Max(10)
  @Schema(description = "Processing attempts that fail before the order goes through", example = "0")
  private int simulateFailures;

  public String getOrderId() { return orderId; }
  public String getCustomerId() { return customerId; }
  public long getAmountCents() { return amountCents; }
  public int getSimulateFailures() { return simulateFailures; }
}
