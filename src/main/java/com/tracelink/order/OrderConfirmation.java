package com.tracelink.order;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OrderConfirmation(
        @JsonProperty("order_id") String orderId,
        String status,
        String message
) {}
