package com.tracelink.order;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OrderDetails(
        @JsonProperty("order_id") String orderId,
        String status,
        int items,
        String total
) {}
