package com.tracelink.web;

import com.tracelink.order.OrderConfirmation;
import com.tracelink.order.OrderDetails;
import com.tracelink.order.OrderService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class OrderController {

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @PostMapping("/orders")
    @ResponseStatus(HttpStatus.CREATED)
    public OrderConfirmation createOrder() {
        return orderService.createOrder();
    }

    @GetMapping("/orders/{id}")
    public OrderDetails getOrder(@PathVariable("id") String id) {
        return orderService.getOrder(id);
    }

    @GetMapping("/error")
    public void triggerError() {
        orderService.triggerFailure();
    }
}
