package com.adrelay.api.controller;

import com.adrelay.api.dto.CancelOrderRequest;
import com.adrelay.api.dto.CreateOrderRequest;
import com.adrelay.api.dto.OrderResponse;
import com.adrelay.domain.Order;
import com.adrelay.order.OrderLedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Order intake: POST /orders, GET /orders/{referenceCode}, POST /orders/{orderId}/cancel.
 */
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderLedgerService orderLedgerService;

    @PostMapping
    public ResponseEntity<OrderResponse> create(@Valid @RequestBody CreateOrderRequest request) {
        Order order = orderLedgerService.createOrder(
                request.userId().strip(), request.durationDays(), request.channelIds(), request.payerAddress());
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(order));
    }

    @GetMapping("/{referenceCode}")
    public ResponseEntity<OrderResponse> getByReferenceCode(@PathVariable String referenceCode) {
        return orderLedgerService.findByReferenceCode(referenceCode)
                .map(o -> ResponseEntity.ok(OrderResponse.from(o)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancel(@PathVariable String orderId,
                                                @RequestBody(required = false) CancelOrderRequest request) {
        String userId = request != null ? request.userId() : null;
        return ResponseEntity.ok(OrderResponse.from(orderLedgerService.cancel(orderId, userId)));
    }
}
