package com.adrelay.api.dto;

/**
 * POST /api/v1/orders/{orderId}/cancel body. When userId is set the order must belong to it.
 */
public record CancelOrderRequest(String userId) {
}
