package com.adrelay.api.controller;

import com.adrelay.admin.AdminActionException;
import com.adrelay.api.dto.ErrorBody;
import com.adrelay.campaign.CampaignProvisioningException;
import com.adrelay.order.OrderLedgerException;
import com.adrelay.pricing.PricingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps validation failures and domain exceptions to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(PricingException.class)
    public ResponseEntity<ErrorBody> handlePricing(PricingException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(OrderLedgerException.class)
    public ResponseEntity<ErrorBody> handleOrderLedger(OrderLedgerException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case OrderLedgerException.ORDER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case OrderLedgerException.ORDER_NOT_CANCELLABLE -> HttpStatus.CONFLICT;
            default -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        if (status == HttpStatus.SERVICE_UNAVAILABLE) {
            log.error("Order intake unavailable: {}", ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(CampaignProvisioningException.class)
    public ResponseEntity<ErrorBody> handleProvisioning(CampaignProvisioningException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(AdminActionException.class)
    public ResponseEntity<ErrorBody> handleAdmin(AdminActionException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case AdminActionException.TRANSACTION_NOT_FOUND, AdminActionException.ORDER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case AdminActionException.INVALID_OUTCOME -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_PAYER_ADDRESS" -> "Invalid TON payer address format";
            case "INVALID_CHANNEL_COUNT" -> "At least one channel is required";
            case "INVALID_DURATION" -> "Duration in days is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
