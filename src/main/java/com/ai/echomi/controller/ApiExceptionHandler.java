package com.ai.echomi.controller;

import com.ai.echomi.exception.IllegalOrderTransitionException;
import com.ai.echomi.exception.InvalidTurnRequestException;
import com.ai.echomi.exception.OrderNotFoundException;
import com.ai.echomi.exception.OtpNotReleasableException;
import com.ai.echomi.exception.UnauthorizedRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice(basePackages = "com.ai.echomi.controller")
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    /**
     * Malformed turn: unknown role or stage, or no utterance.
     */
    @ExceptionHandler(InvalidTurnRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTurn(InvalidTurnRequestException e) {
        log.warn("Invalid turn request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), "VALIDATION_ERROR");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Validation error: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), "VALIDATION_ERROR");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Request body is missing or malformed", "VALIDATION_ERROR");
    }

    @ExceptionHandler(UnauthorizedRequestException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthorized(UnauthorizedRequestException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage(), "UNAUTHORIZED");
    }

    @ExceptionHandler(OtpNotReleasableException.class)
    public ResponseEntity<Map<String, Object>> handleNotReleasable(OtpNotReleasableException e) {
        log.info("OTP release refused: {}", e.getMessage());
        return error(HttpStatus.FORBIDDEN, e.getMessage(), "OTP_NOT_RELEASABLE");
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleOrderNotFound(OrderNotFoundException e) {
        Map<String, Object> body = body(e.getMessage(), "ORDER_NOT_FOUND");
        body.put("orderId", e.getOrderId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(IllegalOrderTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalTransition(IllegalOrderTransitionException e) {
        log.warn("Rejected order transition: {}", e.getMessage());
        Map<String, Object> body = body(e.getMessage(), "ILLEGAL_TRANSITION");
        body.put("from", e.getFrom().label());
        body.put("to", e.getTo().label());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, String type) {
        return ResponseEntity.status(status).body(body(message, type));
    }

    private static Map<String, Object> body(String message, String type) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", message);
        errorResponse.put("type", type);
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        return errorResponse;
    }
}
