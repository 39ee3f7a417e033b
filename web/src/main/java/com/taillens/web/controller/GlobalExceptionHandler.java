/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.web.controller;

import com.taillens.common.exception.InvalidQueryException;
import com.taillens.common.exception.TailLensException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions from the REST endpoints to JSON error bodies.
 *
 * <p>Bad request parameters are 400 and framework errors keep their own status; both are
 * logged at DEBUG. Anything else is a 500 and is logged with its stack trace.</p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidQuery(InvalidQueryException ex,
                                                                  HttpServletRequest request) {
        log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
        body.put("parameter", ex.getParameter());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex,
                                                                     HttpServletRequest request) {
        log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(body(HttpStatus.BAD_REQUEST, "TL_BAD_REQUEST", ex.getMessage(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception ex, HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex);
        if (status.is5xxServerError()) {
            log.error("Unhandled exception at {} {}: {}", request.getMethod(),
                    request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.debug("{} at {} {}: {}", status.value(), request.getMethod(), request.getRequestURI(), ex.getMessage());
        }
        String code = ex instanceof TailLensException tle ? tle.getErrorCode() : "TL_HTTP_" + status.value();
        String message = ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred";
        return ResponseEntity.status(status).body(body(status, code, message, request));
    }

    private HttpStatus resolveStatus(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
            if (status != null) return status;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private Map<String, Object> body(HttpStatus status, String code, String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return body;
    }
}
