package com.volforecast.engine.api;

import com.volforecast.engine.domain.exception.GovernanceRejectedException;
import com.volforecast.engine.domain.exception.InvalidObservationException;
import com.volforecast.engine.domain.exception.InvalidScalingException;
import com.volforecast.engine.domain.exception.MarketDataUnavailableException;
import com.volforecast.engine.domain.exception.PathGenerationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({InvalidObservationException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ex.getMessage(), request, ex);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleMalformed(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "잘못된 요청: " + ex.getMessage(), request, ex);
    }

    @ExceptionHandler(GovernanceRejectedException.class)
    public ResponseEntity<ApiError> handleRejected(GovernanceRejectedException ex, HttpServletRequest request) {
        return buildError(HttpStatus.CONFLICT, ex.getMessage(), request, ex);
    }

    @ExceptionHandler({InvalidScalingException.class, PathGenerationException.class})
    public ResponseEntity<ApiError> handleUnprocessable(RuntimeException ex, HttpServletRequest request) {
        return buildError(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), request, ex);
    }

    @ExceptionHandler(MarketDataUnavailableException.class)
    public ResponseEntity<ApiError> handleUnavailable(MarketDataUnavailableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "예상하지 못한 오류", request, ex);
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String message,
                                                HttpServletRequest request, Exception ex) {
        if (status.is5xxServerError()) {
            log.error("[API] {} {} -> {}", request.getMethod(), request.getRequestURI(), status.value(), ex);
        } else {
            log.warn("[API] {} {} -> {}: {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        }
        ApiError body = new ApiError(Instant.now().toString(), status.value(), status.getReasonPhrase(),
                message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
