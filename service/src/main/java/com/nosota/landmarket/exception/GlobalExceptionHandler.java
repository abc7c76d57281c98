package com.nosota.landmarket.exception;

import com.nosota.landmarket.config.CorrelationIdFilter;
import com.nosota.landmarket.dto.ErrorResponse;
import com.nosota.landmarket.error.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(
            InsufficientBalanceException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.warn("Insufficient balance [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Insufficient Balance", ex.getMessage(), request,
                Map.of("asset", ex.getAsset().symbol(), "required", ex.getRequired()));
    }

    @ExceptionHandler(PriceBelowFloorException.class)
    public ResponseEntity<ErrorResponse> handlePriceBelowFloor(
            PriceBelowFloorException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.warn("Price below floor [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Price Below Floor", ex.getMessage(), request,
                Map.of("floorPercentage", ex.getFloorPercentage(), "actualPercentage", ex.getActualPercentage()));
    }

    @ExceptionHandler(UnderpricedCooldownActiveException.class)
    public ResponseEntity<ErrorResponse> handleCooldown(
            UnderpricedCooldownActiveException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.warn("Underpriced cooldown [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Selling Locked", ex.getMessage(), request,
                Map.of("remainingSeconds", ex.getRemaining().toSeconds()));
    }

    @ExceptionHandler({
            FeatureNotFoundException.class,
            BuyRequestNotFoundException.class,
            SellRequestNotFoundException.class
    })
    public ResponseEntity<ErrorResponse> handleNotFound(MarketplaceException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.warn("Not found [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, Map.of());
    }

    @ExceptionHandler(UnauthorizedActionException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(
            UnauthorizedActionException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.warn("Unauthorized action [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request, Map.of());
    }

    @ExceptionHandler(LedgerOperationFailedException.class)
    public ResponseEntity<ErrorResponse> handleLedgerFailure(
            LedgerOperationFailedException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.error("Ledger operation failed [correlationId={}]", correlationId, ex);

        return respond(HttpStatus.BAD_GATEWAY, "Payment Failed",
                "The payment could not be processed. No money was moved, please try again later.",
                request, Map.of());
    }

    @ExceptionHandler(AmbiguousLedgerFailureException.class)
    public ResponseEntity<ErrorResponse> handleAmbiguousLedger(
            AmbiguousLedgerFailureException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.error("Ambiguous ledger outcome [correlationId={}]", correlationId, ex);

        return respond(HttpStatus.BAD_GATEWAY, "Payment Pending Verification",
                "The payment outcome could not be confirmed. Please contact support with correlation ID: " + correlationId,
                request, Map.of());
    }

    /**
     * Remaining business conflicts: not pending, duplicates, ownership races, not for sale, quotas.
     */
    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<ErrorResponse> handleMarketplaceConflict(
            MarketplaceException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.warn("{} [correlationId={}]: {}", ex.getClass().getSimpleName(), correlationId, ex.getMessage());
        for (Throwable suppressed : ex.getSuppressed()) {
            log.error("Suppressed during {} [correlationId={}]", ex.getClass().getSimpleName(), correlationId, suppressed);
        }

        return respond(HttpStatus.CONFLICT, title(ex), ex.getMessage(), request, Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Invalid request body [correlationId={}]: {}", correlationId, message);

        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", message, request, Map.of());
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.warn("Invalid request [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request, Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.error("Illegal argument [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request, Map.of());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request, Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request, Map.of());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String title, String message,
                                                         HttpServletRequest request, Map<String, Object> details) {
        ErrorResponse error = ErrorResponse.of(status.value(), title, message, request.getRequestURI(), details);
        return ResponseEntity.status(status).body(error);
    }

    private static String title(MarketplaceException ex) {
        String name = ex.getClass().getSimpleName().replace("Exception", "");
        return name.replaceAll("([a-z])([A-Z])", "$1 $2");
    }
}
