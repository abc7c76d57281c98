package com.nosota.landmarket.error;

/**
 * The buy request has already reached a final status.
 */
public class RequestNotPendingException extends MarketplaceException {
    public RequestNotPendingException() {
    }

    public RequestNotPendingException(String message) {
        super(message);
    }

    public RequestNotPendingException(String message, Throwable cause) {
        super(message, cause);
    }

    public RequestNotPendingException(Throwable cause) {
        super(cause);
    }

    public RequestNotPendingException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
