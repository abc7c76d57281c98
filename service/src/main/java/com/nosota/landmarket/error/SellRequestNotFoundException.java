package com.nosota.landmarket.error;

public class SellRequestNotFoundException extends MarketplaceException {
    public SellRequestNotFoundException() {
    }

    public SellRequestNotFoundException(String message) {
        super(message);
    }

    public SellRequestNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public SellRequestNotFoundException(Throwable cause) {
        super(cause);
    }

    public SellRequestNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
