package com.nosota.landmarket.error;

public class BuyRequestNotFoundException extends MarketplaceException {
    public BuyRequestNotFoundException() {
    }

    public BuyRequestNotFoundException(String message) {
        super(message);
    }

    public BuyRequestNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public BuyRequestNotFoundException(Throwable cause) {
        super(cause);
    }

    public BuyRequestNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
