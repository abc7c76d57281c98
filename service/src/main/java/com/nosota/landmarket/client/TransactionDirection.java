package com.nosota.landmarket.client;

public enum TransactionDirection {
    WITHDRAW,
    DEPOSIT
}
