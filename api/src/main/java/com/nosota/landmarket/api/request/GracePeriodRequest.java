package com.nosota.landmarket.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Seller-chosen extension window of a pending buy request, in days.
 */
public record GracePeriodRequest(@NotNull @Min(1) @Max(30) Integer days) {
}
