package com.nosota.landmarket.dto;

import com.nosota.landmarket.service.AcquisitionPath;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Everything needed to finish a settlement once the buyer's funds are captured.
 *
 * @param featureId          Feature changing hands
 * @param sellerId           Owner observed before settling
 * @param buyerId            New owner
 * @param path               Acquisition path that produced the plan
 * @param reference          Key prefix shared by all ledger calls of this settlement
 * @param acceptedRequestId  Accepted buy request, null for immediate purchases
 * @param payouts            Credits to make after the ownership update
 * @param settledPsc         Nominal PSC recorded on the trade
 * @param settledIrr         Nominal IRR recorded on the trade
 * @param feePsc             Platform PSC fee, null when no commission applies
 * @param feeIrr             Platform IRR fee, null when no commission applies
 */
@Builder
public record SettlementPlan(
        Long featureId,
        Long sellerId,
        Long buyerId,
        AcquisitionPath path,
        String reference,
        UUID acceptedRequestId,
        List<Payout> payouts,
        BigDecimal settledPsc,
        BigDecimal settledIrr,
        BigDecimal feePsc,
        BigDecimal feeIrr
) {

    public boolean hasCommission() {
        return feePsc != null && feeIrr != null;
    }
}
