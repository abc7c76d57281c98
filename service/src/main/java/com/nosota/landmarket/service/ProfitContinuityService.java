package com.nosota.landmarket.service;

import com.nosota.landmarket.api.model.Asset;
import com.nosota.landmarket.service.HourlyProfitService.ProfitHandover;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps a feature's passive income continuous across ownership changes.
 *
 * <p>On transfer the income accrued so far goes to the previous owner and the
 * record starts over for the new owner, who must wait the withdraw window
 * before collecting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfitContinuityService {

    private final HourlyProfitService hourlyProfitService;
    private final SettlementLedger settlementLedger;
    private final IdentityLookup identityLookup;

    /**
     * Pays out the accrued balance to the previous owner and hands the record to the new owner.
     *
     * @param featureId       Transferred feature
     * @param previousOwnerId Seller
     * @param newOwnerId      Buyer
     * @param resource        Asset the feature accrues in, used when a record has to be created
     * @param reference       Key prefix of the settlement
     */
    public void flushAndReassign(Long featureId, Long previousOwnerId, Long newOwnerId, Asset resource, String reference) {
        int withdrawDays = identityLookup.withdrawProfitDays(newOwnerId);
        ProfitHandover handover = hourlyProfitService.reassign(featureId, newOwnerId, withdrawDays, resource);

        if (!handover.hasBalance()) {
            return;
        }
        if (!previousOwnerId.equals(handover.previousHolderId())) {
            log.warn("Profit record of feature {} was held by {}, expected seller {}",
                    featureId, handover.previousHolderId(), previousOwnerId);
        }

        settlementLedger.payout(handover.previousHolderId(), handover.asset(), handover.amount(),
                reference + ":profit:" + handover.asset().symbol(), "feature", String.valueOf(featureId));
    }
}
