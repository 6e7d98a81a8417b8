package com.fieldreport.impound.service.ledger;

import com.fieldreport.impound.model.InspectionStatus;

/**
 * Effect of an accepted release on an inspection's quantity.
 */
public record LedgerDecision(
    int previous,
    int released,
    int remaining,
    InspectionStatus status
) {
    public boolean completesInspection() {
        return remaining == 0;
    }
}
