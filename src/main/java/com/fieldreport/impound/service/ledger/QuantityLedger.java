package com.fieldreport.impound.service.ledger;

import com.fieldreport.impound.exception.InvalidQuantityException;
import com.fieldreport.impound.exception.OverReleaseException;
import com.fieldreport.impound.model.InspectionStatus;
import org.springframework.stereotype.Component;

/**
 * Decides whether a release can be applied to an impounded quantity and what it leaves behind.
 *
 * Pure: no I/O, no state. The caller must pass the quantity it has just read from the store.
 */
@Component
public class QuantityLedger {

    /**
     * @param currentQuantity   authoritative remaining quantity, never negative
     * @param requestedQuantity boxes the operator wants to release
     * @return remaining quantity and the status it implies
     * @throws InvalidQuantityException if the request is missing or not positive
     * @throws OverReleaseException     if the request exceeds what is impounded
     */
    public LedgerDecision applyRelease(int currentQuantity, Integer requestedQuantity) {
        if (currentQuantity < 0) {
            throw new IllegalArgumentException("current quantity must not be negative: " + currentQuantity);
        }
        if (requestedQuantity == null || requestedQuantity <= 0) {
            throw new InvalidQuantityException(requestedQuantity);
        }
        if (requestedQuantity > currentQuantity) {
            throw new OverReleaseException(requestedQuantity, currentQuantity);
        }
        int remaining = currentQuantity - requestedQuantity;
        return new LedgerDecision(currentQuantity, requestedQuantity, remaining, statusFor(remaining));
    }

    /**
     * Status implied by a remaining quantity after at least one release.
     */
    public InspectionStatus statusFor(int remaining) {
        return remaining == 0 ? InspectionStatus.COMPLETED : InspectionStatus.PENDING_REVIEW;
    }
}
