package com.fieldreport.impound.service.confirmation;

import com.fieldreport.impound.exception.ConfirmationRequiredException;
import com.fieldreport.impound.model.ReleaseConfirmation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Guards the coordinator: a release is only committed after the operator has ticked both
 * acknowledgements and typed {@code RELEASE} or the inspection's serial number.
 */
@Component
public class ReleaseConfirmationGate {

    public static final String CONFIRMATION_TOKEN = "RELEASE";

    public static final String PHYSICAL_COUNT = "physicalCountVerified";
    public static final String RECORD_KEEPING = "recordKeepingAccepted";
    public static final String CONFIRMATION_TEXT = "confirmationText";

    /**
     * Fresh workflow state; all three requirements unsatisfied.
     */
    public ReleaseConfirmation open() {
        return ReleaseConfirmation.unsatisfied();
    }

    public boolean isSatisfied(ReleaseConfirmation confirmation, String serialNumber) {
        return missing(confirmation, serialNumber).isEmpty();
    }

    /**
     * @throws ConfirmationRequiredException naming every unmet requirement
     */
    public void check(ReleaseConfirmation confirmation, String serialNumber) {
        List<String> missing = missing(confirmation, serialNumber);
        if (!missing.isEmpty()) {
            throw new ConfirmationRequiredException(missing);
        }
    }

    List<String> missing(ReleaseConfirmation confirmation, String serialNumber) {
        ReleaseConfirmation c = confirmation == null ? ReleaseConfirmation.unsatisfied() : confirmation;
        List<String> missing = new ArrayList<>(3);
        if (!c.physicalCountVerified()) missing.add(PHYSICAL_COUNT);
        if (!c.recordKeepingAccepted()) missing.add(RECORD_KEEPING);
        if (!typedTextMatches(c.confirmationText(), serialNumber)) missing.add(CONFIRMATION_TEXT);
        return missing;
    }

    private boolean typedTextMatches(String typedText, String serialNumber) {
        if (typedText == null) {
            return false;
        }
        String typed = typedText.trim();
        if (typed.toUpperCase(Locale.ROOT).equals(CONFIRMATION_TOKEN)) {
            return true;
        }
        String serial = serialNumber == null ? "" : serialNumber.trim();
        return !serial.isEmpty() && typed.equalsIgnoreCase(serial);
    }
}
