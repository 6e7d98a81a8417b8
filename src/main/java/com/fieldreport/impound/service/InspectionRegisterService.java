package com.fieldreport.impound.service;

import com.fieldreport.impound.config.AppMetrics;
import com.fieldreport.impound.exception.InvalidFormException;
import com.fieldreport.impound.exception.StoreUnavailableException;
import com.fieldreport.impound.model.NewRegisterEntry;
import com.fieldreport.impound.model.Operator;
import com.fieldreport.impound.model.RegisterEntry;
import com.fieldreport.impound.repository.RegisterEntryRepository;
import com.fieldreport.impound.repository.StoreRetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The inspection register: a running book of inspection visits, separate from impounds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InspectionRegisterService {

    static final String MSG_REQUIRED = "Required";
    static final String MSG_DATE_REQUIRED = "Date is required";

    private final RegisterEntryRepository registerRepository;
    private final StoreRetryPolicy retryPolicy;
    private final AppMetrics metrics;

    public RegisterEntry record(NewRegisterEntry form, Operator operator) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (form == null) {
            errors.put("form", "Register entry is required");
            throw new InvalidFormException(errors);
        }
        validate(form, errors);
        if (!errors.isEmpty()) {
            throw new InvalidFormException(errors);
        }

        RegisterEntry draft = RegisterEntry.builder()
                .date(form.date())
                .inspectors(form.inspectors().trim())
                .purpose(form.purpose().trim())
                .observations(trimToNull(form.observations()))
                .recommendations(trimToNull(form.recommendations()))
                .signature(trimToNull(form.signature()))
                .serialNo(trimToNull(form.serialNo()))
                .createdAt(Instant.now())
                .createdBy((operator == null ? Operator.anonymous() : operator).identity())
                .build();

        RegisterEntry stored;
        try {
            stored = registerRepository.append(draft);
        } catch (DataAccessException e) {
            log.error("Could not store register entry dated {}: {}", draft.getDate(), e.getMessage());
            throw new StoreUnavailableException("Failed to save entry. Please try again.", e);
        }
        metrics.incrementRegisterEntries();
        log.info("Register entry {} recorded (date={}, by={})", stored.getId(), stored.getDate(), stored.getCreatedBy());
        return stored;
    }

    /**
     * All entries, most recent visit first.
     */
    public List<RegisterEntry> list() {
        try {
            return retryPolicy.execute("findRegisterEntries", registerRepository::findAll);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("The inspection store is unavailable", e);
        }
    }

    void validate(NewRegisterEntry form, Map<String, String> errors) {
        if (form.date() == null) {
            errors.put("date", MSG_DATE_REQUIRED);
        }
        if (isBlank(form.inspectors())) {
            errors.put("inspectors", MSG_REQUIRED);
        }
        if (isBlank(form.purpose())) {
            errors.put("purpose", MSG_REQUIRED);
        }
        FieldLimits.checkLength(trimToNull(form.inspectors()), FieldLimits.INSPECTORS, "inspectors", errors);
        FieldLimits.checkLength(trimToNull(form.purpose()), FieldLimits.PURPOSE, "purpose", errors);
        FieldLimits.checkLength(trimToNull(form.observations()), FieldLimits.REMARKS, "observations", errors);
        FieldLimits.checkLength(trimToNull(form.recommendations()), FieldLimits.REMARKS, "recommendations", errors);
        FieldLimits.checkLength(trimToNull(form.signature()), FieldLimits.NAME, "signature", errors);
        FieldLimits.checkLength(trimToNull(form.serialNo()), FieldLimits.SERIAL_NUMBER, "serialNo", errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String trimToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
