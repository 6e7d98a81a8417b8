package com.fieldreport.impound.service;

import com.fieldreport.impound.config.AppMetrics;
import com.fieldreport.impound.exception.InvalidFormException;
import com.fieldreport.impound.exception.StoreUnavailableException;
import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.InspectionStatus;
import com.fieldreport.impound.model.IntakeReceipt;
import com.fieldreport.impound.model.NewInspection;
import com.fieldreport.impound.model.NotificationOutcome;
import com.fieldreport.impound.model.Operator;
import com.fieldreport.impound.model.QuantityRepresentation;
import com.fieldreport.impound.repository.InspectionRepository;
import com.fieldreport.impound.service.notification.NotificationDispatcher;
import com.fieldreport.impound.service.notification.PhoneNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Records new inspections and sends the impound SMS to the drugshop contacts.
 */
@Service
@Slf4j
public class InspectionIntakeService {

    static final String MSG_SENT = "Report submitted and SMS sent.";
    static final String MSG_FAILED = "Report submitted. SMS delivery failed, please retry later.";
    static final String MSG_SUBMITTED = "Inspection report submitted!";

    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    private final InspectionRepository inspectionRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final AppMetrics metrics;
    private final Duration notificationAwait;

    public InspectionIntakeService(InspectionRepository inspectionRepository,
                                   NotificationDispatcher notificationDispatcher,
                                   AppMetrics metrics,
                                   @Value("${app.notification.await-timeout:5s}") Duration notificationAwait) {
        this.inspectionRepository = inspectionRepository;
        this.notificationDispatcher = notificationDispatcher;
        this.metrics = metrics;
        this.notificationAwait = notificationAwait;
    }

    public IntakeReceipt submit(NewInspection form, Operator operator) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (form == null) {
            errors.put("form", "Inspection form is required");
            throw new InvalidFormException(errors);
        }
        Integer boxes = validate(form, errors);
        List<String> phones = PhoneNumbers.split(form.drugshopContactPhones());
        if (!errors.isEmpty()) {
            throw new InvalidFormException(errors);
        }

        Operator principal = operator == null ? Operator.anonymous() : operator;
        Instant now = Instant.now();
        Inspection draft = Inspection.builder()
                .serialNumber(form.serialNumber().trim())
                .drugshopName(form.drugshopName().trim())
                .drugshopContactPhones(phones)
                .clientTelephone(trimToNull(form.clientTelephone()))
                .impoundedBy(form.impoundedBy().trim())
                .inspectionDate(form.inspectionDate() == null ? now : form.inspectionDate())
                .locationAddress(trimToNull(form.locationAddress()))
                .boxesImpounded(boxes)
                .boxesRepresentation(QuantityRepresentation.of(form.boxesImpounded()))
                .initialBoxes(boxes)
                .status(InspectionStatus.SUBMITTED)
                .createdAt(now)
                .createdBy(principal.identity())
                .build();

        Inspection stored;
        try {
            stored = inspectionRepository.insert(draft);
        } catch (DataAccessException e) {
            log.error("Could not store inspection {}: {}", draft.getSerialNumber(), e.getMessage());
            throw new StoreUnavailableException("The inspection store is unavailable, the report was not saved", e);
        }
        metrics.incrementInspectionsCreated();
        log.info("Inspection {} recorded (serial={}, boxes={}, by={})",
                stored.getId(), stored.getSerialNumber(), boxes, stored.getCreatedBy());

        if (!form.sendSms() || boxes == 0 || phones.isEmpty()) {
            return new IntakeReceipt(stored, NotificationOutcome.skipped("not requested"), MSG_SUBMITTED);
        }

        NotificationOutcome outcome = await(notificationDispatcher.dispatchImpound(stored, PhoneNumbers.destinations(phones)));
        String message = switch (outcome.status()) {
            case SENT -> MSG_SENT;
            case FAILED -> MSG_FAILED;
            case PENDING, SKIPPED -> MSG_SUBMITTED;
        };
        return new IntakeReceipt(stored, outcome, message);
    }

    /**
     * @return the parsed box count, or null when it is missing or invalid (an error is recorded)
     */
    Integer validate(NewInspection form, Map<String, String> errors) {
        requireText(form.serialNumber(), "serialNumber", errors);
        requireText(form.drugshopName(), "drugshopName", errors);
        requireText(form.impoundedBy(), "impoundedBy", errors);

        Integer boxes = parseBoxes(form.boxesImpounded(), errors);

        String clientTelephone = trimToNull(form.clientTelephone());
        if (clientTelephone != null && !PhoneNumbers.isValid(clientTelephone)) {
            errors.put("clientTelephone", "Enter a valid phone number");
        }

        if (form.sendSms() && boxes != null && boxes > 0) {
            List<String> phones = PhoneNumbers.split(form.drugshopContactPhones());
            if (phones.isEmpty()) {
                errors.put("drugshopContactPhones", "Enter at least one phone number");
            } else {
                PhoneNumbers.invalid(phones).stream().findFirst()
                        .ifPresent(bad -> errors.put("drugshopContactPhones", "Invalid phone: " + bad));
            }
        }
        FieldLimits.checkLength(trimToNull(form.serialNumber()), FieldLimits.SERIAL_NUMBER, "serialNumber", errors);
        FieldLimits.checkLength(trimToNull(form.drugshopName()), FieldLimits.NAME, "drugshopName", errors);
        FieldLimits.checkLength(trimToNull(form.impoundedBy()), FieldLimits.NAME, "impoundedBy", errors);
        FieldLimits.checkLength(trimToNull(form.locationAddress()), FieldLimits.ADDRESS, "locationAddress", errors);
        FieldLimits.checkLength(clientTelephone, FieldLimits.PHONE, "clientTelephone", errors);
        List<String> contacts = PhoneNumbers.split(form.drugshopContactPhones());
        FieldLimits.checkLength(String.join(",", contacts), FieldLimits.CONTACT_PHONES, "drugshopContactPhones", errors);
        return boxes;
    }

    private static Integer parseBoxes(Object raw, Map<String, String> errors) {
        if (raw == null || raw.toString().isBlank()) {
            errors.put("boxesImpounded", "This field is required");
            return null;
        }
        if (raw instanceof CharSequence cs) {
            String text = cs.toString().trim();
            if (!DIGITS.matcher(text).matches()) {
                errors.put("boxesImpounded", "Enter a valid number");
                return null;
            }
            return toInt(new BigInteger(text), errors);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte
                || raw instanceof BigInteger) {
            return toInt(new BigInteger(raw.toString()), errors);
        }
        if (raw instanceof Number n) {
            try {
                BigDecimal value = new BigDecimal(n.toString());
                if (value.stripTrailingZeros().scale() <= 0) {
                    return toInt(value.toBigInteger(), errors);
                }
            } catch (NumberFormatException e) {
                log.debug("Rejecting non-finite box count {}", n);
            }
        }
        errors.put("boxesImpounded", "Enter a valid number");
        return null;
    }

    private static Integer toInt(BigInteger value, Map<String, String> errors) {
        if (value.signum() < 0 || value.bitLength() > 31) {
            errors.put("boxesImpounded", "Enter a valid number");
            return null;
        }
        return value.intValue();
    }

    private NotificationOutcome await(CompletableFuture<NotificationOutcome> future) {
        try {
            return future.get(notificationAwait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return NotificationOutcome.pending();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NotificationOutcome.pending();
        } catch (ExecutionException e) {
            log.warn("Impound SMS dispatch failed unexpectedly: {}", String.valueOf(e.getCause()));
            return NotificationOutcome.failed(String.valueOf(e.getCause()));
        }
    }

    private static void requireText(String value, String field, Map<String, String> errors) {
        if (value == null || value.isBlank()) {
            errors.put(field, "This field is required");
        }
    }

    private static String trimToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
