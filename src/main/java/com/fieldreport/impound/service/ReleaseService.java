package com.fieldreport.impound.service;

import com.fieldreport.impound.exception.InspectionNotFoundException;
import com.fieldreport.impound.exception.InvalidFormException;
import com.fieldreport.impound.exception.StoreUnavailableException;
import com.fieldreport.impound.model.CommittedRelease;
import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.InspectionStatus;
import com.fieldreport.impound.model.NotificationOutcome;
import com.fieldreport.impound.model.Operator;
import com.fieldreport.impound.model.ReleaseMetadata;
import com.fieldreport.impound.model.ReleaseReceipt;
import com.fieldreport.impound.model.ReleaseRecord;
import com.fieldreport.impound.model.ReleaseSubmission;
import com.fieldreport.impound.repository.InspectionRepository;
import com.fieldreport.impound.repository.StoreRetryPolicy;
import com.fieldreport.impound.service.cache.ReleaseReceiptCache;
import com.fieldreport.impound.service.confirmation.ReleaseConfirmationGate;
import com.fieldreport.impound.service.notification.NotificationDispatcher;
import com.fieldreport.impound.service.notification.PhoneNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One operator release submission, end to end:
 * form check, confirmation gate, commit, owner SMS, receipt.
 *
 * The receipt always reports the committed quantity change. The SMS outcome only changes the
 * message; a failed or slow SMS never undoes a release.
 */
@Service
@Slf4j
public class ReleaseService {

    static final String MSG_SENT = "Release submitted and SMS sent to the owner.";
    static final String MSG_FAILED = "Release submitted. SMS delivery failed, please notify the owner manually.";
    static final String MSG_SKIPPED = "Release submitted.";
    static final String MSG_PENDING = "Release submitted. SMS delivery is still in progress.";

    private final InspectionRepository inspectionRepository;
    private final ReconciliationCoordinator coordinator;
    private final ReleaseConfirmationGate confirmationGate;
    private final NotificationDispatcher notificationDispatcher;
    private final ReleaseReceiptCache receiptCache;
    private final StoreRetryPolicy retryPolicy;
    private final Duration notificationAwait;

    public ReleaseService(InspectionRepository inspectionRepository,
                          ReconciliationCoordinator coordinator,
                          ReleaseConfirmationGate confirmationGate,
                          NotificationDispatcher notificationDispatcher,
                          ReleaseReceiptCache receiptCache,
                          StoreRetryPolicy retryPolicy,
                          @Value("${app.notification.await-timeout:5s}") Duration notificationAwait) {
        this.inspectionRepository = inspectionRepository;
        this.coordinator = coordinator;
        this.confirmationGate = confirmationGate;
        this.notificationDispatcher = notificationDispatcher;
        this.receiptCache = receiptCache;
        this.retryPolicy = retryPolicy;
        this.notificationAwait = notificationAwait;
    }

    /**
     * @param idempotencyKey optional client-chosen release id; a resubmission with the same key
     *                       returns the first receipt and changes nothing
     */
    public ReleaseReceipt submit(String inspectionId, ReleaseSubmission submission, String idempotencyKey, Operator operator) {
        String releaseKey = trimToNull(idempotencyKey);
        var cached = receiptCache.find(inspectionId, releaseKey);
        if (cached.isPresent()) {
            log.info("Release {} on inspection {} resubmitted, returning cached receipt", releaseKey, inspectionId);
            return cached.get();
        }

        validateForm(inspectionId, releaseKey, submission);
        Inspection inspection = loadInspection(inspectionId);
        confirmationGate.check(submission.confirmation(), inspection.getSerialNumber());

        String telephone = PhoneNumbers.stripWhitespace(submission.telephone());
        String releaseId = releaseKey == null ? UUID.randomUUID().toString() : releaseKey;
        ReleaseMetadata metadata = new ReleaseMetadata(
                releaseId,
                submission.releaseDate(),
                submission.clientName().trim(),
                telephone,
                submission.releasedBy().trim(),
                trimToNull(submission.note()),
                operator == null ? Operator.anonymous() : operator);

        CommittedRelease committed = coordinator.commitRelease(inspectionId, submission.quantity(), metadata);

        NotificationOutcome outcome;
        if (committed.replayed()) {
            outcome = recordedOutcome(committed.record());
        } else {
            Set<String> destinations = new LinkedHashSet<>();
            destinations.add(telephone);
            outcome = await(notificationDispatcher.dispatchRelease(inspection, committed.record(), destinations));
        }

        ReleaseReceipt receipt = new ReleaseReceipt(
                inspectionId,
                committed.releaseId(),
                committed.released(),
                committed.remaining(),
                committed.status(),
                outcome,
                receiptMessage(outcome, committed.status()));
        if (outcome.status() != NotificationOutcome.Status.PENDING) {
            receiptCache.remember(receipt);
        }
        return receipt;
    }

    static String receiptMessage(NotificationOutcome outcome, InspectionStatus status) {
        String smsMessage = switch (outcome.status()) {
            case SENT -> MSG_SENT;
            case FAILED -> MSG_FAILED;
            case PENDING -> MSG_PENDING;
            case SKIPPED -> MSG_SKIPPED;
        };
        return smsMessage + "\nStatus set to “" + status.label() + "”.";
    }

    /**
     * Required fields and column widths of the release form. The quantity is left to the ledger.
     */
    void validateForm(String inspectionId, String releaseKey, ReleaseSubmission submission) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (inspectionId == null || inspectionId.isBlank()) {
            errors.put("inspectionId", "Missing inspection reference. Re-open this form from an inspection.");
        }
        FieldLimits.checkLength(releaseKey, FieldLimits.ID, "releaseId", errors);
        if (submission == null) {
            errors.put("form", "Release form is required");
            throw new InvalidFormException(errors);
        }
        if (isBlank(submission.clientName())) {
            errors.put("clientName", "Client name is required");
        }
        if (isBlank(submission.telephone())) {
            errors.put("telephone", "Telephone number is required");
        } else if (!PhoneNumbers.isValid(PhoneNumbers.stripWhitespace(submission.telephone()))) {
            errors.put("telephone", "Enter a valid phone number");
        }
        if (isBlank(submission.releasedBy())) {
            errors.put("releasedBy", "Released by field is required");
        }
        FieldLimits.checkLength(trimToNull(submission.clientName()), FieldLimits.NAME, "clientName", errors);
        FieldLimits.checkLength(PhoneNumbers.stripWhitespace(submission.telephone()), FieldLimits.PHONE, "telephone", errors);
        FieldLimits.checkLength(trimToNull(submission.releasedBy()), FieldLimits.NAME, "releasedBy", errors);
        FieldLimits.checkLength(trimToNull(submission.note()), FieldLimits.NOTE, "note", errors);
        if (!errors.isEmpty()) {
            throw new InvalidFormException(errors);
        }
    }

    private Inspection loadInspection(String inspectionId) {
        try {
            return retryPolicy.execute("findInspectionById", () -> inspectionRepository.findById(inspectionId))
                    .orElseThrow(() -> new InspectionNotFoundException(inspectionId));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Could not read inspection " + inspectionId, e);
        }
    }

    private NotificationOutcome await(CompletableFuture<NotificationOutcome> future) {
        try {
            return future.get(notificationAwait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("SMS still in flight after {}ms, reporting it as pending", notificationAwait.toMillis());
            return NotificationOutcome.pending();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NotificationOutcome.pending();
        } catch (ExecutionException e) {
            log.warn("SMS dispatch failed unexpectedly: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return NotificationOutcome.failed(String.valueOf(e.getCause()));
        }
    }

    /**
     * Outcome of the SMS sent for a release that had already been committed earlier.
     */
    private static NotificationOutcome recordedOutcome(ReleaseRecord record) {
        if (record.isNotificationSucceeded()) {
            return NotificationOutcome.sent();
        }
        if (record.isNotificationAttempted()) {
            return NotificationOutcome.failed(record.getNotificationError());
        }
        return NotificationOutcome.skipped("release already recorded");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String trimToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
