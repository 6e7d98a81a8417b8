package com.fieldreport.impound.service;

import com.fieldreport.impound.config.AppMetrics;
import com.fieldreport.impound.exception.InspectionNotFoundException;
import com.fieldreport.impound.exception.InvalidFormException;
import com.fieldreport.impound.exception.InvalidQuantityException;
import com.fieldreport.impound.exception.OverReleaseException;
import com.fieldreport.impound.exception.ReleaseNotFoundException;
import com.fieldreport.impound.exception.ReleaseOutcomeUnknownException;
import com.fieldreport.impound.exception.StoreUnavailableException;
import com.fieldreport.impound.model.CommittedRelease;
import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.InspectionStatus;
import com.fieldreport.impound.model.Operator;
import com.fieldreport.impound.model.ReleaseMetadata;
import com.fieldreport.impound.model.ReleaseRecord;
import com.fieldreport.impound.repository.InspectionRepository;
import com.fieldreport.impound.repository.ReleaseRecordRepository;
import com.fieldreport.impound.repository.StoreRetryPolicy;
import com.fieldreport.impound.service.ledger.LedgerDecision;
import com.fieldreport.impound.service.ledger.QuantityLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies releases to the store so that concurrent releases against one inspection behave as if
 * they ran one after another.
 *
 * Each attempt reads the inspection, lets the {@link QuantityLedger} decide, then writes the new
 * quantity with a conditional update (expected version and quantity) and appends the release
 * record in the same transaction. A lost race re-reads and re-decides. The release id is the
 * idempotency key: every attempt first looks for a record with that id, so a retried or
 * resubmitted release is never applied twice.
 */
@Service
@Slf4j
public class ReconciliationCoordinator {

    private final InspectionRepository inspectionRepository;
    private final ReleaseRecordRepository releaseRepository;
    private final QuantityLedger ledger;
    private final TransactionTemplate transactionTemplate;
    private final StoreRetryPolicy retryPolicy;
    private final AppMetrics metrics;
    private final int maxConflictRetries;

    public ReconciliationCoordinator(InspectionRepository inspectionRepository,
                                     ReleaseRecordRepository releaseRepository,
                                     QuantityLedger ledger,
                                     TransactionTemplate transactionTemplate,
                                     StoreRetryPolicy retryPolicy,
                                     AppMetrics metrics,
                                     @Value("${app.store.max-conflict-retries:5}") int maxConflictRetries) {
        this.inspectionRepository = inspectionRepository;
        this.releaseRepository = releaseRepository;
        this.ledger = ledger;
        this.transactionTemplate = transactionTemplate;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.maxConflictRetries = maxConflictRetries;
    }

    /**
     * Commit one release.
     *
     * @throws InspectionNotFoundException     the inspection does not exist
     * @throws InvalidQuantityException        quantity missing or not positive
     * @throws OverReleaseException            quantity exceeds what is impounded right now
     * @throws StoreUnavailableException       store unreachable or contended; nothing was written
     * @throws ReleaseOutcomeUnknownException  a write was sent but never confirmed either way
     */
    public CommittedRelease commitRelease(String inspectionId, Integer requestedQuantity, ReleaseMetadata metadata) {
        String releaseId = metadata.releaseId() == null || metadata.releaseId().isBlank()
                ? UUID.randomUUID().toString()
                : metadata.releaseId();
        long start = System.currentTimeMillis();

        int faults = 0;
        int conflicts = 0;
        RuntimeException unresolvedWrite = null;

        while (true) {
            try {
                Optional<ReleaseRecord> existing = releaseRepository.find(inspectionId, releaseId);
                if (existing.isPresent()) {
                    return replay(existing.get(), unresolvedWrite != null);
                }
                // the store has answered for this id, so an earlier failed write did not land
                unresolvedWrite = null;

                Inspection current = inspectionRepository.findById(inspectionId)
                        .orElseThrow(() -> new InspectionNotFoundException(inspectionId));
                LedgerDecision decision = decide(current, requestedQuantity);
                ReleaseRecord record = newRecord(releaseId, current, decision, metadata);

                boolean applied;
                try {
                    applied = Boolean.TRUE.equals(transactionTemplate.execute(tx -> apply(current, decision, record)));
                } catch (DuplicateKeyException e) {
                    return resolveDuplicate(inspectionId, releaseId, e);
                } catch (ConcurrencyFailureException e) {
                    log.debug("Lock conflict releasing {} boxes from inspection {}: {}",
                            decision.released(), inspectionId, e.getMessage());
                    applied = false;
                } catch (DataAccessException | TransactionException e) {
                    // a non-transient failure means the statement was refused and rolled back
                    if (!(e instanceof DataAccessException dae) || retryPolicy.isTransient(dae)) {
                        unresolvedWrite = e;
                    }
                    throw e;
                }

                if (applied) {
                    metrics.incrementReleasesCommitted();
                    metrics.recordReleaseCommitTime(System.currentTimeMillis() - start);
                    log.info("Released {} boxes from inspection {} (release={}, remaining={}, status={})",
                            decision.released(), inspectionId, releaseId, decision.remaining(), decision.status());
                    return new CommittedRelease(record, decision.remaining(), decision.status(), false);
                }

                conflicts++;
                metrics.incrementConflicts();
                if (conflicts > maxConflictRetries) {
                    log.error("Giving up on release {} for inspection {} after {} conflicting updates",
                            releaseId, inspectionId, conflicts);
                    throw new StoreUnavailableException(
                            "Inspection " + inspectionId + " is being changed concurrently (contention), try again");
                }
                log.info("Inspection {} changed during release {} (conflict {}/{}), re-reading",
                        inspectionId, releaseId, conflicts, maxConflictRetries);
                if (!retryPolicy.sleep(retryPolicy.backoffDelay(conflicts))) {
                    throw new StoreUnavailableException("Interrupted while waiting to retry release " + releaseId);
                }

            } catch (DataAccessException | TransactionException e) {
                faults++;
                boolean retryable = !(e instanceof DataAccessException dae) || retryPolicy.isTransient(dae);
                if (!retryable || faults > retryPolicy.maxRetries()) {
                    throw giveUp(inspectionId, releaseId, faults, unresolvedWrite, e);
                }
                metrics.incrementStoreRetries();
                long delay = retryPolicy.backoffDelay(faults);
                log.warn("Store fault during release {} for inspection {} (attempt {}/{}), retrying in {}ms: {}",
                        releaseId, inspectionId, faults, retryPolicy.maxRetries() + 1, delay, e.getMessage());
                if (!retryPolicy.sleep(delay)) {
                    throw giveUp(inspectionId, releaseId, faults, unresolvedWrite, e);
                }
            }
        }
    }

    /**
     * Look up a release by its id, e.g. to resolve an unknown outcome.
     */
    public CommittedRelease findRelease(String inspectionId, String releaseId) {
        try {
            return retryPolicy.execute("findRelease", () -> releaseRepository.find(inspectionId, releaseId))
                    .map(record -> CommittedRelease.fromRecord(record, true))
                    .orElseThrow(() -> new ReleaseNotFoundException(inspectionId, releaseId));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Could not read release " + releaseId, e);
        }
    }

    private boolean apply(Inspection current, LedgerDecision decision, ReleaseRecord record) {
        if (!inspectionRepository.compareAndSetRelease(current, decision.remaining(), decision.status(), record)) {
            return false;
        }
        releaseRepository.append(record);
        verifyConservation(current, decision);
        return true;
    }

    /**
     * Sum of releases plus what is left must equal what was impounded. Throwing here rolls back
     * both writes.
     */
    private void verifyConservation(Inspection current, LedgerDecision decision) {
        boolean completed = decision.status() == InspectionStatus.COMPLETED;
        if (decision.remaining() < 0 || completed != (decision.remaining() == 0)) {
            throw new IllegalStateException("Inconsistent release decision for inspection " + current.getId()
                    + ": remaining=" + decision.remaining() + ", status=" + decision.status());
        }
        ReleaseRecordRepository.ReleaseTotals totals = releaseRepository.totals(current.getId());
        if (totals.totalReleased() + decision.remaining() != current.getInitialBoxes()) {
            log.error("Quantity mismatch on inspection {}: released={} remaining={} initial={}",
                    current.getId(), totals.totalReleased(), decision.remaining(), current.getInitialBoxes());
            throw new IllegalStateException("Release totals of inspection " + current.getId()
                    + " do not add up to the impounded quantity");
        }
    }

    private LedgerDecision decide(Inspection current, Integer requestedQuantity) {
        try {
            return ledger.applyRelease(current.getBoxesImpounded(), requestedQuantity);
        } catch (InvalidQuantityException e) {
            metrics.incrementInvalidQuantity();
            throw e;
        } catch (OverReleaseException e) {
            metrics.incrementOverRelease();
            log.info("Rejected release on inspection {}: {}", current.getId(), e.getMessage());
            throw e;
        }
    }

    private ReleaseRecord newRecord(String releaseId, Inspection current, LedgerDecision decision, ReleaseMetadata metadata) {
        Operator operator = metadata.operator() == null ? Operator.anonymous() : metadata.operator();
        Instant now = Instant.now();
        return ReleaseRecord.builder()
                .releaseId(releaseId)
                .inspectionId(current.getId())
                .quantity(decision.released())
                .releaseDate(metadata.releaseDate() == null ? now : metadata.releaseDate())
                .clientName(metadata.clientName())
                .telephone(metadata.telephone())
                .releasedBy(metadata.releasedBy())
                .note(metadata.note())
                .createdByUid(operator.uid())
                .createdByEmail(operator.email())
                .createdByName(operator.displayName())
                .createdAt(now)
                .remainingAfter(decision.remaining())
                .statusAfter(decision.status())
                .build();
    }

    private CommittedRelease replay(ReleaseRecord record, boolean resolvedUnknownWrite) {
        metrics.incrementReleasesReplayed();
        if (resolvedUnknownWrite) {
            log.info("Release {} on inspection {} had landed despite the store fault", record.getReleaseId(), record.getInspectionId());
        } else {
            log.info("Release {} on inspection {} already committed, returning recorded result",
                    record.getReleaseId(), record.getInspectionId());
        }
        return CommittedRelease.fromRecord(record, true);
    }

    private CommittedRelease resolveDuplicate(String inspectionId, String releaseId, DuplicateKeyException e) {
        return releaseRepository.find(inspectionId, releaseId)
                .map(record -> replay(record, false))
                .orElseThrow(() -> {
                    log.warn("Release id {} is already used by another inspection: {}", releaseId, e.getMessage());
                    return new InvalidFormException(Map.of("releaseId", "Release id is already in use"));
                });
    }

    private RuntimeException giveUp(String inspectionId, String releaseId, int attempts,
                                    RuntimeException unresolvedWrite, RuntimeException last) {
        if (unresolvedWrite != null) {
            metrics.incrementOutcomeUnknown();
            log.error("Release {} on inspection {} unresolved after {} attempts: {}",
                    releaseId, inspectionId, attempts, last.getMessage());
            return new ReleaseOutcomeUnknownException(inspectionId, releaseId, last);
        }
        log.error("Release {} on inspection {} failed after {} attempts: {}", releaseId, inspectionId, attempts, last.getMessage());
        return new StoreUnavailableException("The inspection store is unavailable, nothing was released", last);
    }
}
