package com.fieldreport.impound.service;

import com.fieldreport.impound.config.AppMetrics;
import com.fieldreport.impound.exception.InvalidFormException;
import com.fieldreport.impound.exception.OverReleaseException;
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
import com.fieldreport.impound.service.ledger.QuantityLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Store faults and lost races around a release commit, with the repositories mocked.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReconciliationCoordinatorRetryTest {

    private static final String INSPECTION_ID = "insp-1";
    private static final String RELEASE_ID = "rel-1";

    @Mock private InspectionRepository inspectionRepository;
    @Mock private ReleaseRecordRepository releaseRepository;
    @Mock private TransactionTemplate transactionTemplate;

    private AppMetrics metrics;
    private ReconciliationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        metrics = new AppMetrics(new SimpleMeterRegistry());
        coordinator = new ReconciliationCoordinator(inspectionRepository, releaseRepository, new QuantityLedger(),
                transactionTemplate, new StoreRetryPolicy(3, 0L), metrics, 2);

        when(transactionTemplate.execute(any())).thenAnswer(inv -> {
            TransactionCallback<?> callback = inv.getArgument(0);
            return callback.doInTransaction(null);
        });
        when(inspectionRepository.findById(INSPECTION_ID))
                .thenReturn(Optional.of(InspectionTestData.stored(INSPECTION_ID, 10)));
        when(releaseRepository.totals(INSPECTION_ID)).thenReturn(new ReleaseRecordRepository.ReleaseTotals(4, 1));
    }

    @Test
    void transientReadFault_isRetried() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID))
                .thenThrow(new TransientDataAccessResourceException("connection reset"))
                .thenReturn(Optional.empty());
        when(inspectionRepository.compareAndSetRelease(any(), eq(6), eq(InspectionStatus.PENDING_REVIEW), any()))
                .thenReturn(true);

        CommittedRelease committed = coordinator.commitRelease(INSPECTION_ID, 4, metadata());

        assertEquals(6, committed.remaining());
        assertFalse(committed.replayed());
        assertEquals(1.0, metrics.getStoreRetryCounter().count());
        verify(releaseRepository).append(any(ReleaseRecord.class));
    }

    @Test
    void storeDownThroughout_isUnavailableAndWritesNothing() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID))
                .thenThrow(new TransientDataAccessResourceException("store down"));

        assertThrows(StoreUnavailableException.class, () -> coordinator.commitRelease(INSPECTION_ID, 4, metadata()));

        verify(releaseRepository, times(4)).find(INSPECTION_ID, RELEASE_ID);
        verify(inspectionRepository, never()).compareAndSetRelease(any(), anyInt(), any(), any());
    }

    @Test
    void writeFault_thenRecordFound_isReportedAsCommitted() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(InspectionTestData.release(RELEASE_ID, INSPECTION_ID, 4, 6,
                        InspectionStatus.PENDING_REVIEW)));
        when(inspectionRepository.compareAndSetRelease(any(), anyInt(), any(), any()))
                .thenThrow(new TransientDataAccessResourceException("connection dropped before commit ack"));

        CommittedRelease committed = coordinator.commitRelease(INSPECTION_ID, 4, metadata());

        assertTrue(committed.replayed());
        assertEquals(RELEASE_ID, committed.releaseId());
        assertEquals(6, committed.remaining());
        verify(inspectionRepository, times(1)).compareAndSetRelease(any(), anyInt(), any(), any());
    }

    @Test
    void writeFault_thenStoreGone_isOutcomeUnknown() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID))
                .thenReturn(Optional.empty())
                .thenThrow(new TransientDataAccessResourceException("store down"));
        when(inspectionRepository.compareAndSetRelease(any(), anyInt(), any(), any()))
                .thenThrow(new TransientDataAccessResourceException("connection dropped before commit ack"));

        ReleaseOutcomeUnknownException e = assertThrows(ReleaseOutcomeUnknownException.class,
                () -> coordinator.commitRelease(INSPECTION_ID, 4, metadata()));

        assertEquals(INSPECTION_ID, e.getInspectionId());
        assertEquals(RELEASE_ID, e.getReleaseId());
        assertEquals(1.0, metrics.getOutcomeUnknownCounter().count());
    }

    @Test
    void refusedWrite_isUnavailableNotUnknown() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID)).thenReturn(Optional.empty());
        when(inspectionRepository.compareAndSetRelease(any(), anyInt(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("check constraint"));

        assertThrows(StoreUnavailableException.class, () -> coordinator.commitRelease(INSPECTION_ID, 4, metadata()));
        verify(inspectionRepository, times(1)).compareAndSetRelease(any(), anyInt(), any(), any());
    }

    @Test
    void lostRaces_reReadAndGiveUpAfterLimit() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID)).thenReturn(Optional.empty());
        when(inspectionRepository.compareAndSetRelease(any(), anyInt(), any(), any())).thenReturn(false);

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> coordinator.commitRelease(INSPECTION_ID, 4, metadata()));

        assertThat(e.getMessage()).contains("contention");
        assertEquals(3.0, metrics.getConflictCounter().count());
        verify(inspectionRepository, times(3)).findById(INSPECTION_ID);
        verify(releaseRepository, never()).append(any());
    }

    @Test
    void lostRace_reDecidesAgainstFreshQuantity() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID)).thenReturn(Optional.empty());
        when(inspectionRepository.findById(INSPECTION_ID))
                .thenReturn(Optional.of(InspectionTestData.stored(INSPECTION_ID, 10)))
                .thenReturn(Optional.of(InspectionTestData.stored(INSPECTION_ID, 10).toBuilder()
                        .boxesImpounded(3).version(1L).build()));
        when(inspectionRepository.compareAndSetRelease(any(), anyInt(), any(), any())).thenReturn(false);

        OverReleaseException e = assertThrows(OverReleaseException.class,
                () -> coordinator.commitRelease(INSPECTION_ID, 4, metadata()));

        assertEquals(3, e.getAvailable());
        assertEquals(1.0, metrics.getConflictCounter().count());
        assertEquals(1.0, metrics.getOverReleaseCounter().count());
    }

    @Test
    void rejection_neverOpensATransaction() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID)).thenReturn(Optional.empty());

        assertThrows(OverReleaseException.class, () -> coordinator.commitRelease(INSPECTION_ID, 11, metadata()));

        verifyNoInteractions(transactionTemplate);
        verify(inspectionRepository, never()).compareAndSetRelease(any(), anyInt(), any(), any());
    }

    @Test
    void duplicateRecord_fromParallelResubmission_isReplayed() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(InspectionTestData.release(RELEASE_ID, INSPECTION_ID, 4, 6,
                        InspectionStatus.PENDING_REVIEW)));
        when(inspectionRepository.compareAndSetRelease(any(), anyInt(), any(), any())).thenReturn(true);
        doThrow(new DuplicateKeyException("release_id")).when(releaseRepository).append(any());

        CommittedRelease committed = coordinator.commitRelease(INSPECTION_ID, 4, metadata());

        assertTrue(committed.replayed());
        assertEquals(1.0, metrics.getReleasesReplayedCounter().count());
        assertEquals(0.0, metrics.getReleasesCommittedCounter().count());
    }

    @Test
    void duplicateRecord_ofAnotherInspection_isInvalidForm() {
        when(releaseRepository.find(INSPECTION_ID, RELEASE_ID)).thenReturn(Optional.empty());
        when(inspectionRepository.compareAndSetRelease(any(), anyInt(), any(), any())).thenReturn(true);
        doThrow(new DuplicateKeyException("release_id")).when(releaseRepository).append(any());

        InvalidFormException e = assertThrows(InvalidFormException.class,
                () -> coordinator.commitRelease(INSPECTION_ID, 4, metadata()));
        assertThat(e.getFieldErrors()).containsKey("releaseId");
    }

    private static ReleaseMetadata metadata() {
        return new ReleaseMetadata(RELEASE_ID, Instant.now(), "Client", "0772000003", "Officer Okello", null,
                new Operator("uid-1", null, null));
    }
}
