package com.fieldreport.impound.service;

import com.fieldreport.impound.config.AppMetrics;
import com.fieldreport.impound.exception.InspectionNotFoundException;
import com.fieldreport.impound.exception.InvalidFormException;
import com.fieldreport.impound.exception.InvalidQuantityException;
import com.fieldreport.impound.exception.OverReleaseException;
import com.fieldreport.impound.exception.ReleaseNotFoundException;
import com.fieldreport.impound.exception.StoreUnavailableException;
import com.fieldreport.impound.model.CommittedRelease;
import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.InspectionStatus;
import com.fieldreport.impound.model.Operator;
import com.fieldreport.impound.model.QuantityRepresentation;
import com.fieldreport.impound.model.ReleaseMetadata;
import com.fieldreport.impound.repository.H2TestDatabase;
import com.fieldreport.impound.repository.InspectionRepository;
import com.fieldreport.impound.repository.ReleaseRecordRepository;
import com.fieldreport.impound.repository.SqlTemplateLoader;
import com.fieldreport.impound.repository.StoreRetryPolicy;
import com.fieldreport.impound.service.ledger.QuantityLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Release commits against a real H2 store.
 */
class ReconciliationCoordinatorIntegrationTest {

    private InspectionRepository inspections;
    private ReleaseRecordRepository releases;
    private NamedParameterJdbcTemplate jdbcTemplate;
    private AppMetrics metrics;
    private ReconciliationCoordinator coordinator;

    @BeforeEach
    void setup() throws Exception {
        DataSource ds = H2TestDatabase.create("coordinatortest");
        jdbcTemplate = new NamedParameterJdbcTemplate(ds);
        SqlTemplateLoader loader = H2TestDatabase.sqlLoader();
        inspections = new InspectionRepository(jdbcTemplate, loader);
        releases = new ReleaseRecordRepository(jdbcTemplate, loader);
        metrics = new AppMetrics(new SimpleMeterRegistry());
        coordinator = new ReconciliationCoordinator(
                inspections,
                releases,
                new QuantityLedger(),
                new TransactionTemplate(new DataSourceTransactionManager(ds)),
                new StoreRetryPolicy(3, 1L),
                metrics,
                10);
    }

    @Test
    void partialThenFullRelease_completesInspection() {
        Inspection inspection = impound(20);

        CommittedRelease first = coordinator.commitRelease(inspection.getId(), 5, metadata("r-1"));
        assertEquals(15, first.remaining());
        assertEquals(InspectionStatus.PENDING_REVIEW, first.status());
        assertFalse(first.replayed());

        CommittedRelease second = coordinator.commitRelease(inspection.getId(), 15, metadata("r-2"));
        assertEquals(0, second.remaining());
        assertEquals(InspectionStatus.COMPLETED, second.status());

        Inspection after = inspections.findById(inspection.getId()).orElseThrow();
        assertEquals(0, after.getBoxesImpounded());
        assertEquals(InspectionStatus.COMPLETED, after.getStatus());
        assertEquals(15, after.getLastReleaseCount());
        assertEquals(2L, after.getVersion());
        assertEquals(2, releases.findByInspection(inspection.getId()).size());
        assertEquals(20L, releases.totals(inspection.getId()).totalReleased());
        assertEquals(2.0, metrics.getReleasesCommittedCounter().count());
    }

    @Test
    void overRelease_writesNothing() {
        Inspection inspection = impound(3);

        OverReleaseException e = assertThrows(OverReleaseException.class,
                () -> coordinator.commitRelease(inspection.getId(), 4, metadata("r-1")));

        assertEquals(4, e.getRequested());
        assertEquals(3, e.getAvailable());
        Inspection after = inspections.findById(inspection.getId()).orElseThrow();
        assertEquals(3, after.getBoxesImpounded());
        assertEquals(InspectionStatus.SUBMITTED, after.getStatus());
        assertTrue(releases.findByInspection(inspection.getId()).isEmpty());
        assertEquals(1.0, metrics.getOverReleaseCounter().count());
    }

    @Test
    void invalidQuantity_writesNothing() {
        Inspection inspection = impound(3);

        assertThrows(InvalidQuantityException.class,
                () -> coordinator.commitRelease(inspection.getId(), 0, metadata("r-1")));
        assertThrows(InvalidQuantityException.class,
                () -> coordinator.commitRelease(inspection.getId(), null, metadata("r-2")));

        assertEquals(0L, inspections.findById(inspection.getId()).orElseThrow().getVersion());
    }

    @Test
    void unknownInspection_isNotFound() {
        assertThrows(InspectionNotFoundException.class,
                () -> coordinator.commitRelease("missing", 1, metadata("r-1")));
    }

    @Test
    void textRepresentation_isKeptAcrossReleases() {
        Inspection stored = inspections.insert(InspectionTestData.inspection(8, QuantityRepresentation.TEXT));

        coordinator.commitRelease(stored.getId(), 3, metadata("r-1"));

        Inspection after = inspections.findById(stored.getId()).orElseThrow();
        assertEquals("5", after.boxesImpoundedValue());
    }

    @Test
    void resubmittedReleaseId_isReplayedNotReapplied() {
        Inspection inspection = impound(10);

        CommittedRelease first = coordinator.commitRelease(inspection.getId(), 4, metadata("r-1"));
        CommittedRelease again = coordinator.commitRelease(inspection.getId(), 4, metadata("r-1"));

        assertTrue(again.replayed());
        assertEquals(first.releaseId(), again.releaseId());
        assertEquals(6, again.remaining());
        assertEquals(6, inspections.findById(inspection.getId()).orElseThrow().getBoxesImpounded());
        assertEquals(1, releases.findByInspection(inspection.getId()).size());
    }

    @Test
    void releaseIdOfAnotherInspection_isRejected() {
        Inspection a = impound(10);
        Inspection b = impound(10);
        coordinator.commitRelease(a.getId(), 1, metadata("shared"));

        assertThrows(InvalidFormException.class, () -> coordinator.commitRelease(b.getId(), 1, metadata("shared")));
        assertEquals(10, inspections.findById(b.getId()).orElseThrow().getBoxesImpounded());
    }

    @Test
    void generatedReleaseId_whenNoneGiven() {
        Inspection inspection = impound(10);

        CommittedRelease committed = coordinator.commitRelease(inspection.getId(), 1, metadata(null));

        assertNotNull(committed.releaseId());
        assertEquals(committed.releaseId(), coordinator.findRelease(inspection.getId(), committed.releaseId()).releaseId());
    }

    @Test
    void findRelease_unknownId_isNotFound() {
        Inspection inspection = impound(10);
        assertThrows(ReleaseNotFoundException.class, () -> coordinator.findRelease(inspection.getId(), "nope"));
    }

    @Test
    void brokenTotals_rollBackTheRelease() {
        Inspection inspection = impound(10);
        // a stray record nobody accounted for in the remaining quantity
        jdbcTemplate.getJdbcTemplate().update(
                "INSERT INTO release_records (release_id, inspection_id, quantity, created_at, remaining_after, status_after) "
                        + "VALUES ('stray', ?, 2, CURRENT_TIMESTAMP, 8, 'Pending Review')", inspection.getId());

        assertThrows(IllegalStateException.class, () -> coordinator.commitRelease(inspection.getId(), 3, metadata("r-1")));

        Inspection after = inspections.findById(inspection.getId()).orElseThrow();
        assertEquals(10, after.getBoxesImpounded());
        assertEquals(0L, after.getVersion());
        assertTrue(releases.find(inspection.getId(), "r-1").isEmpty());
    }

    @Test
    void concurrentReleases_neverOverRelease() throws Exception {
        Inspection inspection = impound(10);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CommittedRelease>> futures = new ArrayList<>();
            for (String releaseId : List.of("a", "b")) {
                Callable<CommittedRelease> task = () -> {
                    start.await(5, TimeUnit.SECONDS);
                    return coordinator.commitRelease(inspection.getId(), 6, metadata(releaseId));
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int committed = 0;
            List<Throwable> failures = new ArrayList<>();
            for (Future<CommittedRelease> f : futures) {
                try {
                    CommittedRelease r = f.get(30, TimeUnit.SECONDS);
                    assertEquals(4, r.remaining());
                    committed++;
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }

            assertEquals(1, committed);
            assertThat(failures).hasSize(1);
            OverReleaseException rejected = assertInstanceOf(OverReleaseException.class, failures.get(0));
            assertEquals(6, rejected.getRequested());
            assertEquals(4, rejected.getAvailable());
        } finally {
            pool.shutdownNow();
        }

        Inspection after = inspections.findById(inspection.getId()).orElseThrow();
        assertEquals(4, after.getBoxesImpounded());
        assertEquals(1, releases.findByInspection(inspection.getId()).size());
        assertEquals(6L, releases.totals(inspection.getId()).totalReleased());
    }

    @Test
    void manySmallConcurrentReleases_addUp() throws Exception {
        Inspection inspection = impound(12);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CommittedRelease>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String releaseId = "small-" + i;
                futures.add(pool.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    return coordinator.commitRelease(inspection.getId(), 1, metadata(releaseId));
                }));
            }
            start.countDown();
            for (Future<CommittedRelease> f : futures) {
                try {
                    f.get(30, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    // contention may exhaust retries; totals must still add up
                    assertThat(e.getCause()).isInstanceOf(StoreUnavailableException.class);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        Inspection after = inspections.findById(inspection.getId()).orElseThrow();
        long released = releases.totals(inspection.getId()).totalReleased();
        assertEquals(12L, released + after.getBoxesImpounded());
        assertEquals(after.getVersion(), releases.totals(inspection.getId()).releaseCount());
    }

    private Inspection impound(int boxes) {
        return inspections.insert(InspectionTestData.inspection(boxes, QuantityRepresentation.NUMERIC));
    }

    private static ReleaseMetadata metadata(String releaseId) {
        return new ReleaseMetadata(releaseId, Instant.now(), "Client", "0772000003", "Officer Okello", null,
                new Operator("uid-1", "officer@example.org", "Officer Okello"));
    }
}
