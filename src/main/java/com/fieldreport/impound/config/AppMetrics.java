package com.fieldreport.impound.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Release and notification metrics.
 *
 * View at: http://localhost:8080/actuator/metrics
 *
 * Key metrics:
 * - release.committed      → Releases durably applied
 * - release.rejected       → Releases refused by the ledger (tag: kind)
 * - release.conflict       → Conditional updates that lost a race and were re-decided
 * - store.retry            → Transient store faults retried
 * - notification.*         → SMS outcomes (sent / failed / skipped)
 * - register.entry.created → Inspection register entries
 * - release.commit.time    → Time to commit one release (use MEAN for avg)
 * - notification.send.time → SMS gateway round trip
 */
@Component
@Getter
public class AppMetrics {

    // Timers
    private final Timer releaseCommitTimer;
    private final Timer notificationTimer;

    // Counters
    private final Counter releasesCommittedCounter;
    private final Counter releasesReplayedCounter;
    private final Counter invalidQuantityCounter;
    private final Counter overReleaseCounter;
    private final Counter conflictCounter;
    private final Counter storeRetryCounter;
    private final Counter outcomeUnknownCounter;
    private final Counter inspectionsCreatedCounter;
    private final Counter registerEntriesCounter;
    private final Counter notificationsSentCounter;
    private final Counter notificationsFailedCounter;
    private final Counter notificationsSkippedCounter;

    public AppMetrics(MeterRegistry registry) {
        this.releaseCommitTimer = Timer.builder("release.commit.time")
                .description("Time to commit one release including conflict retries")
                .register(registry);

        this.notificationTimer = Timer.builder("notification.send.time")
                .description("SMS gateway round trip")
                .register(registry);

        this.releasesCommittedCounter = Counter.builder("release.committed")
                .description("Releases durably applied")
                .register(registry);

        this.releasesReplayedCounter = Counter.builder("release.replayed")
                .description("Release submissions answered from an earlier commit")
                .register(registry);

        this.invalidQuantityCounter = Counter.builder("release.rejected")
                .description("Releases refused by the ledger")
                .tag("kind", "invalid_quantity")
                .register(registry);

        this.overReleaseCounter = Counter.builder("release.rejected")
                .description("Releases refused by the ledger")
                .tag("kind", "over_release")
                .register(registry);

        this.conflictCounter = Counter.builder("release.conflict")
                .description("Conditional updates that lost a race")
                .register(registry);

        this.storeRetryCounter = Counter.builder("store.retry")
                .description("Transient store faults retried")
                .register(registry);

        this.outcomeUnknownCounter = Counter.builder("release.outcome.unknown")
                .description("Releases whose commit could not be confirmed")
                .register(registry);

        this.inspectionsCreatedCounter = Counter.builder("inspection.created")
                .description("Inspection reports submitted")
                .register(registry);

        this.registerEntriesCounter = Counter.builder("register.entry.created")
                .description("Inspection register entries written")
                .register(registry);

        this.notificationsSentCounter = Counter.builder("notification.sent")
                .description("SMS messages accepted by the gateway")
                .register(registry);

        this.notificationsFailedCounter = Counter.builder("notification.failed")
                .description("SMS messages the gateway refused or never answered")
                .register(registry);

        this.notificationsSkippedCounter = Counter.builder("notification.skipped")
                .description("Notifications not attempted (disabled or no recipient)")
                .register(registry);
    }

    public void recordReleaseCommitTime(long millis) {
        releaseCommitTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordNotificationTime(long millis) {
        notificationTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementReleasesCommitted() {
        releasesCommittedCounter.increment();
    }

    public void incrementReleasesReplayed() {
        releasesReplayedCounter.increment();
    }

    public void incrementInvalidQuantity() {
        invalidQuantityCounter.increment();
    }

    public void incrementOverRelease() {
        overReleaseCounter.increment();
    }

    public void incrementConflicts() {
        conflictCounter.increment();
    }

    public void incrementStoreRetries() {
        storeRetryCounter.increment();
    }

    public void incrementOutcomeUnknown() {
        outcomeUnknownCounter.increment();
    }

    public void incrementInspectionsCreated() {
        inspectionsCreatedCounter.increment();
    }

    public void incrementRegisterEntries() {
        registerEntriesCounter.increment();
    }

    public void incrementNotifications(boolean attempted, boolean succeeded) {
        if (!attempted) {
            notificationsSkippedCounter.increment();
        } else if (succeeded) {
            notificationsSentCounter.increment();
        } else {
            notificationsFailedCounter.increment();
        }
    }
}
