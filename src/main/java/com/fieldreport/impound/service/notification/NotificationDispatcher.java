package com.fieldreport.impound.service.notification;

import com.fieldreport.impound.config.AppMetrics;
import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.NotificationOutcome;
import com.fieldreport.impound.model.ReleaseRecord;
import com.fieldreport.impound.repository.InspectionRepository;
import com.fieldreport.impound.repository.ReleaseRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends the owner SMS that follows a committed change.
 *
 * Runs on {@code notificationExecutor} after the store write, so a slow or failing gateway can
 * never undo or delay a release. Failures end up as a {@link NotificationOutcome}, never as an
 * exception, and the outcome is stamped on the record best-effort.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final SmsGateway smsGateway;
    private final SmsMessageFormatter formatter;
    private final InspectionRepository inspectionRepository;
    private final ReleaseRecordRepository releaseRepository;
    private final AppMetrics metrics;
    private final ExecutorService executor;
    private final boolean enabled;
    private final Duration timeout;

    public NotificationDispatcher(SmsGateway smsGateway,
                                  SmsMessageFormatter formatter,
                                  InspectionRepository inspectionRepository,
                                  ReleaseRecordRepository releaseRepository,
                                  AppMetrics metrics,
                                  @Qualifier("notificationExecutor") ExecutorService executor,
                                  @Value("${app.notification.enabled:true}") boolean enabled,
                                  @Value("${app.notification.timeout:15s}") Duration timeout) {
        this.smsGateway = smsGateway;
        this.formatter = formatter;
        this.inspectionRepository = inspectionRepository;
        this.releaseRepository = releaseRepository;
        this.metrics = metrics;
        this.executor = executor;
        this.enabled = enabled;
        this.timeout = timeout;
    }

    /**
     * Tell the owner about a committed release.
     */
    public CompletableFuture<NotificationOutcome> dispatchRelease(Inspection inspection, ReleaseRecord release,
                                                                  Set<String> destinations) {
        NotificationOutcome skipped = skipReason(destinations);
        if (skipped != null) {
            metrics.incrementNotifications(false, false);
            return CompletableFuture.completedFuture(skipped);
        }
        String message = formatter.releaseMessage(inspection, release);
        return send(destinations, message, "release " + release.getReleaseId())
                .thenApply(outcome -> {
                    auditRelease(release.getReleaseId(), outcome);
                    return outcome;
                });
    }

    /**
     * Tell the drugshop contacts about a new impound.
     */
    public CompletableFuture<NotificationOutcome> dispatchImpound(Inspection inspection, Set<String> destinations) {
        NotificationOutcome skipped = skipReason(destinations);
        if (skipped != null) {
            metrics.incrementNotifications(false, false);
            return CompletableFuture.completedFuture(skipped);
        }
        String message = formatter.impoundMessage(inspection);
        return send(destinations, message, "inspection " + inspection.getId())
                .thenApply(outcome -> {
                    auditInspection(inspection.getId(), outcome);
                    return outcome;
                });
    }

    private NotificationOutcome skipReason(Set<String> destinations) {
        if (!enabled) {
            return NotificationOutcome.skipped("notifications disabled");
        }
        if (destinations == null || destinations.isEmpty()) {
            return NotificationOutcome.skipped("no recipients");
        }
        return null;
    }

    private CompletableFuture<NotificationOutcome> send(Set<String> destinations, String message, String subject) {
        return CompletableFuture
                .supplyAsync(() -> deliver(destinations, message, subject), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    String detail = cause instanceof TimeoutException
                            ? "SMS gateway did not answer within " + timeout.toMillis() + "ms"
                            : String.valueOf(cause.getMessage());
                    log.warn("SMS for {} failed: {}", subject, detail);
                    return NotificationOutcome.failed(detail);
                })
                .thenApply(outcome -> {
                    metrics.incrementNotifications(outcome.attempted(), outcome.succeeded());
                    return outcome;
                });
    }

    private NotificationOutcome deliver(Set<String> destinations, String message, String subject) {
        long start = System.currentTimeMillis();
        try {
            smsGateway.send(destinations, message);
            log.info("SMS for {} sent to {} recipient(s)", subject, destinations.size());
            return NotificationOutcome.sent();
        } catch (SmsDeliveryException e) {
            log.warn("SMS for {} failed: {}", subject, e.getMessage());
            return NotificationOutcome.failed(e.getMessage());
        } finally {
            metrics.recordNotificationTime(System.currentTimeMillis() - start);
        }
    }

    private void auditRelease(String releaseId, NotificationOutcome outcome) {
        try {
            releaseRepository.updateNotificationAudit(releaseId, outcome.attempted(), outcome.succeeded(),
                    outcome.succeeded() ? null : outcome.detail());
        } catch (DataAccessException e) {
            log.warn("Could not record SMS outcome {} on release {}: {}", outcome.status(), releaseId, e.getMessage());
        }
    }

    private void auditInspection(String inspectionId, NotificationOutcome outcome) {
        try {
            inspectionRepository.updateNotificationAudit(inspectionId, outcome.attempted(), outcome.succeeded());
        } catch (DataAccessException e) {
            log.warn("Could not record SMS outcome {} on inspection {}: {}", outcome.status(), inspectionId, e.getMessage());
        }
    }
}
