package com.fieldreport.impound.controller;

import com.fieldreport.impound.config.AppMetrics;
import com.fieldreport.impound.service.cache.ReleaseReceiptCache;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Metrics summary in one response.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;
    private final ReleaseReceiptCache receiptCache;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());
        response.put("releases", getReleaseMetrics());
        response.put("notifications", getNotificationMetrics());
        response.put("timing", getTimingMetrics());
        response.put("receiptCache", receiptCache.getStats());
        return response;
    }

    @GetMapping("/releases")
    public Map<String, Object> getReleaseMetrics() {
        Map<String, Object> releases = new LinkedHashMap<>();
        releases.put("committed", (long) appMetrics.getReleasesCommittedCounter().count());
        releases.put("replayed", (long) appMetrics.getReleasesReplayedCounter().count());
        releases.put("rejectedInvalidQuantity", (long) appMetrics.getInvalidQuantityCounter().count());
        releases.put("rejectedOverRelease", (long) appMetrics.getOverReleaseCounter().count());
        releases.put("conflicts", (long) appMetrics.getConflictCounter().count());
        releases.put("storeRetries", (long) appMetrics.getStoreRetryCounter().count());
        releases.put("outcomeUnknown", (long) appMetrics.getOutcomeUnknownCounter().count());
        releases.put("inspectionsCreated", (long) appMetrics.getInspectionsCreatedCounter().count());
        return releases;
    }

    @GetMapping("/notifications")
    public Map<String, Object> getNotificationMetrics() {
        Map<String, Object> notifications = new LinkedHashMap<>();
        double sent = appMetrics.getNotificationsSentCounter().count();
        double failed = appMetrics.getNotificationsFailedCounter().count();
        notifications.put("sent", (long) sent);
        notifications.put("failed", (long) failed);
        notifications.put("skipped", (long) appMetrics.getNotificationsSkippedCounter().count());
        if (sent + failed > 0) {
            notifications.put("deliveryRate", String.format("%.2f%%", (sent / (sent + failed)) * 100));
        } else {
            notifications.put("deliveryRate", "N/A");
        }
        return notifications;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();
        timing.put("releaseCommit", getTimerStats(appMetrics.getReleaseCommitTimer()));
        timing.put("notificationSend", getTimerStats(appMetrics.getNotificationTimer()));
        return timing;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();
        long count = timer.count();
        stats.put("count", count);
        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }
        return stats;
    }
}
