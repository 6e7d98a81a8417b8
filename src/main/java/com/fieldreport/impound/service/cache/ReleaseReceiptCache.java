package com.fieldreport.impound.service.cache;

import com.fieldreport.impound.model.ReleaseReceipt;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Remembers the receipt handed out for each release so a resubmitted release
 * (same idempotency key) gets the same answer without a second SMS.
 *
 * Entries are keyed by inspection and release id. Only receipts of committed releases are stored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReleaseReceiptCache {

    private final Cache<String, ReleaseReceipt> receiptStore;

    private static String key(String inspectionId, String releaseId) {
        return inspectionId + "::" + releaseId;
    }

    public Optional<ReleaseReceipt> find(String inspectionId, String releaseId) {
        if (releaseId == null || releaseId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(receiptStore.getIfPresent(key(inspectionId, releaseId)));
    }

    public void remember(ReleaseReceipt receipt) {
        receiptStore.put(key(receipt.inspectionId(), receipt.releaseId()), receipt);
        log.debug("Cached receipt of release {} on inspection {}", receipt.releaseId(), receipt.inspectionId());
    }

    public CacheStats getStats() {
        var stats = receiptStore.stats();
        return new CacheStats(
                receiptStore.estimatedSize(),
                stats.hitCount(),
                stats.missCount(),
                stats.hitRate()
        );
    }

    public record CacheStats(
            long size,
            long hits,
            long misses,
            double hitRate
    ) {}
}
