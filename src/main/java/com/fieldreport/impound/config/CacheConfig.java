package com.fieldreport.impound.config;

import com.fieldreport.impound.model.ReleaseReceipt;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine cache of release receipts keyed by release id.
 *
 * A resubmitted release (same id) is answered from here without touching the store or
 * sending a second SMS. The store stays the authority once an entry expires.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.receipts.max-size:10000}")
    private int receiptMaxSize;

    @Value("${app.cache.receipts.ttl-minutes:60}")
    private int receiptTtlMinutes;

    @Bean
    public Cache<String, ReleaseReceipt> receiptCacheStore() {
        log.info("Creating release receipt cache: maxSize={}, ttl={}m", receiptMaxSize, receiptTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(receiptMaxSize)
                .expireAfterWrite(Duration.ofMinutes(receiptTtlMinutes))
                .recordStats()
                .build();
    }
}
