package com.gt.wordfilter.validation;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.gt.wordfilter.exception.ExternalServiceUnavailableException;
import com.gt.wordfilter.model.CacheStats;
import com.gt.wordfilter.model.ValidationRecord;
import com.gt.wordfilter.util.WordUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizes dictionary lookups per normalized word.
 *
 * <p>A miss starts exactly one lookup on the dictionary executor. Every caller asking for the same
 * word while that lookup is in flight receives the same future. Dictionary outages never surface as
 * exceptions: they are cached as UNAVAILABLE records with a short lifetime so the word is asked
 * about again soon.
 */
@Component
public class ValidationCache {

    private static final Logger log = LoggerFactory.getLogger(ValidationCache.class);

    static final String INVALID_FORMAT_REASON = "Invalid word format (must contain only letters)";

    private final DictionaryClient dictionaryClient;
    private final RequestRateLimiter rateLimiter;
    private final long callerTimeoutMs;

    private final AsyncCache<String, ValidationRecord> cache;
    private final AtomicLong externalRequests = new AtomicLong();

    @Autowired
    public ValidationCache(DictionaryClient dictionaryClient,
                           RequestRateLimiter rateLimiter,
                           @Qualifier("dictionaryExecutor") Executor dictionaryExecutor,
                           @Value("${wordfilter.validation.cache.ttlHours:24}") long ttlHours,
                           @Value("${wordfilter.validation.cache.unavailableTtlSeconds:60}") long unavailableTtlSeconds,
                           @Value("${wordfilter.validation.cache.maxSize:50000}") long maxSize,
                           @Value("${wordfilter.validation.callerTimeoutMs:60000}") long callerTimeoutMs) {
        this.dictionaryClient = dictionaryClient;
        this.rateLimiter = rateLimiter;
        this.callerTimeoutMs = callerTimeoutMs;

        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new RecordExpiry(Duration.ofHours(ttlHours), Duration.ofSeconds(unavailableTtlSeconds)))
                .executor(dictionaryExecutor)
                .recordStats()
                .buildAsync();
    }

    /**
     * Validates a word, waiting for the shared lookup to finish. Never throws for dictionary
     * failures; those come back as UNAVAILABLE records.
     */
    public ValidationRecord validate(String word) {
        String normalizedWord = WordUtil.normalize(word);
        if (!WordUtil.isAlphabetic(normalizedWord)) {
            return ValidationRecord.invalid(normalizedWord, INVALID_FORMAT_REASON);
        }

        CompletableFuture<ValidationRecord> future = validateAsync(normalizedWord);
        try {
            return future.get(callerTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Gave up waiting {} ms for validation of {}", callerTimeoutMs, normalizedWord);
            return ValidationRecord.unavailable(normalizedWord, "timed out waiting for lookup");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ValidationRecord.unavailable(normalizedWord, "interrupted");
        } catch (ExecutionException ex) {
            log.error("Validation of " + normalizedWord + " failed", ex.getCause());
            return ValidationRecord.unavailable(normalizedWord, String.valueOf(ex.getCause().getMessage()));
        }
    }

    public CompletableFuture<ValidationRecord> validateAsync(String word) {
        String normalizedWord = WordUtil.normalize(word);
        if (!WordUtil.isAlphabetic(normalizedWord)) {
            return CompletableFuture.completedFuture(ValidationRecord.invalid(normalizedWord, INVALID_FORMAT_REASON));
        }

        return cache.get(normalizedWord, (key, executor) -> CompletableFuture.supplyAsync(() -> lookup(key), executor));
    }

    public void invalidate(String word) {
        cache.synchronous().invalidate(WordUtil.normalize(word));
    }

    public void invalidateAll() {
        cache.synchronous().invalidateAll();
        log.info("Cleared validation cache");
    }

    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.synchronous().stats();

        return new CacheStats(cache.synchronous().estimatedSize(),
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.requestCount() == 0 ? 0.0 : WordUtil.roundTwoDecimals(caffeineStats.hitRate() * 100),
                externalRequests.get());
    }

    @Scheduled(fixedDelayString = "${wordfilter.validation.cache.reportIntervalMs:900000}",
               initialDelayString = "${wordfilter.validation.cache.reportIntervalMs:900000}")
    public void reportCacheStats() {
        cache.synchronous().cleanUp();

        CacheStats stats = stats();
        log.info("Validation cache holds {} words. Hits {}, misses {}, external requests {}.",
                stats.cachedWords(), stats.hitCount(), stats.missCount(), stats.externalRequests());
    }

    private ValidationRecord lookup(String word) {
        try {
            rateLimiter.acquire();
            externalRequests.incrementAndGet();

            ValidationRecord record = dictionaryClient.lookup(word);
            log.debug("Validated {}: {}", word, record.status());
            return record;
        } catch (ExternalServiceUnavailableException ex) {
            log.warn("Dictionary unavailable for {}: {}", word, ex.getMessage());
            return ValidationRecord.unavailable(word, ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ValidationRecord.unavailable(word, "interrupted");
        } catch (RuntimeException ex) {
            log.error("Unexpected error validating word '" + word + "'", ex);
            return ValidationRecord.unavailable(word, ex.getMessage());
        }
    }

    private static class RecordExpiry implements Expiry<String, ValidationRecord> {

        private final long ttlNanos;
        private final long unavailableTtlNanos;

        RecordExpiry(Duration ttl, Duration unavailableTtl) {
            this.ttlNanos = ttl.toNanos();
            this.unavailableTtlNanos = unavailableTtl.toNanos();
        }

        @Override
        public long expireAfterCreate(String key, ValidationRecord value, long currentTime) {
            return value.isUnavailable() ? unavailableTtlNanos : ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, ValidationRecord value, long currentTime, long currentDuration) {
            return expireAfterCreate(key, value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, ValidationRecord value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
