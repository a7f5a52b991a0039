package com.gt.wordfilter.validation;

import com.gt.wordfilter.exception.ExternalServiceUnavailableException;
import com.gt.wordfilter.model.CacheStats;
import com.gt.wordfilter.model.ValidationRecord;
import com.gt.wordfilter.model.ValidationStatus;
import com.gt.wordfilter.util.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class ValidationCacheTests {

    private static final long TEST_CALLER_TIMEOUT_MS = 5000;

    @Mock private DictionaryClient dictionaryClient;

    private ExecutorService executor;
    private ValidationCache validationCache;

    @BeforeEach
    public void setup() {
        executor = Executors.newFixedThreadPool(4);
        validationCache = newValidationCache(1, TEST_CALLER_TIMEOUT_MS);
    }

    @AfterEach
    public void teardown() {
        executor.shutdownNow();
    }

    @Test
    public void testValidate() {
        when(dictionaryClient.lookup("owl")).thenReturn(TestUtils.validRecord("owl"));

        ValidationRecord record = validationCache.validate(" Owl ");

        assertEquals(ValidationStatus.VALID, record.status());
        assertTrue(record.valid());
        verify(dictionaryClient, times(1)).lookup("owl");
    }

    @Test
    public void testValidate_CacheHit() {
        when(dictionaryClient.lookup("owl")).thenReturn(TestUtils.validRecord("owl"));

        ValidationRecord first = validationCache.validate("owl");
        ValidationRecord second = validationCache.validate("OWL");

        assertEquals(first, second);
        verify(dictionaryClient, times(1)).lookup("owl");

        CacheStats stats = validationCache.stats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(50.0, stats.hitRate());
        assertEquals(1, stats.externalRequests());
        assertEquals(1, stats.cachedWords());
    }

    @Test
    public void testValidate_InvalidFormatSkipsLookup() {
        ValidationRecord record = validationCache.validate("can't");

        assertEquals(ValidationStatus.INVALID, record.status());
        assertEquals(ValidationCache.INVALID_FORMAT_REASON, record.reason());
        assertEquals(ValidationStatus.INVALID, validationCache.validate("").status());
        verify(dictionaryClient, never()).lookup(anyString());
    }

    @Test
    public void testValidate_ConcurrentColdLookupsShareOneRequest() throws Exception {
        CountDownLatch lookupStarted = new CountDownLatch(1);
        CountDownLatch releaseLookup = new CountDownLatch(1);
        when(dictionaryClient.lookup("xylophone")).thenAnswer(invocation -> {
            lookupStarted.countDown();
            releaseLookup.await(5, TimeUnit.SECONDS);
            return TestUtils.validRecord("xylophone");
        });

        Future<ValidationRecord> first = executor.submit(() -> validationCache.validate("xylophone"));
        assertTrue(lookupStarted.await(5, TimeUnit.SECONDS));
        Future<ValidationRecord> second = executor.submit(() -> validationCache.validate("Xylophone"));
        CompletableFuture<ValidationRecord> third = validationCache.validateAsync("xylophone");

        releaseLookup.countDown();

        assertEquals(ValidationStatus.VALID, first.get(5, TimeUnit.SECONDS).status());
        assertEquals(first.get(), second.get(5, TimeUnit.SECONDS));
        assertEquals(first.get(), third.get(5, TimeUnit.SECONDS));
        verify(dictionaryClient, times(1)).lookup("xylophone");
        assertEquals(1, validationCache.stats().externalRequests());
    }

    @Test
    public void testValidate_ServiceUnavailable() {
        when(dictionaryClient.lookup("owl")).thenThrow(new ExternalServiceUnavailableException("HTTP 503"));

        ValidationRecord record = validationCache.validate("owl");

        assertEquals(ValidationStatus.UNAVAILABLE, record.status());
        assertFalse(record.valid());
        assertEquals("service unavailable: HTTP 503", record.reason());
    }

    @Test
    public void testValidate_UnexpectedErrorIsUnavailable() {
        when(dictionaryClient.lookup("owl")).thenThrow(new IllegalStateException("parser blew up"));

        ValidationRecord record = validationCache.validate("owl");

        assertEquals(ValidationStatus.UNAVAILABLE, record.status());
        assertTrue(record.reason().startsWith(ValidationRecord.SERVICE_UNAVAILABLE_REASON));
    }

    @Test
    public void testValidate_UnavailableExpiresBeforeDefinitiveResults() throws Exception {
        when(dictionaryClient.lookup("owl"))
                .thenThrow(new ExternalServiceUnavailableException("HTTP 503"))
                .thenReturn(TestUtils.validRecord("owl"));
        when(dictionaryClient.lookup("yak")).thenReturn(TestUtils.validRecord("yak"));

        assertEquals(ValidationStatus.UNAVAILABLE, validationCache.validate("owl").status());
        assertEquals(ValidationStatus.VALID, validationCache.validate("yak").status());

        Thread.sleep(1500);

        assertEquals(ValidationStatus.VALID, validationCache.validate("owl").status());
        assertEquals(ValidationStatus.VALID, validationCache.validate("yak").status());
        verify(dictionaryClient, times(2)).lookup("owl");
        verify(dictionaryClient, times(1)).lookup("yak");
    }

    @Test
    public void testValidate_CallerTimeout() {
        CountDownLatch releaseLookup = new CountDownLatch(1);
        when(dictionaryClient.lookup("owl")).thenAnswer(invocation -> {
            releaseLookup.await(5, TimeUnit.SECONDS);
            return TestUtils.validRecord("owl");
        });
        ValidationCache impatientCache = newValidationCache(60, 100);

        try {
            ValidationRecord record = impatientCache.validate("owl");

            assertEquals(ValidationStatus.UNAVAILABLE, record.status());
        } finally {
            releaseLookup.countDown();
        }
    }

    @Test
    public void testInvalidate() {
        when(dictionaryClient.lookup("owl")).thenReturn(TestUtils.validRecord("owl"));

        validationCache.validate("owl");
        validationCache.invalidate("OWL");
        validationCache.validate("owl");

        verify(dictionaryClient, times(2)).lookup("owl");
    }

    @Test
    public void testInvalidateAll() {
        when(dictionaryClient.lookup(anyString())).thenAnswer(invocation -> TestUtils.validRecord(invocation.getArgument(0)));

        validationCache.validate("owl");
        validationCache.validate("yak");
        validationCache.invalidateAll();

        assertEquals(0, validationCache.stats().cachedWords());
    }

    @Test
    public void testStats_Empty() {
        CacheStats stats = validationCache.stats();

        assertEquals(0, stats.cachedWords());
        assertEquals(0.0, stats.hitRate());
        assertEquals(0, stats.externalRequests());
    }

    private ValidationCache newValidationCache(long unavailableTtlSeconds, long callerTimeoutMs) {
        return new ValidationCache(dictionaryClient,
                new RequestRateLimiter(Duration.ZERO, Duration.ofSeconds(5)),
                executor,
                24,
                unavailableTtlSeconds,
                1000,
                callerTimeoutMs);
    }
}
