package com.gt.wordfilter.maintenance;

import com.gt.wordfilter.model.CollectionValidationSummary;
import com.gt.wordfilter.model.ValidationRecord;
import com.gt.wordfilter.util.WordUtil;
import com.gt.wordfilter.validation.AcceptanceVerdict;
import com.gt.wordfilter.validation.ValidationCache;
import com.gt.wordfilter.validation.WordAcceptancePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Validation pass over a fixed list of words, advanced one batch at a time.
 *
 * <p>The word list is taken once when the run is created, so words added or removed while the run
 * is in progress do not affect it. Words in a batch are validated concurrently through the
 * {@link ValidationCache}; a word whose lookup fails is counted as unavailable and the run
 * carries on. Progress may be read from other threads while the run advances.
 */
public class CollectionValidationRun {

    private static final Logger log = LoggerFactory.getLogger(CollectionValidationRun.class);

    private final List<String> words;
    private final ValidationCache validationCache;
    private final WordAcceptancePolicy acceptancePolicy;
    private final int batchSize;

    private final List<String> invalidWords = new ArrayList<>();
    private final List<String> unavailableWords = new ArrayList<>();
    private int validCount = 0;
    private int position = 0;

    private volatile boolean cancelled = false;
    private boolean finished = false;

    public CollectionValidationRun(List<String> words,
                                   ValidationCache validationCache,
                                   WordAcceptancePolicy acceptancePolicy,
                                   int batchSize) {
        this.words = List.copyOf(words);
        this.validationCache = validationCache;
        this.acceptancePolicy = acceptancePolicy;
        this.batchSize = Math.max(1, batchSize);
    }

    public synchronized boolean hasNextBatch() {
        return !cancelled && position < words.size();
    }

    /**
     * Validates the next batch and records the outcome of every word in it.
     *
     * @return the number of words processed by this call, zero once the run is finished or cancelled
     */
    public int nextBatch() {
        List<String> batch;
        synchronized (this) {
            if (!hasNextBatch()) {
                return 0;
            }
            batch = words.subList(position, Math.min(position + batchSize, words.size()));
        }

        List<CompletableFuture<ValidationRecord>> futures = new ArrayList<>(batch.size());
        for (String word : batch) {
            futures.add(validationCache.validateAsync(word)
                    .exceptionally(ex -> {
                        log.warn("Validation of {} failed: {}", word, ex.getMessage());
                        return ValidationRecord.unavailable(word, ex.getMessage());
                    }));
        }

        List<ValidationRecord> records = new ArrayList<>(batch.size());
        for (CompletableFuture<ValidationRecord> future : futures) {
            records.add(future.join());
        }

        synchronized (this) {
            for (int idx = 0; idx < batch.size(); idx++) {
                record(batch.get(idx), records.get(idx));
            }
            position += batch.size();
        }

        return batch.size();
    }

    /**
     * Stops the run before its next batch.
     *
     * @return false if the run was already finished, in which case its outcome stands
     */
    public synchronized boolean cancel() {
        if (finished) {
            return false;
        }

        cancelled = true;
        return true;
    }

    /**
     * Closes the run to cancellation. Called once validation stops and before any action is taken
     * on its outcome.
     *
     * @return false if the run was cancelled first
     */
    public synchronized boolean finish() {
        finished = true;
        return !cancelled;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public synchronized int getProcessedWords() {
        return position;
    }

    public int getTotalWords() {
        return words.size();
    }

    public synchronized CollectionValidationSummary summary() {
        double validityPercentage = position == 0 ? 0.0 : WordUtil.roundTwoDecimals(validCount * 100.0 / position);

        return new CollectionValidationSummary(words.size(), position, validCount, invalidWords.size(),
                unavailableWords.size(), validityPercentage, invalidWords, unavailableWords, cancelled);
    }

    private void record(String word, ValidationRecord record) {
        AcceptanceVerdict verdict = acceptancePolicy.evaluate(record);

        if (verdict == AcceptanceVerdict.ACCEPTED) {
            validCount++;
        } else if (verdict == AcceptanceVerdict.UNVERIFIED) {
            unavailableWords.add(word);
        } else {
            invalidWords.add(word);
        }
    }
}
