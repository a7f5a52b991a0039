package com.gt.wordfilter.maintenance;

import com.gt.wordfilter.exception.StorageUnavailableException;
import com.gt.wordfilter.model.CleanupResult;
import com.gt.wordfilter.model.CollectionValidationSummary;
import com.gt.wordfilter.model.RemoveWordsResult;
import com.gt.wordfilter.util.JobIdUtil;
import com.gt.wordfilter.validation.ValidationCache;
import com.gt.wordfilter.validation.WordAcceptancePolicy;
import com.gt.wordfilter.word.WordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Component
public class CollectionMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(CollectionMaintenanceService.class);

    static final int MAX_RETAINED_JOBS = 50;

    private final WordStore wordStore;
    private final ValidationCache validationCache;
    private final WordAcceptancePolicy acceptancePolicy;
    private final Executor maintenanceExecutor;
    private final int batchSize;
    private final long batchPauseMs;

    private final Map<String, MaintenanceJob> jobs = new ConcurrentHashMap<>();

    @Autowired
    public CollectionMaintenanceService(WordStore wordStore,
                                        ValidationCache validationCache,
                                        WordAcceptancePolicy acceptancePolicy,
                                        @Qualifier("maintenanceExecutor") Executor maintenanceExecutor,
                                        @Value("${wordfilter.maintenance.batchSize:20}") int batchSize,
                                        @Value("${wordfilter.maintenance.batchPauseMs:2000}") long batchPauseMs) {
        this.wordStore = wordStore;
        this.validationCache = validationCache;
        this.acceptancePolicy = acceptancePolicy;
        this.maintenanceExecutor = maintenanceExecutor;
        this.batchSize = batchSize;
        this.batchPauseMs = batchPauseMs;
    }

    public CollectionValidationSummary validateCollection() {
        return drive(newRun());
    }

    /**
     * Validates the whole collection and, when {@code autoRemove} is set, removes the words the
     * dictionary rejected. Words that could not be checked are never removed, and neither is
     * anything when the run was cancelled.
     *
     * @throws com.gt.wordfilter.exception.PersistenceException if the removal cannot be written
     */
    public CleanupResult cleanup(boolean autoRemove) {
        return cleanup(newRun(), autoRemove);
    }

    public MaintenanceJob startValidationJob() {
        return startJob(MaintenanceJobType.VALIDATE, false);
    }

    public MaintenanceJob startCleanupJob(boolean autoRemove) {
        return startJob(MaintenanceJobType.CLEANUP, autoRemove);
    }

    public MaintenanceJob getJob(String jobId) {
        return jobs.get(jobId);
    }

    public Collection<MaintenanceJob> getJobs() {
        return List.copyOf(jobs.values());
    }

    // Returns false if the job does not exist or has already finished
    public boolean cancelJob(String jobId) {
        MaintenanceJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }

        boolean cancelled = job.cancel();
        if (cancelled) {
            log.info("Cancellation requested for maintenance job {}", jobId);
        }
        return cancelled;
    }

    private MaintenanceJob startJob(MaintenanceJobType type, boolean autoRemove) {
        pruneFinishedJobs();

        MaintenanceJob job = new MaintenanceJob(JobIdUtil.newJobId(), type, autoRemove);
        jobs.put(job.getId(), job);

        try {
            maintenanceExecutor.execute(() -> runJob(job));
        } catch (RejectedExecutionException ex) {
            String errMsg = "Maintenance executor rejected job " + job.getId();

            log.error(errMsg, ex);
            job.fail(errMsg);
        }

        log.info("Started {} job {} (autoRemove={})", type, job.getId(), autoRemove);
        return job;
    }

    private void runJob(MaintenanceJob job) {
        try {
            CollectionValidationRun run = newRun();
            job.attachRun(run);

            if (job.getType() == MaintenanceJobType.CLEANUP) {
                CleanupResult cleanupResult = cleanup(run, job.isAutoRemove());
                job.complete(run.summary(), cleanupResult);
            } else {
                job.complete(drive(run), null);
            }

            log.info("Maintenance job {} finished with state {}", job.getId(), job.getState());
        } catch (RuntimeException ex) {
            log.error("Maintenance job " + job.getId() + " failed", ex);
            job.fail(ex.getMessage());
        }
    }

    private CollectionValidationRun newRun() {
        try {
            wordStore.load();
        } catch (StorageUnavailableException ex) {
            log.warn("Reload before validation failed, validating the {} words currently in memory", wordStore.size());
        }

        return new CollectionValidationRun(wordStore.words(), validationCache, acceptancePolicy, batchSize);
    }

    CollectionValidationSummary drive(CollectionValidationRun run) {
        log.info("Validating {} words in batches of {}", run.getTotalWords(), batchSize);

        while (run.hasNextBatch()) {
            if (Thread.currentThread().isInterrupted()) {
                run.cancel();
                break;
            }

            run.nextBatch();

            if (run.hasNextBatch() && batchPauseMs > 0) {
                try {
                    Thread.sleep(batchPauseMs);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    run.cancel();
                }
            }
        }

        run.finish();
        CollectionValidationSummary summary = run.summary();
        log.info("Validation {}: {} of {} words processed, {} valid, {} invalid, {} unavailable",
                summary.cancelled() ? "cancelled" : "complete", summary.processedWords(), summary.totalWords(),
                summary.validWords(), summary.invalidWords(), summary.unavailableWords());
        return summary;
    }

    private CleanupResult cleanup(CollectionValidationRun run, boolean autoRemove) {
        CollectionValidationSummary summary = drive(run);
        List<String> invalidWords = summary.invalidWordList();

        if (summary.cancelled()) {
            return new CleanupResult(invalidWords.size(), 0, invalidWords, summary.unavailableWordList(),
                    "Cancelled - no words removed", true, wordStore.size());
        }
        if (invalidWords.isEmpty()) {
            return new CleanupResult(0, 0, invalidWords, summary.unavailableWordList(),
                    "No invalid words found", false, wordStore.size());
        }
        if (!autoRemove) {
            return new CleanupResult(invalidWords.size(), 0, invalidWords, summary.unavailableWordList(),
                    "Dry run - no words removed", false, wordStore.size());
        }

        RemoveWordsResult removeResult = wordStore.removeBatch(invalidWords);
        log.info("Cleanup removed {} invalid words, skipped {} unverified words",
                removeResult.removedCount(), summary.unavailableWords());

        return new CleanupResult(invalidWords.size(), removeResult.removedCount(), invalidWords,
                summary.unavailableWordList(), "Removed " + removeResult.removedCount() + " invalid words",
                false, removeResult.totalWords());
    }

    private void pruneFinishedJobs() {
        if (jobs.size() < MAX_RETAINED_JOBS) {
            return;
        }

        jobs.values().stream()
                .filter(job -> job.getState().isFinished())
                .sorted(Comparator.comparing(MaintenanceJob::getStartedAt))
                .limit(jobs.size() - MAX_RETAINED_JOBS + 1)
                .forEach(job -> jobs.remove(job.getId()));
    }
}
