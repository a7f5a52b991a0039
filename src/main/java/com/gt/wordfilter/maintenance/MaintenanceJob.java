package com.gt.wordfilter.maintenance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gt.wordfilter.model.CleanupResult;
import com.gt.wordfilter.model.CollectionValidationSummary;

import java.time.Instant;

// Progress and outcome of a background validation or cleanup run.
public class MaintenanceJob {

    private final String id;
    private final MaintenanceJobType type;
    private final boolean autoRemove;
    private final Instant startedAt;

    private volatile MaintenanceJobState state = MaintenanceJobState.RUNNING;
    private volatile CollectionValidationRun run;
    private volatile boolean cancelRequested = false;
    private volatile Instant finishedAt;
    private volatile CollectionValidationSummary summary;
    private volatile CleanupResult cleanupResult;
    private volatile String failure;

    public MaintenanceJob(String id, MaintenanceJobType type, boolean autoRemove) {
        this.id = id;
        this.type = type;
        this.autoRemove = autoRemove;
        this.startedAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public MaintenanceJobType getType() {
        return type;
    }

    public boolean isAutoRemove() {
        return autoRemove;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public MaintenanceJobState getState() {
        return state;
    }

    public int getProcessedWords() {
        CollectionValidationRun current = run;
        return current == null ? 0 : current.getProcessedWords();
    }

    public int getTotalWords() {
        CollectionValidationRun current = run;
        return current == null ? 0 : current.getTotalWords();
    }

    // Partial while the job is running
    public CollectionValidationSummary getSummary() {
        CollectionValidationRun current = run;
        if (summary == null && current != null) {
            return current.summary();
        }
        return summary;
    }

    public CleanupResult getCleanupResult() {
        return cleanupResult;
    }

    public String getFailure() {
        return failure;
    }

    @JsonIgnore
    public boolean isCancelRequested() {
        return cancelRequested;
    }

    synchronized void attachRun(CollectionValidationRun run) {
        this.run = run;
        if (cancelRequested) {
            run.cancel();
        }
    }

    // Refused once the run has finished validating, including while a cleanup is removing words
    synchronized boolean cancel() {
        if (state.isFinished()) {
            return false;
        }
        if (run != null && !run.cancel()) {
            return false;
        }

        cancelRequested = true;
        return true;
    }

    void complete(CollectionValidationSummary summary, CleanupResult cleanupResult) {
        this.summary = summary;
        this.cleanupResult = cleanupResult;
        this.finishedAt = Instant.now();
        this.state = summary.cancelled() ? MaintenanceJobState.CANCELLED : MaintenanceJobState.COMPLETED;
    }

    void fail(String failure) {
        this.failure = failure;
        this.finishedAt = Instant.now();
        this.state = MaintenanceJobState.FAILED;
    }
}
