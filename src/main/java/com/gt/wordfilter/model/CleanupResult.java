package com.gt.wordfilter.model;

import java.util.List;

public record CleanupResult(int foundInvalid,
                            int removedCount,
                            List<String> invalidWords,
                            List<String> skippedUnavailable,
                            String actionTaken,
                            boolean cancelled,
                            int totalWords) {

    public CleanupResult {
        invalidWords = List.copyOf(invalidWords);
        skippedUnavailable = List.copyOf(skippedUnavailable);
    }
}
