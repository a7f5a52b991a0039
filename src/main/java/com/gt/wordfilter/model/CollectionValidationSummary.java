package com.gt.wordfilter.model;

import java.util.List;

// validWords + invalidWords + unavailableWords == totalWords for a completed run.
// For a cancelled run the counts cover only the words processed before cancellation.
public record CollectionValidationSummary(int totalWords,
                                          int processedWords,
                                          int validWords,
                                          int invalidWords,
                                          int unavailableWords,
                                          double validityPercentage,
                                          List<String> invalidWordList,
                                          List<String> unavailableWordList,
                                          boolean cancelled) {

    public CollectionValidationSummary {
        invalidWordList = List.copyOf(invalidWordList);
        unavailableWordList = List.copyOf(unavailableWordList);
    }
}
