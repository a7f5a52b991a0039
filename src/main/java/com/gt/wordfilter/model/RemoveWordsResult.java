package com.gt.wordfilter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RemoveWordsResult(Map<String, RemovalOutcome> outcomes, int removedCount, int notFoundCount, int totalWords) {

    public RemoveWordsResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public RemovalOutcome outcomeFor(String word) {
        return outcomes.get(word);
    }
}
