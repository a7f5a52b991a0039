package com.gt.wordfilter.model;

import java.util.List;

public record AddWordsResult(int addedCount, int totalSubmitted, int skippedCount, List<String> addedWords, int totalWords) {

    public AddWordsResult {
        addedWords = List.copyOf(addedWords);
    }
}
