package com.gt.wordfilter.model;

public record WordStats(int totalWords, int minLength, int maxLength, double avgLength) {
    public static final WordStats EMPTY_STATS = new WordStats(0, 0, 0, 0.0);
}
