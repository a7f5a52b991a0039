package com.gt.wordfilter.model;

// Null fields place no constraint on that dimension
public record WordFilterCriteria(String contains,
                                 String startsWith,
                                 String endsWith,
                                 Integer exactLength,
                                 Integer minLength,
                                 Integer maxLength,
                                 Integer limit) {

    public static final WordFilterCriteria EMPTY_CRITERIA = new WordFilterCriteria(null, null, null, null, null, null, null);

    public WordFilterCriteria withLimit(Integer newLimit) {
        return new WordFilterCriteria(contains, startsWith, endsWith, exactLength, minLength, maxLength, newLimit);
    }
}
