package com.gt.wordfilter.model;

public record WordCheckResult(String word, boolean exists, int totalWords) { }
