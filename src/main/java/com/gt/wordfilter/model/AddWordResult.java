package com.gt.wordfilter.model;

public record AddWordResult(boolean success, String word, boolean wasNew, ValidationRecord validation, String message, int totalWords) { }
