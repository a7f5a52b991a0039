package com.gt.wordfilter.model;

public record Pronunciation(String prefix, String ipa, String audioUrl) { }
