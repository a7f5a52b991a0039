package com.gt.wordfilter.model;

public record CacheStats(long cachedWords, long hitCount, long missCount, double hitRate, long externalRequests) { }
