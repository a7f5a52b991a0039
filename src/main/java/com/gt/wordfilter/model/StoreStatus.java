package com.gt.wordfilter.model;

import java.time.Instant;

public record StoreStatus(boolean degraded, int wordCount, long snapshotVersion, Instant lastLoaded, String lastFailure, String storage) { }
