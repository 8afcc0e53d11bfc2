package dev.pinharvest.store;

import java.time.Instant;

public record CacheMetadata(String keyword, int pinCount, Instant lastUpdated) {}
