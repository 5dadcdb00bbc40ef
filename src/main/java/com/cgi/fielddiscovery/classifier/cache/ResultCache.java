package com.cgi.fielddiscovery.classifier.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store for serialized analysis results with a per-entry time to live.
 * Implementations may throw on store failures; callers treat any failure as a miss.
 */
public interface ResultCache {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);
}
