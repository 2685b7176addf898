package com.wildfire.resolution.cache;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the geocache index.
 *
 * @param totalEntries    number of indexed entries
 * @param accessLog       key to last access time, copied at snapshot time
 * @param lruCandidateKey key that would be evicted next, or {@code null} when empty
 * @param lastCleanup     time of the last {@link Geocache#cleanup()}, or {@code null} if never run
 */
public record CacheMetadata(int totalEntries, Map<String, Instant> accessLog, String lruCandidateKey,
                            Instant lastCleanup) {

    public CacheMetadata {
        accessLog = accessLog != null ? Map.copyOf(accessLog) : Map.of();
    }

    public Optional<String> lruCandidate() {
        return Optional.ofNullable(lruCandidateKey);
    }

    public Optional<Instant> lastCleanupTime() {
        return Optional.ofNullable(lastCleanup);
    }
}
