package ai.deadwood.cache;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * @param storedFileHashes content hash of every file the result depends on, at the time it was stored
 */
public record CacheEntry<V>(
        String key, V result, Map<String, String> storedFileHashes, Instant createdAt, Instant expiresAt) {

    public CacheEntry {
        storedFileHashes = Map.copyOf(storedFileHashes);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean dependsOnAny(Collection<String> paths) {
        for (var path : paths) {
            if (storedFileHashes.containsKey(path)) {
                return true;
            }
        }
        return false;
    }
}
