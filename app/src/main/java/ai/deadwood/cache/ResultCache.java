package ai.deadwood.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Results keyed by scope and the content hashes of the files they depend on. An entry is served only while it is
 * unexpired and every stored hash still matches the file's current hash; otherwise it is evicted and the lookup counts
 * as a miss. Store failures never propagate: they are logged and degrade to a miss.
 */
public final class ResultCache<V> {
    private static final Logger logger = LogManager.getLogger(ResultCache.class);

    private final String name;
    private final CacheStore<V> store;
    private final HashSource hashes;
    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResultCache(
            String name, CacheStore<V> store, HashSource hashes, Clock clock, Duration ttl, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got " + maxEntries);
        }
        this.name = name;
        this.store = store;
        this.hashes = hashes;
        this.clock = clock;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
    }

    /** Key for {@code scope} over the files' current hashes. */
    public String keyFor(String scope, Collection<String> files) {
        return CacheKeys.key(scope, currentHashes(files));
    }

    public Optional<V> get(String key) {
        @Nullable CacheEntry<V> entry;
        try {
            entry = store.get(key).orElse(null);
        } catch (RuntimeException e) {
            logger.warn("{} cache lookup failed for {}: {}", name, key, e.getMessage());
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant()) || !hashesMatch(entry)) {
            logger.trace("{} cache entry {} is stale", name, key);
            removeQuietly(key);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.result());
    }

    /** Stores {@code result}, recording the current hash of each file it depends on. */
    public void set(String key, V result, Collection<String> files) {
        var now = clock.instant();
        var entry = new CacheEntry<>(key, result, currentHashes(files), now, now.plus(ttl));
        try {
            if (store.get(key).isEmpty() && store.size() >= maxEntries) {
                evictOldest();
            }
            store.put(entry);
        } catch (RuntimeException e) {
            logger.warn("{} cache store failed for {}: {}", name, key, e.getMessage());
        }
    }

    /** Removes every entry that depends on any of the paths. */
    public int invalidate(Collection<String> paths) {
        int removed = 0;
        try {
            for (var entry : store.entries()) {
                if (entry.dependsOnAny(paths)) {
                    store.remove(entry.key());
                    removed++;
                }
            }
        } catch (RuntimeException e) {
            logger.warn("{} cache invalidation failed: {}", name, e.getMessage());
        }
        if (removed > 0) {
            logger.debug("Invalidated {} {} cache entr{} for {}", removed, name, removed == 1 ? "y" : "ies", paths);
        }
        return removed;
    }

    public CacheStats stats() {
        int size;
        try {
            size = store.size();
        } catch (RuntimeException e) {
            logger.warn("{} cache size unavailable: {}", name, e.getMessage());
            size = 0;
        }
        return new CacheStats(hits.get(), misses.get(), size);
    }

    /** Drops every entry and resets the hit and miss counters. */
    public void clear() {
        try {
            store.clear();
        } catch (RuntimeException e) {
            logger.warn("{} cache clear failed: {}", name, e.getMessage());
        }
        hits.set(0);
        misses.set(0);
    }

    private void removeQuietly(String key) {
        try {
            store.remove(key);
        } catch (RuntimeException e) {
            logger.warn("{} cache eviction failed for {}: {}", name, key, e.getMessage());
        }
    }

    private boolean hashesMatch(CacheEntry<V> entry) {
        for (var stored : entry.storedFileHashes().entrySet()) {
            var current = hashes.currentHash(stored.getKey());
            if (!stored.getValue().equals(current == null ? CacheKeys.MISSING : current)) {
                return false;
            }
        }
        return true;
    }

    private Map<String, String> currentHashes(Collection<String> files) {
        var result = new HashMap<String, String>();
        for (var file : files) {
            var hash = hashes.currentHash(file);
            result.put(file, hash == null ? CacheKeys.MISSING : hash);
        }
        return result;
    }

    /** Evicts the oldest tenth of the entries, at least one. */
    private void evictOldest() {
        var entries = store.entries();
        int toEvict = Math.max(1, entries.size() / 10);
        entries.stream()
                .sorted(Comparator.comparing(CacheEntry::createdAt))
                .limit(toEvict)
                .forEach(e -> store.remove(e.key()));
        logger.debug("{} cache full, evicted {} oldest entr{}", name, toEvict, toEvict == 1 ? "y" : "ies");
    }
}
