package ai.deadwood.cache;

public record CacheStats(long hits, long misses, int totalEntries) {

    public static final CacheStats EMPTY = new CacheStats(0, 0, 0);

    /** Hits over lookups, or 0 before the first lookup. */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    public CacheStats combine(CacheStats other) {
        return new CacheStats(hits + other.hits, misses + other.misses, totalEntries + other.totalEntries);
    }
}
