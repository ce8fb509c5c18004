package ai.deadwood.cache;

import java.util.Collection;
import java.util.Optional;

/**
 * Storage behind a {@link ResultCache}. Implementations must be thread-safe. Failures may be thrown as unchecked
 * exceptions; the cache logs them and treats the lookup as a miss.
 */
public interface CacheStore<V> {

    Optional<CacheEntry<V>> get(String key);

    void put(CacheEntry<V> entry);

    void remove(String key);

    Collection<CacheEntry<V>> entries();

    int size();

    void clear();
}
