package ai.deadwood.cache;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryCacheStore<V> implements CacheStore<V> {
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry<V>> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(CacheEntry<V> entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }

    @Override
    public Collection<CacheEntry<V>> entries() {
        return List.copyOf(entries.values());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
    }
}
