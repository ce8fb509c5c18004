package ai.deadwood.cache;

import ai.deadwood.util.ContentHashes;
import java.util.Map;
import java.util.TreeMap;

public final class CacheKeys {
    static final String MISSING = "<missing>";

    private CacheKeys() {}

    /** {@code scope|sha256(sorted "path=hash" lines)}. Independent of map iteration order. */
    public static String key(String scope, Map<String, String> pathHashes) {
        var sb = new StringBuilder();
        new TreeMap<>(pathHashes).forEach((path, hash) -> sb.append(path).append('=').append(hash).append('\n'));
        return scope + "|" + ContentHashes.sha256(sb.toString());
    }
}
