package ai.deadwood.cache;

import org.jetbrains.annotations.Nullable;

/** Current content hash of a workspace file. */
@FunctionalInterface
public interface HashSource {
    /** @return the hash, or null if the file is not (or no longer) part of the workspace */
    @Nullable
    String currentHash(String path);
}
