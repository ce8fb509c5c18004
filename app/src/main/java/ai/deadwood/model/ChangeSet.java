package ai.deadwood.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/** @param files workspace-relative paths with forward slashes */
public record ChangeSet(List<String> files, String changeId, Instant timestamp) {
    public ChangeSet {
        files = files.stream().map(f -> f.replace('\\', '/')).distinct().toList();
    }

    public static ChangeSet of(String... files) {
        return new ChangeSet(Arrays.asList(files), UUID.randomUUID().toString(), Instant.now());
    }
}
