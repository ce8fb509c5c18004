package ai.deadwood.model;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * A classified issue. Ids are deterministic so re-running on an unchanged workspace yields the same ids, which is what
 * lets callers diff runs and suppress known findings. Tags iterate in sorted order.
 */
public record Finding(
        String id,
        FindingKind kind,
        Certainty certainty,
        List<SourceLocation> locations,
        String symbolName,
        boolean safeFixAvailable,
        Set<String> tags,
        String reason,
        String explanation,
        @Nullable String suggestedFix) {

    public Finding {
        if (locations.isEmpty()) {
            throw new IllegalArgumentException("Finding " + id + " has no location");
        }
        if (certainty == Certainty.LOW && safeFixAvailable) {
            throw new IllegalArgumentException("Low-certainty finding " + id + " cannot offer a safe fix");
        }
        locations = List.copyOf(locations);
        tags = Collections.unmodifiableSortedSet(new TreeSet<>(tags));
    }

    public static String idFor(FindingKind kind, String filePath, String symbolName, int line) {
        return kind.id() + ":" + filePath + ":" + symbolName + ":" + line;
    }

    public SourceLocation primaryLocation() {
        return locations.get(0);
    }

    public String filePath() {
        return primaryLocation().filePath();
    }
}
