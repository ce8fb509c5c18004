package ai.deadwood.model;

import ai.deadwood.analyzer.DeclarationSite;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * Raw detector output, before exclusion rules and certainty are applied.
 *
 * @param site the declaration this candidate is about, used to look for references from other files; null for
 *     structural candidates
 * @param traits facts about the declaration that the classifier's rules depend on
 */
public record Candidate(
        FindingKind kind,
        String symbolName,
        List<SourceLocation> locations,
        @Nullable DeclarationSite site,
        Set<Trait> traits,
        Set<String> tags,
        String reason,
        @Nullable String suggestedFix) {

    public enum Trait {
        EXPORTED,
        PARAMETER,
        DECORATED,
        METHOD,
        TYPE_ONLY
    }

    public Candidate {
        if (locations.isEmpty()) {
            throw new IllegalArgumentException("Candidate for " + symbolName + " has no location");
        }
        locations = List.copyOf(locations);
        traits = traits.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(traits));
        tags = Collections.unmodifiableSortedSet(new TreeSet<>(tags));
    }

    public boolean has(Trait trait) {
        return traits.contains(trait);
    }

    public SourceLocation primaryLocation() {
        return locations.get(0);
    }

    public int line() {
        return primaryLocation().startLine();
    }
}
