package ai.deadwood.scope;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Modules to re-analyze after a change.
 *
 * @param chains for every affected module, the dependent path from a directly affected module to it; directly affected
 *     modules map to themselves alone
 */
public record AffectedSet(
        List<String> directlyAffected,
        List<String> indirectlyAffected,
        List<String> allAffected,
        Map<String, List<String>> chains) {

    public AffectedSet {
        directlyAffected = List.copyOf(directlyAffected);
        indirectlyAffected = List.copyOf(indirectlyAffected);
        allAffected = List.copyOf(allAffected);
        chains = Map.copyOf(chains);
    }

    static AffectedSet of(List<String> direct, List<String> indirect, Map<String, List<String>> chains) {
        var all = new LinkedHashSet<String>(direct);
        all.addAll(indirect);
        return new AffectedSet(direct, indirect, List.copyOf(all), chains);
    }

    public boolean isEmpty() {
        return allAffected.isEmpty();
    }

    public boolean contains(String module) {
        return allAffected.contains(module);
    }
}
