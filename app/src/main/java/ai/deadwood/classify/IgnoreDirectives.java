package ai.deadwood.classify;

import ai.deadwood.model.FindingKind;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Suppression comments in a file.
 *
 * <ul>
 *   <li>{@code // @deadwood-ignore-file [kinds]} suppresses the whole file
 *   <li>{@code // @deadwood-ignore-next [kinds]} suppresses the following line
 *   <li>{@code // @deadwood-ignore [kinds]} suppresses its own line
 * </ul>
 *
 * Kinds is an optional comma-separated list of finding kinds such as {@code unused-import, dead-function}. Without a
 * recognizable list the directive applies to every kind.
 */
public final class IgnoreDirectives {
    private static final IgnoreDirectives NONE = new IgnoreDirectives(null, Map.of());

    private static final Pattern DIRECTIVE = Pattern.compile(
            "(?://|/\\*|^\\s*\\*)\\s*@deadwood-ignore(-file|-next)?(?![\\w-])((?:\\s*,?\\s*[a-z][a-z-]*)*)");

    private final @Nullable Set<FindingKind> fileKinds;
    private final Map<Integer, Set<FindingKind>> lineKinds;

    private IgnoreDirectives(@Nullable Set<FindingKind> fileKinds, Map<Integer, Set<FindingKind>> lineKinds) {
        this.fileKinds = fileKinds;
        this.lineKinds = lineKinds;
    }

    public static IgnoreDirectives none() {
        return NONE;
    }

    public static IgnoreDirectives parse(String text) {
        if (!text.contains("@deadwood-ignore")) {
            return NONE;
        }
        Set<FindingKind> fileKinds = null;
        var lineKinds = new HashMap<Integer, Set<FindingKind>>();
        var lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            var matcher = DIRECTIVE.matcher(lines[i]);
            if (!matcher.find()) {
                continue;
            }
            var variant = matcher.group(1);
            var kinds = parseKinds(matcher.group(2));
            int lineNumber = i + 1;
            if ("-file".equals(variant)) {
                fileKinds = merge(fileKinds, kinds);
            } else {
                int target = "-next".equals(variant) ? lineNumber + 1 : lineNumber;
                lineKinds.merge(target, kinds, IgnoreDirectives::merge);
            }
        }
        return new IgnoreDirectives(fileKinds, Map.copyOf(lineKinds));
    }

    public boolean suppressesFile(FindingKind kind) {
        return fileKinds != null && fileKinds.contains(kind);
    }

    /** Whether a finding of {@code kind} reported at 1-based {@code line} is suppressed. */
    public boolean suppresses(FindingKind kind, int line) {
        if (suppressesFile(kind)) {
            return true;
        }
        var kinds = lineKinds.get(line);
        return kinds != null && kinds.contains(kind);
    }

    public boolean isEmpty() {
        return fileKinds == null && lineKinds.isEmpty();
    }

    private static Set<FindingKind> parseKinds(@Nullable String list) {
        if (list == null || list.isBlank()) {
            return EnumSet.allOf(FindingKind.class);
        }
        var kinds = EnumSet.noneOf(FindingKind.class);
        Arrays.stream(list.split("[,\\s]+"))
                .filter(s -> !s.isBlank())
                .forEach(token -> FindingKind.fromId(token).ifPresent(kinds::add));
        return kinds.isEmpty() ? EnumSet.allOf(FindingKind.class) : kinds;
    }

    private static Set<FindingKind> merge(@Nullable Set<FindingKind> a, Set<FindingKind> b) {
        if (a == null) {
            return b;
        }
        var merged = EnumSet.copyOf(a);
        merged.addAll(b);
        return merged;
    }
}
