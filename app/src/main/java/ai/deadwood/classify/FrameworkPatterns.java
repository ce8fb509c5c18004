package ai.deadwood.classify;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Naming conventions of frameworks that call code the workspace never references directly. A match either suppresses a
 * dead-function or dead-export candidate outright or lowers it to low certainty.
 */
public final class FrameworkPatterns {

    public enum Modifier {
        IGNORE,
        REDUCE
    }

    public record Rule(String name, Pattern pattern, Modifier modifier) {
        boolean matches(String symbolName) {
            return pattern.matcher(symbolName).matches();
        }
    }

    public record Match(String ruleName, Modifier modifier) {}

    static final String DECORATED = "decorated";

    private static final List<Rule> DEFAULT_RULES = List.of(
            ignore(
                    "react-lifecycle",
                    "componentDidMount|componentWillUnmount|componentDidUpdate|shouldComponentUpdate"
                            + "|getSnapshotBeforeUpdate|componentDidCatch|getDerivedStateFromProps"
                            + "|getDerivedStateFromError|render",
                    false),
            ignore(
                    "angular-lifecycle",
                    "ngOnInit|ngOnDestroy|ngOnChanges|ngDoCheck|ngAfterContentInit|ngAfterContentChecked"
                            + "|ngAfterViewInit|ngAfterViewChecked",
                    false),
            ignore(
                    "vue-lifecycle",
                    "beforeCreate|created|beforeMount|mounted|beforeUpdate|updated|beforeUnmount|unmounted"
                            + "|beforeDestroy|destroyed|activated|deactivated|errorCaptured",
                    false),
            ignore("lifecycle", "setup|teardown|init|initialize|dispose|cleanup|destroy", true),
            ignore("entry-point", "main", true),
            ignore("extension-entry-point", "activate|deactivate", false),
            ignore("handler-entry-point", "handler|run|execute|start|bootstrap", true),
            reduce("event-handler", "(handle|on)[A-Z].*"),
            reduce("accessor", "(get|set)[A-Z].*"),
            reduce("hook", "use[A-Z].*"));

    private static final FrameworkPatterns DEFAULTS = new FrameworkPatterns(DEFAULT_RULES, true);
    private static final FrameworkPatterns NONE = new FrameworkPatterns(List.of(), false);

    private final List<Rule> rules;
    private final boolean reduceDecorated;

    public FrameworkPatterns(List<Rule> rules, boolean reduceDecorated) {
        this.rules = List.copyOf(rules);
        this.reduceDecorated = reduceDecorated;
    }

    public static FrameworkPatterns defaults() {
        return DEFAULTS;
    }

    public static FrameworkPatterns none() {
        return NONE;
    }

    /** First matching rule wins; decorated declarations are reduced when no name rule applies. */
    public Optional<Match> match(String symbolName, boolean decorated) {
        for (var rule : rules) {
            if (rule.matches(symbolName)) {
                return Optional.of(new Match(rule.name(), rule.modifier()));
            }
        }
        if (decorated && reduceDecorated) {
            return Optional.of(new Match(DECORATED, Modifier.REDUCE));
        }
        return Optional.empty();
    }

    public List<Rule> rules() {
        return rules;
    }

    private static Rule ignore(String name, String alternatives, boolean caseInsensitive) {
        int flags = caseInsensitive ? Pattern.CASE_INSENSITIVE : 0;
        return new Rule(name, Pattern.compile("(?:" + alternatives + ")", flags), Modifier.IGNORE);
    }

    private static Rule reduce(String name, String regex) {
        return new Rule(name, Pattern.compile(regex), Modifier.REDUCE);
    }
}
