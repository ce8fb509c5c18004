package ai.deadwood.detect;

import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.analyzer.SourceParseException;
import ai.deadwood.analyzer.SymbolProvider;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.classify.AnalysisScope;
import ai.deadwood.classify.CertaintyClassifier;
import ai.deadwood.classify.IgnoreDirectives;
import ai.deadwood.exception.DetectorFailureException;
import ai.deadwood.model.FileAnalysisResult;
import ai.deadwood.model.Finding;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the enabled detectors over one file and classifies their candidates. Detectors run one after another; a
 * detector that throws is recorded and the rest still run.
 */
public final class FileAnalyzer {
    private static final Logger logger = LogManager.getLogger(FileAnalyzer.class);

    private final SymbolProvider provider;
    private final List<Detector> detectors;
    private final AnalysisContext ctx;
    private final CertaintyClassifier classifier;
    private final Map<ProjectFile, SyntaxTree> parsed;

    /**
     * @param parsed trees already parsed during the scan; files missing from it are parsed on demand
     */
    public FileAnalyzer(
            SymbolProvider provider,
            DetectorRegistry registry,
            AnalysisContext ctx,
            Map<ProjectFile, SyntaxTree> parsed) {
        this.provider = provider;
        this.detectors = registry.enabled(ctx.config());
        this.ctx = ctx;
        this.classifier = new CertaintyClassifier(ctx.config());
        this.parsed = parsed;
    }

    /**
     * @throws SourceParseException if the file cannot be parsed
     * @throws DetectorFailureException if any detector threw; carries the findings of the others
     */
    public FileAnalysisResult analyze(ProjectFile file) throws SourceParseException {
        long start = System.nanoTime();
        var tree = tree(file);
        var directives = IgnoreDirectives.parse(tree.text());
        var scope = new AnalysisScope(ctx.scope(), directives, ctx.references());

        // keyed by id; the first detector to report an id wins
        var findings = new LinkedHashMap<String, Finding>();
        var failed = new ArrayList<String>();
        @Nullable RuntimeException firstFailure = null;

        for (var detector : detectors) {
            try {
                for (var candidate : detector.analyze(tree, ctx)) {
                    var finding = classifier.classify(candidate, scope);
                    if (finding != null) {
                        findings.putIfAbsent(finding.id(), finding);
                    }
                }
            } catch (RuntimeException e) {
                logger.error("Detector {} failed on {}", detector.kind(), file, e);
                failed.add(detector.kind().id());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        var results = List.copyOf(findings.values());
        if (firstFailure != null) {
            throw new DetectorFailureException(file.path(), failed, results, firstFailure);
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        logger.trace("Analyzed {} in {} ms: {} finding(s)", file, elapsedMs, results.size());
        return FileAnalysisResult.success(file.path(), results, elapsedMs);
    }

    private SyntaxTree tree(ProjectFile file) throws SourceParseException {
        var tree = parsed.get(file);
        return tree != null ? tree : provider.parse(file);
    }
}
