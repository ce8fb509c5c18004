package ai.deadwood.detect;

import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.model.Candidate;
import ai.deadwood.model.FindingKind;
import java.util.List;

/**
 * Looks for one kind of problem in a parsed file. Implementations are stateless and called concurrently from worker
 * threads; candidates are returned in traversal order.
 */
public interface Detector {

    FindingKind kind();

    List<Candidate> analyze(SyntaxTree tree, AnalysisContext ctx);
}
