package ai.deadwood.classify;

import ai.deadwood.analyzer.DeclarationSite;

/** Answers whether a declaration is referenced from any file other than its own. */
@FunctionalInterface
public interface ExternalReferences {
    ExternalReferences NONE = site -> false;

    boolean isReferencedOutside(DeclarationSite site);
}
