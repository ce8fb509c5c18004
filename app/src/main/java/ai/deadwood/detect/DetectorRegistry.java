package ai.deadwood.detect;

import ai.deadwood.config.AnalysisConfig;
import ai.deadwood.model.FindingKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Ordered set of detectors, at most one per finding kind. Registration order is the per-file finding order. */
public final class DetectorRegistry {
    private final List<Detector> detectors;

    private DetectorRegistry(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public static DetectorRegistry defaults() {
        return new DetectorRegistry(List.of(
                new UnusedImportDetector(),
                new UnusedVariableDetector(),
                new DeadFunctionDetector(),
                new DeadExportDetector(),
                new CircularDependencyDetector(),
                new ComplexityDetector()));
    }

    public static DetectorRegistry of(Detector... detectors) {
        var registry = new DetectorRegistry(List.of());
        for (var d : detectors) {
            registry = registry.with(d);
        }
        return registry;
    }

    /** Registers a detector, replacing any existing detector of the same kind in place. */
    public DetectorRegistry with(Detector detector) {
        var updated = new ArrayList<>(detectors);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).kind() == detector.kind()) {
                updated.set(i, detector);
                return new DetectorRegistry(updated);
            }
        }
        updated.add(detector);
        return new DetectorRegistry(updated);
    }

    public Optional<Detector> get(FindingKind kind) {
        return detectors.stream().filter(d -> d.kind() == kind).findFirst();
    }

    public List<Detector> all() {
        return detectors;
    }

    public List<Detector> enabled(AnalysisConfig config) {
        return detectors.stream().filter(d -> config.isEnabled(d.kind())).toList();
    }
}
