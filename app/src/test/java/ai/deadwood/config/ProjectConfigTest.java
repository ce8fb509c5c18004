package ai.deadwood.config;

import static org.junit.jupiter.api.Assertions.*;

import ai.deadwood.exception.ConfigurationException;
import ai.deadwood.model.FindingKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectConfigTest {
    @TempDir
    Path root;

    @Test
    void missingFileGivesDefaults() {
        var config = ProjectConfig.load(root);

        assertEquals(ProjectConfig.defaults(), config);
        assertTrue(config.analysis().underscoreConvention());
        assertEquals(Duration.ZERO, config.engine().taskTimeout());
        assertFalse(config.engine().hasTaskTimeout());
    }

    @Test
    void fileOverridesOnlyWhatItNames() throws Exception {
        Files.writeString(root.resolve(ProjectConfig.FILE_NAME), """
                {
                  "analysis": {
                    "detectors": { "high-complexity": false, "dead-export": true },
                    "ignorePatterns": ["**/generated/**"],
                    "underscoreConvention": false,
                    "complexity": { "cyclomatic": 15 }
                  },
                  "engine": {
                    "workers": 2,
                    "taskTimeoutMs": 30000
                  }
                }
                """);

        var config = ProjectConfig.load(root);

        var analysis = config.analysis();
        assertFalse(analysis.isEnabled(FindingKind.HIGH_COMPLEXITY));
        assertTrue(analysis.isEnabled(FindingKind.DEAD_EXPORT));
        assertTrue(analysis.isEnabled(FindingKind.UNUSED_IMPORT));
        assertEquals(
                List.of("**/node_modules/**", "**/*.d.ts", "**/generated/**"), analysis.ignorePatterns());
        assertFalse(analysis.underscoreConvention());
        assertTrue(analysis.frameworkPatterns());
        assertEquals(new ComplexityThresholds(15, 4, 5, 50), analysis.complexity());

        var engine = config.engine();
        assertEquals(2, engine.workerCount());
        assertEquals(Duration.ofSeconds(30), engine.taskTimeout());
        assertEquals(EngineSettings.defaults().cacheTtl(), engine.cacheTtl());
    }

    @Test
    void unknownKeysAreIgnored() {
        var config = ProjectConfig.fromJson("""
                { "analysis": { "detectors": { "no-such-detector": false } }, "plugins": [] }
                """);

        assertEquals(AnalysisConfig.defaults().enabledDetectors(), config.analysis().enabledDetectors());
    }

    @Test
    void malformedJsonIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> ProjectConfig.fromJson("{ not json"));
        assertThrows(ConfigurationException.class, () -> ProjectConfig.fromJson("[1, 2]"));
    }

    @Test
    void invalidValuesAreAConfigurationError() {
        var e = assertThrows(
                ConfigurationException.class, () -> ProjectConfig.fromJson("{ \"engine\": { \"workers\": 0 } }"));
        assertTrue(e.getMessage().contains("workerCount"));
    }

    @Test
    void fingerprintChangesWithSettingsThatAffectFindings() {
        var defaults = AnalysisConfig.defaults();

        assertEquals(defaults.fingerprint(), AnalysisConfig.defaults().fingerprint());
        assertNotEquals(defaults.fingerprint(), defaults.withUnderscoreConvention(false).fingerprint());
        assertNotEquals(
                defaults.fingerprint(),
                defaults.withComplexity(new ComplexityThresholds(20, 4, 5, 50)).fingerprint());
    }
}
