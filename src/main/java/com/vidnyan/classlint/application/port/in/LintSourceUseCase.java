package com.vidnyan.classlint.application.port.in;

import com.vidnyan.classlint.domain.rule.Correction;
import com.vidnyan.classlint.domain.rule.Severity;
import com.vidnyan.classlint.domain.rule.Violation;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: lint source files, optionally correcting them in place.
 * This is the main entry point to the application.
 */
public interface LintSourceUseCase {

    /**
     * Lint (or correct) every source file under the requested path.
     * @param request Lint request parameters
     * @return violations or corrections, with run statistics
     */
    LintResult lint(LintRequest request);

    /**
     * Lint request parameters.
     */
    record LintRequest(
        Path sourcePath,
        boolean autocorrect
    ) {
        public static LintRequest forPath(Path path) {
            return new LintRequest(path, false);
        }

        public static LintRequest correcting(Path path) {
            return new LintRequest(path, true);
        }
    }

    /**
     * Lint result. In autocorrect mode only corrections are reported.
     */
    record LintResult(
        List<Violation> violations,
        List<Correction> corrections,
        LintStats stats
    ) {
        public boolean hasErrors() {
            return violations.stream()
                    .anyMatch(v -> v.severity() == Severity.ERROR);
        }

        public int violationCount(Severity severity) {
            return (int) violations.stream()
                    .filter(v -> v.severity() == severity)
                    .count();
        }
    }

    /**
     * Lint statistics.
     */
    record LintStats(
        int filesLinted,
        int filesSkipped,
        int filesCorrected,
        long totalDurationMs
    ) {}
}
