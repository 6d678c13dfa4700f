package com.vidnyan.classlint.adapter.in.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.classlint.LintProperties;
import com.vidnyan.classlint.application.port.in.LintSourceUseCase;
import com.vidnyan.classlint.application.port.in.LintSourceUseCase.LintRequest;
import com.vidnyan.classlint.application.port.in.LintSourceUseCase.LintResult;
import com.vidnyan.classlint.domain.rule.Correction;
import com.vidnyan.classlint.domain.rule.Severity;
import com.vidnyan.classlint.domain.rule.Violation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI Runner for standalone linting.
 * Runs when the lint.path property is set; exits with 1 when the path does not exist and with 2
 * when error-severity violations remain.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LintCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final int MAX_REPORTED = 100;

    private final LintSourceUseCase lintSourceUseCase;
    private final LintProperties properties;
    private final ObjectMapper objectMapper;

    private int exitCode = 0;

    @Override
    public void run(String... args) throws Exception {
        String sourcePath = properties.getPath();
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set lint.path property.");
            return;
        }

        Path path = Path.of(sourcePath);
        if (!Files.exists(path)) {
            log.error("Source path does not exist: {}", path);
            exitCode = 1;
            return;
        }
        LintRequest request = properties.isAutocorrect()
                ? LintRequest.correcting(path)
                : LintRequest.forPath(path);
        LintResult result = lintSourceUseCase.lint(request);

        if ("json".equalsIgnoreCase(properties.getReporter())) {
            printJson(result);
        } else {
            printResults(result);
        }
        exitCode = result.hasErrors() ? 2 : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printJson(LintResult result) throws JsonProcessingException {
        System.out.println(objectMapper.writeValueAsString(result));
    }

    private void printResults(LintResult result) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" LINT RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files linted:     {}", result.stats().filesLinted());
        log.info(" Files skipped:    {}", result.stats().filesSkipped());
        log.info(" Files corrected:  {}", result.stats().filesCorrected());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        if (!result.corrections().isEmpty()) {
            log.info(" CORRECTIONS: {}", result.corrections().size());
            result.corrections().stream()
                    .limit(MAX_REPORTED)
                    .map(Correction::format)
                    .forEach(line -> log.info("   {}", line));
            return;
        }

        log.info(" VIOLATIONS:");
        log.info("   Errors:   {}", result.violationCount(Severity.ERROR));
        log.info("   Warnings: {}", result.violationCount(Severity.WARNING));

        if (result.violations().isEmpty()) {
            log.info(" No violations found.");
            return;
        }

        int count = 0;
        for (Violation v : result.violations()) {
            if (++count > MAX_REPORTED) {
                log.info(" ... and {} more violations", result.violations().size() - MAX_REPORTED);
                break;
            }
            log.info(" {}", v.format());
        }
    }
}
