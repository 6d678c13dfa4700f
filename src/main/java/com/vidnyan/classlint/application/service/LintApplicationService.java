package com.vidnyan.classlint.application.service;

import com.vidnyan.classlint.application.port.in.LintSourceUseCase;
import com.vidnyan.classlint.application.port.out.SourceFileRepository;
import com.vidnyan.classlint.application.port.out.SuppressionFilter;
import com.vidnyan.classlint.application.port.out.SyntaxTreeProvider;
import com.vidnyan.classlint.application.port.out.SyntaxTreeUnavailableException;
import com.vidnyan.classlint.domain.model.SourceFile;
import com.vidnyan.classlint.domain.model.TextRange;
import com.vidnyan.classlint.domain.rule.CorrectableRule;
import com.vidnyan.classlint.domain.rule.Correction;
import com.vidnyan.classlint.domain.rule.CorrectionOutcome;
import com.vidnyan.classlint.domain.rule.Violation;
import com.vidnyan.classlint.domain.syntax.SyntaxNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Main application service that orchestrates linting and correction of source files.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LintApplicationService implements LintSourceUseCase {

    private final SourceFileRepository sourceFileRepository;
    private final SyntaxTreeProvider syntaxTreeProvider;
    private final SuppressionFilter suppressionFilter;
    private final CorrectableRule rule;

    @Override
    public LintResult lint(LintRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting {} of: {}", request.autocorrect() ? "correction" : "lint", request.sourcePath());

        List<Path> files;
        try {
            files = sourceFileRepository.scan(request.sourcePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + request.sourcePath(), e);
        }
        log.info("Found {} source files", files.size());

        List<Violation> allViolations = new ArrayList<>();
        List<Correction> allCorrections = new ArrayList<>();
        int linted = 0;
        int skipped = 0;
        int corrected = 0;

        for (Path path : files) {
            Optional<SourceFile> loaded = load(path);
            if (loaded.isEmpty()) {
                skipped++;
                continue;
            }
            SourceFile file = loaded.get();
            linted++;

            if (request.autocorrect()) {
                List<Correction> corrections = correct(file);
                if (!corrections.isEmpty()) {
                    corrected++;
                    allCorrections.addAll(corrections);
                }
            } else {
                allViolations.addAll(validate(file));
            }
        }

        Duration totalDuration = Duration.between(startTime, Instant.now());
        LintStats stats = new LintStats(linted, skipped, corrected, totalDuration.toMillis());

        log.info("{} complete: {} violations, {} corrections in {}ms",
                request.autocorrect() ? "Correction" : "Lint",
                allViolations.size(), allCorrections.size(), stats.totalDurationMs());

        return new LintResult(List.copyOf(allViolations), List.copyOf(allCorrections), stats);
    }

    private Optional<SourceFile> load(Path path) {
        try {
            String contents = sourceFileRepository.read(path);
            SyntaxNode tree = syntaxTreeProvider.load(path);
            return Optional.of(new SourceFile(path, contents, tree));
        } catch (IOException e) {
            log.warn("Skipping {}: cannot read file: {}", path, e.getMessage());
        } catch (SyntaxTreeUnavailableException e) {
            log.warn("Skipping {}: {}", path, e.getMessage());
        }
        return Optional.empty();
    }

    private List<Violation> validate(SourceFile file) {
        String ruleId = rule.description().identifier();
        List<Violation> violations = rule.validate(file).stream()
                .filter(v -> suppressionFilter.stateAt(file, TextRange.at(v.location().characterOffset()), ruleId)
                        == SuppressionFilter.RuleState.ENABLED)
                .toList();
        if (!violations.isEmpty()) {
            log.debug("  {}: {} violations", file.displayPath(), violations.size());
        }
        return violations;
    }

    private List<Correction> correct(SourceFile file) {
        CorrectionOutcome outcome = rule.correct(file);
        if (outcome.contents().equals(file.contents())) {
            return List.of();
        }
        try {
            sourceFileRepository.write(file.path(), outcome.contents());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write corrected " + file.displayPath(), e);
        }
        log.info("  Corrected {} ({} edits)", file.displayPath(), outcome.corrections().size());

        // corrections come back end-of-file first
        return outcome.corrections().stream()
                .sorted(Comparator.comparingInt(c -> c.location().characterOffset()))
                .toList();
    }
}
