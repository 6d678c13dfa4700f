package com.vidnyan.classlint.domain.rule;

import com.vidnyan.classlint.application.port.out.LocationResolver;
import com.vidnyan.classlint.application.port.out.SuppressionFilter;
import com.vidnyan.classlint.domain.model.Location;
import com.vidnyan.classlint.domain.model.SourceFile;
import com.vidnyan.classlint.domain.model.TextRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Applies correction edits of one rule to the contents of a file.
 * <p>
 * Edits are resolved and filtered before the contents are touched, then replaced from the
 * end of the file towards its start so that every range still pending keeps its offsets.
 * An edit that cannot be resolved, whose range no longer holds the text the tree recorded,
 * or whose rule state is anything but enabled, is dropped on its own.
 */
@Slf4j
@RequiredArgsConstructor
public class CorrectionApplier {

    private final RuleDescription ruleDescription;
    private final LocationResolver locationResolver;
    private final SuppressionFilter suppressionFilter;

    public CorrectionOutcome apply(SourceFile file, List<CorrectionEdit> edits, String replacement) {
        List<PendingCorrection> pending = edits.stream()
                .map(edit -> resolve(file, edit))
                .flatMap(Optional::stream)
                .filter(p -> isEnabled(file, p.range()))
                .sorted(Comparator.comparingInt(PendingCorrection::start).reversed())
                .toList();

        StringBuilder contents = new StringBuilder(file.contents());
        List<Correction> corrections = new ArrayList<>(pending.size());
        for (PendingCorrection p : pending) {
            contents.replace(p.range().location(), p.range().end(), replacement);
            corrections.add(new Correction(ruleDescription, p.location()));
        }

        log.debug("Applied {} of {} corrections to {}", corrections.size(), edits.size(), file.displayPath());
        return new CorrectionOutcome(contents.toString(), List.copyOf(corrections));
    }

    private Optional<PendingCorrection> resolve(SourceFile file, CorrectionEdit edit) {
        Optional<TextRange> range = locationResolver.characterRange(file, edit.start(), edit.end());
        Optional<Location> location = range.flatMap(r -> locationResolver.location(file, r.location()));
        if (range.isEmpty() || location.isEmpty()) {
            log.debug("Dropping correction at unresolvable position {}..{} in {}",
                    edit.start(), edit.end(), file.displayPath());
            return Optional.empty();
        }
        if (!file.hasTextAt(range.get(), edit.text())) {
            log.debug("Dropping correction at {}..{} in {}: contents no longer read '{}'",
                    edit.start(), edit.end(), file.displayPath(), edit.text());
            return Optional.empty();
        }
        return Optional.of(new PendingCorrection(range.get(), location.get()));
    }

    private boolean isEnabled(SourceFile file, TextRange range) {
        SuppressionFilter.RuleState state = suppressionFilter.stateAt(file, range, ruleDescription.identifier());
        if (state != SuppressionFilter.RuleState.ENABLED) {
            log.debug("Skipping correction at {} in {}: rule {}", range.location(), file.displayPath(), state);
            return false;
        }
        return true;
    }

    private record PendingCorrection(TextRange range, Location location) {

        int start() {
            return range.location();
        }
    }
}
