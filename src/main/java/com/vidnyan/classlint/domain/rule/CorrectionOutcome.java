package com.vidnyan.classlint.domain.rule;

import java.util.List;

/**
 * Result of correcting a file: the new contents and the corrections that produced them,
 * in the order they were applied (end of file first).
 */
public record CorrectionOutcome(
    String contents,
    List<Correction> corrections
) {

    public boolean hasCorrections() {
        return !corrections.isEmpty();
    }
}
