package com.vidnyan.classlint.domain.rule;

import com.vidnyan.classlint.domain.model.SourceFile;

import java.util.List;

/**
 * A lint rule that can also rewrite the code it reports.
 */
public interface CorrectableRule {

    RuleDescription description();

    /**
     * Report violations in source order of discovery.
     */
    List<Violation> validate(SourceFile file);

    /**
     * Compute the corrected contents of the file. The file itself is not written.
     */
    CorrectionOutcome correct(SourceFile file);
}
