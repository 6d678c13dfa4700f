package com.vidnyan.classlint.application.port.out;

import com.vidnyan.classlint.domain.model.SourceFile;
import com.vidnyan.classlint.domain.model.TextRange;

/**
 * Port answering whether a rule is active at a given range of a file,
 * e.g. after inline enable/disable directives have been taken into account.
 */
public interface SuppressionFilter {

    RuleState stateAt(SourceFile file, TextRange range, String ruleId);

    enum RuleState {
        ENABLED,
        DISABLED,
        UNRESOLVABLE
    }
}
