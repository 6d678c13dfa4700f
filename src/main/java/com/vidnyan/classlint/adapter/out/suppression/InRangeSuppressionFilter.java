package com.vidnyan.classlint.adapter.out.suppression;

import com.vidnyan.classlint.application.port.out.SuppressionFilter;
import com.vidnyan.classlint.domain.model.SourceFile;
import com.vidnyan.classlint.domain.model.TextRange;
import org.springframework.stereotype.Component;

/**
 * Default filter for sources without suppression directives: every range inside the file is enabled.
 */
@Component
public class InRangeSuppressionFilter implements SuppressionFilter {

    @Override
    public RuleState stateAt(SourceFile file, TextRange range, String ruleId) {
        return range.fitsWithin(file.contents().length()) ? RuleState.ENABLED : RuleState.UNRESOLVABLE;
    }
}
