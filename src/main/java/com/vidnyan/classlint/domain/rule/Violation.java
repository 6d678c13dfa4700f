package com.vidnyan.classlint.domain.rule;

import com.vidnyan.classlint.domain.model.Location;

/**
 * A detected rule violation.
 * Immutable value object.
 *
 * @param position tree position (UTF-8 byte offset) of the offending token
 */
public record Violation(
    String ruleId,
    Severity severity,
    String message,
    int position,
    Location location
) {

    public String format() {
        return String.format("%s: %s: %s (%s)",
                location.format(), severity.configValue(), message, ruleId);
    }
}
