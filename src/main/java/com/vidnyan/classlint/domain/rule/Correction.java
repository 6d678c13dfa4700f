package com.vidnyan.classlint.domain.rule;

import com.vidnyan.classlint.domain.model.Location;

/**
 * A correction that was applied to a file.
 *
 * @param location where the replaced text started in the file before any correction
 */
public record Correction(
    RuleDescription ruleDescription,
    Location location
) {

    public String format() {
        return location.format() + " Corrected " + ruleDescription.name();
    }
}
