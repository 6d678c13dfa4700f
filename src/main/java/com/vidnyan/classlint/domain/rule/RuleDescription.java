package com.vidnyan.classlint.domain.rule;

/**
 * Static identity of a rule, attached to everything the rule reports.
 */
public record RuleDescription(
    String identifier,
    String name,
    String description,
    Kind kind
) {

    public enum Kind {
        LINT,
        IDIOMATIC,
        STYLE,
        PERFORMANCE
    }
}
