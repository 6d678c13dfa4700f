package com.vidnyan.classlint.domain.rule;

/**
 * Raised when a rule option is unknown or carries a value the rule cannot use.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final String option;

    public InvalidConfigurationException(String option, Object value, String hint) {
        super(String.format("Invalid value '%s' for option '%s': %s", value, option, hint));
        this.option = option;
    }

    public String getOption() {
        return option;
    }
}
