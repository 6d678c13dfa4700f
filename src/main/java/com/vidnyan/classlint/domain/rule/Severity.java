package com.vidnyan.classlint.domain.rule;

import java.util.Arrays;
import java.util.Locale;

/**
 * Violation severity levels.
 */
public enum Severity {
    WARNING("warning"),  // Reported, does not fail the run
    ERROR("error");      // Reported, fails CI

    private final String configValue;

    Severity(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static Severity fromConfigValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.configValue.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidConfigurationException(
                        "severity", value, "expected one of: warning, error"));
    }
}
