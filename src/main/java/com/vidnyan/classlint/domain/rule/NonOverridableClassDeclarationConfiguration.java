package com.vidnyan.classlint.domain.rule;

import java.util.Map;

/**
 * Options of the non-overridable class declaration rule.
 *
 * @param severity           severity attached to every violation
 * @param finalClassModifier replacement used when correcting
 */
public record NonOverridableClassDeclarationConfiguration(
    Severity severity,
    FinalClassModifier finalClassModifier
) {

    public static final String SEVERITY = "severity";
    public static final String FINAL_CLASS_MODIFIER = "final_class_modifier";

    public static NonOverridableClassDeclarationConfiguration defaults() {
        return new NonOverridableClassDeclarationConfiguration(Severity.WARNING, FinalClassModifier.FINAL_CLASS);
    }

    /**
     * Build a configuration from raw options, as found under the rule's key in a configuration file.
     * Absent options keep their defaults.
     *
     * @throws InvalidConfigurationException on unknown keys or unsupported values
     */
    public static NonOverridableClassDeclarationConfiguration parse(Map<String, ?> options) {
        NonOverridableClassDeclarationConfiguration config = defaults();
        if (options == null) {
            return config;
        }
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            String value = asString(entry.getKey(), entry.getValue());
            config = switch (entry.getKey()) {
                case SEVERITY -> new NonOverridableClassDeclarationConfiguration(
                        Severity.fromConfigValue(value), config.finalClassModifier());
                case FINAL_CLASS_MODIFIER -> new NonOverridableClassDeclarationConfiguration(
                        config.severity(), FinalClassModifier.fromConfigValue(value));
                default -> throw new InvalidConfigurationException(
                        entry.getKey(), entry.getValue(), "unknown option");
            };
        }
        return config;
    }

    private static String asString(String key, Object value) {
        if (value instanceof String s) {
            return s;
        }
        throw new InvalidConfigurationException(key, value, "expected a string");
    }
}
