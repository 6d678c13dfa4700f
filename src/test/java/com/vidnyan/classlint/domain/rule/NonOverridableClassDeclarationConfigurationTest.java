package com.vidnyan.classlint.domain.rule;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NonOverridableClassDeclarationConfigurationTest {

    @Test
    void defaultsToWarningAndFinalClass() {
        NonOverridableClassDeclarationConfiguration config = NonOverridableClassDeclarationConfiguration.parse(Map.of());

        assertEquals(Severity.WARNING, config.severity());
        assertEquals(FinalClassModifier.FINAL_CLASS, config.finalClassModifier());
        assertEquals("final class", config.finalClassModifier().replacement());
        assertEquals(config, NonOverridableClassDeclarationConfiguration.parse(null));
    }

    @Test
    void parsesBothOptions() {
        NonOverridableClassDeclarationConfiguration config = NonOverridableClassDeclarationConfiguration.parse(Map.of(
                "severity", "error",
                "final_class_modifier", "static"));

        assertEquals(Severity.ERROR, config.severity());
        assertEquals(FinalClassModifier.STATIC, config.finalClassModifier());
    }

    @Test
    void valuesAreMatchedLeniently() {
        assertEquals(Severity.ERROR, Severity.fromConfigValue(" ERROR "));
        assertEquals(FinalClassModifier.FINAL_CLASS, FinalClassModifier.fromConfigValue("final"));
        assertEquals(FinalClassModifier.FINAL_CLASS, FinalClassModifier.fromConfigValue("Final   Class"));
        assertEquals(FinalClassModifier.STATIC, FinalClassModifier.fromConfigValue("STATIC"));
    }

    @Test
    void rejectsUnsupportedValues() {
        InvalidConfigurationException severity = assertThrows(InvalidConfigurationException.class,
                () -> NonOverridableClassDeclarationConfiguration.parse(Map.of("severity", "fatal")));
        InvalidConfigurationException modifier = assertThrows(InvalidConfigurationException.class,
                () -> NonOverridableClassDeclarationConfiguration.parse(Map.of("final_class_modifier", "open")));

        assertEquals("severity", severity.getOption());
        assertEquals("final_class_modifier", modifier.getOption());
        assertTrue(modifier.getMessage().contains("'open'"));
    }

    @Test
    void rejectsUnknownKeysAndNonStringValues() {
        assertThrows(InvalidConfigurationException.class,
                () -> NonOverridableClassDeclarationConfiguration.parse(Map.of("modifier", "static")));

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("severity", 2);
        assertThrows(InvalidConfigurationException.class,
                () -> NonOverridableClassDeclarationConfiguration.parse(options));
    }
}
