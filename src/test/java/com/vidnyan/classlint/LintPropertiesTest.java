package com.vidnyan.classlint;

import com.vidnyan.classlint.domain.rule.FinalClassModifier;
import com.vidnyan.classlint.domain.rule.NonOverridableClassDeclarationConfiguration;
import com.vidnyan.classlint.domain.rule.Severity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LintPropertiesTest {

    @Test
    void defaultRuleOptionsMatchRuleDefaults() {
        LintProperties properties = new LintProperties();

        NonOverridableClassDeclarationConfiguration config = NonOverridableClassDeclarationConfiguration
                .parse(properties.getRules().getNonOverridableClassDeclaration().toOptions());

        assertEquals(NonOverridableClassDeclarationConfiguration.defaults(), config);
    }

    @Test
    void ruleOptionsUseConfigurationKeys() {
        LintProperties.RuleOptions options = new LintProperties.RuleOptions();
        options.setSeverity("error");
        options.setFinalClassModifier("static");

        NonOverridableClassDeclarationConfiguration config =
                NonOverridableClassDeclarationConfiguration.parse(options.toOptions());

        assertEquals(Severity.ERROR, config.severity());
        assertEquals(FinalClassModifier.STATIC, config.finalClassModifier());
    }
}
