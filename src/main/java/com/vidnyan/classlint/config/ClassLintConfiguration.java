package com.vidnyan.classlint.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.classlint.LintProperties;
import com.vidnyan.classlint.application.port.out.LocationResolver;
import com.vidnyan.classlint.application.port.out.SuppressionFilter;
import com.vidnyan.classlint.domain.rule.NonOverridableClassDeclarationConfiguration;
import com.vidnyan.classlint.domain.rule.NonOverridableClassDeclarationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for class-lint components.
 * Wires the domain rule to its adapters.
 */
@Slf4j
@Configuration
public class ClassLintConfiguration {

    /**
     * ObjectMapper for syntax tree dumps and JSON reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Rule options, validated at start-up.
     */
    @Bean
    public NonOverridableClassDeclarationConfiguration nonOverridableClassDeclarationConfiguration(
            LintProperties properties) {
        NonOverridableClassDeclarationConfiguration configuration = NonOverridableClassDeclarationConfiguration
                .parse(properties.getRules().getNonOverridableClassDeclaration().toOptions());
        log.info("Rule {}: severity={}, final_class_modifier='{}'",
                NonOverridableClassDeclarationRule.DESCRIPTION.identifier(),
                configuration.severity().configValue(),
                configuration.finalClassModifier().replacement());
        return configuration;
    }

    @Bean
    public NonOverridableClassDeclarationRule nonOverridableClassDeclarationRule(
            NonOverridableClassDeclarationConfiguration configuration,
            LocationResolver locationResolver,
            SuppressionFilter suppressionFilter) {
        return new NonOverridableClassDeclarationRule(configuration, locationResolver, suppressionFilter);
    }
}
