package com.vidnyan.classlint;

import com.vidnyan.classlint.domain.rule.NonOverridableClassDeclarationConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the linter.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "lint")
public class LintProperties {

    /**
     * File or directory to lint.
     * Default: none, the CLI does nothing
     */
    private String path = "";

    /**
     * Rewrite files instead of only reporting.
     */
    private boolean autocorrect = false;

    /**
     * Report format: log or json.
     */
    private String reporter = "log";

    private Rules rules = new Rules();

    @Data
    public static class Rules {
        private RuleOptions nonOverridableClassDeclaration = new RuleOptions();
    }

    @Data
    public static class RuleOptions {
        private String severity = "warning";
        private String finalClassModifier = "final class";

        /**
         * Options keyed the way the rule configuration names them.
         */
        public Map<String, Object> toOptions() {
            Map<String, Object> options = new LinkedHashMap<>();
            options.put(NonOverridableClassDeclarationConfiguration.SEVERITY, severity);
            options.put(NonOverridableClassDeclarationConfiguration.FINAL_CLASS_MODIFIER, finalClassModifier);
            return options;
        }
    }
}
