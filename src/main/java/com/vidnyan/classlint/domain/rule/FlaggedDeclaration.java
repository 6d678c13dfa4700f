package com.vidnyan.classlint.domain.rule;

import com.vidnyan.classlint.domain.syntax.ModifierToken;

/**
 * A method or property whose {@code class} modifier cannot be overridden anyway.
 * Both the reported violation and the correction edit are derived from it.
 *
 * @param keyword the {@code class} modifier token
 */
public record FlaggedDeclaration(
    ModifierToken keyword,
    DeclarationType type,
    Reason reason
) {

    public enum DeclarationType {
        METHOD("methods"),
        PROPERTY("properties");

        private final String plural;

        DeclarationType(String plural) {
            this.plural = plural;
        }

        public String plural() {
            return plural;
        }
    }

    public enum Reason {
        IN_FINAL_CLASS("Class %s in final classes should themselves be final"),
        PRIVATE("Private class %s should be declared final");

        private final String template;

        Reason(String template) {
            this.template = template;
        }
    }

    public String message() {
        return String.format(reason.template, type.plural());
    }

    public int position() {
        return keyword.start();
    }

    public CorrectionEdit toEdit() {
        return new CorrectionEdit(keyword.start(), keyword.end(), keyword.name());
    }
}
