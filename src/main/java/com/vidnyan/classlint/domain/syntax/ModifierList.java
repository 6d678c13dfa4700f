package com.vidnyan.classlint.domain.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Queries over the ordered modifiers of a declaration.
 */
public record ModifierList(List<ModifierToken> tokens) {

    public static final String FINAL = "final";
    public static final String CLASS = "class";
    public static final String PRIVATE = "private";
    public static final String FILEPRIVATE = "fileprivate";

    public ModifierList {
        tokens = tokens != null ? tokens : List.of();
    }

    public Optional<ModifierToken> find(String name) {
        return tokens.stream()
                .filter(t -> name.equals(t.name()))
                .findFirst();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public boolean isFinal() {
        return contains(FINAL);
    }

    /**
     * {@code private(set)} and {@code fileprivate(set)} only restrict the setter and do not count.
     */
    public boolean isPrivate() {
        return tokens.stream()
                .filter(t -> !t.hasDetail())
                .anyMatch(t -> PRIVATE.equals(t.name()) || FILEPRIVATE.equals(t.name()));
    }
}
