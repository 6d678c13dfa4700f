package com.vidnyan.classlint.domain.syntax;

import java.util.List;

/**
 * Immutable node of a parsed source file.
 * Missing modifier or child lists are read as empty.
 */
public record SyntaxNode(
    SyntaxKind kind,
    String name,
    List<ModifierToken> modifiers,
    List<SyntaxNode> children
) {

    public SyntaxNode {
        kind = kind != null ? kind : SyntaxKind.OTHER;
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
        children = children != null ? List.copyOf(children) : List.of();
    }

    public static SyntaxNode sourceFile(List<SyntaxNode> children) {
        return new SyntaxNode(SyntaxKind.SOURCE_FILE, null, List.of(), children);
    }

    public ModifierList modifierList() {
        return new ModifierList(modifiers);
    }

    public boolean is(SyntaxKind other) {
        return kind == other;
    }
}
