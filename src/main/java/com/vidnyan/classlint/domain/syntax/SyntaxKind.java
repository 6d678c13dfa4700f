package com.vidnyan.classlint.domain.syntax;

/**
 * Node kinds the lint rules distinguish.
 * Everything else in a parsed file (structs, enums, extensions, accessors, code blocks) is {@link #OTHER}.
 */
public enum SyntaxKind {
    SOURCE_FILE,
    CLASS,
    PROTOCOL,
    FUNCTION,
    VARIABLE,
    OTHER
}
