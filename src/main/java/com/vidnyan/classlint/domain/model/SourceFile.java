package com.vidnyan.classlint.domain.model;

import com.vidnyan.classlint.domain.syntax.SyntaxNode;

import java.nio.file.Path;

/**
 * A source file together with the syntax tree parsed from its current contents.
 */
public record SourceFile(
    Path path,
    String contents,
    SyntaxNode tree
) {

    /**
     * Whether the contents hold exactly {@code expected} at {@code range}.
     */
    public boolean hasTextAt(TextRange range, String expected) {
        return range.fitsWithin(contents.length())
                && contents.regionMatches(range.location(), expected, 0, expected.length())
                && range.length() == expected.length();
    }

    public String displayPath() {
        return path != null ? path.toString() : "<memory>";
    }
}
