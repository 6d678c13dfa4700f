package com.vidnyan.classlint.application.port.out;

import com.vidnyan.classlint.domain.syntax.SyntaxNode;

import java.nio.file.Path;

/**
 * Port for obtaining the parsed syntax tree of a source file.
 * Parsing itself happens outside this application.
 */
public interface SyntaxTreeProvider {

    /**
     * Load the tree for a source file.
     * @param sourceFile the source file the tree was parsed from
     * @return root node of kind {@code SOURCE_FILE}
     * @throws SyntaxTreeUnavailableException when no tree can be produced for the file
     */
    SyntaxNode load(Path sourceFile);
}
