package com.vidnyan.classlint.domain.model;

/**
 * Source code location.
 *
 * @param filePath        file the location belongs to
 * @param line            1-based line
 * @param column          1-based column, in UTF-16 code units
 * @param characterOffset 0-based UTF-16 offset into the file contents
 */
public record Location(
    String filePath,
    int line,
    int column,
    int characterOffset
) {

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}
