package com.vidnyan.classlint.domain.model;

/**
 * Half-open range of UTF-16 code units in file contents.
 */
public record TextRange(int location, int length) {

    public TextRange {
        if (location < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid range: " + location + "+" + length);
        }
    }

    public static TextRange between(int start, int end) {
        return new TextRange(start, end - start);
    }

    public static TextRange at(int location) {
        return new TextRange(location, 0);
    }

    public int end() {
        return location + length;
    }

    public boolean fitsWithin(int contentLength) {
        return end() <= contentLength;
    }
}
