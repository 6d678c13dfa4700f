package com.vidnyan.classlint.domain.syntax;

/**
 * A declaration modifier keyword as it appears in the source.
 * Offsets are UTF-8 byte positions of the keyword itself, surrounding trivia excluded.
 *
 * @param name   keyword text, e.g. {@code class}, {@code final}, {@code private}
 * @param detail parenthesised detail, e.g. {@code set} in {@code private(set)}; null when absent
 * @param start  position of the first byte of the keyword
 * @param end    position just past the last byte of the keyword
 */
public record ModifierToken(
    String name,
    String detail,
    int start,
    int end
) {

    public static ModifierToken of(String name, int start, int end) {
        return new ModifierToken(name, null, start, end);
    }

    public boolean hasDetail() {
        return detail != null && !detail.isBlank();
    }
}
