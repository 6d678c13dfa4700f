package com.vidnyan.classlint.domain.rule;

/**
 * Half-open tree position range whose text is to be replaced.
 *
 * @param text the text the tree says sits at the range; the edit only applies where the
 *             contents still match it
 */
public record CorrectionEdit(int start, int end, String text) {
}
