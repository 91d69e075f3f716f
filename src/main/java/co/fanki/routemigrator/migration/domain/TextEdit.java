package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;

/**
 * Replacement of the span {@code [offset, offset + length)} of a text.
 *
 * @param offset the span start
 * @param length the span length, 0 for an insertion
 * @param replacement the new text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TextEdit(int offset, int length, String replacement) {

    public TextEdit {
        Preconditions.requireNonNegative(offset, "Offset must not be negative");
        Preconditions.requireNonNegative(length, "Length must not be negative");
        Preconditions.requireNonNull(replacement, "Replacement is required");
    }

    public int end() {
        return offset + length;
    }

}
