package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;

/**
 * One planned change of a source file, as shown in plan mode.
 *
 * @param line the 1-based line of the change in the original file
 * @param original the text being replaced, empty for an insertion
 * @param replacement the new text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LineChange(int line, String original, String replacement) {

    public LineChange {
        Preconditions.require(line > 0, "Line must be positive");
        Preconditions.requireNonNull(original, "Original text is required");
        Preconditions.requireNonNull(replacement, "Replacement is required");
    }

}
