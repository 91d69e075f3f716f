package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The edits of one file, applied as buffer splices.
 *
 * <p>Edits are applied from the highest offset down. Splicing a later
 * span never moves an earlier one, so every edit can use the offsets
 * recorded against the original text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourceEdits {

    /** Highest offset first; at equal offsets the longer span first. */
    private static final Comparator<TextEdit> DESCENDING = Comparator
            .comparingInt(TextEdit::offset)
            .thenComparingInt(TextEdit::length)
            .reversed();

    private final List<TextEdit> edits = new ArrayList<>();

    /**
     * Adds an edit.
     *
     * @param edit the edit
     * @return this instance
     */
    public SourceEdits add(final TextEdit edit) {
        Preconditions.requireNonNull(edit, "Edit is required");
        edits.add(edit);
        return this;
    }

    /**
     * Returns the edits in application order.
     *
     * @return the edits, highest offset first
     */
    public List<TextEdit> inApplicationOrder() {
        final List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(DESCENDING);
        return sorted;
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int size() {
        return edits.size();
    }

    /**
     * Applies every edit to a text.
     *
     * @param text the original text the offsets refer to
     * @return the edited text
     * @throws co.fanki.routemigrator.shared.DomainException if two edits
     *      overlap
     */
    public String applyTo(final String text) {
        Preconditions.requireNonNull(text, "Text is required");
        final StringBuilder buffer = new StringBuilder(text);
        TextEdit previous = null;
        for (final TextEdit edit : inApplicationOrder()) {
            Preconditions.requireSpanWithin(edit.offset(), edit.length(),
                    text.length());
            Preconditions.requireDomain(previous == null
                    || edit.end() <= previous.offset(),
                    "Overlapping edits at offsets " + edit.offset()
                            + " and " + (previous == null
                                    ? -1 : previous.offset()));
            buffer.replace(edit.offset(), edit.end(), edit.replacement());
            previous = edit;
        }
        return buffer.toString();
    }

    /**
     * Inserts text at the start of the line that follows the last line
     * starting with {@code import}, or at the start of the content.
     *
     * @param content the file content
     * @param text the text to insert, ending with a newline
     * @return the new content
     */
    public static String insertAfterLastImport(final String content,
            final String text) {
        int insertAt = 0;
        int lineStart = 0;
        while (lineStart < content.length()) {
            final int newline = content.indexOf('\n', lineStart);
            final int lineEnd = newline < 0 ? content.length() : newline;
            if (content.substring(lineStart, lineEnd).trim()
                    .startsWith("import ")) {
                insertAt = newline < 0 ? content.length() : newline + 1;
            }
            lineStart = lineEnd + 1;
        }
        if (insertAt == content.length() && !content.isEmpty()
                && !content.endsWith("\n")) {
            return content + "\n" + text;
        }
        return content.substring(0, insertAt) + text
                + content.substring(insertAt);
    }

}
