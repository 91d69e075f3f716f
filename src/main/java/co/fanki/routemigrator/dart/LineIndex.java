package co.fanki.routemigrator.dart;

import java.util.Arrays;

/**
 * Maps source offsets to 1-based line numbers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LineIndex {

    private final int[] lineStarts;

    private LineIndex(final int[] theLineStarts) {
        this.lineStarts = theLineStarts;
    }

    /**
     * Builds the index of a source buffer.
     *
     * @param source the text to index
     * @return the index
     */
    public static LineIndex of(final String source) {
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                count++;
            }
        }
        final int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return new LineIndex(starts);
    }

    /**
     * Returns the line containing an offset.
     *
     * @param offset the offset in the indexed buffer
     * @return the 1-based line number
     */
    public int lineOf(final int offset) {
        final int found = Arrays.binarySearch(lineStarts, offset);
        return found >= 0 ? found + 1 : -found - 1;
    }

    public int lineCount() {
        return lineStarts.length;
    }

}
