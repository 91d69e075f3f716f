package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;

import java.nio.file.Path;

/**
 * Where a call sits in a source file.
 *
 * <p>Offset and length are measured in UTF-16 code units, the unit of
 * Java strings, so they can be used directly to splice the file
 * content.</p>
 *
 * @param file the source file, null for {@link #NONE}
 * @param line the 1-based line of the call, 0 for {@link #NONE}
 * @param offset the start of the call
 * @param length the length of the call text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceLocation(Path file, int line, int offset, int length) {

    /** The location of records that do not come from a call site. */
    public static final SourceLocation NONE = new SourceLocation(null, 0, 0, 0);

    public SourceLocation {
        Preconditions.requireNonNegative(line, "Line must not be negative");
        Preconditions.requireNonNegative(offset, "Offset must not be negative");
        Preconditions.requireNonNegative(length, "Length must not be negative");
    }

    /** Offset just past the end of the call. */
    public int end() {
        return offset + length;
    }

    public boolean isNone() {
        return file == null;
    }

    /**
     * Checks whether another span lies within this one.
     *
     * @param other the span to test
     * @return true if {@code other} starts and ends inside this span
     */
    public boolean contains(final SourceLocation other) {
        return other.offset >= offset && other.end() <= end();
    }

}
