package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.ast.CompilationUnit;
import co.fanki.routemigrator.dart.ast.DartNode;
import co.fanki.routemigrator.shared.Preconditions;

import java.nio.file.Path;

/**
 * A parsed Dart file: its path, its text, its syntax tree and its line
 * index.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DartUnit {

    private final Path path;
    private final String source;
    private final CompilationUnit root;
    private final LineIndex lines;

    /**
     * Creates a new parsed unit.
     *
     * @param thePath the absolute, normalized file path
     * @param theSource the file content
     * @param theRoot the syntax tree of the content
     */
    public DartUnit(final Path thePath, final String theSource,
            final CompilationUnit theRoot) {
        Preconditions.requireNonNull(thePath, "Path is required");
        Preconditions.requireNonNull(theSource, "Source is required");
        Preconditions.requireNonNull(theRoot, "Syntax tree is required");
        this.path = thePath;
        this.source = theSource;
        this.root = theRoot;
        this.lines = LineIndex.of(theSource);
    }

    public Path path() {
        return path;
    }

    public String source() {
        return source;
    }

    public CompilationUnit root() {
        return root;
    }

    /**
     * Returns the exact source text of a node.
     *
     * @param node a node of this unit
     * @return the text between the node's offsets
     */
    public String text(final DartNode node) {
        return source.substring(node.offset(),
                Math.min(node.end(), source.length()));
    }

    /**
     * Returns the 1-based line of an offset.
     *
     * @param offset an offset in this unit's source
     * @return the line number
     */
    public int lineOf(final int offset) {
        return lines.lineOf(offset);
    }

    @Override
    public String toString() {
        return "DartUnit[" + path + "]";
    }

}
