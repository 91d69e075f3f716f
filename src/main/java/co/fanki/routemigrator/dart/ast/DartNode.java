package co.fanki.routemigrator.dart.ast;

import java.util.List;

/**
 * Base class of every node in a parsed Dart unit.
 *
 * <p>Each node knows its source span and its parent. Children are
 * adopted in the subclass constructors, so a tree is fully linked once
 * its root has been built.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class DartNode {

    private final int offset;
    private final int end;
    private DartNode parent;

    /**
     * Creates a node spanning {@code [offset, end)}.
     *
     * @param theOffset the start offset, inclusive
     * @param theEnd the end offset, exclusive
     */
    protected DartNode(final int theOffset, final int theEnd) {
        this.offset = theOffset;
        this.end = Math.max(theOffset, theEnd);
    }

    /**
     * Links a child node to this node.
     *
     * @param child the child, may be null
     * @param <T> the child type
     * @return the same child
     */
    protected final <T extends DartNode> T adopt(final T child) {
        if (child != null) {
            ((DartNode) child).parent = this;
        }
        return child;
    }

    /**
     * Links every node of a list to this node.
     *
     * @param nodes the children
     * @param <T> the child type
     * @return an immutable copy of the list
     */
    protected final <T extends DartNode> List<T> adoptAll(
            final List<T> nodes) {
        for (final T node : nodes) {
            adopt(node);
        }
        return List.copyOf(nodes);
    }

    public int offset() {
        return offset;
    }

    public int end() {
        return end;
    }

    public int length() {
        return end - offset;
    }

    public DartNode parent() {
        return parent;
    }

    /**
     * Returns the direct children of this node in source order.
     *
     * @return the children, never null
     */
    public abstract List<DartNode> children();

    /**
     * Dispatches this node to the matching visitor method.
     *
     * @param visitor the visitor
     */
    public abstract void accept(DartAstVisitor visitor);

}
