package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code key: value} entry of a map literal.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MapLiteralEntry extends Expression {

    private final Expression key;
    private final Expression value;

    public MapLiteralEntry(final int theOffset, final int theEnd,
            final Expression theKey, final Expression theValue) {
        super(theOffset, theEnd);
        this.key = adopt(theKey);
        this.value = adopt(theValue);
    }

    public Expression key() {
        return key;
    }

    public Expression value() {
        return value;
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>();
        children.add(key);
        if (value != null) {
            children.add(value);
        }
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitMapLiteralEntry(this);
    }

}
