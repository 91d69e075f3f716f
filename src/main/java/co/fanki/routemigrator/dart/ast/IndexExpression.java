package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An index read, {@code target[index]}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class IndexExpression extends Expression {

    private final Expression target;
    private final Expression index;

    public IndexExpression(final int theOffset, final int theEnd,
            final Expression theTarget, final Expression theIndex) {
        super(theOffset, theEnd);
        this.target = adopt(theTarget);
        this.index = adopt(theIndex);
    }

    public Expression target() {
        return target;
    }

    public Expression index() {
        return index;
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>();
        children.add(target);
        if (index != null) {
            children.add(index);
        }
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitIndexExpression(this);
    }

}
