package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A list literal, {@code [a, b]} or {@code <RouteBase>[...]}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ListLiteral extends Expression {

    private final String typeArguments;
    private final List<Expression> elements;

    public ListLiteral(final int theOffset, final int theEnd,
            final String theTypeArguments,
            final List<Expression> theElements) {
        super(theOffset, theEnd);
        this.typeArguments = theTypeArguments;
        this.elements = adoptAll(theElements);
    }

    public String typeArguments() {
        return typeArguments;
    }

    public List<Expression> elements() {
        return elements;
    }

    @Override
    public List<DartNode> children() {
        return new ArrayList<>(elements);
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitListLiteral(this);
    }

}
