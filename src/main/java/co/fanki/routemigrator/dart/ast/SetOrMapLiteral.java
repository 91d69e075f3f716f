package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A braced collection literal.
 *
 * <p>It is a map when any element is a {@link MapLiteralEntry}, or when
 * it is empty and not typed as a set.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SetOrMapLiteral extends Expression {

    private final String typeArguments;
    private final List<Expression> elements;
    private final boolean map;

    public SetOrMapLiteral(final int theOffset, final int theEnd,
            final String theTypeArguments,
            final List<Expression> theElements, final boolean isMap) {
        super(theOffset, theEnd);
        this.typeArguments = theTypeArguments;
        this.elements = adoptAll(theElements);
        this.map = isMap;
    }

    public String typeArguments() {
        return typeArguments;
    }

    public List<Expression> elements() {
        return elements;
    }

    public boolean isMap() {
        return map;
    }

    public boolean isSet() {
        return !map;
    }

    @Override
    public List<DartNode> children() {
        return new ArrayList<>(elements);
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitSetOrMapLiteral(this);
    }

}
