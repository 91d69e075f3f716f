package co.fanki.routemigrator.dart.ast;

import java.util.List;

/**
 * A labelled argument, {@code name: expression}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NamedExpression extends Expression {

    private final String name;
    private final Expression expression;

    public NamedExpression(final int theOffset, final int theEnd,
            final String theName, final Expression theExpression) {
        super(theOffset, theEnd);
        this.name = theName;
        this.expression = adopt(theExpression);
    }

    public String name() {
        return name;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public List<DartNode> children() {
        return List.of(expression);
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitNamedExpression(this);
    }

}
