package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A parenthesized expression.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ParenthesizedExpression extends Expression {

    private final Expression expression;

    public ParenthesizedExpression(final int theOffset, final int theEnd,
            final Expression theExpression) {
        super(theOffset, theEnd);
        this.expression = adopt(theExpression);
    }

    /** The inner expression, null for {@code ()}. */
    public Expression expression() {
        return expression;
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>();
        if (expression != null) {
            children.add(expression);
        }
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitParenthesizedExpression(this);
    }

}
