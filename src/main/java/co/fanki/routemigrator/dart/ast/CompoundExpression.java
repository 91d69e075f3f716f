package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Any sequence of operands joined by operators or keywords that the
 * parser does not model structurally: binary and conditional
 * expressions, {@code await}, {@code return}, casts, statements.
 *
 * <p>Operands keep their full structure, so calls nested anywhere in a
 * statement remain reachable by a visitor.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CompoundExpression extends Expression {

    private final List<Expression> operands;
    private final List<String> operators;

    public CompoundExpression(final int theOffset, final int theEnd,
            final List<Expression> theOperands,
            final List<String> theOperators) {
        super(theOffset, theEnd);
        this.operands = adoptAll(theOperands);
        this.operators = List.copyOf(theOperators);
    }

    public List<Expression> operands() {
        return operands;
    }

    /** Operator and keyword tokens in source order. */
    public List<String> operators() {
        return operators;
    }

    @Override
    public List<DartNode> children() {
        return new ArrayList<>(operands);
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitCompoundExpression(this);
    }

}
