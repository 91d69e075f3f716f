package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A closure, {@code (params) => expr} or {@code (params) { ... }}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FunctionExpression extends Expression
        implements FunctionLike {

    private final List<Parameter> parameters;
    private final DartNode body;

    public FunctionExpression(final int theOffset, final int theEnd,
            final List<Parameter> theParameters, final DartNode theBody) {
        super(theOffset, theEnd);
        this.parameters = adoptAll(theParameters);
        this.body = adopt(theBody);
    }

    @Override
    public List<Parameter> parameters() {
        return parameters;
    }

    /** The body: an {@link Expression} for arrow bodies, else a Block. */
    public DartNode body() {
        return body;
    }

    /**
     * Checks whether this closure has an arrow body.
     *
     * @return true for {@code =>} bodies
     */
    public boolean hasExpressionBody() {
        return body instanceof Expression;
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>(parameters);
        if (body != null) {
            children.add(body);
        }
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitFunctionExpression(this);
    }

}
