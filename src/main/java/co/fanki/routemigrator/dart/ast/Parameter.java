package co.fanki.routemigrator.dart.ast;

import java.util.List;

/**
 * A formal parameter of a function, method or function expression.
 *
 * <p>The node spans the parameter name only, so its offset identifies
 * the declaration.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Parameter extends DartNode {

    private final String typeName;
    private final String name;
    private final boolean named;

    public Parameter(final int theOffset, final int theEnd,
            final String theTypeName, final String theName,
            final boolean isNamed) {
        super(theOffset, theEnd);
        this.typeName = theTypeName;
        this.name = theName;
        this.named = isNamed;
    }

    /**
     * The declared type without type arguments, e.g. {@code BuildContext}.
     *
     * @return the type name, null when the parameter is untyped
     */
    public String typeName() {
        return typeName;
    }

    public String name() {
        return name;
    }

    /** True for parameters declared inside {@code {...}}. */
    public boolean named() {
        return named;
    }

    @Override
    public List<DartNode> children() {
        return List.of();
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitParameter(this);
    }

}
