package co.fanki.routemigrator.dart.ast;

import java.util.List;

/**
 * A member read, {@code target.name} or {@code target?.name}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PropertyAccess extends Expression {

    private final Expression target;
    private final String name;

    public PropertyAccess(final int theOffset, final int theEnd,
            final Expression theTarget, final String theName) {
        super(theOffset, theEnd);
        this.target = adopt(theTarget);
        this.name = theName;
    }

    public Expression target() {
        return target;
    }

    public String name() {
        return name;
    }

    @Override
    public List<DartNode> children() {
        return List.of(target);
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitPropertyAccess(this);
    }

}
