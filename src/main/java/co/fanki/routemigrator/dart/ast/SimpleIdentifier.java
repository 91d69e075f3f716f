package co.fanki.routemigrator.dart.ast;

import java.util.List;

/**
 * A bare identifier reference.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SimpleIdentifier extends Expression {

    private final String name;

    public SimpleIdentifier(final int theOffset, final int theEnd,
            final String theName) {
        super(theOffset, theEnd);
        this.name = theName;
    }

    public String name() {
        return name;
    }

    @Override
    public List<DartNode> children() {
        return List.of();
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitSimpleIdentifier(this);
    }

}
