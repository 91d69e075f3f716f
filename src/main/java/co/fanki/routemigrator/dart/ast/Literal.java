package co.fanki.routemigrator.dart.ast;

import java.util.List;

/**
 * Number, boolean and null literals.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Literal extends Expression {

    private final String text;

    public Literal(final int theOffset, final int theEnd,
            final String theText) {
        super(theOffset, theEnd);
        this.text = theText;
    }

    public String text() {
        return text;
    }

    @Override
    public List<DartNode> children() {
        return List.of();
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitLiteral(this);
    }

}
