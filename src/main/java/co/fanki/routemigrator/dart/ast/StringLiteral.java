package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A string literal, possibly made of adjacent literals and
 * interpolations.
 *
 * <p>Parts are either decoded text ({@link String}) or interpolated
 * {@link Expression}s, in source order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StringLiteral extends Expression {

    private final List<Object> parts;

    public StringLiteral(final int theOffset, final int theEnd,
            final List<Object> theParts) {
        super(theOffset, theEnd);
        for (final Object part : theParts) {
            if (part instanceof Expression) {
                adopt((Expression) part);
            }
        }
        this.parts = List.copyOf(theParts);
    }

    public List<Object> parts() {
        return parts;
    }

    /**
     * Returns the literal value when the string has no interpolation.
     *
     * @return the value, or null if any part is an expression
     */
    public String stringValue() {
        final StringBuilder value = new StringBuilder();
        for (final Object part : parts) {
            if (part instanceof Expression) {
                return null;
            }
            value.append(part);
        }
        return value.toString();
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>();
        for (final Object part : parts) {
            if (part instanceof Expression) {
                children.add((Expression) part);
            }
        }
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitStringLiteral(this);
    }

}
