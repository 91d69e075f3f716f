package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;
import co.fanki.routemigrator.shared.ValueObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The data a navigation call hands to its destination.
 *
 * <p>A payload is absent, a single expression (the {@code arguments:}
 * of a named push) or a mapping of field names to expressions (the
 * constructor arguments of a pushed page). The three shapes are
 * mutually exclusive.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ArgumentsPayload implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** The payload shapes. */
    public enum Shape {
        /** Nothing is passed. */
        NONE,
        /** One expression is passed as is. */
        SINGLE,
        /** Named fields are passed. */
        NAMED
    }

    /** The absent payload. */
    public static final ArgumentsPayload NONE = new ArgumentsPayload(
            Shape.NONE, null, Map.of(), false);

    private final Shape shape;
    private final String expression;
    private final Map<String, String> fields;
    private final boolean mapLiteral;

    private ArgumentsPayload(final Shape theShape, final String theExpression,
            final Map<String, String> theFields, final boolean isMapLiteral) {
        this.shape = theShape;
        this.expression = theExpression;
        this.fields = theFields;
        this.mapLiteral = isMapLiteral;
    }

    /**
     * Creates a single-expression payload.
     *
     * @param expression the source text of the expression
     * @param isMapLiteral whether the expression is a map literal
     * @return the payload
     */
    public static ArgumentsPayload single(final String expression,
            final boolean isMapLiteral) {
        Preconditions.requireNonBlank(expression,
                "Payload expression is required");
        return new ArgumentsPayload(Shape.SINGLE, expression, Map.of(),
                isMapLiteral);
    }

    /**
     * Creates a named-field payload.
     *
     * @param fields field names to expression source text, in order
     * @return the payload, or {@link #NONE} if there are no fields
     */
    public static ArgumentsPayload named(final Map<String, String> fields) {
        Preconditions.requireNonNull(fields, "Fields are required");
        if (fields.isEmpty()) {
            return NONE;
        }
        return new ArgumentsPayload(Shape.NAMED, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(fields)),
                false);
    }

    public Shape shape() {
        return shape;
    }

    public boolean isPresent() {
        return shape != Shape.NONE;
    }

    /** The single expression, null unless the shape is SINGLE. */
    public String expression() {
        return expression;
    }

    /** The named fields, empty unless the shape is NAMED. */
    public Map<String, String> fields() {
        return fields;
    }

    /** True when a single payload is written as a map literal. */
    public boolean isMapLiteral() {
        return mapLiteral;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArgumentsPayload other)) {
            return false;
        }
        return shape == other.shape && mapLiteral == other.mapLiteral
                && Objects.equals(expression, other.expression)
                && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, expression, fields, mapLiteral);
    }

    @Override
    public String toString() {
        return switch (shape) {
            case NONE -> "none";
            case SINGLE -> expression;
            case NAMED -> fields.toString();
        };
    }

}
