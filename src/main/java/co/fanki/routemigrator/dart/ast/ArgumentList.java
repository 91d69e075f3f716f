package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The parenthesized arguments of an invocation or construction.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ArgumentList extends DartNode {

    private final List<Expression> arguments;

    public ArgumentList(final int theOffset, final int theEnd,
            final List<Expression> theArguments) {
        super(theOffset, theEnd);
        this.arguments = adoptAll(theArguments);
    }

    /**
     * Returns all arguments, positional and named, in source order.
     *
     * @return the arguments
     */
    public List<Expression> arguments() {
        return arguments;
    }

    /**
     * Returns the positional arguments in source order.
     *
     * @return the arguments that are not {@link NamedExpression}s
     */
    public List<Expression> positional() {
        final List<Expression> result = new ArrayList<>();
        for (final Expression argument : arguments) {
            if (!(argument instanceof NamedExpression)) {
                result.add(argument);
            }
        }
        return result;
    }

    /**
     * Returns the named arguments in source order.
     *
     * @return the named arguments
     */
    public List<NamedExpression> named() {
        final List<NamedExpression> result = new ArrayList<>();
        for (final Expression argument : arguments) {
            if (argument instanceof NamedExpression) {
                result.add((NamedExpression) argument);
            }
        }
        return result;
    }

    /**
     * Finds the value of a named argument.
     *
     * @param name the argument label
     * @return the argument expression, if present
     */
    public Optional<Expression> named(final String name) {
        for (final NamedExpression argument : named()) {
            if (argument.name().equals(name)) {
                return Optional.of(argument.expression());
            }
        }
        return Optional.empty();
    }

    @Override
    public List<DartNode> children() {
        return new ArrayList<>(arguments);
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitArgumentList(this);
    }

}
