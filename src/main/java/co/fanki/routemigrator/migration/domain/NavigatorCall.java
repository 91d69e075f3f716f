package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.MethodInvocation;
import co.fanki.routemigrator.dart.ast.SimpleIdentifier;

import java.util.List;
import java.util.Optional;

/**
 * A call on the {@code Navigator} facility, in one of its two direct
 * shapes: {@code Navigator.method(context, ...)}, where the context is
 * an implicit leading argument, and {@code Navigator.of(context).method(...)}.
 *
 * @param invocation the call
 * @param kind the operation the called method performs
 * @param context the BuildContext expression, null if missing
 * @param implicitContext whether the context is the first argument
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
record NavigatorCall(MethodInvocation invocation, OperationKind kind,
        Expression context, boolean implicitContext) {

    private static final String NAVIGATOR = "Navigator";

    /**
     * Matches a call against the Navigator shapes.
     *
     * @param invocation the call to match
     * @return the navigator call, empty for any other shape
     */
    static Optional<NavigatorCall> match(final MethodInvocation invocation) {
        final Optional<OperationKind> kind = OperationKind.fromNavigatorMethod(
                invocation.methodName());
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        final Expression target = invocation.target();
        if (isNavigator(target)) {
            final List<Expression> positional = invocation.argumentList()
                    .positional();
            return Optional.of(new NavigatorCall(invocation, kind.get(),
                    positional.isEmpty() ? null : positional.get(0), true));
        }
        if (target instanceof MethodInvocation accessor
                && "of".equals(accessor.methodName())
                && isNavigator(accessor.target())) {
            final List<Expression> positional = accessor.argumentList()
                    .positional();
            return Optional.of(new NavigatorCall(invocation, kind.get(),
                    positional.isEmpty() ? null : positional.get(0), false));
        }
        return Optional.empty();
    }

    private static boolean isNavigator(final Expression target) {
        return target instanceof SimpleIdentifier identifier
                && NAVIGATOR.equals(identifier.name());
    }

    /**
     * Returns the positional arguments after the implicit context.
     *
     * @return the explicit positional arguments
     */
    List<Expression> arguments() {
        final List<Expression> positional = invocation.argumentList()
                .positional();
        if (implicitContext && !positional.isEmpty()) {
            return positional.subList(1, positional.size());
        }
        return positional;
    }

}
