package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.dart.DartResolver;
import co.fanki.routemigrator.dart.DartUnit;
import co.fanki.routemigrator.dart.ElementHandle;
import co.fanki.routemigrator.dart.ast.ClassDeclaration;
import co.fanki.routemigrator.dart.ast.DartAstVisitor;
import co.fanki.routemigrator.dart.ast.DartNode;
import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.FunctionDeclaration;
import co.fanki.routemigrator.dart.ast.MethodInvocation;
import co.fanki.routemigrator.dart.ast.Parameter;
import co.fanki.routemigrator.dart.ast.SimpleIdentifier;
import co.fanki.routemigrator.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds navigation helpers: functions and methods whose body makes
 * exactly one {@code Navigator.pushNamed} call, with the route name
 * taken straight from one of their own parameters.
 *
 * <p>Only one level of wrapping is recognized. A helper that calls
 * another helper is not itself a helper.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class NavigationHelperFinder {

    private static final Logger LOG = LoggerFactory.getLogger(
            NavigationHelperFinder.class);

    private static final String BUILD_CONTEXT = "BuildContext";

    /**
     * Finds the helpers declared in one unit.
     *
     * @param unit the unit to inspect
     * @param resolver the project resolver
     * @return the helpers, in declaration order
     */
    public List<HelperDefinition> find(final DartUnit unit,
            final DartResolver resolver) {
        Preconditions.requireNonNull(unit, "Unit is required");
        Preconditions.requireNonNull(resolver, "Resolver is required");

        final List<HelperDefinition> helpers = new ArrayList<>();
        for (final FunctionDeclaration function : functions(unit)) {
            helper(unit, resolver, function).ifPresent(helper -> {
                LOG.debug("Found navigation helper {} (route parameter {})",
                        helper.function(), helper.parameterName());
                helpers.add(helper);
            });
        }
        return helpers;
    }

    private static List<FunctionDeclaration> functions(final DartUnit unit) {
        final List<FunctionDeclaration> functions = new ArrayList<>();
        for (final DartNode declaration : unit.root().declarations()) {
            if (declaration instanceof FunctionDeclaration function) {
                functions.add(function);
            } else if (declaration instanceof ClassDeclaration type) {
                for (final DartNode member : type.members()) {
                    if (member instanceof FunctionDeclaration method) {
                        functions.add(method);
                    }
                }
            }
        }
        return functions;
    }

    private Optional<HelperDefinition> helper(final DartUnit unit,
            final DartResolver resolver, final FunctionDeclaration function) {
        if (function.body() == null || function.parameters().isEmpty()) {
            return Optional.empty();
        }
        final List<NavigatorCall> calls = pushNamedCalls(function.body());
        if (calls.size() != 1) {
            return Optional.empty();
        }
        final NavigatorCall call = calls.get(0);
        final List<Expression> arguments = call.arguments();
        if (arguments.isEmpty()
                || !(arguments.get(0) instanceof SimpleIdentifier route)) {
            return Optional.empty();
        }
        final Optional<ElementHandle> referenced = resolver.element(unit,
                route);
        if (referenced.isEmpty()) {
            return Optional.empty();
        }

        final List<Parameter> parameters = function.parameters();
        final int routeIndex = indexOf(unit, resolver, parameters,
                referenced.get());
        if (routeIndex < 0) {
            return Optional.empty();
        }
        final Parameter routeParameter = parameters.get(routeIndex);
        final int contextIndex = contextIndex(unit, resolver, parameters,
                call.context());
        final Parameter contextParameter = contextIndex < 0
                ? null : parameters.get(contextIndex);

        return Optional.of(new HelperDefinition(
                resolver.declaration(unit, function), routeIndex,
                routeParameter.name(), routeParameter.named(),
                positionalIndex(parameters, routeIndex),
                contextParameter == null ? null : contextParameter.name(),
                contextParameter != null && contextParameter.named(),
                contextParameter == null
                        ? -1 : positionalIndex(parameters, contextIndex)));
    }

    /**
     * Finds the parameter holding the BuildContext: the one the
     * Navigator call receives, else the first parameter typed
     * {@code BuildContext}.
     */
    private static int contextIndex(final DartUnit unit,
            final DartResolver resolver, final List<Parameter> parameters,
            final Expression context) {
        if (context instanceof SimpleIdentifier identifier) {
            final int index = resolver.element(unit, identifier)
                    .map(handle -> indexOf(unit, resolver, parameters,
                            handle))
                    .orElse(-1);
            if (index >= 0) {
                return index;
            }
        }
        for (int i = 0; i < parameters.size(); i++) {
            if (BUILD_CONTEXT.equals(parameters.get(i).typeName())) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOf(final DartUnit unit,
            final DartResolver resolver, final List<Parameter> parameters,
            final ElementHandle handle) {
        for (int i = 0; i < parameters.size(); i++) {
            if (resolver.declaration(unit, parameters.get(i)).equals(handle)) {
                return i;
            }
        }
        return -1;
    }

    /** The index among positional parameters, -1 for a named one. */
    private static int positionalIndex(final List<Parameter> parameters,
            final int index) {
        if (parameters.get(index).named()) {
            return -1;
        }
        int positional = 0;
        for (int i = 0; i < index; i++) {
            if (!parameters.get(i).named()) {
                positional++;
            }
        }
        return positional;
    }

    private static List<NavigatorCall> pushNamedCalls(final DartNode body) {
        final List<NavigatorCall> calls = new ArrayList<>();
        body.accept(new DartAstVisitor() {
            @Override
            public void visitMethodInvocation(final MethodInvocation node) {
                NavigatorCall.match(node)
                        .filter(c -> c.kind() == OperationKind.NAVIGATE_BY_NAME)
                        .ifPresent(calls::add);
                super.visitMethodInvocation(node);
            }
        });
        return calls;
    }

}
