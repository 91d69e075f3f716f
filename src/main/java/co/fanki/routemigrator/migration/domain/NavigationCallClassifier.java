package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.dart.Construction;
import co.fanki.routemigrator.dart.DartResolver;
import co.fanki.routemigrator.dart.DartUnit;
import co.fanki.routemigrator.dart.ElementHandle;
import co.fanki.routemigrator.dart.ast.DartAstVisitor;
import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.FunctionExpression;
import co.fanki.routemigrator.dart.ast.InstanceCreation;
import co.fanki.routemigrator.dart.ast.MethodInvocation;
import co.fanki.routemigrator.dart.ast.NamedExpression;
import co.fanki.routemigrator.dart.ast.SetOrMapLiteral;
import co.fanki.routemigrator.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the navigation calls of a unit and turns each into a
 * {@link CallRecord}.
 *
 * <p>A call is recognized in three shapes: a call to a navigation
 * helper, {@code Navigator.method(context, ...)} and
 * {@code Navigator.of(context).method(...)}. Any other call is ignored,
 * even if its method name looks like navigation.</p>
 *
 * <p>The helper set must be complete when classification starts: a
 * helper missing from it makes its call sites invisible.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class NavigationCallClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(
            NavigationCallClassifier.class);

    /** Named arguments that carry the navigation payload. */
    private static final List<String> PAYLOAD_ARGUMENTS = List.of(
            "arguments", "extra");

    /**
     * Classifies the navigation calls of one unit.
     *
     * @param unit the unit to scan
     * @param resolver the project resolver
     * @param helpers every helper of the project
     * @return the records, ordered by offset
     */
    public List<CallRecord> classify(final DartUnit unit,
            final DartResolver resolver,
            final Collection<HelperDefinition> helpers) {
        Preconditions.requireNonNull(unit, "Unit is required");
        Preconditions.requireNonNull(resolver, "Resolver is required");
        Preconditions.requireNonNull(helpers, "Helpers are required");

        final Map<ElementHandle, HelperDefinition> helpersByHandle =
                new HashMap<>();
        for (final HelperDefinition helper : helpers) {
            helpersByHandle.put(helper.function(), helper);
        }

        final List<CallRecord> records = new ArrayList<>();
        unit.root().accept(new DartAstVisitor() {
            @Override
            public void visitMethodInvocation(final MethodInvocation node) {
                classify(unit, resolver, helpersByHandle, node)
                        .ifPresent(records::add);
                super.visitMethodInvocation(node);
            }
        });
        records.sort(Comparator.comparingInt(r -> r.location().offset()));

        LOG.debug("{} navigation calls in {}", records.size(), unit.path());
        return records;
    }

    private Optional<CallRecord> classify(final DartUnit unit,
            final DartResolver resolver,
            final Map<ElementHandle, HelperDefinition> helpers,
            final MethodInvocation invocation) {
        final Optional<NavigatorCall> navigatorCall = NavigatorCall.match(
                invocation);
        if (navigatorCall.isPresent()) {
            return Optional.of(navigatorRecord(unit, resolver,
                    navigatorCall.get()));
        }
        if (helpers.isEmpty() || invocation.methodName() == null) {
            return Optional.empty();
        }
        return resolver.element(unit, invocation)
                .map(helpers::get)
                .map(helper -> helperRecord(unit, resolver, helper,
                        invocation));
    }

    private CallRecord navigatorRecord(final DartUnit unit,
            final DartResolver resolver, final NavigatorCall call) {
        final MethodInvocation invocation = call.invocation();
        final OperationKind kind = call.kind();
        final CallRecord.Builder record = baseRecord(unit, invocation)
                .kind(kind)
                .methodName(invocation.methodName())
                .typeArguments(invocation.typeArguments());
        if (call.context() != null) {
            record.contextExpression(unit.text(call.context()));
        }

        final List<Expression> arguments = call.arguments();
        if (kind.isByName()) {
            byName(unit, resolver, record,
                    arguments.isEmpty() ? null : arguments.get(0),
                    invocation);
            if (kind == OperationKind.POP_THEN_NAVIGATE_BY_NAME) {
                invocation.argumentList().named("result").ifPresent(
                        result -> record.resultExpression(unit.text(result)));
            }
        } else if (kind.isByWidget()) {
            byWidget(unit, resolver, record, arguments);
        } else {
            record.destination(Destination.NOT_APPLICABLE);
            if (kind != OperationKind.CONDITIONAL_POP && !arguments.isEmpty()) {
                record.resultExpression(unit.text(arguments.get(0)));
            }
        }
        return record.build();
    }

    private CallRecord helperRecord(final DartUnit unit,
            final DartResolver resolver, final HelperDefinition helper,
            final MethodInvocation invocation) {
        final CallRecord.Builder record = baseRecord(unit, invocation)
                .kind(OperationKind.NAVIGATE_BY_NAME)
                .methodName(helper.simpleName())
                .typeArguments(invocation.typeArguments());

        if (helper.hasContextParameter()) {
            final Expression context = argument(invocation,
                    helper.contextParameterName(), helper.contextNamed(),
                    helper.contextPositionalIndex());
            if (context != null) {
                record.contextExpression(unit.text(context));
            }
        }
        final Expression route = argument(invocation, helper.parameterName(),
                helper.named(), helper.positionalIndex());
        byName(unit, resolver, record, route, invocation);
        return record.build();
    }

    /** Finds the argument bound to a parameter, null if not passed. */
    private static Expression argument(final MethodInvocation invocation,
            final String name, final boolean named,
            final int positionalIndex) {
        if (named) {
            return invocation.argumentList().named(name).orElse(null);
        }
        final List<Expression> positional = invocation.argumentList()
                .positional();
        return positionalIndex < positional.size()
                ? positional.get(positionalIndex) : null;
    }

    private static CallRecord.Builder baseRecord(final DartUnit unit,
            final MethodInvocation invocation) {
        return CallRecord.builder()
                .location(new SourceLocation(unit.path(),
                        unit.lineOf(invocation.offset()),
                        invocation.offset(), invocation.length()))
                .originalCode(unit.text(invocation));
    }

    private static void byName(final DartUnit unit,
            final DartResolver resolver, final CallRecord.Builder record,
            final Expression route, final MethodInvocation invocation) {
        if (route == null) {
            record.destination(Destination.UNRESOLVED);
        } else {
            record.destinationExpression(unit.text(route));
            final Optional<String> value = resolver.constantValue(unit, route);
            final Destination destination = value.map(Destination::parse)
                    .orElse(Destination.UNRESOLVED);
            record.destination(destination)
                    .expressionMatchesPath(destination.isResolved()
                            && destination.path().equals(value.get()));
        }
        for (final NamedExpression argument
                : invocation.argumentList().named()) {
            if (PAYLOAD_ARGUMENTS.contains(argument.name())) {
                final Expression value = argument.expression();
                record.payload(ArgumentsPayload.single(unit.text(value),
                        value instanceof SetOrMapLiteral literal
                                && literal.isMap()));
                break;
            }
        }
    }

    /**
     * Extracts the page of a widget push: the sole argument must build a
     * page route whose {@code builder} closure returns a construction.
     */
    private static void byWidget(final DartUnit unit,
            final DartResolver resolver, final CallRecord.Builder record,
            final List<Expression> arguments) {
        if (arguments.size() == 1) {
            record.destinationExpression(unit.text(arguments.get(0)));
        }
        final Optional<Construction> page = pageOf(arguments);
        if (page.isEmpty()) {
            record.kind(OperationKind.UNRESOLVED)
                    .destination(Destination.UNRESOLVED);
            return;
        }

        final Construction target = page.get();
        final Map<String, String> fields = new LinkedHashMap<>();
        for (final NamedExpression argument
                : target.argumentList().named()) {
            fields.put(argument.name(), unit.text(argument.expression()));
        }
        record.targetName(target.typeName())
                .targetConstructor(target.constructorName())
                .targetFile(resolver.type(unit, target.typeName())
                        .map(ElementHandle::file)
                        .orElse(null))
                .payload(ArgumentsPayload.named(fields))
                .destination(Destination.fromWidgetName(target.typeName()));
    }

    private static Optional<Construction> pageOf(
            final List<Expression> arguments) {
        if (arguments.size() != 1
                || !(arguments.get(0) instanceof InstanceCreation route)
                || !route.typeName().contains("Page")) {
            return Optional.empty();
        }
        return route.argumentList().named("builder")
                .filter(FunctionExpression.class::isInstance)
                .map(FunctionExpression.class::cast)
                .filter(FunctionExpression::hasExpressionBody)
                .map(FunctionExpression::body)
                .filter(Expression.class::isInstance)
                .map(Expression.class::cast)
                .flatMap(Construction::of);
    }

}
