package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.dart.Construction;
import co.fanki.routemigrator.dart.DartResolver;
import co.fanki.routemigrator.dart.DartUnit;
import co.fanki.routemigrator.dart.ElementHandle;
import co.fanki.routemigrator.dart.ast.Block;
import co.fanki.routemigrator.dart.ast.CompoundExpression;
import co.fanki.routemigrator.dart.ast.DartAstVisitor;
import co.fanki.routemigrator.dart.ast.DartNode;
import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.FunctionExpression;
import co.fanki.routemigrator.dart.ast.InstanceCreation;
import co.fanki.routemigrator.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the route declarations of an existing go_router configuration.
 *
 * <p>Every {@code GoRoute(...)} construction becomes an imported record
 * keyed by its full path, parent paths prefixed, and holding the exact
 * source text of the declaration. Other constructions are traversed.
 * Route constructions that cannot be modelled, such as a
 * {@code ShellRoute} or a {@code GoRoute} whose path is not a constant,
 * are kept whole as opaque declarations.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class RouterConfigurationReader {

    private static final Logger LOG = LoggerFactory.getLogger(
            RouterConfigurationReader.class);

    private static final String GO_ROUTE = "GoRoute";

    /** Builder results that mean the route has no page of its own. */
    private static final String PLACEHOLDER = "SizedBox";

    /**
     * Reads the routes of a configuration unit.
     *
     * @param unit the parsed configuration file
     * @param resolver the project resolver
     * @return the imported routes
     */
    public ImportedRoutes read(final DartUnit unit,
            final DartResolver resolver) {
        Preconditions.requireNonNull(unit, "Unit is required");
        Preconditions.requireNonNull(resolver, "Resolver is required");

        final List<CallRecord> routes = new ArrayList<>();
        final List<String> opaque = new ArrayList<>();
        unit.root().accept(new RouteCollector(unit, resolver, "", routes,
                opaque, false));

        LOG.info("Read {} routes and {} opaque declarations from {}",
                routes.size(), opaque.size(), unit.path());
        return new ImportedRoutes(routes, opaque);
    }

    /**
     * Walks an expression for route constructions under a parent path.
     */
    private final class RouteCollector extends DartAstVisitor {

        private final DartUnit unit;
        private final DartResolver resolver;
        private final String parentPath;
        private final List<CallRecord> routes;
        private final List<String> opaque;
        private final boolean insideOpaque;

        private RouteCollector(final DartUnit theUnit,
                final DartResolver theResolver, final String theParentPath,
                final List<CallRecord> theRoutes,
                final List<String> theOpaque, final boolean isInsideOpaque) {
            this.unit = theUnit;
            this.resolver = theResolver;
            this.parentPath = theParentPath;
            this.routes = theRoutes;
            this.opaque = theOpaque;
            this.insideOpaque = isInsideOpaque;
        }

        @Override
        public void visitInstanceCreation(final InstanceCreation node) {
            if (GO_ROUTE.equals(node.typeName())) {
                route(node);
                return;
            }
            if (!insideOpaque && isRouteType(node.typeName())) {
                opaque.add(unit.text(node));
                node.argumentList().accept(new RouteCollector(unit, resolver,
                        parentPath, routes, opaque, true));
                return;
            }
            super.visitInstanceCreation(node);
        }

        private void route(final InstanceCreation node) {
            final Optional<Expression> pathArgument = node.argumentList()
                    .named("path");
            final Optional<String> path = pathArgument.flatMap(
                    p -> resolver.constantValue(unit, p));
            if (path.isEmpty()) {
                if (!insideOpaque) {
                    LOG.warn("Route without a constant path kept as is in {}",
                            unit.path());
                    opaque.add(unit.text(node));
                }
                return;
            }

            final Destination destination = Destination.parse(
                    path.get().startsWith("/")
                            ? path.get() : parentPath + "/" + path.get());
            final Optional<Construction> target = target(node);
            routes.add(CallRecord.builder()
                    .kind(OperationKind.IMPORTED)
                    .methodName(GO_ROUTE)
                    .destination(destination)
                    .destinationExpression(unit.text(pathArgument.get()))
                    .targetName(target.map(Construction::typeName)
                            .orElse(null))
                    .targetConstructor(target.map(
                            Construction::constructorName).orElse(null))
                    .targetFile(target.flatMap(
                            t -> resolver.type(unit, t.typeName()))
                            .map(ElementHandle::file)
                            .orElse(null))
                    .declarationText(unit.text(node))
                    .build());

            final String childParent = destination.isRoot()
                    ? "" : destination.path();
            node.argumentList().named("routes").ifPresent(children ->
                    children.accept(new RouteCollector(unit, resolver,
                            childParent, routes, opaque, insideOpaque)));
        }

        /** Finds the page a route builder constructs. */
        private Optional<Construction> target(final InstanceCreation node) {
            final Optional<Expression> builder = node.argumentList()
                    .named("builder");
            if (builder.isEmpty()
                    || !(builder.get() instanceof FunctionExpression closure)) {
                return Optional.empty();
            }
            Optional<Construction> found = Optional.empty();
            if (closure.body() instanceof Expression expression) {
                found = Construction.of(expression);
            } else if (closure.body() instanceof Block block) {
                for (final Expression statement : block.statements()) {
                    if (statement instanceof CompoundExpression compound
                            && compound.operators().contains("return")
                            && lastOperand(compound)
                                    instanceof Expression returned) {
                        found = Construction.of(returned);
                    }
                }
            }
            return found.filter(
                    page -> !PLACEHOLDER.equals(page.typeName()));
        }

        private DartNode lastOperand(final CompoundExpression compound) {
            return compound.operands().get(compound.operands().size() - 1);
        }
    }

    private static boolean isRouteType(final String typeName) {
        return typeName.endsWith("Route") && !typeName.endsWith("PageRoute");
    }

}
