package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.ast.ClassDeclaration;
import co.fanki.routemigrator.dart.ast.CompoundExpression;
import co.fanki.routemigrator.dart.ast.DartNode;
import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.FunctionDeclaration;
import co.fanki.routemigrator.dart.ast.FunctionLike;
import co.fanki.routemigrator.dart.ast.ImportDirective;
import co.fanki.routemigrator.dart.ast.InstanceCreation;
import co.fanki.routemigrator.dart.ast.Literal;
import co.fanki.routemigrator.dart.ast.MethodInvocation;
import co.fanki.routemigrator.dart.ast.Parameter;
import co.fanki.routemigrator.dart.ast.ParenthesizedExpression;
import co.fanki.routemigrator.dart.ast.PropertyAccess;
import co.fanki.routemigrator.dart.ast.SimpleIdentifier;
import co.fanki.routemigrator.dart.ast.StringLiteral;
import co.fanki.routemigrator.dart.ast.VariableDeclaration;
import co.fanki.routemigrator.shared.Preconditions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolver over an in-memory index of every unit of a project.
 *
 * <p>Names are looked up lexically: parameters of the enclosing
 * functions first, then members of the enclosing class, then top-level
 * declarations of the unit and of the units it imports. Imports are
 * followed one level deep, for relative URIs and for
 * {@code package:} URIs of the project's own package.</p>
 *
 * <p>The index is built eagerly in the constructor and never changes,
 * so one instance can serve parallel callers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class IndexedDartResolver implements DartResolver {

    /** Maximum nesting of constant references followed. */
    private static final int MAX_DEPTH = 16;

    private final Map<Path, DartUnit> units = new LinkedHashMap<>();
    private final Map<Path, List<DartUnit>> visible = new HashMap<>();
    private final String packageName;
    private final Path libDirectory;

    /**
     * Indexes a set of units.
     *
     * @param theUnits the units of the project
     * @param thePackageName the package name, null if unknown
     * @param theLibDirectory the {@code lib} directory, null if unknown
     */
    public IndexedDartResolver(final Collection<DartUnit> theUnits,
            final String thePackageName, final Path theLibDirectory) {
        Preconditions.requireNonNull(theUnits, "Units are required");
        this.packageName = thePackageName;
        this.libDirectory = theLibDirectory == null
                ? null : theLibDirectory.toAbsolutePath().normalize();
        for (final DartUnit unit : theUnits) {
            units.put(unit.path(), unit);
        }
        for (final DartUnit unit : theUnits) {
            visible.put(unit.path(), importedUnits(unit));
        }
    }

    private List<DartUnit> importedUnits(final DartUnit unit) {
        final List<DartUnit> result = new ArrayList<>();
        result.add(unit);
        for (final ImportDirective directive : unit.root().imports()) {
            final Path target = resolveUri(unit, directive.uri());
            if (target == null) {
                continue;
            }
            final DartUnit imported = units.get(target);
            if (imported != null && !result.contains(imported)) {
                result.add(imported);
            }
        }
        return result;
    }

    private Path resolveUri(final DartUnit unit, final String uri) {
        if (uri.startsWith("package:")) {
            final String rest = uri.substring("package:".length());
            final int slash = rest.indexOf('/');
            if (slash < 0 || libDirectory == null
                    || !rest.substring(0, slash).equals(packageName)) {
                return null;
            }
            return libDirectory.resolve(rest.substring(slash + 1)).normalize();
        }
        if (uri.isEmpty() || uri.contains(":")) {
            return null;
        }
        final Path parent = unit.path().getParent();
        return parent == null ? null : parent.resolve(uri).normalize();
    }

    // ------------------------------------------------------------------
    // Constants
    // ------------------------------------------------------------------

    @Override
    public Optional<String> constantValue(final DartUnit unit,
            final Expression expression) {
        Preconditions.requireNonNull(unit, "Unit is required");
        if (expression == null) {
            return Optional.empty();
        }
        return constant(unit, expression, 0);
    }

    private Optional<String> constant(final DartUnit unit,
            final Expression expression, final int depth) {
        if (expression == null || depth > MAX_DEPTH) {
            return Optional.empty();
        }
        if (expression instanceof StringLiteral literal) {
            final StringBuilder value = new StringBuilder();
            for (final Object part : literal.parts()) {
                if (part instanceof Expression interpolated) {
                    final Optional<String> resolved = constant(unit,
                            interpolated, depth + 1);
                    if (resolved.isEmpty()) {
                        return Optional.empty();
                    }
                    value.append(resolved.get());
                } else {
                    value.append(part);
                }
            }
            return Optional.of(value.toString());
        }
        if (expression instanceof Literal literal) {
            return literal.text().equals("null")
                    ? Optional.empty() : Optional.of(literal.text());
        }
        if (expression instanceof ParenthesizedExpression parenthesized) {
            return constant(unit, parenthesized.expression(), depth + 1);
        }
        if (expression instanceof CompoundExpression compound) {
            return concatenation(unit, compound, depth);
        }
        if (expression instanceof SimpleIdentifier
                || expression instanceof PropertyAccess) {
            final Optional<Declared> declared = lookup(unit, expression);
            if (declared.isPresent()
                    && declared.get().node() instanceof VariableDeclaration v
                    && v.constant()) {
                return constant(declared.get().unit(), v.initializer(),
                        depth + 1);
            }
        }
        return Optional.empty();
    }

    private Optional<String> concatenation(final DartUnit unit,
            final CompoundExpression compound, final int depth) {
        if (compound.operands().size() != compound.operators().size() + 1
                || !compound.operators().stream().allMatch("+"::equals)) {
            return Optional.empty();
        }
        final StringBuilder value = new StringBuilder();
        for (final Expression operand : compound.operands()) {
            final Optional<String> resolved = constant(unit, operand,
                    depth + 1);
            if (resolved.isEmpty()) {
                return Optional.empty();
            }
            value.append(resolved.get());
        }
        return Optional.of(value.toString());
    }

    // ------------------------------------------------------------------
    // Elements
    // ------------------------------------------------------------------

    @Override
    public Optional<ElementHandle> element(final DartUnit unit,
            final Expression expression) {
        Preconditions.requireNonNull(unit, "Unit is required");
        if (expression == null) {
            return Optional.empty();
        }
        return lookup(unit, expression)
                .map(d -> declaration(d.unit(), d.node()));
    }

    @Override
    public Optional<ElementHandle> type(final DartUnit unit,
            final String typeName) {
        Preconditions.requireNonNull(unit, "Unit is required");
        if (typeName == null) {
            return Optional.empty();
        }
        return topLevel(unit, typeName, true)
                .map(d -> declaration(d.unit(), d.node()));
    }

    @Override
    public ElementHandle declaration(final DartUnit unit,
            final DartNode declaration) {
        Preconditions.requireNonNull(unit, "Unit is required");
        if (declaration instanceof Parameter parameter) {
            return new ElementHandle(unit.path(), parameter.name(),
                    parameter.offset());
        }
        if (declaration instanceof ClassDeclaration type) {
            return new ElementHandle(unit.path(), type.name(),
                    type.nameOffset());
        }
        if (declaration instanceof FunctionDeclaration function) {
            return new ElementHandle(unit.path(),
                    qualified(function, function.name()),
                    function.nameOffset());
        }
        if (declaration instanceof VariableDeclaration variable) {
            return new ElementHandle(unit.path(),
                    qualified(variable, variable.name()),
                    variable.nameOffset());
        }
        throw new IllegalArgumentException("Not a declaration: "
                + declaration);
    }

    private static String qualified(final DartNode member,
            final String name) {
        final ClassDeclaration owner = enclosingClass(member);
        return owner == null ? name : owner.name() + "." + name;
    }

    private Optional<Declared> lookup(final DartUnit unit,
            final Expression expression) {
        if (expression instanceof SimpleIdentifier identifier) {
            return lexical(unit, identifier, identifier.name());
        }
        if (expression instanceof MethodInvocation invocation) {
            return invoked(unit, invocation);
        }
        if (expression instanceof InstanceCreation creation) {
            return topLevel(unit, creation.typeName(), true);
        }
        if (expression instanceof PropertyAccess access
                && access.target() instanceof SimpleIdentifier owner) {
            return topLevel(unit, owner.name(), true)
                    .flatMap(d -> member(d, access.name()));
        }
        return Optional.empty();
    }

    private Optional<Declared> invoked(final DartUnit unit,
            final MethodInvocation invocation) {
        final String name = invocation.methodName();
        if (name == null) {
            return Optional.empty();
        }
        final Expression target = invocation.target();
        if (target == null) {
            return lexical(unit, invocation, name);
        }
        if (target instanceof SimpleIdentifier owner
                && isTypeName(owner.name())) {
            return topLevel(unit, owner.name(), true)
                    .flatMap(d -> member(d, name));
        }
        Declared found = null;
        for (final DartUnit candidate : visibleFrom(unit)) {
            for (final DartNode node : candidate.root().declarations()) {
                if (node instanceof ClassDeclaration type
                        && type.method(name).isPresent()) {
                    if (found != null) {
                        return Optional.empty();
                    }
                    found = new Declared(candidate, type.method(name).get());
                }
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Resolves a simple name from a position: enclosing parameters, then
     * enclosing class members, then top-level declarations.
     */
    private Optional<Declared> lexical(final DartUnit unit,
            final DartNode from, final String name) {
        for (DartNode node = from.parent(); node != null;
                node = node.parent()) {
            if (node instanceof FunctionLike function) {
                final Optional<Parameter> parameter = function.parameter(name);
                if (parameter.isPresent()) {
                    return Optional.of(new Declared(unit, parameter.get()));
                }
            }
            if (node instanceof ClassDeclaration type) {
                final Optional<Declared> member = member(
                        new Declared(unit, type), name);
                if (member.isPresent()) {
                    return member;
                }
            }
        }
        return topLevel(unit, name, false);
    }

    private static Optional<Declared> member(final Declared owner,
            final String name) {
        if (!(owner.node() instanceof ClassDeclaration type)) {
            return Optional.empty();
        }
        final Optional<FunctionDeclaration> method = type.method(name);
        if (method.isPresent()) {
            return Optional.of(new Declared(owner.unit(), method.get()));
        }
        return type.field(name)
                .map(field -> new Declared(owner.unit(), field));
    }

    private Optional<Declared> topLevel(final DartUnit unit,
            final String name, final boolean classesOnly) {
        for (final DartUnit candidate : visibleFrom(unit)) {
            for (final DartNode node : candidate.root().declarations()) {
                if (classesOnly && !(node instanceof ClassDeclaration)) {
                    continue;
                }
                if (name.equals(nameOf(node))) {
                    return Optional.of(new Declared(candidate, node));
                }
            }
        }
        return Optional.empty();
    }

    private List<DartUnit> visibleFrom(final DartUnit unit) {
        return visible.getOrDefault(unit.path(), List.of(unit));
    }

    private static String nameOf(final DartNode node) {
        if (node instanceof ClassDeclaration type) {
            return type.name();
        }
        if (node instanceof FunctionDeclaration function) {
            return function.name();
        }
        if (node instanceof VariableDeclaration variable) {
            return variable.name();
        }
        return null;
    }

    private static ClassDeclaration enclosingClass(final DartNode node) {
        for (DartNode current = node.parent(); current != null;
                current = current.parent()) {
            if (current instanceof ClassDeclaration type) {
                return type;
            }
        }
        return null;
    }

    private static boolean isTypeName(final String name) {
        final String bare = name.replaceFirst("^[_$]+", "");
        return !bare.isEmpty() && Character.isUpperCase(bare.charAt(0));
    }

    /** A declaration together with the unit declaring it. */
    private record Declared(DartUnit unit, DartNode node) {
    }

}
