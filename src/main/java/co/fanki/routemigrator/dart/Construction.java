package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.ast.ArgumentList;
import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.InstanceCreation;
import co.fanki.routemigrator.dart.ast.MethodInvocation;
import co.fanki.routemigrator.dart.ast.PropertyAccess;
import co.fanki.routemigrator.dart.ast.SimpleIdentifier;

import java.util.Optional;

/**
 * An expression read as a widget construction.
 *
 * <p>Besides an {@link InstanceCreation}, a keyword-less named
 * constructor call such as {@code ProfilePage.edit(id: 1)} or
 * {@code screens.ProfilePage.edit()} parses as a method invocation on
 * the type. Where a widget is expected, such an invocation is read as
 * the construction it almost always is.</p>
 *
 * @param prefix the import prefix, null if none
 * @param typeName the constructed type
 * @param constructorName the named constructor, null for the unnamed one
 * @param argumentList the constructor arguments
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Construction(String prefix, String typeName,
        String constructorName, ArgumentList argumentList) {

    /**
     * Reads an expression as a construction.
     *
     * @param expression the expression, may be null
     * @return the construction, empty if the expression is not one
     */
    public static Optional<Construction> of(final Expression expression) {
        if (expression instanceof InstanceCreation creation) {
            return Optional.of(new Construction(creation.prefix(),
                    creation.typeName(), creation.constructorName(),
                    creation.argumentList()));
        }
        if (!(expression instanceof MethodInvocation invocation)
                || invocation.methodName() == null
                || invocation.typeArguments() != null
                || DartParser.isTypeName(invocation.methodName())) {
            return Optional.empty();
        }
        final Expression target = invocation.target();
        if (target instanceof SimpleIdentifier type
                && DartParser.isTypeName(type.name())) {
            return Optional.of(new Construction(null, type.name(),
                    invocation.methodName(), invocation.argumentList()));
        }
        if (target instanceof PropertyAccess access
                && access.target() instanceof SimpleIdentifier prefix
                && !DartParser.isTypeName(prefix.name())
                && DartParser.isTypeName(access.name())) {
            return Optional.of(new Construction(prefix.name(), access.name(),
                    invocation.methodName(), invocation.argumentList()));
        }
        return Optional.empty();
    }

}
