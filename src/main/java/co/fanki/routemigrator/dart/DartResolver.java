package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.ast.DartNode;
import co.fanki.routemigrator.dart.ast.Expression;

import java.util.Optional;

/**
 * Semantic queries over a whole set of parsed units.
 *
 * <p>Implementations are read-only once built and safe to share across
 * threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DartResolver {

    /**
     * Evaluates an expression as a compile-time string constant.
     *
     * @param unit the unit containing the expression
     * @param expression the expression to evaluate
     * @return the constant value, empty if it is not constant
     */
    Optional<String> constantValue(DartUnit unit, Expression expression);

    /**
     * Resolves the element an expression refers to: the invoked function
     * of a call, the class of a construction, or the declaration of an
     * identifier.
     *
     * @param unit the unit containing the expression
     * @param expression the reference
     * @return the element handle, empty when unresolved
     */
    Optional<ElementHandle> element(DartUnit unit, Expression expression);

    /**
     * Resolves a class name from a unit: the class declared in the unit
     * itself or in one of the units it imports.
     *
     * @param unit the unit the name is used in
     * @param typeName the class name, without any import prefix
     * @return the class handle, empty when no visible unit declares it
     */
    Optional<ElementHandle> type(DartUnit unit, String typeName);

    /**
     * Returns the handle of a declaration, matching what
     * {@link #element(DartUnit, Expression)} yields for references to it.
     *
     * @param unit the declaring unit
     * @param declaration a function, class, variable or parameter node
     * @return the handle of the declaration
     */
    ElementHandle declaration(DartUnit unit, DartNode declaration);

}
