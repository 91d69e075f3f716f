package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.dart.ElementHandle;
import co.fanki.routemigrator.shared.Preconditions;
import co.fanki.routemigrator.shared.ValueObject;

/**
 * A project function that forwards one of its parameters as the route
 * name of a {@code Navigator.pushNamed} call.
 *
 * @param function the handle of the helper function
 * @param parameterIndex the index of the route parameter among all
 *      parameters
 * @param parameterName the name of the route parameter
 * @param named whether the route parameter is a named parameter
 * @param positionalIndex the index among positional parameters, -1 when
 *      the parameter is named
 * @param contextParameterName the name of the BuildContext parameter,
 *      null when the helper takes none
 * @param contextNamed whether the BuildContext parameter is named
 * @param contextPositionalIndex the index of the BuildContext parameter
 *      among positional parameters, -1 when it is named or absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record HelperDefinition(ElementHandle function, int parameterIndex,
        String parameterName, boolean named, int positionalIndex,
        String contextParameterName, boolean contextNamed,
        int contextPositionalIndex) implements ValueObject {

    public HelperDefinition {
        Preconditions.requireNonNull(function, "Helper function is required");
        Preconditions.requireNonNegative(parameterIndex,
                "Parameter index must not be negative");
        Preconditions.requireNonBlank(parameterName,
                "Parameter name is required");
        Preconditions.require(named || positionalIndex >= 0,
                "Positional parameters need a positional index");
        Preconditions.require(contextParameterName == null || contextNamed
                        || contextPositionalIndex >= 0,
                "Positional context parameters need a positional index");
    }

    /** True when the helper receives the BuildContext it navigates with. */
    public boolean hasContextParameter() {
        return contextParameterName != null;
    }

    /**
     * Returns the unqualified function name.
     *
     * @return the helper name without its class
     */
    public String simpleName() {
        final String name = function.name();
        return name.substring(name.lastIndexOf('.') + 1);
    }

}
