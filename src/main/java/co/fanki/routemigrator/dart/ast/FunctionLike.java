package co.fanki.routemigrator.dart.ast;

import java.util.List;
import java.util.Optional;

/**
 * A node that introduces parameters into scope.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FunctionLike {

    List<Parameter> parameters();

    /**
     * Finds a parameter by name.
     *
     * @param name the parameter name
     * @return the parameter, if declared here
     */
    default Optional<Parameter> parameter(final String name) {
        return parameters().stream()
                .filter(p -> p.name().equals(name))
                .findFirst();
    }

}
