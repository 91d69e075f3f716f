package co.fanki.routemigrator.migration.domain;

import java.util.List;

/**
 * What was read back from an existing router configuration.
 *
 * @param routes one imported record per route declaration with a
 *      resolvable path, parents before children
 * @param opaqueDeclarations source text of route declarations that could
 *      not be modelled, kept so they can be emitted unchanged
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportedRoutes(List<CallRecord> routes,
        List<String> opaqueDeclarations) {

    /** Nothing imported. */
    public static final ImportedRoutes EMPTY = new ImportedRoutes(
            List.of(), List.of());

    public ImportedRoutes {
        routes = List.copyOf(routes);
        opaqueDeclarations = List.copyOf(opaqueDeclarations);
    }

}
