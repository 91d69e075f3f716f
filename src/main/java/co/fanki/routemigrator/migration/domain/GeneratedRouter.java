package co.fanki.routemigrator.migration.domain;

import java.util.List;

/**
 * The emitted router configuration.
 *
 * @param content the full text of the configuration file
 * @param patched true if an existing file was patched in place, false if
 *      the file was generated from scratch
 * @param warnings problems met while emitting
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GeneratedRouter(String content, boolean patched,
        List<MigrationWarning> warnings) {

    public GeneratedRouter {
        warnings = List.copyOf(warnings);
    }

}
