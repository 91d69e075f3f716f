package co.fanki.routemigrator.migration.application;

import co.fanki.routemigrator.shared.Preconditions;

import java.util.Locale;

/**
 * How a migration run treats the project.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum MigrationMode {

    /** Report and diffs only, nothing is written. */
    PLAN,

    /** Writes the router configuration and rewrites the sources. */
    APPLY;

    /**
     * Parses a mode name, ignoring case.
     *
     * @param name the mode name, {@code plan} or {@code apply}
     * @return the mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MigrationMode fromName(final String name) {
        Preconditions.requireNonBlank(name, "Mode is required");
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

}
