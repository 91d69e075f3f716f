package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;

import java.nio.file.Path;

/**
 * A recovered problem, tied to a file and, where known, a line.
 *
 * @param file the file concerned, null for project-wide warnings
 * @param line the 1-based line, 0 when not applicable
 * @param message what happened
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MigrationWarning(Path file, int line, String message) {

    public MigrationWarning {
        Preconditions.requireNonNegative(line, "Line must not be negative");
        Preconditions.requireNonBlank(message, "Message is required");
    }

    /**
     * Creates a warning about a whole file.
     *
     * @param file the file concerned
     * @param message what happened
     * @return the warning
     */
    public static MigrationWarning of(final Path file, final String message) {
        return new MigrationWarning(file, 0, message);
    }

    @Override
    public String toString() {
        final StringBuilder text = new StringBuilder();
        if (file != null) {
            text.append(file);
            if (line > 0) {
                text.append(':').append(line);
            }
            text.append(": ");
        }
        return text.append(message).toString();
    }

}
