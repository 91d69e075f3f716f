package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;

import java.nio.file.Path;
import java.util.List;

/**
 * The outcome of rewriting the call sites of one file.
 *
 * @param file the rewritten file
 * @param original the content the edits were computed against
 * @param rewritten the content after every edit
 * @param changes the changes in file order
 * @param warnings the problems met while rewriting
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileRewrite(Path file, String original, String rewritten,
        List<LineChange> changes, List<MigrationWarning> warnings) {

    public FileRewrite {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(original, "Original content is required");
        Preconditions.requireNonNull(rewritten, "Rewritten content is required");
        changes = List.copyOf(changes);
        warnings = List.copyOf(warnings);
    }

    /** True when the rewritten content differs from the original. */
    public boolean changed() {
        return !original.equals(rewritten);
    }

}
