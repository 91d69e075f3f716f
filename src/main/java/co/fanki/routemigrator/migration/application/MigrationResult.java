package co.fanki.routemigrator.migration.application;

import co.fanki.routemigrator.migration.domain.LineChange;
import co.fanki.routemigrator.migration.domain.MigrationWarning;
import co.fanki.routemigrator.migration.domain.OperationKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of one migration run.
 *
 * @param mode the mode the run used
 * @param projectRoot the absolute project root
 * @param calls every navigation call found, in file order
 * @param diffs the planned changes of each file with changes
 * @param retainedCount routes kept from the existing configuration that
 *      no call site navigates to
 * @param configurationFile the absolute path of the router configuration
 * @param configuration the emitted router configuration
 * @param written the files written, empty in plan mode
 * @param warnings every recovered problem
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MigrationResult(MigrationMode mode, Path projectRoot,
        List<CallSiteReport> calls, List<FileDiff> diffs, int retainedCount,
        Path configurationFile, String configuration, List<Path> written,
        List<MigrationWarning> warnings) {

    public MigrationResult {
        calls = List.copyOf(calls);
        diffs = List.copyOf(diffs);
        written = List.copyOf(written);
        warnings = List.copyOf(warnings);
    }

    /**
     * Groups the call reports by file.
     *
     * @return file to its calls, in file order
     */
    public Map<String, List<CallSiteReport>> callsByFile() {
        final Map<String, List<CallSiteReport>> byFile = new LinkedHashMap<>();
        for (final CallSiteReport call : calls) {
            byFile.computeIfAbsent(call.file(),
                    file -> new ArrayList<>()).add(call);
        }
        return byFile;
    }

    /**
     * One navigation call as reported.
     *
     * @param file the file, relative to the project root
     * @param line the 1-based line
     * @param kind the operation kind
     * @param method the invoked method or helper
     * @param destination the destination path or sentinel
     * @param expression the source text of the destination argument, or
     *      of the whole call when there is none
     */
    public record CallSiteReport(String file, int line, OperationKind kind,
            String method, String destination, String expression) {
    }

    /**
     * The planned changes of one file.
     *
     * @param file the file, relative to the project root
     * @param changes the changes in file order
     */
    public record FileDiff(String file, List<LineChange> changes) {

        public FileDiff {
            changes = List.copyOf(changes);
        }
    }

}
