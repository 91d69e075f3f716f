package co.fanki.routemigrator.migration.application;

import co.fanki.routemigrator.migration.application.MigrationResult.CallSiteReport;
import co.fanki.routemigrator.migration.application.MigrationResult.FileDiff;
import co.fanki.routemigrator.migration.domain.LineChange;
import co.fanki.routemigrator.migration.domain.MigrationWarning;
import co.fanki.routemigrator.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link MigrationResult} as a JSON report.
 *
 * <p>Paths are written relative to the project root. The layout is:</p>
 * <pre>
 * {
 *   "mode": "PLAN",
 *   "projectRoot": "/abs/root",
 *   "configurationFile": "lib/generated_router.dart",
 *   "retainedCount": 1,
 *   "calls": { "lib/a.dart": [ {"line", "kind", "method",
 *       "destination", "expression"} ] },
 *   "diffs": { "lib/a.dart": [ {"line", "original", "replacement"} ] },
 *   "written": [ "lib/a.dart" ],
 *   "warnings": [ {"file", "line", "message"} ]
 * }
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class MigrationReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            MigrationReportWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Builds the JSON tree of a result.
     *
     * @param result the migration result
     * @return the report
     */
    public ObjectNode toJson(final MigrationResult result) {
        Preconditions.requireNonNull(result, "Result is required");
        final Path root = result.projectRoot();

        final ObjectNode report = objectMapper.createObjectNode();
        report.put("mode", result.mode().name());
        report.put("projectRoot", slashed(root));
        report.put("configurationFile",
                relative(root, result.configurationFile()));
        report.put("retainedCount", result.retainedCount());

        final ObjectNode calls = report.putObject("calls");
        for (final Map.Entry<String, List<CallSiteReport>> entry
                : result.callsByFile().entrySet()) {
            final ArrayNode fileCalls = calls.putArray(entry.getKey());
            for (final CallSiteReport call : entry.getValue()) {
                fileCalls.addObject()
                        .put("line", call.line())
                        .put("kind", call.kind().name())
                        .put("method", call.method())
                        .put("destination", call.destination())
                        .put("expression", call.expression());
            }
        }

        final ObjectNode diffs = report.putObject("diffs");
        for (final FileDiff diff : result.diffs()) {
            final ArrayNode changes = diffs.putArray(diff.file());
            for (final LineChange change : diff.changes()) {
                changes.addObject()
                        .put("line", change.line())
                        .put("original", change.original())
                        .put("replacement", change.replacement());
            }
        }

        final ArrayNode written = report.putArray("written");
        for (final Path file : result.written()) {
            written.add(relative(root, file));
        }

        final ArrayNode warnings = report.putArray("warnings");
        for (final MigrationWarning warning : result.warnings()) {
            final ObjectNode node = warnings.addObject();
            if (warning.file() == null) {
                node.putNull("file");
            } else {
                node.put("file", relative(root, warning.file()));
            }
            node.put("line", warning.line());
            node.put("message", warning.message());
        }
        return report;
    }

    /**
     * Renders a result as indented JSON.
     *
     * @param result the migration result
     * @return the JSON text
     */
    public String render(final MigrationResult result) {
        try {
            return objectMapper.writeValueAsString(toJson(result));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot render report", e);
        }
    }

    /**
     * Writes the report of a result to a file.
     *
     * @param result the migration result
     * @param file the report file, created or replaced
     * @throws IOException if the file cannot be written
     */
    public void write(final MigrationResult result, final Path file)
            throws IOException {
        Preconditions.requireNonNull(file, "Report file is required");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, render(result), StandardCharsets.UTF_8);
        LOG.info("Migration report written to {}", file);
    }

    private static String relative(final Path root, final Path file) {
        if (file == null) {
            return null;
        }
        final Path absolute = file.toAbsolutePath().normalize();
        return slashed(root != null && absolute.startsWith(root)
                ? root.relativize(absolute) : absolute);
    }

    private static String slashed(final Path path) {
        return path.toString().replace('\\', '/');
    }

}
