package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.dart.LineIndex;
import co.fanki.routemigrator.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rewrites the navigation calls of one file into go_router calls.
 *
 * <p>Resolved named pushes, widget pushes and pops are replaced by the
 * matching {@code BuildContext} extension call. Every other call is left
 * in place behind a manual-migration marker comment. When at least one
 * call was replaced, the go_router import is added unless the file
 * already has it.</p>
 *
 * <p>All offsets refer to the content the records were classified
 * from; {@link SourceEdits} applies them from the end of the file
 * backwards.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class CallSiteRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            CallSiteRewriter.class);

    /** The import every rewritten file needs. */
    public static final String GO_ROUTER_IMPORT =
            "import 'package:go_router/go_router.dart';";

    private static final Pattern GO_ROUTER_IMPORT_LINE = Pattern.compile(
            "(?m)^\\s*import\\s+['\"]package:go_router/go_router\\.dart['\"]");

    /** Context expressions usable as a call target without parentheses. */
    private static final Pattern SIMPLE_TARGET = Pattern.compile(
            "[A-Za-z_$][\\w$]*(?:[?!]?\\.[A-Za-z_$][\\w$]*)*!?");

    /** By offset; at equal offsets the enclosing call first. */
    private static final Comparator<CallRecord> SOURCE_ORDER = Comparator
            .comparingInt((CallRecord r) -> r.location().offset())
            .thenComparing(Comparator.comparingInt(
                    (CallRecord r) -> r.location().length()).reversed());

    /**
     * Returns the marker placed in front of a call that needs manual
     * migration.
     *
     * @param methodName the invoked method
     * @return the marker, ending with a space
     */
    public static String manualMarker(final String methodName) {
        return "/* TODO(route-migrator): migrate " + methodName
                + " manually */ ";
    }

    /**
     * Rewrites the calls of one file.
     *
     * @param file the file the records belong to
     * @param content the content the records were classified from
     * @param records the fresh records of the file, in any order
     * @return the rewritten content with its changes and warnings
     */
    public FileRewrite rewrite(final Path file, final String content,
            final List<CallRecord> records) {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(content, "Content is required");
        Preconditions.requireNonNull(records, "Records are required");

        final List<CallRecord> ordered = new ArrayList<>(records);
        ordered.sort(SOURCE_ORDER);

        final LineIndex lines = LineIndex.of(content);
        final SourceEdits edits = new SourceEdits();
        final List<LineChange> changes = new ArrayList<>();
        final List<MigrationWarning> warnings = new ArrayList<>();
        boolean replaced = false;
        int replacedUpTo = -1;

        for (final CallRecord record : ordered) {
            Preconditions.requireDomain(!record.isImported(),
                    "Imported records have no call site to rewrite");
            final SourceLocation location = record.location();
            final int line = lines.lineOf(location.offset());

            if (location.end() > content.length()
                    || !content.substring(location.offset(), location.end())
                            .equals(record.originalCode())) {
                warnings.add(new MigrationWarning(file, line,
                        "Call " + record.methodName()
                                + " no longer matches the source, skipped"));
                continue;
            }
            if (location.offset() < replacedUpTo) {
                warnings.add(new MigrationWarning(file, line,
                        "Call " + record.methodName() + " is nested inside"
                                + " another rewritten call, migrate it"
                                + " manually"));
                continue;
            }

            final Optional<String> replacement = replacement(record);
            if (replacement.isPresent()) {
                edits.add(new TextEdit(location.offset(), location.length(),
                        replacement.get()));
                changes.add(new LineChange(line, record.originalCode(),
                        replacement.get()));
                replacedUpTo = location.end();
                replaced = true;
                continue;
            }

            final String marker = manualMarker(record.methodName());
            if (content.startsWith(marker, location.offset() - marker.length())) {
                continue;
            }
            edits.add(new TextEdit(location.offset(), 0, marker));
            changes.add(new LineChange(line, record.originalCode(),
                    marker + record.originalCode()));
            warnings.add(new MigrationWarning(file, line, "Call "
                    + record.methodName() + " needs manual migration"));
        }

        String rewritten = edits.applyTo(content);
        if (replaced && !GO_ROUTER_IMPORT_LINE.matcher(rewritten).find()) {
            rewritten = SourceEdits.insertAfterLastImport(rewritten,
                    GO_ROUTER_IMPORT + "\n");
            changes.add(0, new LineChange(importLine(content), "",
                    GO_ROUTER_IMPORT));
        }

        if (!edits.isEmpty()) {
            LOG.debug("{} edits planned for {}", edits.size(), file);
        }
        return new FileRewrite(file, content, rewritten, changes, warnings);
    }

    /**
     * Computes the go_router call replacing a record.
     *
     * @param record the call to replace
     * @return the replacement, empty when the call needs a marker instead
     */
    Optional<String> replacement(final CallRecord record) {
        final String target = target(record.contextExpression());
        final String typeArguments = record.typeArguments() == null
                ? "" : record.typeArguments();
        return switch (record.kind()) {
            case NAVIGATE_BY_NAME -> byName(record, target + ".push"
                    + typeArguments);
            case REPLACE_BY_NAME -> byName(record, target + ".pushReplacement"
                    + typeArguments);
            case NAVIGATE_BY_WIDGET -> byWidget(record, target + ".push"
                    + typeArguments);
            case REPLACE_BY_WIDGET -> byWidget(record, target
                    + ".pushReplacement" + typeArguments);
            case POP -> Optional.of(target + ".pop" + typeArguments + "("
                    + (record.resultExpression() == null
                            ? "" : record.resultExpression()) + ")");
            case CONDITIONAL_POP -> Optional.of(target + ".canPop()");
            default -> Optional.empty();
        };
    }

    private static Optional<String> byName(final CallRecord record,
            final String call) {
        if (!record.destination().isResolved()) {
            return Optional.empty();
        }
        final String location = record.expressionMatchesPath()
                ? record.destinationExpression()
                : quote(record.destination().path());
        final ArgumentsPayload payload = record.payload();
        if (payload.isPresent()) {
            return Optional.of(call + "(" + location + ", extra: "
                    + payload.expression() + ")");
        }
        return Optional.of(call + "(" + location + ")");
    }

    private static Optional<String> byWidget(final CallRecord record,
            final String call) {
        if (!record.destination().isResolved()) {
            return Optional.empty();
        }
        final String location = quote(record.destination().path());
        final Map<String, String> fields = record.payload().fields();
        if (fields.isEmpty()) {
            return Optional.of(call + "(" + location + ")");
        }
        if (fields.size() == 1) {
            return Optional.of(call + "(" + location + ", extra: "
                    + fields.values().iterator().next() + ")");
        }
        final StringBuilder map = new StringBuilder("<String, dynamic>{");
        String separator = "";
        for (final Map.Entry<String, String> field : fields.entrySet()) {
            map.append(separator).append(quote(field.getKey()))
                    .append(": ").append(field.getValue());
            separator = ", ";
        }
        map.append('}');
        return Optional.of(call + "(" + location + ", extra: " + map + ")");
    }

    private static String target(final String contextExpression) {
        return SIMPLE_TARGET.matcher(contextExpression).matches()
                ? contextExpression : "(" + contextExpression + ")";
    }

    /**
     * Writes a Dart single-quoted string literal.
     *
     * @param value the string value
     * @return the literal
     */
    static String quote(final String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'")
                .replace("$", "\\$") + "'";
    }

    /** The line the import takes once inserted into the original. */
    private static int importLine(final String content) {
        final String withImport = SourceEdits.insertAfterLastImport(content,
                GO_ROUTER_IMPORT + "\n");
        return LineIndex.of(withImport).lineOf(
                withImport.indexOf(GO_ROUTER_IMPORT));
    }

}
