package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.dart.DartLexer;
import co.fanki.routemigrator.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a route tree as a go_router configuration, either as a new
 * file or as a patch of the routes list of an existing one.
 *
 * <p>Records with declaration text are emitted exactly as written.
 * Other records get a synthesized {@code GoRoute}; whatever cannot be
 * wired statically is left to the developer behind a
 * {@code TODO(route-migrator)} marker. A patch rewrites only the
 * interior of the first {@code routes: [...]} list and adds missing
 * import lines, so the rest of the file is kept byte for byte. The
 * interior has the same text in both modes, which makes repeated runs
 * stable.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class RouterConfigurationGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            RouterConfigurationGenerator.class);

    /** First line of every generated configuration. */
    public static final String HEADER =
            "// GENERATED CODE - DO NOT MODIFY BY HAND";

    /** Opening of the routes list a patch looks for. */
    private static final Pattern ROUTES_LIST = Pattern.compile(
            "routes:\\s*(?:<RouteBase>)?\\s*\\[");

    private static final String TOP_LEVEL_INDENT = "    ";
    private static final String STEP = "  ";
    private static final String BUILDER_SIGNATURE =
            "builder: (BuildContext context, GoRouterState state)";
    private static final String PLACEHOLDER = "const SizedBox.shrink()";

    /**
     * Emits a configuration.
     *
     * @param tree the route tree
     * @param opaqueDeclarations declarations to keep unchanged at the end
     * @param project the project, for import paths
     * @param existingContent the current configuration, null if none
     * @return the configuration
     */
    public GeneratedRouter generate(final RouteTree tree,
            final List<String> opaqueDeclarations,
            final FlutterProject project, final String existingContent) {
        Preconditions.requireNonNull(tree, "Route tree is required");
        Preconditions.requireNonNull(opaqueDeclarations,
                "Opaque declarations are required");
        Preconditions.requireNonNull(project, "Project is required");

        final List<MigrationWarning> warnings = new ArrayList<>();
        final Emission emission = new Emission(project, opaqueDeclarations,
                warnings);
        final String routes = emission.render(tree);
        final List<String> imports = emission.importLines();

        if (existingContent != null) {
            final String patched = patch(existingContent, routes, imports);
            if (patched != null) {
                return new GeneratedRouter(patched, true, warnings);
            }
            LOG.warn("No routes list found in {}, regenerating it",
                    project.routerFile());
            warnings.add(MigrationWarning.of(project.routerFile(),
                    "No routes list found in the existing configuration;"
                            + " the file was regenerated from scratch"));
        }
        return new GeneratedRouter(fresh(routes, imports), false, warnings);
    }

    private static String fresh(final String routes,
            final List<String> imports) {
        final StringBuilder out = new StringBuilder();
        out.append(HEADER).append('\n');
        out.append("// ignore_for_file: constant_identifier_names\n");
        out.append('\n');
        out.append("import 'package:flutter/material.dart';\n");
        out.append("import 'package:go_router/go_router.dart';\n");
        for (final String line : imports) {
            out.append(line).append('\n');
        }
        out.append('\n');
        out.append("/// The router configuration.\n");
        out.append("final GoRouter router = GoRouter(\n");
        out.append("  routes: <RouteBase>[").append(interior(routes))
                .append("],\n");
        out.append(");\n");
        return out.toString();
    }

    /**
     * Replaces the interior of the routes list of an existing file.
     *
     * @return the patched content, or null if the file has no routes list
     */
    private static String patch(final String existing, final String routes,
            final List<String> imports) {
        final Matcher matcher = ROUTES_LIST.matcher(existing);
        if (!matcher.find()) {
            return null;
        }
        final int open = matcher.end() - 1;
        final int close = DartLexer.matchingBracket(existing, open);
        if (close < 0) {
            return null;
        }
        final String content = existing.substring(0, open + 1)
                + interior(routes) + existing.substring(close);
        return addImports(content, imports);
    }

    private static String interior(final String routes) {
        return "\n" + routes + STEP;
    }

    /** Inserts the import lines the content lacks after its last import. */
    private static String addImports(final String content,
            final List<String> imports) {
        final List<String> missing = new ArrayList<>();
        for (final String line : imports) {
            if (!content.contains(line)) {
                missing.add(line);
            }
        }
        if (missing.isEmpty()) {
            return content;
        }
        final String block = String.join("\n", missing) + "\n";
        return SourceEdits.insertAfterLastImport(content, block);
    }

    /** State of one rendering pass. */
    private static final class Emission {

        private final FlutterProject project;
        private final List<String> opaque;
        private final List<MigrationWarning> warnings;
        private final List<String> emittedTexts = new ArrayList<>();
        private final TreeSet<String> imports = new TreeSet<>();
        private final List<Map.Entry<String, RouteNode>> hoisted =
                new ArrayList<>();

        private Emission(final FlutterProject theProject,
                final List<String> theOpaque,
                final List<MigrationWarning> theWarnings) {
            this.project = theProject;
            this.opaque = theOpaque;
            this.warnings = theWarnings;
            this.emittedTexts.addAll(theOpaque);
        }

        private String render(final RouteTree tree) {
            final StringBuilder out = new StringBuilder();
            tree.rootRecord().ifPresent(record -> {
                final RouteNode root = new RouteNode("");
                root.bind(record);
                node(out, root, "/", TOP_LEVEL_INDENT);
            });
            for (final RouteNode node : tree.topLevel()) {
                node(out, node, "/" + node.segment(), TOP_LEVEL_INDENT);
            }
            for (int i = 0; i < hoisted.size(); i++) {
                final Map.Entry<String, RouteNode> entry = hoisted.get(i);
                node(out, entry.getValue(), entry.getKey(), TOP_LEVEL_INDENT);
            }
            for (final String declaration : opaque) {
                out.append(TOP_LEVEL_INDENT).append(declaration).append(",\n");
            }
            return out.toString();
        }

        private List<String> importLines() {
            final List<String> lines = new ArrayList<>();
            for (final String path : imports) {
                lines.add("import '" + path + "';");
            }
            return lines;
        }

        /**
         * Renders one node.
         *
         * @param path the path literal: absolute at top level, the
         *      segment below
         */
        private void node(final StringBuilder out, final RouteNode node,
                final String path, final String indent) {
            if (!needsEmission(node)) {
                return;
            }
            final CallRecord record = node.record();
            if (record != null) {
                addImport(record.targetFile());
            }
            if (record != null && record.isVerbatim()) {
                if (!isCovered(record.declarationText())) {
                    out.append(indent).append(record.declarationText())
                            .append(",\n");
                    emittedTexts.add(record.declarationText());
                }
                hoistUncovered(node, absolute(path));
                return;
            }

            final String inner = indent + STEP;
            out.append(indent).append("GoRoute(\n");
            out.append(inner).append("path: '").append(path).append("',\n");
            if (record == null) {
                out.append(inner).append("// TODO(route-migrator): parent"
                        + " route without a page of its own; consider a"
                        + " ShellRoute.\n");
                out.append(inner).append(BUILDER_SIGNATURE).append(" => ")
                        .append(PLACEHOLDER).append(",\n");
            } else {
                builder(out, record, inner);
            }
            if (node.hasChildren()) {
                out.append(inner).append("routes: <RouteBase>[\n");
                for (final RouteNode child : node.children()) {
                    node(out, child, child.segment(), inner + STEP);
                }
                out.append(inner).append("],\n");
            }
            out.append(indent).append("),\n");
        }

        private String absolute(final String path) {
            return path.startsWith("/") ? path : "/" + path;
        }

        /**
         * Queues for top-level emission the descendants of a verbatim
         * node that its text does not already contain.
         */
        private void hoistUncovered(final RouteNode node,
                final String absolutePath) {
            for (final RouteNode child : node.children()) {
                final String childPath = absolutePath.equals("/")
                        ? "/" + child.segment()
                        : absolutePath + "/" + child.segment();
                final CallRecord record = child.record();
                if (record != null && record.isVerbatim()
                        && isCovered(record.declarationText())) {
                    addImport(record.targetFile());
                    hoistUncovered(child, childPath);
                } else if (needsEmission(child)) {
                    LOG.warn("Route {} lies under a hand-written declaration"
                            + " and is emitted at top level", childPath);
                    warnings.add(MigrationWarning.of(project.routerFile(),
                            "Route " + childPath + " lies under a hand-written"
                                    + " declaration that does not contain it;"
                                    + " it was emitted at top level"));
                    hoisted.add(Map.entry(childPath, child));
                }
            }
        }

        /** Whether rendering a subtree produces any text. */
        private boolean needsEmission(final RouteNode node) {
            final CallRecord record = node.record();
            if (record != null && !(record.isVerbatim()
                    && isCovered(record.declarationText()))) {
                return true;
            }
            for (final RouteNode child : node.children()) {
                if (needsEmission(child)) {
                    return true;
                }
            }
            return false;
        }

        private boolean isCovered(final String text) {
            for (final String emitted : emittedTexts) {
                if (emitted.contains(text)) {
                    return true;
                }
            }
            return false;
        }

        private void addImport(final Path targetFile) {
            if (targetFile != null) {
                imports.add(project.importPathFor(targetFile));
            }
        }

        private void builder(final StringBuilder out,
                final CallRecord record, final String indent) {
            final String target = record.targetConstruction();
            final ArgumentsPayload payload = record.payload();
            final String body = indent + STEP;

            if (target == null) {
                final String todo = "// TODO(route-migrator): build the page"
                        + " opened by " + record.methodName() + "().";
                if (!payload.isPresent()) {
                    out.append(indent).append(todo).append('\n');
                    out.append(indent).append(BUILDER_SIGNATURE)
                            .append(" => ").append(PLACEHOLDER).append(",\n");
                    return;
                }
                out.append(indent).append(BUILDER_SIGNATURE).append(" {\n");
                out.append(body).append(extraCast(payload)).append('\n');
                out.append(body).append(todo).append('\n');
                out.append(body).append("return ").append(PLACEHOLDER)
                        .append(";\n");
                out.append(indent).append("},\n");
                return;
            }

            if (!payload.isPresent()) {
                out.append(indent).append(BUILDER_SIGNATURE).append(" => const ")
                        .append(target).append("(),\n");
                return;
            }

            out.append(indent).append(BUILDER_SIGNATURE).append(" {\n");
            if (payload.shape() == ArgumentsPayload.Shape.NAMED
                    && payload.fields().size() == 1) {
                final String field = payload.fields().keySet().iterator()
                        .next();
                out.append(body)
                        .append("final argument = state.extra as dynamic;\n");
                out.append(body).append("return ").append(target).append('(')
                        .append(field).append(": argument);\n");
            } else if (payload.shape() == ArgumentsPayload.Shape.NAMED) {
                out.append(body).append(
                        "final args = state.extra as Map<String, dynamic>;\n");
                out.append(body).append("return ").append(target)
                        .append("(\n");
                for (final String field : payload.fields().keySet()) {
                    out.append(body).append(STEP).append(field)
                            .append(": args['").append(field).append("'],\n");
                }
                out.append(body).append(");\n");
            } else {
                out.append(body).append(extraCast(payload)).append('\n');
                out.append(body).append("// TODO(route-migrator): pass the ")
                        .append(payload.isMapLiteral()
                                ? "map entries" : "arguments")
                        .append(" to ").append(target).append(".\n");
                out.append(body).append("return const ").append(target)
                        .append("();\n");
            }
            out.append(indent).append("},\n");
        }

        private static String extraCast(final ArgumentsPayload payload) {
            return payload.isMapLiteral()
                    ? "final arguments = state.extra as Map<String, dynamic>;"
                    : "final arguments = state.extra as dynamic;";
        }
    }

}
