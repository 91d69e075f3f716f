package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.dart.DartParser;
import co.fanki.routemigrator.dart.DartUnit;
import co.fanki.routemigrator.dart.IndexedDartResolver;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for CallSiteRewriter.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CallSiteRewriterTest {

    private static final Path FILE = Path.of("/app/lib/home.dart");

    private static final String SOURCE = """
            import 'package:flutter/material.dart';

            void open(BuildContext context, String name) {
              Navigator.pushNamed(context, '/details', arguments: {'id': 42});
              Navigator.of(context).pushReplacementNamed('settings/');
              Navigator.pushNamed(context, name);
              Navigator.pop<bool>(context, true);
              Navigator.maybePop(context);
            }
            """;

    private final CallSiteRewriter rewriter = new CallSiteRewriter();

    @Test
    void whenRewriting_givenMixedCalls_shouldReplaceOrMarkEachOne() {
        final FileRewrite rewrite = rewriter.rewrite(FILE, SOURCE,
                classify(SOURCE));

        assertTrue(rewrite.changed());
        assertEquals("""
                import 'package:flutter/material.dart';
                import 'package:go_router/go_router.dart';

                void open(BuildContext context, String name) {
                  context.push('/details', extra: {'id': 42});
                  context.pushReplacement('/settings');
                  /* TODO(route-migrator): migrate pushNamed manually */ Navigator.pushNamed(context, name);
                  context.pop<bool>(true);
                  /* TODO(route-migrator): migrate maybePop manually */ Navigator.maybePop(context);
                }
                """, rewrite.rewritten());
    }

    @Test
    void whenRewriting_givenMixedCalls_shouldReportLineChangesAndWarnings() {
        final FileRewrite rewrite = rewriter.rewrite(FILE, SOURCE,
                classify(SOURCE));

        final List<LineChange> changes = rewrite.changes();
        assertEquals(6, changes.size());
        assertEquals(new LineChange(2, "",
                CallSiteRewriter.GO_ROUTER_IMPORT), changes.get(0));
        assertEquals(4, changes.get(1).line());
        assertEquals("context.push('/details', extra: {'id': 42})",
                changes.get(1).replacement());
        assertEquals(2, rewrite.warnings().size());
        assertTrue(rewrite.warnings().get(0).message()
                .contains("needs manual migration"));
        assertEquals(6, rewrite.warnings().get(0).line());
    }

    @Test
    void whenRewriting_givenAlreadyMigratedFile_shouldChangeNothing() {
        final String once = rewriter.rewrite(FILE, SOURCE, classify(SOURCE))
                .rewritten();

        final FileRewrite twice = rewriter.rewrite(FILE, once,
                classify(once));

        assertFalse(twice.changed());
        assertEquals(once, twice.rewritten());
        assertTrue(twice.changes().isEmpty());
    }

    @Test
    void whenRewriting_givenExistingGoRouterImport_shouldNotAddItAgain() {
        final String source = """
                import "package:go_router/go_router.dart";

                void back(BuildContext context) {
                  Navigator.pop(context);
                }
                """;

        final String rewritten = rewriter.rewrite(FILE, source,
                classify(source)).rewritten();

        assertFalse(rewritten.contains(CallSiteRewriter.GO_ROUTER_IMPORT));
        assertTrue(rewritten.contains("  context.pop();\n"));
    }

    @Test
    void whenRewriting_givenOnlyManualCalls_shouldNotAddTheImport() {
        final String source = """
                void open(BuildContext context, String name) {
                  Navigator.pushNamed(context, name);
                }
                """;

        final String rewritten = rewriter.rewrite(FILE, source,
                classify(source)).rewritten();

        assertFalse(rewritten.contains("go_router"));
    }

    @Test
    void whenRewriting_givenCallNestedInAReplacedCall_shouldWarnAndKeepOuterReplacement() {
        final String source = """
                void open(BuildContext context) {
                  Navigator.pushNamed(context, '/a', arguments: Navigator.of(context).canPop());
                }
                """;

        final FileRewrite rewrite = rewriter.rewrite(FILE, source,
                classify(source));

        assertTrue(rewrite.rewritten().contains(
                "context.push('/a', extra: Navigator.of(context).canPop())"));
        assertEquals(1, rewrite.warnings().size());
        assertTrue(rewrite.warnings().get(0).message().contains("nested"));
    }

    @Test
    void whenRewriting_givenStaleRecord_shouldSkipItWithAWarning() {
        final List<CallRecord> records = classify(SOURCE);
        final String edited = SOURCE.replace("'/details'", "'/other'");

        final FileRewrite rewrite = rewriter.rewrite(FILE, edited,
                records.subList(0, 1));

        assertEquals(edited, rewrite.rewritten());
        assertTrue(rewrite.warnings().get(0).message()
                .contains("no longer matches"));
    }

    @Test
    void whenRewriting_givenConstPayload_shouldKeepTheConstKeyword() {
        final String source = """
                void open(BuildContext context) {
                  Navigator.pushReplacementNamed(context, '/raw', arguments: const {'k': 1});
                }
                """;

        final String rewritten = rewriter.rewrite(FILE, source,
                classify(source)).rewritten();

        assertTrue(rewritten.contains(
                "  context.pushReplacement('/raw', extra: const {'k': 1});\n"));
    }

    @Test
    void whenRewriting_givenHelperCalledWithItsOwnContext_shouldNavigateOnThatContext() {
        final String source = """
                void goTo(BuildContext context, String route) {
                  Navigator.pushNamed(context, route);
                }

                void tap(BuildContext ctx) {
                  goTo(ctx, '/a');
                }
                """;
        final DartUnit unit = new DartUnit(FILE, source,
                DartParser.parse(source));
        final IndexedDartResolver resolver = new IndexedDartResolver(
                List.of(unit), "demo", Path.of("/app/lib"));
        final List<CallRecord> records = new NavigationCallClassifier()
                .classify(unit, resolver,
                        new NavigationHelperFinder().find(unit, resolver));

        final String rewritten = rewriter.rewrite(FILE, source, records)
                .rewritten();

        assertTrue(rewritten.contains("  ctx.push('/a');\n"));
    }

    @Test
    void whenComputingReplacement_givenWidgetFields_shouldPassThemAsAMap() {
        final Map<String, String> fields = new LinkedHashMap<>();
        fields.put("userId", "id");
        fields.put("tab", "2");
        final CallRecord record = CallRecord.builder()
                .kind(OperationKind.REPLACE_BY_WIDGET)
                .methodName("pushReplacement")
                .destination(Destination.fromWidgetName("ProfileScreen"))
                .payload(ArgumentsPayload.named(fields))
                .build();

        assertEquals("context.pushReplacement('/profile-screen', extra:"
                + " <String, dynamic>{'userId': id, 'tab': 2})",
                rewriter.replacement(record).orElseThrow());
    }

    @Test
    void whenComputingReplacement_givenComplexContext_shouldParenthesizeIt() {
        final CallRecord record = CallRecord.builder()
                .kind(OperationKind.POP)
                .methodName("pop")
                .destination(Destination.NOT_APPLICABLE)
                .contextExpression("ctx ?? fallback")
                .build();

        assertEquals("(ctx ?? fallback).pop()",
                rewriter.replacement(record).orElseThrow());
    }

    @Test
    void whenQuoting_givenSpecialCharacters_shouldEscapeThem() {
        assertEquals("'/it\\'s/\\$x'", CallSiteRewriter.quote("/it's/$x"));
    }

    private static List<CallRecord> classify(final String source) {
        final DartUnit unit = new DartUnit(FILE, source,
                DartParser.parse(source));
        return new NavigationCallClassifier().classify(unit,
                new IndexedDartResolver(List.of(unit), "demo",
                        Path.of("/app/lib")), List.of());
    }

}
