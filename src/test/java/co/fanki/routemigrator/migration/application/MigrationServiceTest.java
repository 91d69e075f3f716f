package co.fanki.routemigrator.migration.application;

import co.fanki.routemigrator.dart.DartSourceAnalyzer;
import co.fanki.routemigrator.migration.application.MigrationResult.CallSiteReport;
import co.fanki.routemigrator.migration.domain.CallSiteRewriter;
import co.fanki.routemigrator.migration.domain.NavigationCallClassifier;
import co.fanki.routemigrator.migration.domain.NavigationHelperFinder;
import co.fanki.routemigrator.migration.domain.OperationKind;
import co.fanki.routemigrator.migration.domain.RouteMerger;
import co.fanki.routemigrator.migration.domain.RouterConfigurationGenerator;
import co.fanki.routemigrator.migration.domain.RouterConfigurationReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for MigrationService running over a Flutter project on disk.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MigrationServiceTest {

    private static final String MAIN = """
            import 'package:flutter/material.dart';
            import 'routes.dart';
            import 'screens/details_screen.dart';

            class HomeScreen extends StatelessWidget {
              @override
              Widget build(BuildContext context) {
                return ElevatedButton(
                  onPressed: () {
                    Navigator.pushNamed(context, Routes.details, arguments: {'id': 42});
                    Navigator.push(context, MaterialPageRoute(
                        builder: (context) => const DetailsScreen(itemId: 7)));
                  },
                  child: const Text('Open'),
                );
              }
            }
            """;

    private static final String ROUTES = """
            class Routes {
              static const String details = '/details';
            }
            """;

    private static final String DETAILS = """
            class DetailsScreen extends StatelessWidget {
              const DetailsScreen({super.key, required this.itemId});

              final int itemId;
            }
            """;

    @TempDir
    Path root;

    private MigrationService service;

    @BeforeEach
    void setUp() throws IOException {
        service = new MigrationService(
                new DartSourceAnalyzer(),
                new NavigationHelperFinder(),
                new NavigationCallClassifier(),
                new RouterConfigurationReader(),
                new RouteMerger(),
                new RouterConfigurationGenerator(),
                new CallSiteRewriter(),
                "lib/generated_router.dart",
                2);

        Files.writeString(root.resolve("pubspec.yaml"), "name: demo\n");
        Files.createDirectories(root.resolve("lib/screens"));
        Files.writeString(root.resolve("lib/main.dart"), MAIN);
        Files.writeString(root.resolve("lib/routes.dart"), ROUTES);
        Files.writeString(root.resolve("lib/screens/details_screen.dart"),
                DETAILS);
    }

    @Test
    void whenPlanning_givenProject_shouldReportCallsWithoutWriting()
            throws IOException {
        final MigrationResult result = service.migrate(root,
                MigrationMode.PLAN);

        final List<CallSiteReport> calls = result.calls();
        assertEquals(2, calls.size());
        assertEquals("lib/main.dart", calls.get(0).file());
        assertEquals(10, calls.get(0).line());
        assertEquals(OperationKind.NAVIGATE_BY_NAME, calls.get(0).kind());
        assertEquals("/details", calls.get(0).destination());
        assertEquals("Routes.details", calls.get(0).expression());
        assertEquals(OperationKind.NAVIGATE_BY_WIDGET, calls.get(1).kind());
        assertEquals("/details-screen", calls.get(1).destination());

        assertEquals(1, result.diffs().size());
        assertEquals("lib/main.dart", result.diffs().get(0).file());
        assertEquals(3, result.diffs().get(0).changes().size());

        assertTrue(result.configuration().contains("path: '/details',"));
        assertTrue(result.configuration().contains(
                "import 'package:demo/screens/details_screen.dart';"));
        assertTrue(result.written().isEmpty());
        assertTrue(result.warnings().isEmpty());
        assertFalse(Files.exists(root.resolve("lib/generated_router.dart")));
        assertEquals(MAIN, Files.readString(root.resolve("lib/main.dart")));
    }

    @Test
    void whenApplying_givenProject_shouldWriteRouterAndRewriteSources()
            throws IOException {
        final MigrationResult result = service.migrate(root,
                MigrationMode.APPLY);

        final Path router = root.resolve("lib/generated_router.dart")
                .toAbsolutePath().normalize();
        assertEquals(2, result.written().size());
        assertTrue(result.written().contains(router));
        assertEquals(result.configuration(), Files.readString(router));

        final String main = Files.readString(root.resolve("lib/main.dart"));
        assertTrue(main.contains(
                "context.push('/details', extra: {'id': 42})"));
        assertTrue(main.contains("context.push('/details-screen', extra: 7)"));
        assertTrue(main.contains(CallSiteRewriter.GO_ROUTER_IMPORT));
        assertFalse(main.contains("Navigator."));
    }

    @Test
    void whenApplyingTwice_givenMigratedProject_shouldChangeNothing()
            throws IOException {
        service.migrate(root, MigrationMode.APPLY);
        final Path router = root.resolve("lib/generated_router.dart");
        final String firstRouter = Files.readString(router);
        final String firstMain = Files.readString(
                root.resolve("lib/main.dart"));

        final MigrationResult second = service.migrate(root,
                MigrationMode.APPLY);

        assertTrue(second.calls().isEmpty());
        assertTrue(second.written().isEmpty());
        assertEquals(2, second.retainedCount());
        assertEquals(firstRouter, Files.readString(router));
        assertEquals(firstMain, Files.readString(
                root.resolve("lib/main.dart")));
    }

    @Test
    void whenMigrating_givenUnreadableFile_shouldSkipItWithAWarning()
            throws IOException {
        Files.write(root.resolve("lib/broken.dart"),
                new byte[] {(byte) 0xC3, (byte) 0x28});

        final MigrationResult result = service.migrate(root,
                MigrationMode.PLAN);

        assertEquals(2, result.calls().size());
        assertTrue(result.warnings().stream().anyMatch(w ->
                w.message().startsWith("Skipped, parse failed")
                        && w.file().endsWith("broken.dart")));
    }

    @Test
    void whenMigrating_givenNoPubspec_shouldWarnAndUseRelativeImports()
            throws IOException {
        Files.delete(root.resolve("pubspec.yaml"));

        final MigrationResult result = service.migrate(root,
                MigrationMode.PLAN);

        assertEquals(1, result.warnings().size());
        assertTrue(result.configuration().contains(
                "import 'screens/details_screen.dart';"));
    }

    @Test
    void whenApplying_givenUtf8Source_shouldKeepItsCharacters()
            throws IOException {
        Files.writeString(root.resolve("lib/main.dart"), MAIN.replace(
                "'Open'", "'Abrir ñandú ✓'"), StandardCharsets.UTF_8);

        service.migrate(root, MigrationMode.APPLY);

        assertTrue(Files.readString(root.resolve("lib/main.dart"),
                StandardCharsets.UTF_8).contains("'Abrir ñandú ✓'"));
    }

}
