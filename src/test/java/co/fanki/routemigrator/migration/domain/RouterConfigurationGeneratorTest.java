package co.fanki.routemigrator.migration.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for RouterConfigurationGenerator.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RouterConfigurationGeneratorTest {

    @TempDir
    Path root;

    private FlutterProject project;

    private final RouterConfigurationGenerator generator =
            new RouterConfigurationGenerator();

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("pubspec.yaml"), "name: demo\n");
        project = FlutterProject.open(root, "lib/generated_router.dart");
    }

    @Test
    void whenGenerating_givenNoExistingFile_shouldEmitTheWholeConfiguration() {
        final RouteTree tree = tree(
                page("/", "HomeScreen", "home.dart").build(),
                named("/settings").build());

        final GeneratedRouter router = generator.generate(tree, List.of(),
                project, null);

        assertFalse(router.patched());
        assertEquals("""
                // GENERATED CODE - DO NOT MODIFY BY HAND
                // ignore_for_file: constant_identifier_names

                import 'package:flutter/material.dart';
                import 'package:go_router/go_router.dart';
                import 'package:demo/home.dart';

                /// The router configuration.
                final GoRouter router = GoRouter(
                  routes: <RouteBase>[
                    GoRoute(
                      path: '/',
                      builder: (BuildContext context, GoRouterState state) => const HomeScreen(),
                    ),
                    GoRoute(
                      path: '/settings',
                      // TODO(route-migrator): build the page opened by pushNamed().
                      builder: (BuildContext context, GoRouterState state) => const SizedBox.shrink(),
                    ),
                  ],
                );
                """, router.content());
    }

    @Test
    void whenGenerating_givenMapPayload_shouldCastExtraToAMap() {
        final RouteTree tree = tree(page("/details", "DetailsScreen",
                "details.dart")
                .payload(ArgumentsPayload.single("{'id': 42}", true))
                .build());

        final String content = generator.generate(tree, List.of(), project,
                null).content();

        assertTrue(content.contains(
                "final arguments = state.extra as Map<String, dynamic>;"));
        assertTrue(content.contains("// TODO(route-migrator): pass the map"
                + " entries to DetailsScreen."));
        assertTrue(content.contains("return const DetailsScreen();"));
    }

    @Test
    void whenGenerating_givenWidgetFields_shouldRebuildThePageFromExtra() {
        final Map<String, String> one = Map.of("userId", "id");
        final Map<String, String> two = new LinkedHashMap<>();
        two.put("userId", "id");
        two.put("tab", "2");
        final RouteTree tree = tree(
                widget("/profile-screen", "ProfileScreen", one),
                widget("/order-screen", "OrderScreen", two));

        final String content = generator.generate(tree, List.of(), project,
                null).content();

        assertTrue(content.contains(
                "final argument = state.extra as dynamic;"));
        assertTrue(content.contains("return ProfileScreen(userId: argument);"));
        assertTrue(content.contains(
                "final args = state.extra as Map<String, dynamic>;"));
        assertTrue(content.contains("userId: args['userId'],"));
        assertTrue(content.contains("tab: args['tab'],"));
    }

    @Test
    void whenGenerating_givenNamedConstructorPage_shouldBuildWithThatConstructor() {
        final RouteTree tree = tree(
                widget("/profile-page", "ProfilePage", Map.of("id", "1"))
                        .toBuilder().targetConstructor("edit").build(),
                page("/settings-page", "SettingsPage", "settings.dart")
                        .targetConstructor("compact").build());

        final String content = generator.generate(tree, List.of(), project,
                null).content();

        assertTrue(content.contains(
                "return ProfilePage.edit(id: argument);"));
        assertTrue(content.contains("=> const SettingsPage.compact(),"));
    }

    @Test
    void whenGenerating_givenNestedPath_shouldEmitAPlaceholderParent() {
        final RouteTree tree = tree(named("/a/b").build());

        final String content = generator.generate(tree, List.of(), project,
                null).content();

        assertTrue(content.contains("path: '/a',"));
        assertTrue(content.contains("parent route without a page of its own"));
        assertTrue(content.contains("path: 'b',"));
    }

    @Test
    void whenGenerating_givenVerbatimRecord_shouldEmitItsTextUnchanged() {
        final String legacy = "GoRoute(path: '/legacy', builder: (c, s) =>"
                + " const LegacyScreen())";
        final RouteTree tree = tree(verbatim("/legacy", legacy),
                named("/home").build());

        final String content = generator.generate(tree, List.of(), project,
                null).content();

        assertTrue(content.contains("    " + legacy + ",\n"));
        assertTrue(content.indexOf("path: '/home'")
                < content.indexOf(legacy));
    }

    @Test
    void whenGenerating_givenOpaqueDeclarationCoveringARoute_shouldEmitItOnce() {
        final String inside = "GoRoute(path: '/inside')";
        final String shell = "ShellRoute(routes: [" + inside + "])";

        final String content = generator.generate(
                tree(verbatim("/inside", inside)), List.of(shell), project,
                null).content();

        assertEquals(content.indexOf(inside), content.lastIndexOf(inside));
        assertTrue(content.contains("    " + shell + ",\n"));
    }

    @Test
    void whenGenerating_givenNewChildOfVerbatimRoute_shouldHoistItWithAWarning() {
        final String shop = "GoRoute(path: '/shop', builder: (c, s) =>"
                + " const ShopScreen())";
        final RouteTree tree = tree(verbatim("/shop", shop),
                named("/shop/cart").build());

        final GeneratedRouter router = generator.generate(tree, List.of(),
                project, null);

        assertTrue(router.content().contains("path: '/shop/cart',"));
        assertEquals(1, router.warnings().size());
        assertTrue(router.warnings().get(0).message().contains("/shop/cart"));
    }

    @Test
    void whenPatching_givenExistingRoutesList_shouldOnlyReplaceItsInterior() {
        final String existing = """
                import 'package:go_router/go_router.dart';

                // keep me: ']' inside a comment
                final router = GoRouter(
                  initialLocation: '/',
                  routes: [
                    GoRoute(path: '/old', builder: (c, s) => const Text('[x]')),
                  ],
                  debugLogDiagnostics: true,
                );
                """;
        final RouteTree tree = tree(page("/settings", "SettingsScreen",
                "settings.dart").build());

        final GeneratedRouter router = generator.generate(tree, List.of(),
                project, existing);

        assertTrue(router.patched());
        assertEquals("""
                import 'package:go_router/go_router.dart';
                import 'package:demo/settings.dart';

                // keep me: ']' inside a comment
                final router = GoRouter(
                  initialLocation: '/',
                  routes: [
                    GoRoute(
                      path: '/settings',
                      builder: (BuildContext context, GoRouterState state) => const SettingsScreen(),
                    ),
                  ],
                  debugLogDiagnostics: true,
                );
                """, router.content());
    }

    @Test
    void whenPatching_givenFileWithoutRoutesList_shouldRegenerateWithAWarning() {
        final GeneratedRouter router = generator.generate(
                tree(named("/home").build()), List.of(), project,
                "void main() {}\n");

        assertFalse(router.patched());
        assertTrue(router.content().startsWith(
                RouterConfigurationGenerator.HEADER));
        assertEquals(1, router.warnings().size());
    }

    @Test
    void whenPatching_givenPreviousOutput_shouldBeStable() {
        final RouteTree tree = tree(page("/", "HomeScreen", "home.dart")
                .build(), named("/settings").build());
        final String first = generator.generate(tree, List.of(), project,
                null).content();

        final GeneratedRouter second = generator.generate(tree, List.of(),
                project, first);

        assertTrue(second.patched());
        assertEquals(first, second.content());
    }

    private CallRecord.Builder page(final String path, final String page,
            final String file) {
        return named(path).targetName(page)
                .targetFile(project.libDirectory().resolve(file));
    }

    private static CallRecord.Builder named(final String path) {
        return CallRecord.builder()
                .kind(OperationKind.NAVIGATE_BY_NAME)
                .methodName("pushNamed")
                .destination(Destination.of(path));
    }

    private static CallRecord widget(final String path, final String page,
            final Map<String, String> fields) {
        return CallRecord.builder()
                .kind(OperationKind.NAVIGATE_BY_WIDGET)
                .methodName("push")
                .destination(Destination.of(path))
                .targetName(page)
                .payload(ArgumentsPayload.named(fields))
                .build();
    }

    private static CallRecord verbatim(final String path, final String text) {
        return CallRecord.builder()
                .kind(OperationKind.IMPORTED)
                .methodName("GoRoute")
                .destination(Destination.of(path))
                .declarationText(text)
                .build();
    }

    private static RouteTree tree(final CallRecord... records) {
        final Map<Destination, CallRecord> table = new LinkedHashMap<>();
        for (final CallRecord record : records) {
            table.put(record.destination(), record);
        }
        return RouteTree.build(table);
    }

}
