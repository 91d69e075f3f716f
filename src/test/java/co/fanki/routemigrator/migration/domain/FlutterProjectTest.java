package co.fanki.routemigrator.migration.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for FlutterProject.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlutterProjectTest {

    @TempDir
    Path root;

    @Test
    void whenOpening_givenPubspecWithName_shouldUsePackageImports()
            throws IOException {
        Files.writeString(root.resolve("pubspec.yaml"),
                "name: demo\ndependencies:\n  flutter:\n    sdk: flutter\n");

        final FlutterProject project = FlutterProject.open(root,
                "lib/generated_router.dart");

        assertEquals("demo", project.packageName());
        assertTrue(project.warnings().isEmpty());
        assertEquals(root.toAbsolutePath().normalize()
                .resolve("lib/generated_router.dart"), project.routerFile());
        assertEquals("package:demo/screens/home.dart", project.importPathFor(
                project.libDirectory().resolve("screens/home.dart")));
    }

    @Test
    void whenOpening_givenNoPubspec_shouldWarnAndUseRelativeImports() {
        final FlutterProject project = FlutterProject.open(root,
                "lib/router/app_router.dart");

        assertNull(project.packageName());
        assertEquals(1, project.warnings().size());
        assertEquals("../screens/home.dart", project.importPathFor(
                project.libDirectory().resolve("screens/home.dart")));
    }

    @Test
    void whenOpening_givenPubspecWithoutName_shouldWarn() throws IOException {
        Files.writeString(root.resolve("pubspec.yaml"), "version: 1.0.0\n");

        final FlutterProject project = FlutterProject.open(root,
                "lib/generated_router.dart");

        assertNull(project.packageName());
        assertTrue(project.warnings().get(0).message()
                .contains("no package name"));
    }

    @Test
    void whenComputingImport_givenFileOutsideLib_shouldBeRelativeToTheRouter()
            throws IOException {
        Files.writeString(root.resolve("pubspec.yaml"), "name: demo\n");
        final FlutterProject project = FlutterProject.open(root,
                "lib/generated_router.dart");

        assertEquals("../test/fake_screen.dart", project.importPathFor(
                project.root().resolve("test/fake_screen.dart")));
    }

    @Test
    void whenRelativizing_givenProjectFile_shouldUseForwardSlashes() {
        final FlutterProject project = FlutterProject.open(root,
                "lib/generated_router.dart");

        assertEquals("lib/a/b.dart", project.relative(
                project.root().resolve("lib").resolve("a").resolve("b.dart")));
    }

}
