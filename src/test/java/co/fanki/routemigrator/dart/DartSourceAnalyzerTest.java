package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.ast.VariableDeclaration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for DartSourceAnalyzer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DartSourceAnalyzerTest {

    @TempDir
    Path projectDir;

    private final DartSourceAnalyzer analyzer = new DartSourceAnalyzer();

    @Test
    void whenDiscoveringFiles_givenToolAndHiddenDirectories_shouldSkipThem()
            throws IOException {
        write("lib/main.dart", "void main() {}");
        write("lib/src/home.dart", "class Home {}");
        write("test/home_test.dart", "void main() {}");
        write("build/generated.dart", "void x() {}");
        write(".dart_tool/cache.dart", "void y() {}");
        write("lib/README.md", "# not dart");

        final List<Path> files = analyzer.discoverFiles(projectDir);

        final Path base = projectDir.toAbsolutePath().normalize();
        assertEquals(List.of(
                base.resolve("lib/main.dart"),
                base.resolve("lib/src/home.dart"),
                base.resolve("test/home_test.dart")), files);
    }

    @Test
    void whenDiscoveringFiles_givenMissingDirectory_shouldReturnEmptyList()
            throws IOException {
        assertTrue(analyzer.discoverFiles(projectDir.resolve("missing"))
                .isEmpty());
    }

    @Test
    void whenParsingFile_givenUtf8Content_shouldKeepSourceAndTree()
            throws IOException {
        final Path file = write("lib/main.dart",
                "// Ñandú\nconst title = 'Café';\n");

        final DartUnit unit = analyzer.parse(file);

        assertEquals(Files.readString(file), unit.source());
        assertEquals(1, unit.root().declarations().size());
        assertEquals(2, unit.lineOf(unit.root().declarations().get(0)
                .offset()));
    }

    @Test
    void whenBuildingResolver_givenUnits_shouldResolveAcrossRelativeImports() {
        final Path lib = projectDir.resolve("lib").toAbsolutePath()
                .normalize();
        final DartUnit constants = analyzer.parse(lib.resolve("a.dart"),
                "const home = '/home';");
        final DartUnit user = analyzer.parse(lib.resolve("b.dart"),
                "import 'a.dart';\nconst copy = home;");

        final DartResolver resolver = analyzer.resolver(
                List.of(constants, user), null, lib);

        final VariableDeclaration copy = (VariableDeclaration) user.root()
                .declarations().get(0);
        assertEquals("/home", resolver.constantValue(user,
                copy.initializer()).orElseThrow());
    }

    private Path write(final String relative, final String content)
            throws IOException {
        final Path file = projectDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

}
