package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Built-in Dart analyzer backed by {@link DartParser} and
 * {@link IndexedDartResolver}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class DartSourceAnalyzer implements DartAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            DartSourceAnalyzer.class);

    /** Directory names that never hold project sources. */
    private static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
            "build", "node_modules");

    /**
     * Walks the directory for {@code .dart} files.
     *
     * <p>Tool output ({@code build}, {@code node_modules}) and hidden
     * directories are skipped.</p>
     */
    @Override
    public List<Path> discoverFiles(final Path root) throws IOException {
        Preconditions.requireNonNull(root, "Root directory is required");
        final Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            LOG.warn("Source directory not found: {}", base);
            return List.of();
        }

        try (Stream<Path> walk = Files.walk(base)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".dart"))
                    .filter(p -> !isExcluded(base.relativize(p)))
                    .sorted()
                    .toList();
        }
    }

    private static boolean isExcluded(final Path relative) {
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            final String name = relative.getName(i).toString();
            if (name.startsWith(".") || EXCLUDED_DIRECTORIES.contains(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public DartUnit parse(final Path file) throws IOException {
        Preconditions.requireNonNull(file, "File is required");
        final String content = Files.readString(file, StandardCharsets.UTF_8);
        return parse(file, content);
    }

    @Override
    public DartUnit parse(final Path file, final String content) {
        Preconditions.requireNonNull(file, "File is required");
        Preconditions.requireNonNull(content, "Content is required");
        LOG.debug("Parsing {}", file);
        return new DartUnit(file.toAbsolutePath().normalize(), content,
                DartParser.parse(content));
    }

    @Override
    public DartResolver resolver(final Collection<DartUnit> units,
            final String packageName, final Path libDirectory) {
        return new IndexedDartResolver(units, packageName, libDirectory);
    }

}
