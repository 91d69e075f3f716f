package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A Flutter project on disk: its root, its {@code lib} directory, its
 * package name and the location of the router configuration.
 *
 * <p>The package name comes from the {@code name} entry of
 * {@code pubspec.yaml}. Without it, generated imports fall back to
 * relative paths.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FlutterProject {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlutterProject.class);

    private static final ObjectMapper YAML = new ObjectMapper(
            new YAMLFactory());

    /** The manifest file name. */
    public static final String PUBSPEC = "pubspec.yaml";

    private final Path root;
    private final Path libDirectory;
    private final String packageName;
    private final Path routerFile;
    private final List<MigrationWarning> warnings;

    private FlutterProject(final Path theRoot, final String thePackageName,
            final Path theRouterFile, final List<MigrationWarning> theWarnings) {
        this.root = theRoot;
        this.libDirectory = theRoot.resolve("lib");
        this.packageName = thePackageName;
        this.routerFile = theRouterFile;
        this.warnings = List.copyOf(theWarnings);
    }

    /**
     * Opens a project directory.
     *
     * @param root the project root
     * @param routerFile the router configuration path, relative to the root
     * @return the project, with a warning if the manifest is unusable
     */
    public static FlutterProject open(final Path root,
            final String routerFile) {
        Preconditions.requireNonNull(root, "Project root is required");
        Preconditions.requireNonBlank(routerFile, "Router file is required");

        final Path base = root.toAbsolutePath().normalize();
        final List<MigrationWarning> warnings = new ArrayList<>();
        final Path pubspec = base.resolve(PUBSPEC);
        String name = null;
        if (!Files.isRegularFile(pubspec)) {
            warnings.add(MigrationWarning.of(pubspec,
                    "No pubspec.yaml found, generated imports are relative"));
        } else {
            try {
                final JsonNode manifest = YAML.readTree(pubspec.toFile());
                final JsonNode nameNode = manifest == null
                        ? null : manifest.get("name");
                if (nameNode != null && nameNode.isTextual()
                        && !nameNode.asText().isBlank()) {
                    name = nameNode.asText().trim();
                } else {
                    warnings.add(MigrationWarning.of(pubspec,
                            "pubspec.yaml declares no package name,"
                                    + " generated imports are relative"));
                }
            } catch (final IOException e) {
                LOG.warn("Failed to read {}: {}", pubspec, e.getMessage());
                warnings.add(MigrationWarning.of(pubspec,
                        "Unreadable pubspec.yaml: " + e.getMessage()));
            }
        }
        return new FlutterProject(base, name,
                base.resolve(routerFile).normalize(), warnings);
    }

    public Path root() {
        return root;
    }

    public Path libDirectory() {
        return libDirectory;
    }

    /** The package name, null when unknown. */
    public String packageName() {
        return packageName;
    }

    /** Absolute path of the router configuration file. */
    public Path routerFile() {
        return routerFile;
    }

    /** Problems found while opening the project. */
    public List<MigrationWarning> warnings() {
        return warnings;
    }

    /**
     * Computes the import URI of a file for the router configuration.
     *
     * @param file the absolute path of the imported file
     * @return a {@code package:} URI for files under {@code lib} when the
     *      package name is known, otherwise a path relative to the
     *      router file
     */
    public String importPathFor(final Path file) {
        final Path target = file.toAbsolutePath().normalize();
        if (packageName != null && target.startsWith(libDirectory)) {
            return "package:" + packageName + "/"
                    + slashed(libDirectory.relativize(target));
        }
        final Path from = routerFile.getParent() == null
                ? libDirectory : routerFile.getParent();
        return slashed(from.relativize(target));
    }

    /**
     * Returns a path relative to the project root, for reports.
     *
     * @param file an absolute path inside the project
     * @return the relative path with forward slashes
     */
    public String relative(final Path file) {
        final Path target = file.toAbsolutePath().normalize();
        return target.startsWith(root) ? slashed(root.relativize(target))
                : slashed(target);
    }

    private static String slashed(final Path path) {
        return path.toString().replace('\\', '/');
    }

}
