package co.fanki.routemigrator.dart;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Entry point to Dart source analysis.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DartAnalyzer {

    /**
     * Lists the Dart source files under a directory.
     *
     * @param root the directory to scan
     * @return absolute, normalized paths in sorted order
     * @throws IOException if the directory cannot be walked
     */
    List<Path> discoverFiles(Path root) throws IOException;

    /**
     * Reads and parses one file.
     *
     * @param file the file to parse
     * @return the parsed unit
     * @throws IOException if the file cannot be read
     */
    DartUnit parse(Path file) throws IOException;

    /**
     * Parses content that has already been read.
     *
     * @param file the path the content belongs to
     * @param content the Dart source
     * @return the parsed unit
     */
    DartUnit parse(Path file, String content);

    /**
     * Builds a resolver over a set of units.
     *
     * @param units every unit of the project
     * @param packageName the project's package name, null if unknown
     * @param libDirectory the project's {@code lib} directory
     * @return the resolver
     */
    DartResolver resolver(Collection<DartUnit> units, String packageName,
            Path libDirectory);

}
