package co.fanki.routemigrator.migration.application;

import co.fanki.routemigrator.dart.DartAnalyzer;
import co.fanki.routemigrator.dart.DartResolver;
import co.fanki.routemigrator.dart.DartUnit;
import co.fanki.routemigrator.migration.application.MigrationResult.CallSiteReport;
import co.fanki.routemigrator.migration.application.MigrationResult.FileDiff;
import co.fanki.routemigrator.migration.domain.CallRecord;
import co.fanki.routemigrator.migration.domain.CallSiteRewriter;
import co.fanki.routemigrator.migration.domain.FileRewrite;
import co.fanki.routemigrator.migration.domain.FlutterProject;
import co.fanki.routemigrator.migration.domain.GeneratedRouter;
import co.fanki.routemigrator.migration.domain.HelperDefinition;
import co.fanki.routemigrator.migration.domain.ImportedRoutes;
import co.fanki.routemigrator.migration.domain.MergeResult;
import co.fanki.routemigrator.migration.domain.MigrationWarning;
import co.fanki.routemigrator.migration.domain.NavigationCallClassifier;
import co.fanki.routemigrator.migration.domain.NavigationHelperFinder;
import co.fanki.routemigrator.migration.domain.RouteMerger;
import co.fanki.routemigrator.migration.domain.RouteTree;
import co.fanki.routemigrator.migration.domain.RouterConfigurationGenerator;
import co.fanki.routemigrator.migration.domain.RouterConfigurationReader;
import co.fanki.routemigrator.shared.DomainException;
import co.fanki.routemigrator.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Application service running one Navigator to go_router migration.
 *
 * <p>Migration flow: Discover files -> Parse (parallel) -> Find helpers
 * (parallel) -> barrier -> Classify calls (parallel) -> Read existing
 * configuration -> Merge -> Build tree -> Emit configuration -> Rewrite
 * call sites -> Write (apply mode only).</p>
 *
 * <p>Classification only starts once helper discovery has finished for
 * every file, since a call through a helper that is not known yet would
 * go unnoticed. A file that cannot be read, analyzed or written is
 * reported as a warning and skipped; the run carries on with the rest.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class MigrationService {

    private static final Logger LOG = LoggerFactory.getLogger(
            MigrationService.class);

    private final DartAnalyzer analyzer;
    private final NavigationHelperFinder helperFinder;
    private final NavigationCallClassifier classifier;
    private final RouterConfigurationReader reader;
    private final RouteMerger merger;
    private final RouterConfigurationGenerator generator;
    private final CallSiteRewriter rewriter;
    private final String routerFile;
    private final int parallelism;

    /**
     * Creates a new MigrationService.
     *
     * @param theAnalyzer the Dart source analyzer
     * @param theHelperFinder the navigation helper finder
     * @param theClassifier the navigation call classifier
     * @param theReader the router configuration reader
     * @param theMerger the route merger
     * @param theGenerator the router configuration generator
     * @param theRewriter the call site rewriter
     * @param theRouterFile the router file, relative to the project root
     * @param theParallelism the number of files analyzed at once
     */
    public MigrationService(
            final DartAnalyzer theAnalyzer,
            final NavigationHelperFinder theHelperFinder,
            final NavigationCallClassifier theClassifier,
            final RouterConfigurationReader theReader,
            final RouteMerger theMerger,
            final RouterConfigurationGenerator theGenerator,
            final CallSiteRewriter theRewriter,
            @Value("${migration.router-file:lib/generated_router.dart}")
            final String theRouterFile,
            @Value("${migration.parallelism:4}") final int theParallelism) {
        this.analyzer = theAnalyzer;
        this.helperFinder = theHelperFinder;
        this.classifier = theClassifier;
        this.reader = theReader;
        this.merger = theMerger;
        this.generator = theGenerator;
        this.rewriter = theRewriter;
        this.routerFile = Preconditions.requireNonBlank(theRouterFile,
                "Router file is required");
        Preconditions.require(theParallelism > 0,
                "Parallelism must be positive");
        this.parallelism = theParallelism;
    }

    /**
     * Migrates a Flutter project.
     *
     * @param projectRoot the project root directory
     * @param mode plan to only report, apply to write the changes
     * @return the outcome of the run
     * @throws DomainException if the project directory cannot be scanned
     */
    public MigrationResult migrate(final Path projectRoot,
            final MigrationMode mode) {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        Preconditions.requireNonNull(mode, "Mode is required");

        final FlutterProject project = FlutterProject.open(projectRoot,
                routerFile);
        final List<MigrationWarning> warnings = new ArrayList<>(
                project.warnings());
        LOG.info("Migrating {} in {} mode", project.root(), mode);

        final List<Path> files;
        try {
            files = analyzer.discoverFiles(project.root());
        } catch (final IOException e) {
            throw new DomainException("Cannot scan project "
                    + project.root() + ": " + e.getMessage(), e);
        }
        LOG.info("Found {} Dart files", files.size());

        final List<DartUnit> units = inParallel("parse", files, file -> file,
                analyzer::parse, warnings);
        final DartResolver resolver = analyzer.resolver(units,
                project.packageName(), project.libDirectory());

        final List<HelperDefinition> helpers = new ArrayList<>();
        for (final List<HelperDefinition> found : inParallel("helper discovery",
                units, DartUnit::path,
                unit -> helperFinder.find(unit, resolver), warnings)) {
            helpers.addAll(found);
        }
        LOG.info("Found {} navigation helpers", helpers.size());

        final List<DartUnit> sources = units.stream()
                .filter(unit -> !unit.path().equals(project.routerFile()))
                .toList();
        final List<CallRecord> fresh = new ArrayList<>();
        for (final List<CallRecord> found : inParallel("classification",
                sources, DartUnit::path,
                unit -> classifier.classify(unit, resolver, helpers),
                warnings)) {
            fresh.addAll(found);
        }
        LOG.info("Found {} navigation calls", fresh.size());

        final Optional<DartUnit> existing = units.stream()
                .filter(unit -> unit.path().equals(project.routerFile()))
                .findFirst();
        final ImportedRoutes imported = existing
                .map(unit -> reader.read(unit, resolver))
                .orElse(ImportedRoutes.EMPTY);

        final MergeResult merged = merger.merge(fresh, imported.routes());
        final RouteTree tree = RouteTree.build(merged.table());
        final GeneratedRouter router = generator.generate(tree,
                imported.opaqueDeclarations(), project,
                existing.map(DartUnit::source).orElse(null));
        warnings.addAll(router.warnings());
        LOG.info("{} routes in the configuration, {} retained without a"
                + " call site", merged.table().size(), merged.retainedCount());

        final List<FileRewrite> rewrites = rewrite(sources, fresh, warnings);

        final List<Path> written = new ArrayList<>();
        if (mode == MigrationMode.APPLY) {
            final String current = existing.map(DartUnit::source).orElse(null);
            if (!router.content().equals(current)) {
                write(project.routerFile(), router.content(), written,
                        warnings);
            }
            for (final FileRewrite rewrite : rewrites) {
                if (rewrite.changed()) {
                    write(rewrite.file(), rewrite.rewritten(), written,
                            warnings);
                }
            }
        }

        for (final MigrationWarning warning : warnings) {
            LOG.warn("{}", warning);
        }
        LOG.info("Migration finished: {} calls, {} files to change,"
                + " {} files written, {} warnings", fresh.size(),
                rewrites.stream().filter(FileRewrite::changed).count(),
                written.size(), warnings.size());

        return new MigrationResult(mode, project.root(),
                reports(project, fresh), diffs(project, rewrites),
                merged.retainedCount(), project.routerFile(),
                router.content(), written, warnings);
    }

    private List<FileRewrite> rewrite(final List<DartUnit> sources,
            final List<CallRecord> fresh,
            final List<MigrationWarning> warnings) {
        final Map<Path, List<CallRecord>> byFile = new LinkedHashMap<>();
        for (final CallRecord record : fresh) {
            byFile.computeIfAbsent(record.location().file(),
                    file -> new ArrayList<>()).add(record);
        }
        final List<FileRewrite> rewrites = new ArrayList<>();
        for (final DartUnit unit : sources) {
            final List<CallRecord> records = byFile.get(unit.path());
            if (records == null) {
                continue;
            }
            try {
                final FileRewrite rewrite = rewriter.rewrite(unit.path(),
                        unit.source(), records);
                warnings.addAll(rewrite.warnings());
                rewrites.add(rewrite);
            } catch (final DomainException e) {
                LOG.warn("Cannot rewrite {}: {}", unit.path(), e.getMessage());
                warnings.add(MigrationWarning.of(unit.path(),
                        "Not rewritten: " + e.getMessage()));
            }
        }
        return rewrites;
    }

    private static void write(final Path file, final String content,
            final List<Path> written, final List<MigrationWarning> warnings) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
            written.add(file);
            LOG.info("Wrote {}", file);
        } catch (final IOException e) {
            LOG.warn("Failed to write {}: {}", file, e.getMessage());
            warnings.add(MigrationWarning.of(file,
                    "Write failed: " + e.getMessage()));
        }
    }

    private static List<CallSiteReport> reports(final FlutterProject project,
            final List<CallRecord> records) {
        final List<CallSiteReport> reports = new ArrayList<>();
        for (final CallRecord record : records) {
            reports.add(new CallSiteReport(
                    project.relative(record.location().file()),
                    record.location().line(), record.kind(),
                    record.methodName(), record.destination().path(),
                    record.destinationExpression() != null
                            ? record.destinationExpression()
                            : record.originalCode()));
        }
        return reports;
    }

    private static List<FileDiff> diffs(final FlutterProject project,
            final List<FileRewrite> rewrites) {
        final List<FileDiff> diffs = new ArrayList<>();
        for (final FileRewrite rewrite : rewrites) {
            if (!rewrite.changes().isEmpty()) {
                diffs.add(new FileDiff(project.relative(rewrite.file()),
                        rewrite.changes()));
            }
        }
        return diffs;
    }

    /**
     * Runs one task per input on the worker pool and waits for all of
     * them. A failed task becomes a warning on its file and contributes
     * no result.
     *
     * @return the results of the successful tasks, in input order
     */
    private <T, R> List<R> inParallel(final String phase,
            final List<T> inputs, final FileOf<T> fileOf,
            final Task<T, R> task, final List<MigrationWarning> warnings) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        LOG.debug("Running {} on {} files", phase, inputs.size());

        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(parallelism, inputs.size()));
        try {
            final List<Future<R>> futures = new ArrayList<>(inputs.size());
            for (final T input : inputs) {
                futures.add(executor.submit(() -> task.run(input)));
            }

            final List<R> results = new ArrayList<>(inputs.size());
            for (int i = 0; i < futures.size(); i++) {
                final Path file = fileOf.fileOf(inputs.get(i));
                try {
                    results.add(futures.get(i).get());
                } catch (final ExecutionException e) {
                    final Throwable cause = e.getCause() == null
                            ? e : e.getCause();
                    LOG.warn("{} failed for {}: {}", phase, file,
                            cause.getMessage());
                    warnings.add(MigrationWarning.of(file, "Skipped, "
                            + phase + " failed: " + cause.getMessage()));
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DomainException("Interrupted during " + phase,
                            e);
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    /** One unit of parallel work. */
    @FunctionalInterface
    private interface Task<T, R> {
        R run(T input) throws Exception;
    }

    /** The file a unit of parallel work is about. */
    @FunctionalInterface
    private interface FileOf<T> {
        Path fileOf(T input);
    }

}
