package co.fanki.routemigrator.config;

import co.fanki.routemigrator.migration.application.MigrationMode;
import co.fanki.routemigrator.migration.application.MigrationReportWriter;
import co.fanki.routemigrator.migration.application.MigrationResult;
import co.fanki.routemigrator.migration.application.MigrationService;
import co.fanki.routemigrator.migration.domain.LineChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Runs one migration when the application starts.
 *
 * <p>The project, the mode and the optional JSON report file come from
 * the {@code migration.*} properties. Setting
 * {@code migration.run-on-startup} to {@code false} boots the context
 * without running anything.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "migration.run-on-startup", havingValue = "true",
        matchIfMissing = true)
public class MigrationRunnerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            MigrationRunnerConfiguration.class);

    /**
     * Creates the runner of the migration.
     *
     * @param migrationService the migration service
     * @param reportWriter the report writer
     * @param projectRoot the Flutter project to migrate
     * @param mode {@code plan} or {@code apply}
     * @param reportFile where to write the JSON report, blank for none
     * @return the command line runner
     */
    @Bean
    public CommandLineRunner migrationRunner(
            final MigrationService migrationService,
            final MigrationReportWriter reportWriter,
            @Value("${migration.project-root:.}") final String projectRoot,
            @Value("${migration.mode:plan}") final String mode,
            @Value("${migration.report-file:}") final String reportFile) {
        return args -> {
            final MigrationResult result = migrationService.migrate(
                    Path.of(projectRoot), MigrationMode.fromName(mode));
            logSummary(result);
            if (reportFile != null && !reportFile.isBlank()) {
                reportWriter.write(result, Path.of(reportFile));
            }
        };
    }

    private static void logSummary(final MigrationResult result) {
        result.callsByFile().forEach((file, calls) -> {
            LOG.info("{}:", file);
            calls.forEach(call -> LOG.info("  line {}: {} {} -> {}",
                    call.line(), call.kind(), call.method(),
                    call.destination()));
        });
        if (result.mode() == MigrationMode.PLAN) {
            result.diffs().forEach(diff -> {
                LOG.info("--- {}", diff.file());
                for (final LineChange change : diff.changes()) {
                    LOG.info("  {}: - {}", change.line(), change.original());
                    LOG.info("  {}: + {}", change.line(),
                            change.replacement());
                }
            });
        }
        LOG.info("{} routes retained from the existing configuration"
                + " without a call site", result.retainedCount());
    }

}
