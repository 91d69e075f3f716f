package co.fanki.routemigrator.config;

import co.fanki.routemigrator.migration.application.MigrationMode;
import co.fanki.routemigrator.migration.application.MigrationReportWriter;
import co.fanki.routemigrator.migration.application.MigrationResult;
import co.fanki.routemigrator.migration.application.MigrationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for MigrationRunnerConfiguration.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MigrationRunnerConfigurationTest {

    private MigrationService migrationService;
    private MigrationReportWriter reportWriter;
    private MigrationResult result;

    @BeforeEach
    void setUp() {
        migrationService = createMock(MigrationService.class);
        reportWriter = createMock(MigrationReportWriter.class);
        result = new MigrationResult(MigrationMode.APPLY,
                Path.of("/app"), List.of(), List.of(), 0,
                Path.of("/app/lib/generated_router.dart"), "", List.of(),
                List.of());
    }

    @Test
    void whenRunning_givenReportFile_shouldMigrateAndWriteTheReport()
            throws Exception {
        expect(migrationService.migrate(Path.of("/app"), MigrationMode.APPLY))
                .andReturn(result);
        reportWriter.write(result, Path.of("/tmp/report.json"));
        expectLastCall();
        replay(migrationService, reportWriter);

        new MigrationRunnerConfiguration().migrationRunner(migrationService,
                reportWriter, "/app", "Apply", "/tmp/report.json").run();

        verify(migrationService, reportWriter);
    }

    @Test
    void whenRunning_givenNoReportFile_shouldOnlyMigrate() throws Exception {
        expect(migrationService.migrate(Path.of("."), MigrationMode.PLAN))
                .andReturn(result);
        replay(migrationService, reportWriter);

        new MigrationRunnerConfiguration().migrationRunner(migrationService,
                reportWriter, ".", "plan", "").run();

        verify(migrationService, reportWriter);
    }

    @Test
    void whenRunning_givenUnknownMode_shouldFail() {
        replay(migrationService, reportWriter);

        assertThrows(IllegalArgumentException.class, () ->
                new MigrationRunnerConfiguration().migrationRunner(
                        migrationService, reportWriter, ".", "dry-run", "")
                        .run());
    }

}
