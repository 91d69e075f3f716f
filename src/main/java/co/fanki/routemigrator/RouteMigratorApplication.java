package co.fanki.routemigrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Route Migrator Application.
 *
 * <p>Main entry point of the migrator, which moves the imperative
 * {@code Navigator} calls of a Flutter project to a declarative
 * go_router configuration. The run itself is driven by
 * {@link co.fanki.routemigrator.config.MigrationRunnerConfiguration}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class RouteMigratorApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments, as Spring properties such as
     *      {@code --migration.project-root=/path/to/app}
     */
    public static void main(final String[] args) {
        SpringApplication.run(RouteMigratorApplication.class, args);
    }

}
