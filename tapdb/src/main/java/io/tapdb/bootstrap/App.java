package io.tapdb.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.tapdb.application.service.DatabaseStatusService.TableCount;
import io.tapdb.config.SeedResult;
import io.tapdb.infrastructure.persistence.Database;
import io.tapdb.migration.SchemaMigration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point: prepares the schema, seeds templates from the config directory
 * and reports table counts.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== TAPDB Starting ===");

        EngineConfig config = EngineConfig.fromEnv();

        // Database
        HikariDataSource dataSource = createDataSource(config);
        try {
            new SchemaMigration(dataSource).migrate();

            Database database = new Database(dataSource, config.dialect(), config.actor());
            TapdbEngine engine = new TapdbEngine(database, config.sandbox());
            engine.startup();

            // Template seeding
            Path configDir = Path.of(config.configDir());
            if (Files.isDirectory(configDir)) {
                SeedResult result = database.inTransaction(config.actor(), uow ->
                    engine.templateSeeder().seedDirectory(uow, configDir, config.seedOverwrite(), config.seedStrict()));
                log.info("Seeded templates from {}: inserted={}, updated={}, skipped={}, warnings={}",
                    configDir, result.inserted(), result.updated(), result.skipped(), result.warnings().size());
            } else {
                log.info("No template config directory at {}, skipping seed", configDir);
            }

            Map<String, TableCount> counts = database.inTransaction(config.actor(),
                uow -> engine.statusService().tableCounts(uow));
            counts.forEach((table, count) ->
                log.info("  {}: live={}, total={}", table, count.live(), count.total()));

            log.info("=== TAPDB Ready ===");
        } finally {
            dataSource.close();
        }
    }

    private static HikariDataSource createDataSource(EngineConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setMaximumPoolSize(config.poolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("tapdb-hikari");

        log.info("DB: url={}, user={}, pool={}, dialect={}",
            config.dbUrl(), config.dbUser(), config.poolSize(), config.dialect());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
