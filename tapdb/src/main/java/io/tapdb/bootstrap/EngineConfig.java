package io.tapdb.bootstrap;

import io.tapdb.domain.euid.EuidEnvironment;
import io.tapdb.infrastructure.persistence.SqlDialect;
import io.tapdb.util.Env;

/**
 * Startup settings, read from environment variables or system properties.
 *
 * @param sandbox sandbox letter, required when {@code environment} is SANDBOX
 */
public record EngineConfig(
    String dbUrl,
    String dbUser,
    String dbPassword,
    int poolSize,
    SqlDialect dialect,
    String actor,
    String configDir,
    boolean seedOverwrite,
    boolean seedStrict,
    EuidEnvironment environment,
    String sandbox
) {
    public static final String DEFAULT_DB_URL = "jdbc:postgresql://localhost:5432/tapdb";
    public static final String DEFAULT_ACTOR = "tapdb";

    public EngineConfig {
        if (environment == EuidEnvironment.SANDBOX && (sandbox == null || sandbox.isBlank())) {
            throw new IllegalArgumentException("TAPDB_SANDBOX is required when TAPDB_EUID_ENVIRONMENT=SANDBOX");
        }
        if (environment == EuidEnvironment.PRODUCTION) {
            sandbox = null;
        }
    }

    public static EngineConfig fromEnv() {
        String url = Env.get("TAPDB_DB_URL", DEFAULT_DB_URL);
        SqlDialect dialect = Env.getEnum("TAPDB_DIALECT", SqlDialect.class, SqlDialect.fromJdbcUrl(url));

        return new EngineConfig(
            url,
            Env.get("TAPDB_DB_USER", "postgres"),
            Env.get("TAPDB_DB_PASS", "postgres"),
            Env.getInt("TAPDB_DB_POOL_SIZE", 10),
            dialect,
            Env.get("TAPDB_ACTOR", DEFAULT_ACTOR),
            Env.get("TAPDB_CONFIG_DIR", "config/templates"),
            Env.getBool("TAPDB_SEED_OVERWRITE", false),
            Env.getBool("TAPDB_SEED_STRICT", false),
            Env.getEnum("TAPDB_EUID_ENVIRONMENT", EuidEnvironment.class, EuidEnvironment.PRODUCTION),
            Env.get("TAPDB_SANDBOX", null)
        );
    }

    public boolean isSandbox() {
        return environment == EuidEnvironment.SANDBOX;
    }
}
