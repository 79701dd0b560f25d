package io.tapdb.infrastructure.persistence;

/**
 * SQL differences between the production store and the in-memory test store.
 */
public enum SqlDialect {
    POSTGRES {
        @Override
        public String nextValueSql(String sequenceName) {
            return "SELECT nextval('" + sequenceName + "')";
        }
    },
    H2 {
        @Override
        public String nextValueSql(String sequenceName) {
            return "SELECT NEXT VALUE FOR " + sequenceName;
        }
    };

    public abstract String nextValueSql(String sequenceName);

    public String createSequenceSql(String sequenceName) {
        return "CREATE SEQUENCE IF NOT EXISTS " + sequenceName + " START WITH 1 INCREMENT BY 1";
    }

    /** Guess the dialect from a JDBC URL; anything unknown is treated as PostgreSQL. */
    public static SqlDialect fromJdbcUrl(String jdbcUrl) {
        return jdbcUrl != null && jdbcUrl.startsWith("jdbc:h2:") ? H2 : POSTGRES;
    }
}
