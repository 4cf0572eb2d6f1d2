package com.mediaanalytics.etl.config;

import java.util.Map;

/**
 * Connection settings for the interaction store.
 *
 * Built once at startup, usually from the process environment, and handed to
 * the connection pool explicitly.
 */
public class DatabaseConfig {
    public static final String POSTGRES_HOST = "POSTGRES_HOST";
    public static final String POSTGRES_DB = "POSTGRES_DB";
    public static final String POSTGRES_USER = "POSTGRES_USER";
    public static final String POSTGRES_PASSWORD = "POSTGRES_PASSWORD";
    public static final String POSTGRES_PORT = "POSTGRES_PORT";
    public static final String ETL_POOL_MAX_SIZE = "ETL_POOL_MAX_SIZE";

    private static final String DEFAULT_HOST = "localhost";
    private static final String DEFAULT_DATABASE = "media_analytics";
    private static final String DEFAULT_USER = "postgres";
    private static final int DEFAULT_PORT = 5432;
    private static final int DEFAULT_POOL_MAX_SIZE = 2;

    private final String host;
    private final int port;
    private final String database;
    private final String user;
    private final String password;
    private final int poolMaxSize;

    public DatabaseConfig(String host, int port, String database, String user, String password) {
        this(host, port, database, user, password, DEFAULT_POOL_MAX_SIZE);
    }

    public DatabaseConfig(String host, int port, String database, String user, String password, int poolMaxSize) {
        EnvironmentValues.requireNonBlank(POSTGRES_HOST, host);
        EnvironmentValues.requireNonBlank(POSTGRES_DB, database);
        EnvironmentValues.requireRange(POSTGRES_PORT, port, 1, 65535);
        EnvironmentValues.requireRange(ETL_POOL_MAX_SIZE, poolMaxSize, 1, 20);
        this.host = host;
        this.port = port;
        this.database = database;
        this.user = user;
        this.password = password != null ? password : "";
        this.poolMaxSize = poolMaxSize;
    }

    public static DatabaseConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static DatabaseConfig fromEnvironment(Map<String, String> env) {
        EnvironmentValues values = new EnvironmentValues(env);
        return new DatabaseConfig(
            values.getString(POSTGRES_HOST, DEFAULT_HOST),
            values.getInt(POSTGRES_PORT, DEFAULT_PORT),
            values.getString(POSTGRES_DB, DEFAULT_DATABASE),
            values.getString(POSTGRES_USER, DEFAULT_USER),
            values.getString(POSTGRES_PASSWORD, ""),
            values.getInt(ETL_POOL_MAX_SIZE, DEFAULT_POOL_MAX_SIZE));
    }

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public int getPoolMaxSize() { return poolMaxSize; }

    @Override
    public String toString() {
        return String.format("DatabaseConfig[host=%s, port=%d, database=%s, user=%s, password=%s, poolMaxSize=%d]",
            host, port, database, user, password.isEmpty() ? "<empty>" : "****", poolMaxSize);
    }
}
