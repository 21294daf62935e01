package com.studentcrud.config;

import java.util.function.Function;

/**
 * Connection parameters for the students database.
 *
 * Resolved once at startup from the PG* keys and injected wherever a connection is built.
 */
public record DatabaseSettings(
    String host,
    int port,
    String database,
    String user,
    String password
) {

    public static final String HOST_KEY = "PGHOST";
    public static final String PORT_KEY = "PGPORT";
    public static final String DATABASE_KEY = "PGDATABASE";
    public static final String USER_KEY = "PGUSER";
    public static final String PASSWORD_KEY = "PGPASSWORD";

    static final String DEFAULT_HOST = "localhost";
    static final int DEFAULT_PORT = 5432;
    static final String DEFAULT_DATABASE = "postgres";
    static final String DEFAULT_USER = "postgres";
    static final String DEFAULT_PASSWORD = "postgres";

    /**
     * Resolve settings through the given lookup (environment, system properties, ...).
     * Absent or empty values take the default; a port that is present but not numeric
     * is rejected rather than defaulted.
     *
     * @throws IllegalStateException if PGPORT is not an integer
     */
    public static DatabaseSettings resolve(Function<String, String> lookup) {
        return new DatabaseSettings(
                valueOrDefault(lookup, HOST_KEY, DEFAULT_HOST),
                parsePort(lookup.apply(PORT_KEY)),
                valueOrDefault(lookup, DATABASE_KEY, DEFAULT_DATABASE),
                valueOrDefault(lookup, USER_KEY, DEFAULT_USER),
                valueOrDefault(lookup, PASSWORD_KEY, DEFAULT_PASSWORD));
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    private static String valueOrDefault(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        return (value == null || value.isBlank()) ? defaultValue : value.trim();
    }

    private static int parsePort(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_PORT;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(PORT_KEY + " must be an integer but was '" + raw + "'", e);
        }
    }

    // Keep the password out of logs.
    @Override
    public String toString() {
        return "DatabaseSettings[host=" + host + ", port=" + port + ", database=" + database
                + ", user=" + user + ", password=****]";
    }
}
