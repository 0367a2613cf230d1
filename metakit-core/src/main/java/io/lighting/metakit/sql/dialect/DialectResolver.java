package io.lighting.metakit.sql.dialect;

import io.lighting.metakit.sql.Dialect;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;
import javax.sql.DataSource;

public final class DialectResolver {
    private DialectResolver() {
    }

    public static Dialect resolve(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData meta = connection.getMetaData();
            return resolve(meta.getDatabaseProductName(), meta.getDriverName(), meta.getURL());
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to resolve dialect from dataSource", ex);
        }
    }

    public static Dialect resolve(String productName, String driverName, String url) {
        String product = normalize(productName);
        String driver = normalize(driverName);
        String jdbcUrl = normalize(url);
        if (matches(product, driver, jdbcUrl, "mariadb") || matches(product, driver, jdbcUrl, "mysql")) {
            return Dialect.MYSQL;
        }
        if (matches(product, driver, jdbcUrl, "postgres")) {
            return Dialect.POSTGRESQL;
        }
        if (matches(product, driver, jdbcUrl, "sqlite")) {
            return Dialect.SQLITE;
        }
        // H2 and other LIMIT/OFFSET engines accept '?' markers and no hints.
        if (matches(product, driver, jdbcUrl, "h2")) {
            return Dialect.SQLITE;
        }
        throw new IllegalStateException("Unsupported database: " + productName);
    }

    public static Dialect parse(String name) {
        Objects.requireNonNull(name, "name");
        String value = normalize(name).trim();
        return switch (value) {
            case "mysql", "mariadb" -> Dialect.MYSQL;
            case "postgres", "postgresql", "pg" -> Dialect.POSTGRESQL;
            case "sqlite", "sqlite3" -> Dialect.SQLITE;
            default -> throw new IllegalArgumentException("Unknown dialect: " + name);
        };
    }

    private static boolean matches(String product, String driver, String url, String token) {
        return product.contains(token) || driver.contains(token) || url.contains(token);
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
