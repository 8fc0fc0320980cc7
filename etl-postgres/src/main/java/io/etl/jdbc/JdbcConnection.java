/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.etl.EtlException;
import io.etl.annotation.NotThreadSafe;
import io.etl.config.Configuration;
import io.etl.config.Field;

/**
 * A lazily opened JDBC connection. The connection is opened on first use and reopened after {@link #close()}.
 */
@NotThreadSafe
public class JdbcConnection implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcConnection.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private static final Field[] URL_FIELDS = { JdbcConfiguration.HOSTNAME, JdbcConfiguration.PORT, JdbcConfiguration.DATABASE };

    /**
     * Opens connections.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection connect(JdbcConfiguration config) throws SQLException;
    }

    @FunctionalInterface
    public interface StatementPreparer {
        void accept(PreparedStatement statement) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetMapper<T> {
        T apply(ResultSet rs) throws SQLException;
    }

    /**
     * A factory that opens {@link #url(String, JdbcConfiguration) the URL} built from {@code urlPattern} through
     * {@link DriverManager}, passing the settings the URL does not use as driver properties.
     */
    public static ConnectionFactory patternBasedFactory(String urlPattern) {
        return config -> {
            String url = url(urlPattern, config);
            Properties props = config.asProperties();
            for (Field field : URL_FIELDS) {
                props.remove(field.name());
            }
            LOGGER.debug("Connecting to {} as {}", url, config.user());
            return DriverManager.getConnection(url, props);
        };
    }

    /**
     * Replace {@code ${hostname}}, {@code ${port}} and {@code ${dbname}} in {@code urlPattern}. Placeholders without a
     * value are left as they are.
     */
    public static String url(String urlPattern, JdbcConfiguration config) {
        String url = urlPattern;
        for (Field field : URL_FIELDS) {
            String value = config.getString(field);
            if (value != null) {
                url = url.replace("${" + field.name() + "}", value);
            }
        }
        return url;
    }

    private final JdbcConfiguration config;
    private final ConnectionFactory factory;
    private Connection conn;

    public JdbcConnection(Configuration config, ConnectionFactory factory) {
        this.config = JdbcConfiguration.adapt(Objects.requireNonNull(config, "config"));
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public JdbcConfiguration config() {
        return config;
    }

    /**
     * @return the open connection, opening one first if there is none
     * @throws SQLException if a connection cannot be opened
     */
    public synchronized Connection connection() throws SQLException {
        if (conn == null || conn.isClosed()) {
            conn = factory.connect(config);
            if (conn == null || conn.isClosed()) {
                throw new SQLException("Unable to obtain a JDBC connection");
            }
        }
        return conn;
    }

    /**
     * Run each statement in turn on one {@link Statement}, committing afterwards unless the connection auto-commits.
     */
    public JdbcConnection execute(String... sqlStatements) throws SQLException {
        Connection connection = connection();
        try (Statement statement = connection.createStatement()) {
            for (String sql : sqlStatements) {
                LOGGER.trace("Executing '{}'", sql);
                statement.execute(sql);
            }
        }
        if (!connection.getAutoCommit()) {
            connection.commit();
        }
        return this;
    }

    /**
     * Run a query with bound parameters and map its rows.
     *
     * @return whatever {@code mapper} returns
     */
    public <T> T prepareQueryAndMap(String sql, StatementPreparer preparer, ResultSetMapper<T> mapper) throws SQLException {
        Objects.requireNonNull(mapper, "mapper");
        try (PreparedStatement statement = connection().prepareStatement(sql)) {
            preparer.accept(statement);
            LOGGER.trace("Executing '{}'", sql);
            try (ResultSet rs = statement.executeQuery()) {
                return mapper.apply(rs);
            }
        }
    }

    /**
     * Close the connection, if open. A close that does not finish within ten seconds is abandoned and the connection
     * aborted.
     */
    @Override
    public synchronized void close() throws SQLException {
        if (conn == null) {
            return;
        }
        Connection closing = conn;
        conn = null;

        ExecutorService closer = Executors.newSingleThreadExecutor();
        try {
            Future<?> closed = closer.submit(() -> {
                closing.close();
                return null;
            });
            closed.get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            LOGGER.debug("Closed JDBC connection");
        }
        catch (TimeoutException e) {
            LOGGER.warn("JDBC connection did not close within {}, aborting it", CLOSE_TIMEOUT);
            closing.abort(Runnable::run);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while closing JDBC connection, aborting it");
            closing.abort(Runnable::run);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SQLException) {
                throw (SQLException) cause;
            }
            throw new EtlException("Failed to close JDBC connection", cause);
        }
        finally {
            closer.shutdownNow();
        }
    }
}
