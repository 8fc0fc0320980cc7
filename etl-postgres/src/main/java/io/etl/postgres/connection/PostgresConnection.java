/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.etl.config.Configuration;
import io.etl.config.PgConnectionConfig;
import io.etl.config.TlsConfig;
import io.etl.jdbc.JdbcConfiguration;
import io.etl.jdbc.JdbcConnection;

/**
 * {@link JdbcConnection} to the Postgres instance a pipeline replicates from.
 */
public class PostgresConnection extends JdbcConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresConnection.class);

    public static final String URL_PATTERN = "jdbc:postgresql://${hostname}:${port}/${dbname}";

    static final String SSL_MODE = "sslmode";
    static final String SSL_FACTORY = "sslfactory";
    static final String SSL_FACTORY_ARG = "sslfactoryarg";

    /**
     * Validates the server certificate against a single PEM root certificate passed as {@link #SSL_FACTORY_ARG}.
     */
    static final String SINGLE_CERT_FACTORY = "org.postgresql.ssl.SingleCertValidatingFactory";

    private static final ConnectionFactory FACTORY = JdbcConnection.patternBasedFactory(URL_PATTERN);

    /**
     * The {@code sslmode} values this connection uses.
     */
    public enum SecureConnectionMode {

        /**
         * Establish an unencrypted connection
         */
        DISABLED("disable"),

        /**
         * Require TLS and verify that the server certificate chains to the trusted root and matches the host name.
         */
        VERIFY_FULL("verify-full");

        private final String value;

        SecureConnectionMode(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    public PostgresConnection(JdbcConfiguration config) {
        this(config, FACTORY);
    }

    public PostgresConnection(JdbcConfiguration config, ConnectionFactory connectionFactory) {
        super(config, connectionFactory);
    }

    /**
     * Create a connection for the given source settings. Nothing is opened until the connection is first used.
     *
     * @param config the connection settings; may not be null
     * @return the connection; never null
     */
    public static PostgresConnection forSource(PgConnectionConfig config) {
        return new PostgresConnection(jdbcConfiguration(config));
    }

    /**
     * Translate source settings into the JDBC configuration used by {@link #URL_PATTERN} and the Postgres driver.
     *
     * @param config the connection settings; may not be null
     * @return the JDBC configuration; never null
     */
    public static JdbcConfiguration jdbcConfiguration(PgConnectionConfig config) {
        Configuration.Builder builder = Configuration.create()
                .with(JdbcConfiguration.HOSTNAME, config.host())
                .with(JdbcConfiguration.PORT, config.port())
                .with(JdbcConfiguration.DATABASE, config.name())
                .with(JdbcConfiguration.USER, config.username())
                .with(JdbcConfiguration.PASSWORD, config.password());

        TlsConfig tls = config.tls();
        if (tls.enabled()) {
            builder.with(SSL_MODE, SecureConnectionMode.VERIFY_FULL.getValue())
                    .with(SSL_FACTORY, SINGLE_CERT_FACTORY)
                    .with(SSL_FACTORY_ARG, tls.trustedRootCerts());
        }
        else {
            builder.with(SSL_MODE, SecureConnectionMode.DISABLED.getValue());
        }
        JdbcConfiguration jdbcConfig = JdbcConfiguration.adapt(builder.build());
        LOGGER.debug("Using JDBC configuration {}", jdbcConfig);
        return jdbcConfig;
    }
}
