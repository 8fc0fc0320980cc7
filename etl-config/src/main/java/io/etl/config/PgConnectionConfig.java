/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.util.Objects;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.etl.annotation.Immutable;

/**
 * Connection settings of the Postgres instance a pipeline replicates from. Holds the password, so it is never
 * serialized; use {@link PgConnectionConfigWithoutSecrets} for that.
 */
@Immutable
public final class PgConnectionConfig {

    public static final int DEFAULT_PORT = 5432;

    public static final Field HOST = Field.create("pg.host")
            .withDisplayName("Hostname")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("Resolvable hostname or IP address of the database server.");

    public static final Field PORT = Field.create("pg.port")
            .withDisplayName("Port")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDefault(DEFAULT_PORT)
            .withValidation(Field.UNSIGNED_SHORT)
            .withDescription("Port of the database server.");

    public static final Field NAME = Field.create("pg.name")
            .withDisplayName("Database")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("The name of the database from which the pipeline should capture changes");

    public static final Field USERNAME = Field.create("pg.username")
            .withDisplayName("User")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .required()
            .withDescription("Name of the database user to be used when connecting to the database.");

    public static final Field PASSWORD = Field.create("pg.password")
            .withDisplayName("Password")
            .withType(Type.PASSWORD)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Password of the database user to be used when connecting to the database.");

    private final String host;
    private final int port;
    private final String name;
    private final String username;
    private final String password;
    private final TlsConfig tls;

    public PgConnectionConfig(String host, int port, String name, String username, String password, TlsConfig tls) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = (int) UnsignedRange.U16.require("port", port);
        this.name = Objects.requireNonNull(name, "name");
        this.username = Objects.requireNonNull(username, "username");
        this.password = password;
        this.tls = tls != null ? tls : TlsConfig.disabled();
    }

    public static PgConnectionConfig from(Configuration config) {
        return new PgConnectionConfig(
                config.getString(HOST),
                config.getInteger(PORT),
                config.getString(NAME),
                config.getString(USERNAME),
                config.getString(PASSWORD),
                TlsConfig.from(config));
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String name() {
        return name;
    }

    public String username() {
        return username;
    }

    /**
     * @return the password, or {@code null} if none is configured
     */
    public String password() {
        return password;
    }

    public TlsConfig tls() {
        return tls;
    }

    public PgConnectionConfigWithoutSecrets withoutSecrets() {
        return new PgConnectionConfigWithoutSecrets(host, port, name, username, tls);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PgConnectionConfig that = (PgConnectionConfig) o;
        return port == that.port && host.equals(that.host) && name.equals(that.name) && username.equals(that.username)
                && Objects.equals(password, that.password) && tls.equals(that.tls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, name, username, tls);
    }

    @Override
    public String toString() {
        return "PgConnectionConfig{host=" + host + ", port=" + port + ", name=" + name + ", username=" + username
                + ", password=" + (password != null ? Configuration.MASKED_VALUE : null) + ", tls=" + tls + "}";
    }
}
