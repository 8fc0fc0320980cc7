/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.etl.annotation.Immutable;

/**
 * {@link PgConnectionConfig} without the password, safe to serialize.
 */
@Immutable
public final class PgConnectionConfigWithoutSecrets {

    @JsonProperty("host")
    private final String host;

    @JsonProperty("port")
    private final int port;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("username")
    private final String username;

    @JsonProperty("tls")
    private final TlsConfig tls;

    @JsonCreator
    public PgConnectionConfigWithoutSecrets(@JsonProperty("host") String host,
                                            @JsonProperty("port") int port,
                                            @JsonProperty("name") String name,
                                            @JsonProperty("username") String username,
                                            @JsonProperty("tls") TlsConfig tls) {
        this.host = host;
        this.port = (int) UnsignedRange.U16.require("port", port);
        this.name = name;
        this.username = username;
        this.tls = tls != null ? tls : TlsConfig.disabled();
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

    public TlsConfig tls() {
        return tls;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PgConnectionConfigWithoutSecrets that = (PgConnectionConfigWithoutSecrets) o;
        return port == that.port && Objects.equals(host, that.host) && Objects.equals(name, that.name)
                && Objects.equals(username, that.username) && tls.equals(that.tls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, name, username, tls);
    }

    @Override
    public String toString() {
        return "PgConnectionConfigWithoutSecrets{host=" + host + ", port=" + port + ", name=" + name + ", username=" + username
                + ", tls=" + tls + "}";
    }
}
