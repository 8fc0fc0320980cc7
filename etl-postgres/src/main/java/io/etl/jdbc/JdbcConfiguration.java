/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.jdbc;

import java.util.Set;

import io.etl.config.Configuration;
import io.etl.config.Field;

/**
 * Settings of a JDBC connection. {@link #HOSTNAME}, {@link #PORT} and {@link #DATABASE} fill the URL pattern; every
 * other key, including {@link #USER} and {@link #PASSWORD}, is handed to the driver as a connection property.
 */
public interface JdbcConfiguration extends Configuration {

    Field HOSTNAME = Field.create("hostname");
    Field PORT = Field.create("port");
    Field DATABASE = Field.create("dbname");
    Field USER = Field.create("user");
    Field PASSWORD = Field.create("password");

    /**
     * View {@code config} as JDBC settings.
     */
    static JdbcConfiguration adapt(Configuration config) {
        if (config instanceof JdbcConfiguration) {
            return (JdbcConfiguration) config;
        }
        return new JdbcConfiguration() {
            @Override
            public Set<String> keys() {
                return config.keys();
            }

            @Override
            public String getString(String key) {
                return config.getString(key);
            }

            @Override
            public String toString() {
                return config.toString();
            }
        };
    }

    default String hostname() {
        return getString(HOSTNAME);
    }

    default String port() {
        return getString(PORT);
    }

    default String database() {
        return getString(DATABASE);
    }

    default String user() {
        return getString(USER);
    }

    default String password() {
        return getString(PASSWORD);
    }
}
