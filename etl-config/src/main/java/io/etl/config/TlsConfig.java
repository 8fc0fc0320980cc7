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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.etl.annotation.Immutable;

/**
 * TLS settings for the source database connection. The trusted root certificates are PEM text, not a path.
 */
@Immutable
public final class TlsConfig {

    public static final Field ENABLED = Field.create("pg.tls.enabled")
            .withDisplayName("Enable TLS")
            .withType(Type.BOOLEAN)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(false)
            .withDescription("Whether to use a TLS connection verified against the trusted root certificates");

    public static final Field TRUSTED_ROOT_CERTS = Field.create("pg.tls.trusted.root.certs")
            .withDisplayName("Trusted root certificates")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.MEDIUM)
            .withDefault("")
            .withDescription("PEM encoded root certificate(s) the server certificate must chain to");

    private static final TlsConfig DISABLED = new TlsConfig("", false);

    @JsonProperty("trusted_root_certs")
    private final String trustedRootCerts;

    @JsonProperty("enabled")
    private final boolean enabled;

    @JsonCreator
    public TlsConfig(@JsonProperty("trusted_root_certs") String trustedRootCerts, @JsonProperty("enabled") boolean enabled) {
        this.trustedRootCerts = trustedRootCerts != null ? trustedRootCerts : "";
        this.enabled = enabled;
    }

    public static TlsConfig disabled() {
        return DISABLED;
    }

    public static TlsConfig from(Configuration config) {
        return new TlsConfig(config.getString(TRUSTED_ROOT_CERTS), config.getBoolean(ENABLED));
    }

    public String trustedRootCerts() {
        return trustedRootCerts;
    }

    public boolean enabled() {
        return enabled;
    }

    /**
     * @throws ValidationException with {@link ValidationError#MISSING_TRUSTED_ROOT_CERTS} if TLS is enabled without
     *             trusted root certificates
     */
    public void validate() {
        if (enabled && trustedRootCerts.isEmpty()) {
            throw new ValidationException(ValidationError.MISSING_TRUSTED_ROOT_CERTS);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TlsConfig that = (TlsConfig) o;
        return enabled == that.enabled && trustedRootCerts.equals(that.trustedRootCerts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trustedRootCerts, enabled);
    }

    @Override
    public String toString() {
        return "TlsConfig{enabled=" + enabled + ", trustedRootCerts=" + (trustedRootCerts.isEmpty() ? "<none>" : "<pem>") + "}";
    }
}
