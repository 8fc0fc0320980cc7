/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class PipelineConfigWithoutSecretsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void shouldDropPassword() throws Exception {
        PipelineConfigWithoutSecrets config = pipelineConfig(7L).withoutSecrets();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(config));
        assertThat(json.get("pg_connection").has("password")).isFalse();
        assertThat(mapper.writeValueAsString(config)).doesNotContain("hunter2");
        assertThat(json.get("pg_connection").get("host").asText()).isEqualTo("db.internal");
    }

    @Test
    public void shouldUseSnakeCaseNames() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(pipelineConfig(7L).withoutSecrets()));

        assertThat(json.get("id").asLong()).isEqualTo(7L);
        assertThat(json.get("publication_name").asText()).isEqualTo("orders_pub");
        assertThat(json.get("batch").get("max_size").asInt()).isEqualTo(500);
        assertThat(json.get("batch").get("max_fill_ms").asLong()).isEqualTo(2_000L);
        assertThat(json.get("table_error_retry_delay_ms").asLong()).isEqualTo(10_000L);
        assertThat(json.get("table_error_retry_max_attempts").asLong()).isEqualTo(5L);
        assertThat(json.get("max_table_sync_workers").asInt()).isEqualTo(4);
        assertThat(json.get("slot_prefix").asText()).isEqualTo("myapp");
        assertThat(json.get("pg_connection").get("tls").get("enabled").asBoolean()).isFalse();
    }

    @Test
    public void shouldReadBackWhatItWrites() throws Exception {
        PipelineConfigWithoutSecrets config = pipelineConfig(-1L).withoutSecrets();
        String json = mapper.writeValueAsString(config);

        assertThat(json).contains("\"id\":18446744073709551615");
        assertThat(mapper.readValue(json, PipelineConfigWithoutSecrets.class)).isEqualTo(config);
    }

    @Test
    public void shouldDefaultMissingSlotPrefix() throws Exception {
        String json = "{\"id\":3,\"publication_name\":\"pub\","
                + "\"pg_connection\":{\"host\":\"h\",\"port\":5432,\"name\":\"db\",\"username\":\"u\","
                + "\"tls\":{\"trusted_root_certs\":\"\",\"enabled\":false}},"
                + "\"batch\":{\"max_size\":10,\"max_fill_ms\":20},"
                + "\"table_error_retry_delay_ms\":1,\"table_error_retry_max_attempts\":2,\"max_table_sync_workers\":3}";

        PipelineConfigWithoutSecrets config = mapper.readValue(json, PipelineConfigWithoutSecrets.class);
        assertThat(config.slotPrefix()).isEqualTo(PipelineConfig.DEFAULT_SLOT_PREFIX);
        assertThat(config.id()).isEqualTo(3L);
        assertThat(config.maxTableSyncWorkers()).isEqualTo(3);
    }

    @Test
    public void shouldRejectWorkerCountAboveUnsignedShort() {
        assertRejected(document("18", "1", "2", "70000", "5432"), "max_table_sync_workers");
    }

    @Test
    public void shouldRejectNegativeWorkerCount() {
        assertRejected(document("18", "1", "2", "-1", "5432"), "max_table_sync_workers");
    }

    @Test
    public void shouldRejectNegativeRetryAttempts() {
        assertRejected(document("18", "1", "-1", "3", "5432"), "table_error_retry_max_attempts");
    }

    @Test
    public void shouldRejectRetryAttemptsAboveUnsignedInt() {
        assertRejected(document("18", "1", "4294967296", "3", "5432"), "table_error_retry_max_attempts");
    }

    @Test
    public void shouldRejectNegativeRetryDelay() {
        assertRejected(document("18", "-5", "2", "3", "5432"), "table_error_retry_delay_ms");
    }

    @Test
    public void shouldRejectIdOutsideUnsignedLong() {
        assertRejected(document("-1", "1", "2", "3", "5432"), "id");
        assertRejected(document("18446744073709551616", "1", "2", "3", "5432"), "id");
    }

    @Test
    public void shouldRejectPortAboveUnsignedShort() {
        assertRejected(document("18", "1", "2", "3", "65536"), "port");
    }

    @Test
    public void shouldRejectDocumentWithSeveralValuesOutOfRange() {
        assertThatThrownBy(() -> mapper.readValue(document("18", "-5", "-1", "70000", "5432"), PipelineConfigWithoutSecrets.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    public void shouldAcceptLargestValues() throws Exception {
        PipelineConfigWithoutSecrets config = mapper.readValue(
                document("18446744073709551615", "9223372036854775807", "4294967295", "65535", "65535"),
                PipelineConfigWithoutSecrets.class);

        assertThat(config.id()).isEqualTo(-1L);
        assertThat(config.tableErrorRetryMaxAttempts()).isEqualTo(4_294_967_295L);
        assertThat(config.maxTableSyncWorkers()).isEqualTo(65_535);
        assertThat(config.pgConnection().port()).isEqualTo(65_535);
    }

    private void assertRejected(String json, String property) {
        assertThatThrownBy(() -> mapper.readValue(json, PipelineConfigWithoutSecrets.class))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining("'" + property + "' must be an unsigned");
    }

    private static String document(String id, String delayMs, String maxAttempts, String workers, String port) {
        return "{\"id\":" + id + ",\"publication_name\":\"pub\","
                + "\"pg_connection\":{\"host\":\"h\",\"port\":" + port + ",\"name\":\"db\",\"username\":\"u\","
                + "\"tls\":{\"trusted_root_certs\":\"\",\"enabled\":false}},"
                + "\"batch\":{\"max_size\":10,\"max_fill_ms\":20},"
                + "\"table_error_retry_delay_ms\":" + delayMs + ",\"table_error_retry_max_attempts\":" + maxAttempts
                + ",\"max_table_sync_workers\":" + workers + ",\"slot_prefix\":\"myapp\"}";
    }

    private static PipelineConfig pipelineConfig(long id) {
        return new PipelineConfig(id, "orders_pub",
                new PgConnectionConfig("db.internal", 5432, "orders", "etl", "hunter2", TlsConfig.disabled()),
                new BatchConfig(500, 2_000L), 10_000L, 5L, 4, "myapp");
    }
}
