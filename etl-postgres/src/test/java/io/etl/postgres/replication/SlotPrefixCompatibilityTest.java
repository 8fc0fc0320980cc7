/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.replication;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import io.etl.config.BatchConfig;
import io.etl.config.PgConnectionConfig;
import io.etl.config.PipelineConfig;
import io.etl.config.TlsConfig;
import io.etl.config.ValidationException;
import io.etl.postgres.types.TableId;

/**
 * Slot prefixes accepted by pipeline configuration produce slot names that fit and decode back.
 */
public class SlotPrefixCompatibilityTest {

    private static final String[] ACCEPTED = {
            PipelineConfig.DEFAULT_SLOT_PREFIX,
            "abcdefghijklmnopqrst",
            "apply",
            "table_sync",
            "apply_x",
            "my_table_syncs",
            "_",
            "__",
            "a_",
            "éééééééééé"
    };

    private static final String[] REJECTED = {
            "x_apply",
            "x_apply_y",
            "x_apply_",
            "_apply",
            "x_table_sync",
            "a_table_sync_b"
    };

    @Test
    public void shouldRoundTripEveryAcceptedPrefix() {
        for (String prefix : ACCEPTED) {
            pipelineConfig(prefix).validate();

            EtlReplicationSlot apply = EtlReplicationSlot.forApplyWorker(-1L, prefix);
            assertThat(EtlReplicationSlot.parse(apply.slotName())).as(prefix).isEqualTo(apply);

            EtlReplicationSlot tableSync = EtlReplicationSlot.forTableSyncWorker(-1L, TableId.of(TableId.MAX_VALUE), prefix);
            assertThat(EtlReplicationSlot.parse(tableSync.slotName())).as(prefix).isEqualTo(tableSync);
        }
    }

    @Test
    public void shouldRejectPrefixesThatBreakDecoding() {
        for (String prefix : REJECTED) {
            assertThatThrownBy(() -> pipelineConfig(prefix).validate()).as(prefix).isInstanceOf(ValidationException.class);
        }
    }

    @Test
    public void shouldShowWhyCollidingPrefixesAreRejected() {
        EtlReplicationSlot slot = EtlReplicationSlot.forTableSyncWorker(1, TableId.of(2), "a_table_sync_b");
        assertThatThrownBy(() -> EtlReplicationSlot.parse(slot.slotName())).isInstanceOf(InvalidSlotNameException.class);
    }

    private static PipelineConfig pipelineConfig(String slotPrefix) {
        return new PipelineConfig(1L, "pub",
                new PgConnectionConfig("localhost", 5432, "db", "user", null, TlsConfig.disabled()),
                new BatchConfig(100, 100L), 1_000L, 3L, 2, slotPrefix);
    }
}
