/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.replication;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.etl.annotation.ThreadSafe;
import io.etl.jdbc.JdbcConnection;
import io.etl.postgres.types.TableId;

/**
 * Catalog operations on the replication slots owned by a pipeline.
 */
@ThreadSafe
public final class ReplicationSlots {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicationSlots.class);

    static final String DROP_INACTIVE_SLOTS = "select pg_drop_replication_slot(r.slot_name) from pg_replication_slots r "
            + "where r.slot_name = any(?) and r.active = false";

    static final String SELECT_PIPELINE_SLOTS = "select r.slot_name from pg_replication_slots r "
            + "where r.slot_name = ? or starts_with(r.slot_name, ?) order by r.slot_name";

    private ReplicationSlots() {
    }

    /**
     * Compute the names of the apply slot and of the table sync slots of the given tables. Slots whose name would be
     * too long are left out.
     *
     * @param pipelineId the pipeline id; an unsigned 64-bit value
     * @param tableIds the tables whose table sync slots are included; may be empty
     * @param slotPrefix the slot prefix; may not be null
     * @return the names in encounter order, apply slot first; never null
     */
    public static Set<String> pipelineSlotNames(long pipelineId, Collection<TableId> tableIds, String slotPrefix) {
        Set<String> names = new LinkedHashSet<>();
        addSlotName(names, EtlReplicationSlot.forApplyWorker(pipelineId, slotPrefix));
        for (TableId tableId : tableIds) {
            addSlotName(names, EtlReplicationSlot.forTableSyncWorker(pipelineId, tableId, slotPrefix));
        }
        return names;
    }

    private static void addSlotName(Set<String> names, EtlReplicationSlot slot) {
        try {
            names.add(slot.slotName());
        }
        catch (EtlReplicationSlotException e) {
            LOGGER.debug("Skipping replication slot {}: {}", slot, e.getMessage());
        }
    }

    /**
     * Drop the apply slot and the table sync slots of the given tables in a single statement. Slots that are in use
     * are left alone, as are slots that do not exist. Running it again with the same arguments drops nothing.
     *
     * @param connection the connection to the source database; may not be null
     * @param pipelineId the pipeline id; an unsigned 64-bit value
     * @param tableIds the tables whose table sync slots should be dropped; may be empty
     * @param slotPrefix the slot prefix; may not be null
     * @throws SQLException if the statement fails
     */
    public static void deletePipelineReplicationSlots(JdbcConnection connection, long pipelineId, Collection<TableId> tableIds,
                                                      String slotPrefix)
            throws SQLException {
        Set<String> names = pipelineSlotNames(pipelineId, tableIds, slotPrefix);
        LOGGER.debug("Dropping inactive replication slots {} of pipeline {}", names, Long.toUnsignedString(pipelineId));

        Array slotNames = connection.connection().createArrayOf("text", names.toArray(new String[0]));
        try {
            int dropped = connection.prepareQueryAndMap(DROP_INACTIVE_SLOTS,
                    statement -> statement.setArray(1, slotNames),
                    rs -> {
                        int rows = 0;
                        while (rs.next()) {
                            rows++;
                        }
                        return rows;
                    });
            LOGGER.info("Dropped {} replication slot(s) of pipeline {}", dropped, Long.toUnsignedString(pipelineId));
        }
        finally {
            slotNames.free();
        }
    }

    /**
     * Find the replication slots of a pipeline that currently exist, whether active or not. Names that match the
     * pipeline's prefixes but do not decode are skipped.
     *
     * @param connection the connection to the source database; may not be null
     * @param pipelineId the pipeline id; an unsigned 64-bit value
     * @param slotPrefix the slot prefix; may not be null
     * @return the slots ordered by name; never null
     * @throws SQLException if the query fails
     */
    public static List<EtlReplicationSlot> findPipelineReplicationSlots(JdbcConnection connection, long pipelineId, String slotPrefix)
            throws SQLException {
        String applyName = prefixOrNull(() -> EtlReplicationSlot.applyPrefix(pipelineId, slotPrefix));
        String tableSyncPrefix = prefixOrNull(() -> EtlReplicationSlot.tableSyncPrefix(pipelineId, slotPrefix));
        if (applyName == null && tableSyncPrefix == null) {
            return Collections.emptyList();
        }

        return connection.prepareQueryAndMap(SELECT_PIPELINE_SLOTS,
                statement -> {
                    setStringOrNull(statement, 1, applyName);
                    setStringOrNull(statement, 2, tableSyncPrefix);
                },
                rs -> {
                    List<EtlReplicationSlot> slots = new ArrayList<>();
                    while (rs.next()) {
                        String name = rs.getString(1);
                        try {
                            slots.add(EtlReplicationSlot.parse(name));
                        }
                        catch (InvalidSlotNameException e) {
                            LOGGER.debug("Ignoring replication slot '{}' that does not decode", name);
                        }
                    }
                    return slots;
                });
    }

    private static void setStringOrNull(PreparedStatement statement, int index, String value) throws SQLException {
        if (value != null) {
            statement.setString(index, value);
        }
        else {
            statement.setNull(index, Types.VARCHAR);
        }
    }

    private static String prefixOrNull(Supplier<String> prefix) {
        try {
            return prefix.get();
        }
        catch (InvalidSlotNameLengthException e) {
            LOGGER.debug("Slot name prefix '{}' is too long to match any slot", e.slotName());
            return null;
        }
    }
}
