/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.replication;

import java.util.Objects;

import io.etl.annotation.Immutable;
import io.etl.postgres.types.TableId;
import io.etl.util.Strings;

/**
 * The identity of a replication slot owned by a pipeline. A slot belongs either to the pipeline's apply worker or to
 * the table sync worker copying one table, and its name is derived from that identity:
 * <ul>
 * <li>apply: {@code <prefix>_apply_<pipeline id>}</li>
 * <li>table sync: {@code <prefix>_table_sync_<pipeline id>_<table id>}</li>
 * </ul>
 * Pipeline ids are unsigned 64-bit values held in a {@code long}. Names are measured in UTF-8 bytes and may not be
 * longer than {@link #MAX_SLOT_NAME_LENGTH}; they are never truncated.
 * <p>
 * {@link #parse(String)} reverses {@link #slotName()} for every slot whose prefix contains neither {@code _apply_} nor
 * {@code _table_sync_} when followed by an underscore.
 */
@Immutable
public abstract class EtlReplicationSlot {

    /**
     * Maximum length of a Postgres replication slot name, in bytes.
     */
    public static final int MAX_SLOT_NAME_LENGTH = 63;

    static final String APPLY_DELIMITER = "_apply_";
    static final String TABLE_SYNC_DELIMITER = "_table_sync_";

    /**
     * Branches on the kind of slot.
     *
     * @param <R> the result type
     */
    public interface Visitor<R> {
        R visitApply(Apply slot);

        R visitTableSync(TableSync slot);
    }

    private static final Visitor<String> NAME_RENDERER = new Visitor<String>() {
        @Override
        public String visitApply(Apply slot) {
            return applyName(slot.pipelineId(), slot.slotPrefix());
        }

        @Override
        public String visitTableSync(TableSync slot) {
            return tableSyncNamePrefix(slot.pipelineId(), slot.slotPrefix()) + slot.tableId();
        }
    };

    private final long pipelineId;
    private final String slotPrefix;

    private EtlReplicationSlot(long pipelineId, String slotPrefix) {
        this.pipelineId = pipelineId;
        this.slotPrefix = Objects.requireNonNull(slotPrefix, "slotPrefix");
    }

    public static Apply forApplyWorker(long pipelineId, String slotPrefix) {
        return new Apply(pipelineId, slotPrefix);
    }

    public static TableSync forTableSyncWorker(long pipelineId, TableId tableId, String slotPrefix) {
        return new TableSync(pipelineId, tableId, slotPrefix);
    }

    /**
     * @return the pipeline id; an unsigned 64-bit value
     */
    public long pipelineId() {
        return pipelineId;
    }

    public String slotPrefix() {
        return slotPrefix;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Encode this identity as a slot name.
     *
     * @return the slot name; never null
     * @throws InvalidSlotNameLengthException if the name would be longer than {@link #MAX_SLOT_NAME_LENGTH} bytes
     */
    public String slotName() {
        String name = accept(NAME_RENDERER);
        if (Strings.utf8Length(name) > MAX_SLOT_NAME_LENGTH) {
            throw new InvalidSlotNameLengthException(name);
        }
        return name;
    }

    /**
     * Decode a slot name. The first {@code _apply_} decides the kind if present; otherwise the first
     * {@code _table_sync_} does, and the pipeline and table ids are split at the last underscore after it.
     *
     * @param slotName the slot name; may not be null
     * @return the slot identity; never null
     * @throws InvalidSlotNameException if the name does not follow either naming scheme or an id does not fit its type
     */
    public static EtlReplicationSlot parse(String slotName) {
        int applyAt = slotName.indexOf(APPLY_DELIMITER);
        if (applyAt >= 0) {
            String prefix = slotName.substring(0, applyAt);
            String pipelineId = slotName.substring(applyAt + APPLY_DELIMITER.length());
            return new Apply(parsePipelineId(pipelineId, slotName), prefix);
        }

        int tableSyncAt = slotName.indexOf(TABLE_SYNC_DELIMITER);
        if (tableSyncAt >= 0) {
            String prefix = slotName.substring(0, tableSyncAt);
            String ids = slotName.substring(tableSyncAt + TABLE_SYNC_DELIMITER.length());
            int split = ids.lastIndexOf('_');
            if (split < 0) {
                throw new InvalidSlotNameException(slotName);
            }
            long pipelineId = parsePipelineId(ids.substring(0, split), slotName);
            TableId tableId;
            try {
                tableId = TableId.parse(ids.substring(split + 1));
            }
            catch (NumberFormatException e) {
                throw new InvalidSlotNameException(slotName);
            }
            return new TableSync(pipelineId, tableId, prefix);
        }

        throw new InvalidSlotNameException(slotName);
    }

    /**
     * The name of the apply slot of a pipeline, also usable to look it up.
     *
     * @return {@code <slotPrefix>_apply_<pipelineId>}
     * @throws InvalidSlotNameLengthException if the result is {@link #MAX_SLOT_NAME_LENGTH} bytes or longer
     */
    public static String applyPrefix(long pipelineId, String slotPrefix) {
        return checkedPrefix(applyName(pipelineId, slotPrefix));
    }

    /**
     * The common start of the names of all table sync slots of a pipeline.
     *
     * @return {@code <slotPrefix>_table_sync_<pipelineId>_}
     * @throws InvalidSlotNameLengthException if the result is {@link #MAX_SLOT_NAME_LENGTH} bytes or longer
     */
    public static String tableSyncPrefix(long pipelineId, String slotPrefix) {
        return checkedPrefix(tableSyncNamePrefix(pipelineId, slotPrefix));
    }

    // a name prefix must leave room for at least one more byte
    private static String checkedPrefix(String prefix) {
        if (Strings.utf8Length(prefix) >= MAX_SLOT_NAME_LENGTH) {
            throw new InvalidSlotNameLengthException(prefix);
        }
        return prefix;
    }

    private static String applyName(long pipelineId, String slotPrefix) {
        return slotPrefix + APPLY_DELIMITER + Long.toUnsignedString(pipelineId);
    }

    private static String tableSyncNamePrefix(long pipelineId, String slotPrefix) {
        return slotPrefix + TABLE_SYNC_DELIMITER + Long.toUnsignedString(pipelineId) + "_";
    }

    private static long parsePipelineId(String text, String slotName) {
        try {
            return Long.parseUnsignedLong(text);
        }
        catch (NumberFormatException e) {
            throw new InvalidSlotNameException(slotName);
        }
    }

    @Override
    public String toString() {
        return accept(NAME_RENDERER);
    }

    /**
     * The slot used by a pipeline's apply worker.
     */
    public static final class Apply extends EtlReplicationSlot {

        private Apply(long pipelineId, String slotPrefix) {
            super(pipelineId, slotPrefix);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitApply(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (obj instanceof Apply) {
                Apply that = (Apply) obj;
                return pipelineId() == that.pipelineId() && slotPrefix().equals(that.slotPrefix());
            }
            return false;
        }

        @Override
        public int hashCode() {
            return Objects.hash("apply", pipelineId(), slotPrefix());
        }
    }

    /**
     * The slot used by the table sync worker of one table of a pipeline.
     */
    public static final class TableSync extends EtlReplicationSlot {

        private final TableId tableId;

        private TableSync(long pipelineId, TableId tableId, String slotPrefix) {
            super(pipelineId, slotPrefix);
            this.tableId = Objects.requireNonNull(tableId, "tableId");
        }

        public TableId tableId() {
            return tableId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTableSync(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (obj instanceof TableSync) {
                TableSync that = (TableSync) obj;
                return pipelineId() == that.pipelineId() && tableId.equals(that.tableId) && slotPrefix().equals(that.slotPrefix());
            }
            return false;
        }

        @Override
        public int hashCode() {
            return Objects.hash("table_sync", pipelineId(), tableId, slotPrefix());
        }
    }
}
