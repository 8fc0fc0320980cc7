/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.replication;

import java.util.Objects;

import io.etl.annotation.Immutable;
import io.etl.postgres.types.TableId;

/**
 * The role of a replication worker: the single apply worker of a pipeline, or the table sync worker of one table.
 */
@Immutable
public abstract class WorkerType {

    private static final Apply APPLY = new Apply();

    /**
     * Branches on the kind of worker.
     *
     * @param <R> the result type
     */
    public interface Visitor<R> {
        R visitApply(Apply worker);

        R visitTableSync(TableSync worker);
    }

    private WorkerType() {
    }

    public static Apply apply() {
        return APPLY;
    }

    public static TableSync tableSync(TableId tableId) {
        return new TableSync(tableId);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * The identity of the replication slot this worker uses. No name is computed, so this never fails.
     *
     * @param pipelineId the pipeline id; an unsigned 64-bit value
     * @param slotPrefix the slot prefix; may not be null
     * @return the slot identity; never null
     */
    public EtlReplicationSlot buildEtlReplicationSlot(long pipelineId, String slotPrefix) {
        return accept(new Visitor<EtlReplicationSlot>() {
            @Override
            public EtlReplicationSlot visitApply(Apply worker) {
                return EtlReplicationSlot.forApplyWorker(pipelineId, slotPrefix);
            }

            @Override
            public EtlReplicationSlot visitTableSync(TableSync worker) {
                return EtlReplicationSlot.forTableSyncWorker(pipelineId, worker.tableId(), slotPrefix);
            }
        });
    }

    public static final class Apply extends WorkerType {

        private Apply() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitApply(this);
        }

        @Override
        public String toString() {
            return "Apply";
        }
    }

    public static final class TableSync extends WorkerType {

        private final TableId tableId;

        private TableSync(TableId tableId) {
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
                return tableId.equals(((TableSync) obj).tableId);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return tableId.hashCode();
        }

        @Override
        public String toString() {
            return "TableSync{tableId=" + tableId + "}";
        }
    }
}
