/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.etl.postgres.replication;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import io.etl.config.Configuration;
import io.etl.jdbc.JdbcConnection;
import io.etl.postgres.types.TableId;

public class ReplicationSlotsTest {

    private Connection connection;
    private PreparedStatement statement;
    private ResultSet resultSet;
    private Array array;
    private JdbcConnection jdbc;

    @Before
    public void beforeEach() throws SQLException {
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        resultSet = mock(ResultSet.class);
        array = mock(Array.class);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(connection.createArrayOf(eq("text"), any(Object[].class))).thenReturn(array);
        when(statement.executeQuery()).thenReturn(resultSet);
        jdbc = new JdbcConnection(Configuration.create().build(), config -> connection);
    }

    @Test
    public void shouldComputeApplySlotFirstThenTableSyncSlots() {
        assertThat(ReplicationSlots.pipelineSlotNames(1, Arrays.asList(TableId.of(20), TableId.of(10), TableId.of(20)), "supabase_etl"))
                .containsExactly("supabase_etl_apply_1", "supabase_etl_table_sync_1_20", "supabase_etl_table_sync_1_10");
    }

    @Test
    public void shouldLeaveOutNamesThatAreTooLong() {
        // 50 + "_apply_1" fits, 50 + "_table_sync_1_7" does not
        String prefix = "p".repeat(50);
        assertThat(ReplicationSlots.pipelineSlotNames(1, Collections.singletonList(TableId.of(7)), prefix))
                .containsExactly(prefix + "_apply_1");
    }

    @Test
    public void shouldDropInactiveSlotsInOneStatement() throws SQLException {
        when(resultSet.next()).thenReturn(true, true, false);

        ReplicationSlots.deletePipelineReplicationSlots(jdbc, 7, Arrays.asList(TableId.of(1), TableId.of(2)), "supabase_etl");

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertThat(sql.getValue()).isEqualTo(ReplicationSlots.DROP_INACTIVE_SLOTS).contains("r.active = false");

        ArgumentCaptor<Object[]> names = ArgumentCaptor.forClass(Object[].class);
        verify(connection).createArrayOf(eq("text"), names.capture());
        assertThat(names.getValue()).containsExactly(
                "supabase_etl_apply_7", "supabase_etl_table_sync_7_1", "supabase_etl_table_sync_7_2");

        verify(statement).setArray(1, array);
        verify(statement).close();
        verify(resultSet).close();
        verify(array).free();
    }

    @Test
    public void shouldIssueStatementForApplySlotWhenThereAreNoTables() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        ReplicationSlots.deletePipelineReplicationSlots(jdbc, 7, Collections.emptyList(), "supabase_etl");

        ArgumentCaptor<Object[]> names = ArgumentCaptor.forClass(Object[].class);
        verify(connection).createArrayOf(eq("text"), names.capture());
        assertThat(names.getValue()).containsExactly("supabase_etl_apply_7");
        verify(statement).executeQuery();
    }

    @Test
    public void shouldSucceedWhenRunAgain() throws SQLException {
        when(resultSet.next()).thenReturn(true, false, false);

        ReplicationSlots.deletePipelineReplicationSlots(jdbc, 7, Collections.singletonList(TableId.of(1)), "supabase_etl");
        ReplicationSlots.deletePipelineReplicationSlots(jdbc, 7, Collections.singletonList(TableId.of(1)), "supabase_etl");

        verify(statement, times(2)).executeQuery();
        verify(array, times(2)).free();
    }

    @Test
    public void shouldPropagateDatabaseErrorsAndReleaseArray() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("permission denied"));

        assertThatThrownBy(() -> ReplicationSlots.deletePipelineReplicationSlots(jdbc, 7, Collections.emptyList(), "supabase_etl"))
                .isInstanceOf(SQLException.class)
                .hasMessage("permission denied");
        verify(array).free();
        verify(statement).close();
    }

    @Test
    public void shouldFindPipelineSlots() throws SQLException {
        when(resultSet.next()).thenReturn(true, true, true, false);
        when(resultSet.getString(1)).thenReturn("supabase_etl_apply_7", "supabase_etl_table_sync_7_12", "supabase_etl_table_sync_7_x");

        List<EtlReplicationSlot> slots = ReplicationSlots.findPipelineReplicationSlots(jdbc, 7, "supabase_etl");

        assertThat(slots).containsExactly(
                EtlReplicationSlot.forApplyWorker(7, "supabase_etl"),
                EtlReplicationSlot.forTableSyncWorker(7, TableId.of(12), "supabase_etl"));
        verify(connection).prepareStatement(ReplicationSlots.SELECT_PIPELINE_SLOTS);
        verify(statement).setString(1, "supabase_etl_apply_7");
        verify(statement).setString(2, "supabase_etl_table_sync_7_");
    }

    @Test
    public void shouldBindNullForPrefixThatCannotMatch() throws SQLException {
        // 50 + "_apply_7" is 58 bytes, 50 + "_table_sync_7_" is 64 bytes
        String prefix = "p".repeat(50);
        when(resultSet.next()).thenReturn(false);

        assertThat(ReplicationSlots.findPipelineReplicationSlots(jdbc, 7, prefix)).isEmpty();

        verify(statement).setString(1, prefix + "_apply_7");
        verify(statement).setNull(2, Types.VARCHAR);
    }

    @Test
    public void shouldNotQueryWhenNoSlotCanMatch() throws SQLException {
        assertThat(ReplicationSlots.findPipelineReplicationSlots(jdbc, 7, "p".repeat(60))).isEmpty();
        verify(connection, never()).prepareStatement(anyString());
    }
}
