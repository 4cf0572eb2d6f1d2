package com.mediaanalytics.etl.connection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionScopeTest {

    @Mock
    private Connection connection;

    @Test
    void testCommittedScopeDoesNotRollBack() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);

        try (TransactionScope tx = TransactionScope.begin(connection)) {
            tx.commit();
            assertThat(tx.isCommitted()).isTrue();
        }

        InOrder order = inOrder(connection);
        order.verify(connection).setAutoCommit(false);
        order.verify(connection).commit();
        order.verify(connection).setAutoCommit(true);
        verify(connection, never()).rollback();
    }

    @Test
    void testUncommittedScopeRollsBack() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);

        try (TransactionScope tx = TransactionScope.begin(connection)) {
            assertThat(tx.isCommitted()).isFalse();
        }

        verify(connection, never()).commit();
        verify(connection).rollback();
        verify(connection).setAutoCommit(true);
    }

    @Test
    void testAutoCommitRestoredWhenRollbackFails() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);
        doThrow(new SQLException("connection lost")).when(connection).rollback();

        TransactionScope tx = TransactionScope.begin(connection);

        assertThatThrownBy(tx::close).isInstanceOf(SQLException.class).hasMessage("connection lost");
        verify(connection).setAutoCommit(true);
    }

    @Test
    void testExceptionInBlockTriggersRollback() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(false);

        assertThatThrownBy(() -> {
            try (TransactionScope tx = TransactionScope.begin(connection)) {
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);

        verify(connection).rollback();
        verify(connection, never()).commit();
    }
}
