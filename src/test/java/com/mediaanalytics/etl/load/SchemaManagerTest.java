package com.mediaanalytics.etl.load;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchemaManagerTest {

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private PreparedStatement existsStatement;

    @Mock
    private ResultSet resultSet;

    private SchemaManager schemaManager;

    @BeforeEach
    void setUp() {
        schemaManager = new SchemaManager("user_interactions");
    }

    @Test
    void testEnsureSchemaCreatesPartitionedTableAndIndexes() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);

        schemaManager.ensureSchema(connection);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(statement, atLeastOnce()).execute(sql.capture());
        List<String> executed = sql.getAllValues();
        assertThat(executed.get(0))
                .startsWith("CREATE TABLE IF NOT EXISTS user_interactions (")
                .contains("PRIMARY KEY (interaction_id, event_date)")
                .endsWith("PARTITION BY RANGE (event_date)");
        assertThat(executed.subList(1, executed.size())).containsExactly(
            "CREATE INDEX IF NOT EXISTS idx_user_interactions_user_id ON user_interactions (user_id)",
            "CREATE INDEX IF NOT EXISTS idx_user_interactions_event_date ON user_interactions (event_date)",
            "CREATE INDEX IF NOT EXISTS idx_user_interactions_content_category ON user_interactions (content_category)",
            "CREATE INDEX IF NOT EXISTS idx_user_interactions_article_id ON user_interactions (article_id)");
        verify(statement).close();
    }

    @Test
    void testEnsurePartitionsCreatesOnlyMissingOnes() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(existsStatement);
        when(existsStatement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        // March exists, April does not
        when(resultSet.getBoolean(1)).thenReturn(true, false);
        when(connection.createStatement()).thenReturn(statement);

        Set<MonthlyPartition> partitions = MonthlyPartition.covering("user_interactions",
            Arrays.asList(LocalDate.of(2025, 3, 10), LocalDate.of(2025, 4, 2)));
        int created = schemaManager.ensurePartitions(connection, partitions);

        assertThat(created).isEqualTo(1);
        verify(existsStatement).setString(1, "user_interactions_2025_03");
        verify(existsStatement).setString(1, "user_interactions_2025_04");
        verify(statement).execute("CREATE TABLE IF NOT EXISTS user_interactions_2025_04 PARTITION OF user_interactions "
            + "FOR VALUES FROM ('2025-04-01') TO ('2025-05-01')");
        verify(statement).execute(
            "CREATE INDEX IF NOT EXISTS idx_user_interactions_2025_04_user_id ON user_interactions_2025_04 (user_id)");
        verify(statement).execute(
            "CREATE INDEX IF NOT EXISTS idx_user_interactions_2025_04_article_id ON user_interactions_2025_04 (article_id)");
    }

    @Test
    void testSchemaErrorIsRethrown() throws SQLException {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute(anyString())).thenThrow(new SQLException("permission denied for schema public"));

        assertThatThrownBy(() -> schemaManager.ensureSchema(connection))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("permission denied");
        verify(statement).close();
    }
}
