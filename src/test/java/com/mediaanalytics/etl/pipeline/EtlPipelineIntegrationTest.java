package com.mediaanalytics.etl.pipeline;

import com.mediaanalytics.etl.config.DatabaseConfig;
import com.mediaanalytics.etl.config.PipelineConfig;
import com.mediaanalytics.etl.connection.PostgresConnection;
import com.mediaanalytics.etl.testutil.InteractionFixtures;
import com.mediaanalytics.etl.transform.InteractionIdPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class EtlPipelineIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
            .withDatabaseName("media_analytics")
            .withUsername("testuser")
            .withPassword("testpass");

    @TempDir
    Path dataDir;

    private PostgresConnection database;

    @BeforeEach
    void setUp() {
        database = new PostgresConnection(new DatabaseConfig(
            postgres.getHost(),
            postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT),
            postgres.getDatabaseName(),
            postgres.getUsername(),
            postgres.getPassword()));
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void testRunTwiceOverSameInput() throws Exception {
        writeInput("day1.json", "["
            + InteractionFixtures.rawRecordJson("i1", "u1", "2025-03-01T10:00:00Z") + ","
            + InteractionFixtures.rawRecordJson("i2", "u2", "2025-03-01T11:00:00Z") + "]");
        writeInput("day2.json", InteractionFixtures.rawRecordJson("i3", "u3", "2025-04-02T09:15:00Z") + "\n");
        writeInput("garbage.json", "[{\"interaction_id\": ");
        EtlPipeline pipeline = new EtlPipeline(database,
            new PipelineConfig("pipeline_interactions", 2, InteractionIdPolicy.DATASET));

        PipelineResult first = pipeline.run(dataDir);
        PipelineResult second = pipeline.run(dataDir);

        assertThat(first.getState()).isEqualTo(PipelineState.LOADED);
        assertThat(first.getRecordsExtracted()).isEqualTo(3);
        assertThat(first.getInserted()).isEqualTo(3);
        assertThat(first.getWarnings()).hasSize(1);
        assertThat(second.getState()).isEqualTo(PipelineState.LOADED);
        assertThat(second.getInserted()).isZero();
        assertThat(second.getSkipped()).isEqualTo(3);
        assertThat(count("SELECT COUNT(*) FROM pipeline_interactions")).isEqualTo(3);
        assertThat(count("SELECT COUNT(*) FROM pipeline_interactions WHERE content_category = 'politics' "
            + "AND article_id = '7' AND referrer_category = 'direct'")).isEqualTo(3);
    }

    @Test
    void testEmptyDirectoryCreatesSchemaOnly() throws Exception {
        EtlPipeline pipeline = new EtlPipeline(database,
            new PipelineConfig("pipeline_empty", 100, InteractionIdPolicy.DATASET));

        PipelineResult result = pipeline.run(dataDir);

        assertThat(result.getState()).isEqualTo(PipelineState.COMPLETED_EMPTY);
        assertThat(count("SELECT COUNT(*) FROM pipeline_empty")).isZero();
    }

    private long count(String sql) throws SQLException {
        try (Connection conn = database.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private void writeInput(String name, String content) throws IOException {
        Files.write(dataDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }
}
