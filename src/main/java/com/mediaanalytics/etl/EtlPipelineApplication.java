package com.mediaanalytics.etl;

import com.mediaanalytics.etl.config.ConfigurationException;
import com.mediaanalytics.etl.config.DatabaseConfig;
import com.mediaanalytics.etl.config.PipelineConfig;
import com.mediaanalytics.etl.connection.PostgresConnection;
import com.mediaanalytics.etl.pipeline.EtlPipeline;
import com.mediaanalytics.etl.pipeline.PipelineResult;
import com.mediaanalytics.etl.pipeline.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point.
 *
 * Usage: {@code java -jar interaction-etl.jar [input-directory]} (default {@code ./data}).
 * Connection and pipeline settings come from environment variables, see {@link DatabaseConfig}
 * and {@link PipelineConfig}. Exits with 1 when the run fails, 0 otherwise.
 */
public class EtlPipelineApplication {
    private static final Logger LOGGER = LoggerFactory.getLogger(EtlPipelineApplication.class);

    static final String DEFAULT_INPUT_DIRECTORY = "./data";

    public static void main(String[] args) {
        Path inputDirectory = Paths.get(args.length > 0 ? args[0] : DEFAULT_INPUT_DIRECTORY);

        DatabaseConfig databaseConfig;
        PipelineConfig pipelineConfig;
        try {
            databaseConfig = DatabaseConfig.fromEnvironment();
            pipelineConfig = PipelineConfig.fromEnvironment();
        } catch (ConfigurationException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        LOGGER.info("ETL Pipeline Configuration:");
        LOGGER.info("  Input directory: {}", inputDirectory.toAbsolutePath());
        LOGGER.info("  Database: {}", databaseConfig);
        LOGGER.info("  Pipeline: {}", pipelineConfig);

        PipelineResult result;
        try (PostgresConnection connection = new PostgresConnection(databaseConfig)) {
            result = new EtlPipeline(connection, pipelineConfig).run(inputDirectory);
        }

        if (result.isSuccessful()) {
            LOGGER.info("ETL pipeline finished with state {}", result.getState());
        } else {
            LOGGER.error("ETL pipeline finished with state {}: {}", result.getState(),
                        result.getFailure() != null ? result.getFailure().getMessage() : "unknown error");
        }
        System.exit(exitCode(result));
    }

    static int exitCode(PipelineResult result) {
        return result.getState() == PipelineState.FAILED ? 1 : 0;
    }
}
