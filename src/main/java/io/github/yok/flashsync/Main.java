package io.github.yok.flashsync;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flashsync.config.ConfigValidator;
import io.github.yok.flashsync.config.ConnectionConfig;
import io.github.yok.flashsync.config.DestinationConfig;
import io.github.yok.flashsync.config.PoolConfig;
import io.github.yok.flashsync.config.SourceCatalog;
import io.github.yok.flashsync.config.SyncConfig;
import io.github.yok.flashsync.core.ExtractLoadExecutor;
import io.github.yok.flashsync.core.JobOrchestrator;
import io.github.yok.flashsync.core.SchemaInferencer;
import io.github.yok.flashsync.core.TableReconciler;
import io.github.yok.flashsync.core.TableSyncWorker;
import io.github.yok.flashsync.db.SourceConnectionFactory;
import io.github.yok.flashsync.destination.DestinationClient;
import io.github.yok.flashsync.destination.bigquery.BigQueryClientFactory;
import io.github.yok.flashsync.model.RunResult;
import io.github.yok.flashsync.model.SourceDatabase;
import io.github.yok.flashsync.parser.DynamicRowParser;
import io.github.yok.flashsync.util.ErrorHandler;
import io.github.yok.flashsync.util.TemporalValueFormatter;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line option {@code --target}/{@code -t}, validates the configuration, and
 * runs one sync of every configured table through {@link JobOrchestrator}.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --target [src1,src2,…]} or {@code -t [src1,src2,…]} restricts the run to the named
 * sources. If omitted, all sources are synced.</li>
 * </ul>
 *
 * <p>
 * The process exits with 0 when every table synced and 1 otherwise.
 * </p>
 *
 * @see ConnectionConfig
 * @see DestinationConfig
 * @see SyncConfig
 * @see PoolConfig
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, DestinationConfig.class, SyncConfig.class,
        PoolConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final ConfigValidator configValidator;
    private final SourceCatalog sourceCatalog;
    private final SyncConfig syncConfig;
    private final SourceConnectionFactory connectionFactory;
    private final BigQueryClientFactory destinationFactory;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        List<String> targetSources = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--target":
                case "-t":
                    if (i + 1 < args.length) {
                        targetSources = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        RunResult result;
        try {
            configValidator.validate();
            List<SourceDatabase> sources = sourceCatalog.sources(targetSources);
            log.info("Target sources: {}", sources.stream().map(SourceDatabase::getName)
                    .collect(Collectors.toList()));

            try (DestinationClient destination = destinationFactory.create()) {
                result = buildOrchestrator(destination).run(sources);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = 1;
            ErrorHandler.errorAndExit("Sync interrupted", e);
            return;
        } catch (Exception e) {
            exitCode = 1;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
            return;
        }

        if (result.isSuccess()) {
            log.info("Sync completed successfully ({} tables)", result.getOutcomes().size());
            exitCode = 0;
        } else {
            exitCode = 1;
            ErrorHandler.errorAndExit("Sync failed: " + result.getFirstFailure().getMessage(),
                    result.getFirstFailure());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    JobOrchestrator buildOrchestrator(DestinationClient destination) {
        TemporalValueFormatter formatter = new TemporalValueFormatter(syncConfig.getDateFormat(),
                ZoneId.of(syncConfig.getTimeZone()));
        ExtractLoadExecutor executor = new ExtractLoadExecutor(destination,
                new DynamicRowParser(formatter), jsonLinesMapper(),
                syncConfig.loadPollIntervalDuration());
        TableSyncWorker worker = new TableSyncWorker(connectionFactory, new SchemaInferencer(),
                new TableReconciler(destination), executor);
        return new JobOrchestrator(worker, syncConfig.timeoutDuration());
    }

    static ObjectMapper jsonLinesMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        return mapper;
    }
}
