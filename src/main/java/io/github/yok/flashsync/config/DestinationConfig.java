package io.github.yok.flashsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * BigQuery destination settings ({@code destination} section).
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "destination")
@Data
public class DestinationConfig {

    /**
     * GCP project that owns the dataset and runs the load jobs.
     */
    private String projectId;

    /**
     * Dataset that receives one table per source table.
     */
    private String datasetId;

    /**
     * Optional job location (e.g. {@code US}); left to BigQuery when blank.
     */
    private String location;
}
