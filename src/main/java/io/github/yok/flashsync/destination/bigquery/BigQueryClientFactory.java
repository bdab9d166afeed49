package io.github.yok.flashsync.destination.bigquery;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import io.github.yok.flashsync.config.DestinationConfig;
import io.github.yok.flashsync.destination.DestinationClient;
import io.github.yok.flashsync.destination.DestinationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Creates the run's {@link DestinationClient} from {@link DestinationConfig}.
 *
 * <p>
 * Credentials are resolved by the BigQuery client library (Application Default Credentials).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BigQueryClientFactory {

    private final DestinationConfig destinationConfig;

    /**
     * Connects to BigQuery.
     *
     * @return client bound to the configured project and dataset
     * @throws DestinationException if the client library cannot be initialized
     */
    public DestinationClient create() throws DestinationException {
        String projectId = destinationConfig.getProjectId();
        String location = StringUtils.trimToNull(destinationConfig.getLocation());
        BigQuery bigQuery;
        try {
            BigQueryOptions.Builder builder = BigQueryOptions.newBuilder().setProjectId(projectId);
            if (location != null) {
                builder.setLocation(location);
            }
            bigQuery = builder.build().getService();
        } catch (RuntimeException e) {
            throw new DestinationException("Failed to create BigQuery client for project "
                    + projectId, e);
        }
        log.info("BigQuery client ready: project={}, dataset={}, location={}", projectId,
                destinationConfig.getDatasetId(), location == null ? "(dataset default)" : location);
        return new BigQueryDestinationClient(bigQuery, projectId,
                destinationConfig.getDatasetId(), location);
    }
}
