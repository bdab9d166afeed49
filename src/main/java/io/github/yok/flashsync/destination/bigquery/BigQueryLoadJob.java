package io.github.yok.flashsync.destination.bigquery;

import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobStatus;
import io.github.yok.flashsync.destination.DestinationException;
import io.github.yok.flashsync.destination.LoadJob;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LoadJob} over a BigQuery {@link Job}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
class BigQueryLoadJob implements LoadJob {

    private final Job job;

    BigQueryLoadJob(Job job) {
        this.job = job;
    }

    @Override
    public String getId() {
        return job.getJobId().getJob();
    }

    @Override
    public boolean isDone() throws DestinationException {
        try {
            return job.isDone();
        } catch (BigQueryException e) {
            throw new DestinationException("Failed to check status of load job " + getId(), e);
        }
    }

    @Override
    public Optional<String> failure() throws DestinationException {
        Job latest;
        try {
            latest = job.reload();
        } catch (BigQueryException e) {
            throw new DestinationException("Failed to read status of load job " + getId(), e);
        }
        if (latest == null) {
            throw new DestinationException("Load job " + getId() + " no longer exists");
        }
        JobStatus status = latest.getStatus();
        BigQueryError error = status == null ? null : status.getError();
        return error == null ? Optional.empty() : Optional.of(error.getMessage());
    }

    @Override
    public void cancel() {
        try {
            boolean cancelled = job.cancel();
            log.info("Cancellation of load job {} requested (accepted={})", getId(), cancelled);
        } catch (BigQueryException e) {
            log.warn("Failed to cancel load job {}: {}", getId(), e.getMessage());
        }
    }
}
