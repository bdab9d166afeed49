package io.github.yok.flashsync.destination.bigquery;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobStatus;
import io.github.yok.flashsync.destination.DestinationException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BigQueryLoadJobTest {

    private Job job;
    private BigQueryLoadJob loadJob;

    @BeforeEach
    void setup() {
        job = mock(Job.class);
        when(job.getJobId()).thenReturn(JobId.of("job-9"));
        loadJob = new BigQueryLoadJob(job);
    }

    @Test
    void failure_正常ケース_エラーなしで完了_空が返ること() throws Exception {
        JobStatus status = mock(JobStatus.class);
        when(job.reload()).thenReturn(job);
        when(job.getStatus()).thenReturn(status);

        assertFalse(loadJob.failure().isPresent());
    }

    @Test
    void failure_正常ケース_エラーありで完了_エラーメッセージが返ること() throws Exception {
        JobStatus status = mock(JobStatus.class);
        when(status.getError()).thenReturn(new BigQueryError("invalid", null, "bad row 3"));
        when(job.reload()).thenReturn(job);
        when(job.getStatus()).thenReturn(status);

        Optional<String> failure = loadJob.failure();
        assertEquals("bad row 3", failure.get());
    }

    @Test
    void isDone_異常ケース_状態取得に失敗する_DestinationExceptionが送出されること() {
        when(job.isDone()).thenThrow(new BigQueryException(503, "unavailable"));
        assertThrows(DestinationException.class, () -> loadJob.isDone());
    }

    @Test
    void failure_異常ケース_ジョブが消えている_DestinationExceptionが送出されること() {
        when(job.reload()).thenReturn(null);
        assertThrows(DestinationException.class, () -> loadJob.failure());
    }

    @Test
    void cancel_正常ケース_キャンセル失敗でも例外が送出されないこと() {
        when(job.cancel()).thenThrow(new BigQueryException(500, "boom"));
        assertDoesNotThrow(() -> loadJob.cancel());
        verify(job).cancel();
    }
}
