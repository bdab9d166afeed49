package io.github.yok.flashsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flashsync.error.ExtractionException;
import io.github.yok.flashsync.error.SyncTimeoutException;
import io.github.yok.flashsync.model.RunResult;
import io.github.yok.flashsync.model.SourceDatabase;
import io.github.yok.flashsync.model.SyncOutcome;
import io.github.yok.flashsync.model.SyncTask;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobOrchestratorTest {

    private TableSyncWorker worker;
    private List<SourceDatabase> sources;

    @BeforeEach
    void setup() {
        worker = mock(TableSyncWorker.class);
        sources = Arrays.asList(
                source("salesforce", "arr_sf_opportunity", "arr_sf_account"),
                source("finance", "cache_financial_acc_expense"));
    }

    @Test
    void run_正常ケース_全タスク成功_成功結果が返ること() throws Exception {
        when(worker.sync(any(), any())).thenAnswer(inv -> succeeded(inv.getArgument(1)));

        RunResult result = new JobOrchestrator(worker, Duration.ofMinutes(1)).run(sources);

        assertTrue(result.isSuccess());
        assertEquals(3, result.getOutcomes().size());
        assertEquals(3, result.count(SyncOutcome.Status.SUCCEEDED));
        verify(worker, times(3)).sync(any(), any());
    }

    @Test
    void run_異常ケース_1タスクが失敗する_実行失敗となり全タスクが終了状態であること()
            throws Exception {
        ExtractionException boom = new ExtractionException("Failed to query source");
        when(worker.sync(any(), any())).thenAnswer(inv -> {
            RunContext context = inv.getArgument(0);
            SyncTask task = inv.getArgument(1);
            if ("arr_sf_account".equals(task.getTableName())) {
                throw boom;
            }
            // 兄弟タスクのキャンセルを待つ
            boolean cancelled = false;
            while (!cancelled) {
                cancelled = context.await(Duration.ofMillis(10));
            }
            context.checkCancelled("extraction");
            return succeeded(task);
        });

        RunResult result = new JobOrchestrator(worker, Duration.ofMinutes(1)).run(sources);

        assertFalse(result.isSuccess());
        assertSame(boom, result.getFirstFailure());
        assertEquals(3, result.getOutcomes().size());
        assertEquals(1, result.count(SyncOutcome.Status.FAILED));
        assertEquals(2, result.count(SyncOutcome.Status.CANCELLED));
        assertEquals("arr_sf_opportunity", result.getOutcomes().get(0).getTask().getTableName());
    }

    @Test
    void run_異常ケース_タイムアウトする_SyncTimeoutExceptionで全タスクがキャンセルされること()
            throws Exception {
        when(worker.sync(any(), any())).thenAnswer(inv -> {
            RunContext context = inv.getArgument(0);
            boolean cancelled = false;
            while (!cancelled) {
                cancelled = context.await(Duration.ofMillis(10));
            }
            context.checkCancelled("load");
            return succeeded(inv.getArgument(1));
        });

        RunResult result = new JobOrchestrator(worker, Duration.ofMillis(200)).run(sources);

        assertFalse(result.isSuccess());
        assertInstanceOf(SyncTimeoutException.class, result.getFirstFailure());
        assertEquals(3, result.count(SyncOutcome.Status.CANCELLED));
    }

    @Test
    void run_異常ケース_実行時例外が発生する_失敗として記録されること() throws Exception {
        IllegalStateException unexpected = new IllegalStateException("unexpected");
        when(worker.sync(any(), any())).thenThrow(unexpected);

        RunResult result = new JobOrchestrator(worker, Duration.ofMinutes(1))
                .run(Collections.singletonList(source("finance", "t1")));

        assertSame(unexpected, result.getFirstFailure());
        assertEquals(SyncOutcome.Status.FAILED, result.getOutcomes().get(0).getStatus());
    }

    @Test
    void run_正常ケース_テーブルなし_何も実行されず成功すること() throws Exception {
        RunResult result = new JobOrchestrator(worker, Duration.ofMinutes(1))
                .run(Collections.singletonList(source("finance")));

        assertTrue(result.isSuccess());
        assertTrue(result.getOutcomes().isEmpty());
        verify(worker, never()).sync(any(), any());
    }

    private static SyncOutcome succeeded(SyncTask task) {
        return SyncOutcome.builder().task(task).status(SyncOutcome.Status.SUCCEEDED)
                .rowsExtracted(3).loaded(true).build();
    }

    private static SourceDatabase source(String name, String... tables) {
        return SourceDatabase.builder().name(name).url("jdbc:mysql://h/" + name + "_db").user("u")
                .password("p").databaseName(name + "_db").tables(Arrays.asList(tables)).build();
    }
}
