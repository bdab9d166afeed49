package io.github.yok.flashsync.core;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.flashsync.error.SyncCancelledException;
import io.github.yok.flashsync.error.SyncException;
import io.github.yok.flashsync.model.RunResult;
import io.github.yok.flashsync.model.SourceDatabase;
import io.github.yok.flashsync.model.SyncOutcome;
import io.github.yok.flashsync.model.SyncTask;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one {@link TableSyncWorker} per (source, table) pair, all concurrently, under a shared
 * {@link RunContext}.
 *
 * <p>
 * The first task failure cancels the context so that the other tasks stop at their next
 * cancellation check. The run also stops when the configured timeout passes. The orchestrator
 * always waits for every task to reach a terminal state before returning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JobOrchestrator {

    private final TableSyncWorker worker;
    private final Duration timeout;

    public JobOrchestrator(TableSyncWorker worker, Duration timeout) {
        this.worker = worker;
        this.timeout = timeout;
    }

    /**
     * Syncs every table of the given sources.
     *
     * @param sources source databases with their tables
     * @return per-task outcomes and the first failure, if any
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public RunResult run(List<SourceDatabase> sources) throws InterruptedException {
        List<SyncTask> tasks = new ArrayList<>();
        for (SourceDatabase source : sources) {
            for (String table : source.getTables()) {
                tasks.add(new SyncTask(source, table));
            }
        }
        log.info("=== Sync run started (tasks={}, timeout={}) ===", tasks.size(), timeout);
        if (tasks.isEmpty()) {
            log.warn("No tables configured; nothing to sync");
            return new RunResult(new ArrayList<>(), null);
        }

        RunContext context = new RunContext(timeout);
        ExecutorService pool = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("sync-worker-%d").setDaemon(true).build());
        List<SyncOutcome> outcomes = new ArrayList<>(tasks.size());
        try {
            List<Future<SyncOutcome>> futures = new ArrayList<>(tasks.size());
            for (SyncTask task : tasks) {
                futures.add(pool.submit(() -> runTask(context, task)));
            }
            pool.shutdown();
            for (int i = 0; i < tasks.size(); i++) {
                outcomes.add(awaitOutcome(context, tasks.get(i), futures.get(i)));
            }
        } catch (InterruptedException e) {
            context.cancel(new SyncCancelledException("Sync run interrupted", e));
            throw e;
        } finally {
            pool.shutdownNow();
        }

        RunResult result = new RunResult(outcomes, context.getCause());
        logSummary(result);
        log.info("=== Sync run finished (succeeded={}, failed={}, cancelled={}) ===",
                result.count(SyncOutcome.Status.SUCCEEDED),
                result.count(SyncOutcome.Status.FAILED),
                result.count(SyncOutcome.Status.CANCELLED));
        return result;
    }

    SyncOutcome runTask(RunContext context, SyncTask task) {
        try {
            return worker.sync(context, task);
        } catch (SyncCancelledException e) {
            log.warn("[{}] Cancelled: {}", task.label(), e.getMessage());
            return SyncOutcome.terminated(task, SyncOutcome.Status.CANCELLED, e);
        } catch (SyncException | RuntimeException e) {
            fail(context, task, e);
            return SyncOutcome.terminated(task, SyncOutcome.Status.FAILED, e);
        }
    }

    private static void fail(RunContext context, SyncTask task, Throwable error) {
        if (context.cancel(error)) {
            log.error("[{}] Failed, cancelling run: {}", task.label(), error.getMessage(), error);
        } else {
            log.error("[{}] Failed after the run was already cancelled: {}", task.label(),
                    error.getMessage(), error);
        }
    }

    private static SyncOutcome awaitOutcome(RunContext context, SyncTask task,
            Future<SyncOutcome> future) throws InterruptedException {
        while (true) {
            try {
                if (context.isCancelled()) {
                    return future.get();
                }
                return future.get(Math.max(1L, context.remaining().toMillis()),
                        TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // the next isCancelled() call trips the deadline
                log.debug("[{}] Still running at the run deadline", task.label());
            } catch (ExecutionException e) {
                fail(context, task, e.getCause());
                return SyncOutcome.terminated(task, SyncOutcome.Status.FAILED, e.getCause());
            }
        }
    }

    private static void logSummary(RunResult result) {
        log.info("===== Summary =====");
        int maxNameLen = result.getOutcomes().stream().mapToInt(o -> o.getTask().label().length())
                .max().orElse(0);
        int maxCountDigits = result.getOutcomes().stream()
                .mapToInt(o -> String.valueOf(o.getRowsExtracted()).length()).max().orElse(1);
        String fmt = "  Table[%-" + maxNameLen + "s] Status=%-9s Rows=%" + maxCountDigits
                + "d Skipped=%d";
        for (SyncOutcome o : result.getOutcomes()) {
            log.info(String.format(fmt, o.getTask().label(), o.getStatus(), o.getRowsExtracted(),
                    o.getRowsSkipped()));
        }
    }
}
