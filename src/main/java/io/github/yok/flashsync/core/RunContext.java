package io.github.yok.flashsync.core;

import io.github.yok.flashsync.error.SyncCancelledException;
import io.github.yok.flashsync.error.SyncTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Cancellation scope shared by every task of one run.
 *
 * <p>
 * The run is cancelled either explicitly (the first failing task calls {@link #cancel(Throwable)})
 * or implicitly when its deadline passes. Only the first cause is kept. Registered hooks run once,
 * on the thread that cancels, and are used to interrupt blocking work such as an executing JDBC
 * statement.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RunContext {

    private final Clock clock;
    private final Duration timeout;
    private final Instant deadline;
    private final AtomicReference<Throwable> cause = new AtomicReference<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

    public RunContext(Duration timeout) {
        this(timeout, Clock.systemUTC());
    }

    RunContext(Duration timeout, Clock clock) {
        this.clock = clock;
        this.timeout = timeout;
        this.deadline = clock.instant().plus(timeout);
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Cancels the run. Later calls are ignored.
     *
     * @param reason why the run is cancelled
     * @return {@code true} if this call cancelled the run
     */
    public boolean cancel(Throwable reason) {
        if (!cause.compareAndSet(null, reason)) {
            return false;
        }
        log.debug("Run cancelled: {}", reason.getMessage());
        cancelled.countDown();
        for (Runnable hook : hooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation hook failed: {}", e.getMessage(), e);
            }
        }
        return true;
    }

    /**
     * Checks cancellation, tripping the deadline if it has passed.
     *
     * @return {@code true} if the run is cancelled
     */
    public boolean isCancelled() {
        if (cause.get() == null && !clock.instant().isBefore(deadline)
                && cancel(new SyncTimeoutException(timeout))) {
            log.error("Run exceeded its timeout of {}; cancelling remaining work", timeout);
        }
        return cause.get() != null;
    }

    /**
     * Returns the error that cancelled the run.
     *
     * @return cause, or {@code null} while the run is live
     */
    public Throwable getCause() {
        return cause.get();
    }

    /**
     * Throws if the run has been cancelled.
     *
     * @param what the step about to run, used in the exception message
     * @throws SyncCancelledException if the run is cancelled or past its deadline
     */
    public void checkCancelled(String what) throws SyncCancelledException {
        if (isCancelled()) {
            throw new SyncCancelledException("Run cancelled before " + what, cause.get());
        }
    }

    /**
     * Time left until the deadline.
     *
     * @return remaining time, never negative
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Registers a hook run on cancellation. If the run is already cancelled the hook runs now.
     *
     * @param hook action, typically aborting blocking I/O
     * @return registration; closing it removes the hook
     */
    public Registration onCancel(Runnable hook) {
        hooks.add(hook);
        if (cause.get() != null && hooks.remove(hook)) {
            hook.run();
        }
        return () -> hooks.remove(hook);
    }

    /**
     * Sleeps for the given time, returning early on cancellation or at the deadline.
     *
     * @param duration time to wait
     * @return {@code true} if the run is cancelled when the wait ends
     * @throws InterruptedException if the thread is interrupted
     */
    public boolean await(Duration duration) throws InterruptedException {
        long waitMillis = Math.min(duration.toMillis(), remaining().toMillis());
        if (waitMillis > 0) {
            cancelled.await(waitMillis, TimeUnit.MILLISECONDS);
        }
        return isCancelled();
    }

    /**
     * Removes a hook registered with {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
