package io.github.yok.flashsync.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregated result of one orchestration run.
 *
 * <p>
 * Only the first failure is kept; failures that happen after the run was cancelled are visible in
 * the individual {@link SyncOutcome}s and in the logs, but not here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class RunResult {

    private final ImmutableList<SyncOutcome> outcomes;

    private final Throwable firstFailure;

    public RunResult(List<SyncOutcome> outcomes, Throwable firstFailure) {
        this.outcomes = ImmutableList.copyOf(outcomes);
        this.firstFailure = firstFailure;
    }

    public boolean isSuccess() {
        return firstFailure == null;
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(firstFailure);
    }

    /**
     * Counts outcomes with the given status.
     *
     * @param status status
     * @return count
     */
    public long count(SyncOutcome.Status status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
