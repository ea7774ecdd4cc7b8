package org.iceforge.ullr.query;

import org.iceforge.ullr.logs.LogInsightsBackend;
import org.iceforge.ullr.logs.LogModels;
import org.iceforge.ullr.logs.LogsBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs one analytical query to completion: submit once, poll with backoff until the backend reports a
 * terminal status or the timeout ceiling passes, then hand back the raw rows.
 * <p>
 * Every call owns its own state; instances are safe to share between threads as long as the backend is.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final LogInsightsBackend backend;
    private final PollingPolicy policy;
    private final Duration defaultLookback;
    private final Clock clock;
    private final Sleeper sleeper;

    public QueryExecutor(LogInsightsBackend backend,
                         PollingPolicy policy,
                         Duration defaultLookback,
                         Clock clock,
                         Sleeper sleeper) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.policy = policy == null ? PollingPolicy.defaults() : policy;
        this.defaultLookback = defaultLookback == null ? Duration.ofHours(24) : defaultLookback;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public QueryExecutor(LogInsightsBackend backend, PollingPolicy policy) {
        this(backend, policy, null, null, null);
    }

    public List<LogModels.RawRow> run(List<String> sources, String queryText, QueryModels.TimeWindow window) {
        return execute(sources, queryText, window).rows();
    }

    /**
     * Like {@link #run} but also returns the query id, backend statistics and poll count.
     *
     * @param window time range to search; {@code null} means the default trailing window
     */
    public QueryModels.QueryResult execute(List<String> sources, String queryText, QueryModels.TimeWindow window) {
        List<String> srcs = validateSources(sources);
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("query text is blank");
        }
        QueryModels.TimeWindow w = window != null ? window : QueryModels.TimeWindow.trailing(clock, defaultLookback);

        Instant started = clock.instant();
        Instant deadline = started.plus(policy.timeout());

        String queryId = submit(srcs, queryText, w);
        QueryModels.QueryState state = QueryModels.QueryState.SUBMITTED;
        logger.info("Started query {} over {} log group(s) window=[{}, {})", queryId, srcs.size(), w.start(), w.end());

        int polls = 0;
        while (!state.terminal()) {
            LogModels.QueryPoll poll = withRetry(queryId, started, deadline, () -> backend.pollQuery(queryId));
            polls++;

            LogModels.BackendStatus status = poll.status();
            if (status == LogModels.BackendStatus.COMPLETE) {
                List<LogModels.RawRow> rows = poll.rows() != null
                        ? poll.rows()
                        : withRetry(queryId, started, deadline, () -> backend.fetchResults(queryId));
                Duration elapsed = Duration.between(started, clock.instant());
                logger.info("Query {} complete after {} poll(s) in {} ms, {} row(s)",
                        queryId, polls, elapsed.toMillis(), rows.size());
                return new QueryModels.QueryResult(queryId, QueryModels.QueryState.COMPLETE, rows,
                        poll.statistics(), polls, elapsed);
            }
            if (!status.inProgress()) {
                // backend Timeout is a remote failure, not our ceiling
                QueryModels.QueryState failedState = status == LogModels.BackendStatus.CANCELLED
                        ? QueryModels.QueryState.CANCELLED
                        : QueryModels.QueryState.FAILED;
                throw failed(queryId, failedState, poll);
            }
            if (state == QueryModels.QueryState.SUBMITTED) {
                logger.debug("Query {} SUBMITTED -> RUNNING (backend status {})", queryId, status);
            }
            state = QueryModels.QueryState.RUNNING;

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                state = QueryModels.QueryState.TIMED_OUT;
                continue;
            }

            Duration wait = min(policy.pollDelay(polls - 1), Duration.between(now, deadline));
            logger.debug("Query {} {}; next poll in {} ms", queryId, state, wait.toMillis());
            pause(wait, queryId, started);
        }

        Duration elapsed = Duration.between(started, clock.instant());
        logger.warn("Query {} {} after {} ms and {} poll(s); giving up locally, remote query left running",
                queryId, state, elapsed.toMillis(), polls);
        throw new QueryTimeoutException(queryId, elapsed);
    }

    private String submit(List<String> sources, String queryText, QueryModels.TimeWindow window) {
        String queryId;
        try {
            queryId = backend.submitQuery(sources, queryText, window);
        } catch (LogsBackendException e) {
            if (e.kind() == LogsBackendException.Kind.NOT_FOUND) {
                throw new SourceNotFoundException(String.join(",", sources), e);
            }
            throw new QuerySubmissionException("Failed to start query over " + sources + ": " + e.getMessage(), e);
        }
        if (queryId == null || queryId.isBlank()) {
            throw new QuerySubmissionException("Backend returned no query id for query over " + sources);
        }
        return queryId;
    }

    /**
     * Calls the backend, retrying throttled or transient faults with bounded backoff. Retries never wait
     * past the deadline.
     */
    private <T> T withRetry(String queryId, Instant started, Instant deadline, Supplier<T> call) {
        int attempt = 0;
        for (;;) {
            try {
                return call.get();
            } catch (LogsBackendException e) {
                if (!e.kind().retryable()) {
                    throw new QueryExecutionFailedException(queryId, QueryModels.QueryState.FAILED, e.getMessage(), e);
                }
                attempt++;
                if (attempt > policy.maxTransientRetries()) {
                    throw new QueryThrottledException(queryId, attempt, e);
                }
                Instant now = clock.instant();
                if (!now.isBefore(deadline)) {
                    throw new QueryTimeoutException(queryId, Duration.between(started, now));
                }
                Duration backoff = min(policy.retryBackoff(attempt), Duration.between(now, deadline));
                logger.warn("Poll for query {} hit {} (attempt {}/{}), retrying in {} ms",
                        queryId, e.kind(), attempt, policy.maxTransientRetries(), backoff.toMillis());
                pause(backoff, queryId, started);
            }
        }
    }

    private void pause(Duration d, String queryId, Instant started) {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryTimeoutException(queryId, Duration.between(started, clock.instant()));
        }
    }

    private static QueryExecutionFailedException failed(String queryId, QueryModels.QueryState state, LogModels.QueryPoll poll) {
        String reason = poll.reason() != null ? poll.reason() : "backend status " + poll.status();
        return new QueryExecutionFailedException(queryId, state, reason);
    }

    private static List<String> validateSources(List<String> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("at least one log group is required");
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String s : sources) {
            if (s == null || s.isBlank()) {
                throw new IllegalArgumentException("log group name is blank");
            }
            out.add(s.trim());
        }
        return new ArrayList<>(out);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
