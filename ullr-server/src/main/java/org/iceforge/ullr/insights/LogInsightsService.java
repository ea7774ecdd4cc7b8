package org.iceforge.ullr.insights;

import org.iceforge.ullr.decode.ResultDecoder;
import org.iceforge.ullr.logs.LogInsightsBackend;
import org.iceforge.ullr.logs.LogModels;
import org.iceforge.ullr.logs.LogsBackendException;
import org.iceforge.ullr.query.PollingPolicy;
import org.iceforge.ullr.query.QueryExecutor;
import org.iceforge.ullr.query.QueryModels;
import org.iceforge.ullr.query.QuerySubmissionException;
import org.iceforge.ullr.query.QueryThrottledException;
import org.iceforge.ullr.query.Sleeper;
import org.iceforge.ullr.query.SourceNotFoundException;
import org.iceforge.ullr.schema.SchemaEntry;
import org.iceforge.ullr.schema.SchemaInferencer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Entry point for running Logs Insights queries and discovering the fields of log groups.
 * <p>
 * Only {@link org.iceforge.ullr.query.LogInsightsException} subtypes and {@link IllegalArgumentException}
 * leave this class.
 */
@Service
public class LogInsightsService {
    private static final Logger logger = LoggerFactory.getLogger(LogInsightsService.class);

    private final QueryExecutor executor;
    private final ResultDecoder decoder;
    private final SchemaInferencer inferencer;
    private final LogInsightsBackend backend;
    private final InsightsProperties props;
    private final Clock clock;
    private final Sleeper sleeper;

    public LogInsightsService(QueryExecutor executor,
                              ResultDecoder decoder,
                              SchemaInferencer inferencer,
                              LogInsightsBackend backend,
                              InsightsProperties props,
                              Clock clock,
                              Sleeper sleeper) {
        this.executor = Objects.requireNonNull(executor);
        this.decoder = Objects.requireNonNull(decoder);
        this.inferencer = Objects.requireNonNull(inferencer);
        this.backend = Objects.requireNonNull(backend);
        this.props = Objects.requireNonNull(props);
        this.clock = Objects.requireNonNull(clock);
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    public InsightsModels.QueryResponse executeQuery(String source, String queryText, Long startMillis, Long endMillis) {
        return executeQuery(source == null ? null : List.of(source), queryText, startMillis, endMillis);
    }

    /**
     * Runs a query to completion and returns its rows with any JSON message body flattened.
     *
     * @param startMillis inclusive epoch millis, or {@code null} for end minus the default lookback
     * @param endMillis exclusive epoch millis, or {@code null} for now
     */
    public InsightsModels.QueryResponse executeQuery(Collection<String> sources, String queryText,
                                                     Long startMillis, Long endMillis) {
        List<String> srcs = normalize(sources);
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("queryString is required");
        }
        QueryModels.TimeWindow window = QueryModels.TimeWindow.resolve(startMillis, endMillis, clock, props.getDefaultLookback());
        verifySources(srcs);

        QueryModels.QueryResult result = executor.execute(srcs, queryText, window);
        List<LogModels.DecodedRow> decoded = decoder.decode(result.rows());

        List<Map<String, Object>> rows = new ArrayList<>(decoded.size());
        for (LogModels.DecodedRow r : decoded) rows.add(r.fields());

        return new InsightsModels.QueryResponse(
                result.queryId(),
                result.state(),
                srcs,
                result.statistics(),
                result.polls(),
                result.elapsed().toMillis(),
                rows
        );
    }

    public InsightsModels.FieldDiscovery discoverFields(String source) {
        return discoverFields(source == null ? null : List.of(source));
    }

    /**
     * Samples recent records of the given log groups and infers a type per field. The answer only
     * covers what the sample contained.
     */
    public InsightsModels.FieldDiscovery discoverFields(Collection<String> sources) {
        List<String> srcs = normalize(sources);
        verifySources(srcs);

        QueryModels.QueryResult result = executor.execute(srcs, props.samplingQuery(), null);
        List<LogModels.DecodedRow> decoded = decoder.decode(result.rows());
        SortedMap<String, SchemaEntry> fields = inferencer.infer(decoded);

        logger.info("Discovered {} field(s) in {} from {} sampled row(s)", fields.size(), srcs, decoded.size());
        return new InsightsModels.FieldDiscovery(result.queryId(), srcs, decoded.size(), fields);
    }

    public boolean sourceExists(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("log group name is blank");
        }
        try {
            return backend.sourceExists(name.trim());
        } catch (LogsBackendException e) {
            throw new BackendUnavailableException("Could not check log group '" + name + "': " + e.getMessage(), e);
        }
    }

    public List<LogModels.LogSource> listSources(String namePrefix) {
        try {
            return backend.listSources(namePrefix);
        } catch (LogsBackendException e) {
            throw new BackendUnavailableException("Could not list log groups: " + e.getMessage(), e);
        }
    }

    public List<LogModels.SavedQuery> listSavedQueries() {
        try {
            return backend.listSavedQueries();
        } catch (LogsBackendException e) {
            throw new BackendUnavailableException("Could not list saved queries: " + e.getMessage(), e);
        }
    }

    private void verifySources(List<String> sources) {
        if (!props.isVerifySources()) return;
        for (String s : sources) {
            if (!checkExists(s)) {
                logger.warn("Log group {} does not exist", s);
                throw new SourceNotFoundException(s);
            }
        }
    }

    /**
     * Existence lookup with the same bounded backoff the executor uses for polls.
     */
    private boolean checkExists(String source) {
        PollingPolicy policy = props.toPollingPolicy();
        int attempt = 0;
        for (;;) {
            try {
                return backend.sourceExists(source);
            } catch (LogsBackendException e) {
                if (e.kind() == LogsBackendException.Kind.NOT_FOUND) {
                    throw new SourceNotFoundException(source, e);
                }
                if (!e.kind().retryable()) {
                    throw new QuerySubmissionException("Could not verify log group '" + source + "': " + e.getMessage(), e);
                }
                attempt++;
                if (attempt > policy.maxTransientRetries()) {
                    throw throttled(source, attempt, e);
                }
                Duration backoff = policy.retryBackoff(attempt);
                logger.warn("Existence check for {} hit {} (attempt {}/{}), retrying in {} ms",
                        source, e.kind(), attempt, policy.maxTransientRetries(), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw throttled(source, attempt, e);
                }
            }
        }
    }

    private static QueryThrottledException throttled(String source, int attempts, LogsBackendException cause) {
        return new QueryThrottledException("Existence check for log group '" + source
                + "' still throttled or unreachable after " + attempts + " attempts", null, attempts, cause);
    }

    private static List<String> normalize(Collection<String> sources) {
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
}
