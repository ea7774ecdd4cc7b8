package org.iceforge.ullr.aws.logs;

import org.iceforge.ullr.aws.AwsErrors;
import org.iceforge.ullr.logs.LogInsightsBackend;
import org.iceforge.ullr.logs.LogModels;
import org.iceforge.ullr.logs.LogsBackendException;
import org.iceforge.ullr.query.QueryModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link LogInsightsBackend} over CloudWatch Logs Insights.
 * <p>
 * StartQuery takes epoch seconds, so the window start is floored and the end is rounded up; the
 * searched range never shrinks.
 */
@Service
public class CloudWatchLogsInsightsBackend implements LogInsightsBackend {
    private static final Logger logger = LoggerFactory.getLogger(CloudWatchLogsInsightsBackend.class);

    private final CloudWatchLogsClient logs;

    public CloudWatchLogsInsightsBackend(CloudWatchLogsClient logs) {
        this.logs = Objects.requireNonNull(logs);
    }

    @Override
    public String submitQuery(List<String> sources, String queryText, QueryModels.TimeWindow window) {
        try {
            StartQueryResponse resp = logs.startQuery(StartQueryRequest.builder()
                    .logGroupNames(sources)
                    .queryString(queryText)
                    .startTime(Math.floorDiv(window.startMillis(), 1000L))
                    .endTime(-Math.floorDiv(-window.endMillis(), 1000L))
                    .build());
            return resp.queryId();
        } catch (SdkException e) {
            logger.error("StartQuery failed for log groups {}", sources, e);
            throw AwsErrors.translate("StartQuery", e);
        }
    }

    @Override
    public LogModels.QueryPoll pollQuery(String queryId) {
        GetQueryResultsResponse resp;
        try {
            resp = logs.getQueryResults(GetQueryResultsRequest.builder().queryId(queryId).build());
        } catch (SdkException e) {
            LogsBackendException translated = AwsErrors.translate("GetQueryResults", e);
            if (translated.kind().retryable()) {
                // the executor retries these; keep the log quiet
                logger.debug("GetQueryResults for {} hit {}", queryId, translated.kind());
            } else {
                logger.error("GetQueryResults failed for query {}", queryId, e);
            }
            throw translated;
        }

        LogModels.BackendStatus status = toStatus(resp.status());
        return switch (status) {
            case COMPLETE -> LogModels.QueryPoll.complete(toRows(resp.results()), toStatistics(resp.statistics()));
            case FAILED, CANCELLED, TIMEOUT -> LogModels.QueryPoll.terminal(status,
                    "CloudWatch Logs reported status " + resp.statusAsString() + " for query " + queryId);
            default -> LogModels.QueryPoll.inProgress(status);
        };
    }

    @Override
    public boolean sourceExists(String name) {
        try {
            // Names sharing the prefix sort after the exact name, so the first match is enough
            DescribeLogGroupsResponse resp = logs.describeLogGroups(DescribeLogGroupsRequest.builder()
                    .logGroupNamePrefix(name)
                    .limit(1)
                    .build());
            return resp.logGroups().stream().anyMatch(g -> name.equals(g.logGroupName()));
        } catch (SdkException e) {
            logger.error("DescribeLogGroups failed checking log group {}", name, e);
            throw AwsErrors.translate("DescribeLogGroups", e);
        }
    }

    @Override
    public List<LogModels.LogSource> listSources(String namePrefix) {
        List<LogModels.LogSource> out = new ArrayList<>();
        String token = null;
        try {
            do {
                DescribeLogGroupsRequest.Builder req = DescribeLogGroupsRequest.builder();
                if (namePrefix != null && !namePrefix.isBlank()) req = req.logGroupNamePrefix(namePrefix);
                if (token != null) req = req.nextToken(token);

                DescribeLogGroupsResponse resp = logs.describeLogGroups(req.build());
                for (LogGroup g : resp.logGroups()) {
                    out.add(new LogModels.LogSource(
                            g.logGroupName(),
                            g.arn(),
                            g.creationTime() == null ? null : Instant.ofEpochMilli(g.creationTime()),
                            g.retentionInDays(),
                            g.storedBytes()
                    ));
                }
                token = resp.nextToken();
            } while (token != null && !token.isBlank());
        } catch (SdkException e) {
            logger.error("DescribeLogGroups failed for prefix {}", namePrefix, e);
            throw AwsErrors.translate("DescribeLogGroups", e);
        }
        return out;
    }

    @Override
    public List<LogModels.SavedQuery> listSavedQueries() {
        List<LogModels.SavedQuery> out = new ArrayList<>();
        String token = null;
        try {
            do {
                DescribeQueryDefinitionsRequest.Builder req = DescribeQueryDefinitionsRequest.builder();
                if (token != null) req = req.nextToken(token);

                DescribeQueryDefinitionsResponse resp = logs.describeQueryDefinitions(req.build());
                for (QueryDefinition d : resp.queryDefinitions()) {
                    out.add(new LogModels.SavedQuery(
                            d.queryDefinitionId(),
                            d.name(),
                            d.queryString(),
                            d.lastModified() == null ? null : Instant.ofEpochMilli(d.lastModified()),
                            d.hasLogGroupNames() ? List.copyOf(d.logGroupNames()) : List.of()
                    ));
                }
                token = resp.nextToken();
            } while (token != null && !token.isBlank());
        } catch (SdkException e) {
            logger.error("DescribeQueryDefinitions failed", e);
            throw AwsErrors.translate("DescribeQueryDefinitions", e);
        }
        return out;
    }

    static LogModels.BackendStatus toStatus(QueryStatus s) {
        if (s == null) return LogModels.BackendStatus.UNKNOWN;
        return switch (s) {
            case SCHEDULED -> LogModels.BackendStatus.SCHEDULED;
            case RUNNING -> LogModels.BackendStatus.RUNNING;
            case COMPLETE -> LogModels.BackendStatus.COMPLETE;
            case FAILED -> LogModels.BackendStatus.FAILED;
            case CANCELLED -> LogModels.BackendStatus.CANCELLED;
            case TIMEOUT -> LogModels.BackendStatus.TIMEOUT;
            default -> LogModels.BackendStatus.UNKNOWN;
        };
    }

    private static List<LogModels.RawRow> toRows(List<List<ResultField>> results) {
        if (results == null || results.isEmpty()) return List.of();
        List<LogModels.RawRow> rows = new ArrayList<>(results.size());
        for (List<ResultField> record : results) {
            List<LogModels.RawField> fields = new ArrayList<>(record.size());
            for (ResultField f : record) {
                // @ptr is an opaque record handle, not log content
                if (f.field() == null || "@ptr".equals(f.field())) continue;
                fields.add(new LogModels.RawField(f.field(), f.value()));
            }
            rows.add(new LogModels.RawRow(fields));
        }
        return rows;
    }

    private static QueryModels.QueryStatistics toStatistics(QueryStatistics s) {
        if (s == null) return QueryModels.QueryStatistics.empty();
        return new QueryModels.QueryStatistics(
                s.recordsMatched() == null ? 0d : s.recordsMatched(),
                s.recordsScanned() == null ? 0d : s.recordsScanned(),
                s.bytesScanned() == null ? 0d : s.bytesScanned()
        );
    }
}
