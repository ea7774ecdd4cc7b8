package org.iceforge.ullr.api;

import org.iceforge.ullr.aws.AwsAccessException;
import org.iceforge.ullr.aws.alarms.AlarmModels;
import org.iceforge.ullr.aws.alarms.CloudWatchAlarmService;
import org.iceforge.ullr.insights.BackendUnavailableException;
import org.iceforge.ullr.insights.InsightsModels;
import org.iceforge.ullr.insights.LogInsightsService;
import org.iceforge.ullr.logs.LogModels;
import org.iceforge.ullr.query.LogInsightsException;
import org.iceforge.ullr.query.QueryExecutionFailedException;
import org.iceforge.ullr.query.QuerySubmissionException;
import org.iceforge.ullr.query.QueryThrottledException;
import org.iceforge.ullr.query.QueryTimeoutException;
import org.iceforge.ullr.query.SourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/v1/insights")
public class InsightsController {
    private static final Logger logger = LoggerFactory.getLogger(InsightsController.class);

    private final LogInsightsService insights;
    private final CloudWatchAlarmService alarms;

    public InsightsController(LogInsightsService insights, CloudWatchAlarmService alarms) {
        this.insights = Objects.requireNonNull(insights);
        this.alarms = Objects.requireNonNull(alarms);
    }

    @PostMapping("/queries")
    public ResponseEntity<InsightsModels.QueryResponse> query(@RequestBody InsightsModels.QueryRequest req) {
        return ResponseEntity.ok(insights.executeQuery(req.logGroupNames(), req.queryString(), req.startTime(), req.endTime()));
    }

    @PostMapping("/fields")
    public ResponseEntity<InsightsModels.FieldDiscovery> fields(@RequestBody InsightsModels.FieldsRequest req) {
        return ResponseEntity.ok(insights.discoverFields(req.logGroupNames()));
    }

    @GetMapping("/sources")
    public List<LogModels.LogSource> sources(@RequestParam(value = "prefix", required = false) String prefix) {
        return insights.listSources(prefix);
    }

    // log group names contain '/', so the name travels as a query parameter
    @GetMapping("/sources/exists")
    public InsightsModels.SourceExists sourceExists(@RequestParam("name") String name) {
        return new InsightsModels.SourceExists(name, insights.sourceExists(name));
    }

    @GetMapping("/saved-queries")
    public List<LogModels.SavedQuery> savedQueries() {
        return insights.listSavedQueries();
    }

    @GetMapping("/alarms")
    public List<AlarmModels.AlarmSummary> alarms(@RequestParam(value = "inAlarm", defaultValue = "false") boolean inAlarm) {
        return alarms.listAlarms(inAlarm);
    }

    @ExceptionHandler(LogInsightsException.class)
    public ResponseEntity<InsightsModels.ErrorResponse> onInsightsError(LogInsightsException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            logger.warn("Insights request failed with {}: {}", e.errorCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new InsightsModels.ErrorResponse(e.errorCode(), e.getMessage(), details(e)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<InsightsModels.ErrorResponse> onBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(new InsightsModels.ErrorResponse("INVALID_ARGUMENT", e.getMessage(), Map.of()));
    }

    @ExceptionHandler(AwsAccessException.class)
    public ResponseEntity<InsightsModels.ErrorResponse> onAwsError(AwsAccessException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new InsightsModels.ErrorResponse("AWS_ACCESS_FAILED", e.getMessage(), Map.of()));
    }

    static HttpStatus statusFor(LogInsightsException e) {
        if (e instanceof SourceNotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof QuerySubmissionException) return HttpStatus.BAD_REQUEST;
        if (e instanceof QueryThrottledException) return HttpStatus.TOO_MANY_REQUESTS;
        if (e instanceof QueryExecutionFailedException) return HttpStatus.BAD_GATEWAY;
        if (e instanceof QueryTimeoutException) return HttpStatus.GATEWAY_TIMEOUT;
        if (e instanceof BackendUnavailableException) return HttpStatus.SERVICE_UNAVAILABLE;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> details(LogInsightsException e) {
        Map<String, Object> d = new LinkedHashMap<>();
        if (e instanceof SourceNotFoundException snf) {
            d.put("logGroupName", snf.source());
        } else if (e instanceof QueryThrottledException qt) {
            if (qt.queryId() != null) d.put("queryId", qt.queryId());
            d.put("attempts", qt.attempts());
        } else if (e instanceof QueryExecutionFailedException qf) {
            d.put("queryId", qf.queryId());
            d.put("state", qf.state());
        } else if (e instanceof QueryTimeoutException qto) {
            d.put("queryId", qto.queryId());
            d.put("elapsedMillis", qto.elapsed().toMillis());
        } else if (e instanceof BackendUnavailableException bu) {
            d.put("kind", bu.kind());
        }
        return d;
    }
}
