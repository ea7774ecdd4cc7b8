package org.iceforge.ullr.aws.alarms;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

public final class AlarmModels {
    private AlarmModels() {}

    public enum AlarmType { METRIC, COMPOSITE }

    /**
     * One CloudWatch alarm. Metric fields are only set for metric alarms; {@code rule} only for
     * composite alarms.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AlarmSummary(
            String name,
            String description,
            String state,
            String stateReason,
            Instant stateUpdatedAt,
            AlarmType type,
            String metric,
            String namespace,
            String statistic,
            Map<String, String> dimensions,
            String rule
    ) {}
}
