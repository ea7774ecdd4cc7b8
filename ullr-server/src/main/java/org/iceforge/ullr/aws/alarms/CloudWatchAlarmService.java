package org.iceforge.ullr.aws.alarms;

import org.iceforge.ullr.aws.AwsAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lists CloudWatch metric and composite alarms.
 */
@Service
public class CloudWatchAlarmService {
    private static final Logger logger = LoggerFactory.getLogger(CloudWatchAlarmService.class);

    private final CloudWatchClient cloudWatch;

    public CloudWatchAlarmService(CloudWatchClient cloudWatch) {
        this.cloudWatch = Objects.requireNonNull(cloudWatch);
    }

    /**
     * @param onlyInAlarm restrict to alarms currently in the ALARM state
     */
    public List<AlarmModels.AlarmSummary> listAlarms(boolean onlyInAlarm) {
        List<AlarmModels.AlarmSummary> out = new ArrayList<>();
        String token = null;
        try {
            do {
                // without alarmTypes DescribeAlarms only returns metric alarms
                DescribeAlarmsRequest.Builder req = DescribeAlarmsRequest.builder()
                        .alarmTypes(AlarmType.METRIC_ALARM, AlarmType.COMPOSITE_ALARM);
                if (onlyInAlarm) req = req.stateValue(StateValue.ALARM);
                if (token != null) req = req.nextToken(token);

                DescribeAlarmsResponse resp = cloudWatch.describeAlarms(req.build());
                for (MetricAlarm a : resp.metricAlarms()) out.add(metricAlarm(a));
                for (CompositeAlarm a : resp.compositeAlarms()) out.add(compositeAlarm(a));
                token = resp.nextToken();
            } while (token != null && !token.isBlank());
        } catch (SdkException e) {
            logger.error("DescribeAlarms failed (onlyInAlarm={})", onlyInAlarm, e);
            throw new AwsAccessException("CloudWatch DescribeAlarms failed: " + e.getMessage(), e);
        }
        logger.debug("Listed {} alarm(s) (onlyInAlarm={})", out.size(), onlyInAlarm);
        return out;
    }

    private static AlarmModels.AlarmSummary metricAlarm(MetricAlarm a) {
        Map<String, String> dims = new LinkedHashMap<>();
        if (a.hasDimensions()) {
            for (Dimension d : a.dimensions()) dims.put(d.name(), d.value());
        }
        String statistic = a.statisticAsString() != null ? a.statisticAsString() : a.extendedStatistic();
        return new AlarmModels.AlarmSummary(
                a.alarmName(),
                a.alarmDescription(),
                a.stateValueAsString(),
                a.stateReason(),
                a.stateUpdatedTimestamp(),
                AlarmModels.AlarmType.METRIC,
                a.metricName(),
                a.namespace(),
                statistic,
                dims,
                null
        );
    }

    private static AlarmModels.AlarmSummary compositeAlarm(CompositeAlarm a) {
        return new AlarmModels.AlarmSummary(
                a.alarmName(),
                a.alarmDescription(),
                a.stateValueAsString(),
                a.stateReason(),
                a.stateUpdatedTimestamp(),
                AlarmModels.AlarmType.COMPOSITE,
                null,
                null,
                null,
                null,
                a.alarmRule()
        );
    }
}
