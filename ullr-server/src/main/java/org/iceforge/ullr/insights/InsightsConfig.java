package org.iceforge.ullr.insights;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.ullr.decode.ResultDecoder;
import org.iceforge.ullr.logs.LogInsightsBackend;
import org.iceforge.ullr.query.QueryExecutor;
import org.iceforge.ullr.query.Sleeper;
import org.iceforge.ullr.schema.SchemaInferencer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class InsightsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public QueryExecutor queryExecutor(LogInsightsBackend backend, InsightsProperties props, Clock clock, Sleeper sleeper) {
        return new QueryExecutor(backend, props.toPollingPolicy(), props.getDefaultLookback(), clock, sleeper);
    }

    @Bean
    public ResultDecoder resultDecoder(ObjectMapper mapper, InsightsProperties props) {
        return new ResultDecoder(mapper, props.getMessageField());
    }

    @Bean
    public SchemaInferencer schemaInferencer(ObjectMapper mapper) {
        return new SchemaInferencer(mapper);
    }
}
