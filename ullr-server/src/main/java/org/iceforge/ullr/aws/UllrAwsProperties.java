package org.iceforge.ullr.aws;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AWS client settings. Credentials always come from the default provider chain.
 */
@ConfigurationProperties(prefix = "ullr.aws")
public record UllrAwsProperties(
        String region,
        Endpoint logs,
        Endpoint cloudwatch
) {
    public record Endpoint(
            String endpoint
    ) {}
}
