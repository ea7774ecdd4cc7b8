package org.iceforge.ullr.aws;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClientBuilder;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClientBuilder;

import java.net.URI;

/**
 * Builds the CloudWatch Logs and CloudWatch clients. Both are thread-safe and shared for the life of
 * the process.
 */
@Configuration
public class CloudWatchClientConfig {

    @Bean(destroyMethod = "close")
    public CloudWatchLogsClient cloudWatchLogsClient(UllrAwsProperties props) {
        CloudWatchLogsClientBuilder b = CloudWatchLogsClient.builder()
                .httpClientBuilder(ApacheHttpClient.builder())
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(props.region()));

        String endpoint = props.logs() == null ? null : props.logs().endpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            b = b.endpointOverride(URI.create(endpoint));
        }
        return b.build();
    }

    @Bean(destroyMethod = "close")
    public CloudWatchClient cloudWatchClient(UllrAwsProperties props) {
        CloudWatchClientBuilder b = CloudWatchClient.builder()
                .httpClientBuilder(ApacheHttpClient.builder())
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(props.region()));

        String endpoint = props.cloudwatch() == null ? null : props.cloudwatch().endpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            b = b.endpointOverride(URI.create(endpoint));
        }
        return b.build();
    }
}
