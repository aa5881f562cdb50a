package com.eduhub.enrollment.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * Publishes enrollment metrics to CloudWatch.
 *
 * Every meter carries a {@code service} tag with the application name so
 * several deployments can share one namespace. With
 * {@code cloud.aws.cloudwatch.enabled=false} Spring Boot's default registry
 * backs {@link com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService}.
 *
 * @author Enrollment Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true", matchIfMissing = true)
public class CloudWatchConfig {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchConfig.class);

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:Enrollment}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private int batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step;

    @Value("${spring.application.name:enrollment-core}")
    private String applicationName;

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        CloudWatchMeterRegistry registry = new CloudWatchMeterRegistry(
                registryConfig(namespace, batchSize, step), Clock.SYSTEM, cloudWatchAsyncClient);
        registry.config().commonTags("service", applicationName);

        logger.info("CloudWatch metrics enabled: namespace {}, region {}, step {}", namespace, awsRegion, step);
        return registry;
    }

    static io.micrometer.cloudwatch2.CloudWatchConfig registryConfig(String namespace, int batchSize, String step) {
        Map<String, String> properties = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step
        );
        return properties::get;
    }
}
