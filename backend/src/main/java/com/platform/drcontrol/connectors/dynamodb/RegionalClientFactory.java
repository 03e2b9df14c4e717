package com.platform.drcontrol.connectors.dynamodb;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.model.Region;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and caches one SDK client per (service, region).
 * Clients are thread-safe and shared by every component that talks to the same region.
 */
@Slf4j
public class RegionalClientFactory implements AutoCloseable {
    
    private final DrControlProperties.Aws settings;
    private final Map<String, DynamoDbClient> dynamoDbClients = new ConcurrentHashMap<>();
    private final Map<String, S3Client> s3Clients = new ConcurrentHashMap<>();
    private final Map<String, CloudWatchClient> cloudWatchClients = new ConcurrentHashMap<>();
    
    public RegionalClientFactory(DrControlProperties.Aws settings) {
        this.settings = settings;
    }
    
    public DynamoDbClient dynamoDb(Region region) {
        return dynamoDbClients.computeIfAbsent(region.id(), id ->
            configure(DynamoDbClient.builder(), id).build());
    }
    
    public S3Client s3(Region region) {
        // Path-style keeps LocalStack endpoint overrides working
        return s3Clients.computeIfAbsent(region.id(), id ->
            configure(S3Client.builder(), id)
                .forcePathStyle(settings.getEndpointOverride() != null)
                .build());
    }
    
    public CloudWatchClient cloudWatch(Region region) {
        return cloudWatchClients.computeIfAbsent(region.id(), id ->
            configure(CloudWatchClient.builder(), id).build());
    }
    
    private <B extends AwsClientBuilder<B, C>, C> B configure(B builder, String regionId) {
        log.info("Creating {} client for region {}", builder.getClass().getSimpleName(), regionId);
        builder.region(software.amazon.awssdk.regions.Region.of(regionId))
            .overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(settings.getApiCallTimeout())
                .apiCallAttemptTimeout(settings.getApiCallAttemptTimeout())
                .build());
        if (settings.getEndpointOverride() != null && !settings.getEndpointOverride().isBlank()) {
            builder.endpointOverride(URI.create(settings.getEndpointOverride()));
        }
        return builder;
    }
    
    @Override
    public void close() {
        closeAll(dynamoDbClients);
        closeAll(s3Clients);
        closeAll(cloudWatchClients);
    }
    
    private void closeAll(Map<String, ? extends SdkClient> clients) {
        clients.forEach((region, client) -> {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close {} client for {}: {}", client.serviceName(), region, e.getMessage());
            }
        });
        clients.clear();
    }
}
