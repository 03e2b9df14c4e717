package com.platform.drcontrol.connectors.s3;

import com.platform.drcontrol.connectors.BlobStore;
import com.platform.drcontrol.connectors.dynamodb.RegionalClientFactory;
import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.model.Region;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * S3 implementation of {@link BlobStore}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class S3BlobStore implements BlobStore {
    
    private final RegionalClientFactory clientFactory;
    
    @Override
    public void ping(Region region, String bucket) {
        try {
            clientFactory.s3(region).listObjectsV2(ListObjectsV2Request.builder()
                .bucket(bucket)
                .maxKeys(1)
                .build());
        } catch (SdkException e) {
            throw BackendUnavailableException.blobStorage(region.id(), "listObjects:" + bucket, e);
        }
    }
    
    @Override
    public void putJson(Region region, String bucket, String key, byte[] content) {
        try {
            clientFactory.s3(region).putObject(PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType("application/json")
                    .build(),
                RequestBody.fromBytes(content));
            log.debug("Uploaded {} bytes to s3://{}/{}", content.length, bucket, key);
        } catch (SdkException e) {
            throw BackendUnavailableException.blobStorage(region.id(), "putObject:" + bucket, e);
        }
    }
}
