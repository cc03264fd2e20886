package com.pagesentry.analyze.storage;

import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.analyze.util.UrlUtils;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * S3-compatible (MinIO) object store. Buckets are created on first use.
 */
@Component
public class S3ObjectStore implements ObjectStore {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3;
    private final AnalyzerProperties properties;
    private final Set<String> knownBuckets = ConcurrentHashMap.newKeySet();

    public S3ObjectStore(S3Client s3, AnalyzerProperties properties) {
        this.s3 = s3;
        this.properties = properties;
    }

    @Override
    public StageResult<String> put(String bucket, String key, byte[] bytes, String contentType) {
        if (bytes == null || bytes.length == 0) {
            return StageResult.failed(FailureReasons.EMPTY_RESPONSE, "nothing to upload");
        }
        try {
            ensureBucket(bucket);
            s3.putObject(
                PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .contentLength((long) bytes.length)
                    .build(),
                RequestBody.fromBytes(bytes)
            );
            return StageResult.ok(publicUrl(bucket, key));
        } catch (SdkException e) {
            log.warn("Object upload failed bucket={} key={}: {}", bucket, key, e.getMessage());
            return StageResult.failed(FailureReasons.IO_ERROR, e.getMessage());
        }
    }

    String publicUrl(String bucket, String key) {
        return UrlUtils.trimTrailingSlash(properties.getStorage().getPublicBaseUrl()) + "/" + bucket + "/" + key;
    }

    private void ensureBucket(String bucket) {
        if (knownBuckets.contains(bucket)) {
            return;
        }
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (NoSuchBucketException e) {
            try {
                s3.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
                log.info("Created bucket {}", bucket);
            } catch (BucketAlreadyOwnedByYouException raced) {
                log.debug("Bucket {} was created concurrently", bucket);
            }
        }
        knownBuckets.add(bucket);
    }
}
