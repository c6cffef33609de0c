package com.vendorhub.marketplace.service.storage;

import com.vendorhub.marketplace.config.StorageProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.InputStream;

/**
 * All direct AWS SDK usage for the remote image store.
 * <p>
 * Every call runs behind the {@code objectStorage} circuit breaker and is
 * bounded by the client's API call timeout. SDK failures are translated into
 * {@link StorageException}s so nothing vendor-specific leaks upwards.
 * </p>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3")
public class S3ObjectGateway {

    private final S3Client s3Client;
    private final String bucket;

    public S3ObjectGateway(S3Client s3Client, StorageProperties storageProperties) {
        this.s3Client = s3Client;
        this.bucket = storageProperties.getS3().getBucket();
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalStateException("storage.s3.bucket must be configured when storage.provider=s3");
        }
    }

    @CircuitBreaker(name = "objectStorage", fallbackMethod = "putUnavailable")
    public void put(String key, InputStream content, long contentLength, String contentType) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .build();
            s3Client.putObject(request, RequestBody.fromInputStream(content, contentLength));
            log.info("Uploaded {} to bucket {} ({} bytes)", key, bucket, contentLength);
        } catch (SdkException e) {
            throw translate("upload", key, e);
        }
    }

    /**
     * @return {@code false} when the object does not exist
     */
    @CircuitBreaker(name = "objectStorage", fallbackMethod = "existsUnavailable")
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw translate("head", key, e);
        } catch (SdkException e) {
            throw translate("head", key, e);
        }
    }

    @CircuitBreaker(name = "objectStorage", fallbackMethod = "deleteUnavailable")
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            log.debug("Deleted {} from bucket {}", key, bucket);
        } catch (SdkException e) {
            throw translate("delete", key, e);
        }
    }

    private void putUnavailable(String key, InputStream content, long contentLength, String contentType,
            CallNotPermittedException e) {
        throw unavailable(key, e);
    }

    private boolean existsUnavailable(String key, CallNotPermittedException e) {
        throw unavailable(key, e);
    }

    private void deleteUnavailable(String key, CallNotPermittedException e) {
        throw unavailable(key, e);
    }

    private StorageException unavailable(String key, CallNotPermittedException e) {
        log.warn("Object storage circuit open, rejecting call for {}", key);
        return new StorageException(StorageErrorCode.IO_FAILURE, "object storage temporarily unavailable", e);
    }

    private StorageException translate(String operation, String key, SdkException e) {
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            log.error("S3 {} timed out for {}", operation, key);
            return new StorageException(StorageErrorCode.TIMEOUT, "object storage " + operation + " timed out", e);
        }
        log.error("S3 {} failed for {}: {}", operation, key, e.getMessage());
        return new StorageException(StorageErrorCode.IO_FAILURE, "object storage " + operation + " failed", e);
    }
}
