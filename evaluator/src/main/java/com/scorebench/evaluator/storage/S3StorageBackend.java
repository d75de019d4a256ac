package com.scorebench.evaluator.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

import java.time.Duration;

/**
 * Private-bucket storage on S3 (or any S3-compatible endpoint).
 *
 * Read URLs are presigned GETs, write URLs presigned PUTs.
 */
public class S3StorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(S3StorageBackend.class);

    private final S3Client    s3;
    private final S3Presigner presigner;
    private final String      bucket;

    public S3StorageBackend(S3Client s3, S3Presigner presigner, String bucket) {
        this.s3        = s3;
        this.presigner = presigner;
        this.bucket    = bucket;
    }

    @Override
    public String save(String path, byte[] content) {
        String key = objectKey(path);
        try {
            s3.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(),
                    RequestBody.fromBytes(content));
            log.debug("Stored s3://{}/{} ({} bytes)", bucket, key, content.length);
            return key;
        } catch (SdkException e) {
            throw new StorageException("save failed for s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public byte[] read(String path) {
        String key = objectKey(path);
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build())
                    .asByteArray();
        } catch (SdkException e) {
            throw new StorageException("read failed for s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public String sign(String path, AccessPermission permission, Duration duration) {
        String key = objectKey(path);
        try {
            if (permission == AccessPermission.WRITE) {
                PutObjectPresignRequest req = PutObjectPresignRequest.builder()
                        .signatureDuration(duration)
                        .putObjectRequest(r -> r.bucket(bucket).key(key))
                        .build();
                return presigner.presignPutObject(req).url().toString();
            }
            GetObjectPresignRequest req = GetObjectPresignRequest.builder()
                    .signatureDuration(duration)
                    .getObjectRequest(r -> r.bucket(bucket).key(key))
                    .build();
            return presigner.presignGetObject(req).url().toString();
        } catch (SdkException | IllegalArgumentException e) {
            throw new StorageException("presign failed for s3://" + bucket + "/" + key, e);
        }
    }

    /**
     * Reduce a stored reference to the object key.
     *
     * References may carry the full object URL; everything up to and including
     * the bucket name is dropped, and '+' (form-encoded space) turns back into
     * a space.
     */
    String objectKey(String path) {
        String key = path;
        int idx = key.lastIndexOf(bucket + "/");
        if (idx >= 0) {
            key = key.substring(idx + bucket.length() + 1);
        }
        key = key.replace('+', ' ');
        while (key.startsWith("/")) {
            key = key.substring(1);
        }
        return key;
    }
}
