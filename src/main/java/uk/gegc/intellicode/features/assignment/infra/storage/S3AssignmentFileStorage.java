package uk.gegc.intellicode.features.assignment.infra.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import uk.gegc.intellicode.features.assignment.config.AssignmentStorageProperties;
import uk.gegc.intellicode.shared.exception.StorageException;

import java.io.InputStream;

@Slf4j
@Component
@RequiredArgsConstructor
public class S3AssignmentFileStorage implements AssignmentFileStorage {

    private final S3Client s3Client;
    private final AssignmentStorageProperties properties;

    @Override
    public StoredObject store(String key, InputStream content, long size, String contentType) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(properties.getBucket())
                            .key(key)
                            .contentType(contentType)
                            .contentLength(size)
                            .acl(ObjectCannedACL.PUBLIC_READ)
                            .build(),
                    RequestBody.fromInputStream(content, size));
        } catch (SdkException ex) {
            throw new StorageException("Failed to store object " + key, ex);
        }
        log.debug("Stored submission object {} ({} bytes)", key, size);
        return new StoredObject(key, publicUrl(key));
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(properties.getBucket())
                    .key(key)
                    .build());
        } catch (SdkException ex) {
            throw new StorageException("Failed to delete object " + key, ex);
        }
        log.debug("Deleted submission object {}", key);
    }

    private String publicUrl(String key) {
        String base = properties.getPublicBaseUrl();
        return base.endsWith("/") ? base + key : base + "/" + key;
    }
}
