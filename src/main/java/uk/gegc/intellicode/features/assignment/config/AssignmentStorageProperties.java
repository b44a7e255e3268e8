package uk.gegc.intellicode.features.assignment.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;

@Data
@Validated
@ConfigurationProperties(prefix = "app.storage")
public class AssignmentStorageProperties {

    @NotBlank
    private String bucket = "intellicode-submissions";

    @NotBlank
    private String region = "us-east-1";

    /**
     * S3-compatible API endpoint.
     * Example: https://s3.us-east-1.amazonaws.com
     */
    @NotNull
    private URI endpoint = URI.create("https://s3.us-east-1.amazonaws.com");

    /**
     * Base URL under which stored objects are publicly readable.
     */
    @NotBlank
    private String publicBaseUrl = "https://intellicode-submissions.s3.us-east-1.amazonaws.com";

    /**
     * Key prefix for submission uploads.
     */
    @NotBlank
    private String keyPrefix = "assignment-submissions";

    /**
     * Key prefix for files instructors attach to assignments.
     */
    @NotBlank
    private String attachmentKeyPrefix = "assignment-attachments";

    @Positive
    private long maxFileSizeBytes = 25L * 1024 * 1024;

    @NotBlank
    private String accessKey = "dev-access-key";

    @NotBlank
    private String secretKey = "dev-secret-key";
}
