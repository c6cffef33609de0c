package com.vendorhub.marketplace.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Binds the {@code storage.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

    /** {@code local} or {@code s3} */
    private String provider = "local";

    private long maxFileSize = DEFAULT_MAX_FILE_SIZE;

    /** Lowercase, without the leading dot. */
    private Set<String> allowedExtensions = new LinkedHashSet<>(List.of("jpg", "jpeg", "png", "gif", "webp"));

    /** Upper bound for a single backend call. */
    private Duration operationTimeout = Duration.ofSeconds(10);

    private Local local = new Local();
    private S3 s3 = new S3();

    @Getter
    @Setter
    public static class Local {
        private String directory = "./uploads";
        private String baseUrl = "http://localhost:8080/uploads";
    }

    @Getter
    @Setter
    public static class S3 {
        private String endpoint;
        private String region = "us-east-1";
        private String bucket;
        private String publicUrl;
        private String accessKeyId;
        private String secretAccessKey;
    }
}
