package com.vendorhub.marketplace.service.storage;

import com.vendorhub.marketplace.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.Clock;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * S3-compatible object store implementation of {@link StorageService}.
 * Active when {@code storage.provider=s3}. Works against AWS S3 as well as
 * Supabase Storage or MinIO through an endpoint override.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3")
public class S3StorageServiceImpl implements StorageService {

    private final S3ObjectGateway gateway;
    private final String publicBaseUrl;
    private final long maxFileSize;
    private final Set<String> allowedExtensions;
    private final Clock clock;

    @Autowired
    public S3StorageServiceImpl(S3ObjectGateway gateway, StorageProperties properties) {
        this(gateway, publicBaseUrl(properties.getS3()), properties.getMaxFileSize(),
                properties.getAllowedExtensions(), Clock.systemUTC());
    }

    public S3StorageServiceImpl(S3ObjectGateway gateway, String publicBaseUrl, long maxFileSize,
            Set<String> allowedExtensions, Clock clock) {
        this.gateway = gateway;
        this.publicBaseUrl = publicBaseUrl;
        this.maxFileSize = maxFileSize;
        this.allowedExtensions = allowedExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.clock = clock;
        log.info("S3StorageService initialized (publicBaseUrl={})", publicBaseUrl);
    }

    @Override
    public String save(InputStream content, String declaredFilename, long declaredSize) {
        String ext = StoredFileNames.validate(declaredFilename, declaredSize, maxFileSize, allowedExtensions);
        String filename = StoredFileNames.generate(ext, clock);
        // PutObject is atomic, a failed upload leaves no partial object behind
        gateway.put(filename, content, declaredSize, StoredFileNames.contentType(ext));
        return filename;
    }

    @Override
    public void delete(String reference) {
        String filename = StoredFileNames.checkedFilename(reference);
        if (!gateway.exists(filename)) {
            throw new StorageException(StorageErrorCode.NOT_FOUND, "file not found: " + filename);
        }
        gateway.delete(filename);
    }

    @Override
    public String resolveUrl(String reference) {
        return StoredFileNames.joinUrl(publicBaseUrl, reference);
    }

    static String publicBaseUrl(StorageProperties.S3 s3) {
        if (hasText(s3.getPublicUrl())) {
            return s3.getPublicUrl();
        }
        if (hasText(s3.getEndpoint())) {
            String endpoint = s3.getEndpoint().endsWith("/")
                    ? s3.getEndpoint().substring(0, s3.getEndpoint().length() - 1)
                    : s3.getEndpoint();
            return endpoint + "/" + s3.getBucket();
        }
        return "https://" + s3.getBucket() + ".s3." + s3.getRegion() + ".amazonaws.com";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
