package com.vendorhub.marketplace.service.storage;

import com.vendorhub.marketplace.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Local filesystem implementation of {@link StorageService}.
 * Active when {@code storage.provider=local} (the default).
 * Files are served back by the {@code /uploads/**} resource handler.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "storage.provider", havingValue = "local", matchIfMissing = true)
public class LocalStorageServiceImpl implements StorageService {

    private static final int BUFFER_SIZE = 8192;

    private final Path storageRoot;
    private final String baseUrl;
    private final long maxFileSize;
    private final Set<String> allowedExtensions;
    private final Duration operationTimeout;
    private final Clock clock;

    @Autowired
    public LocalStorageServiceImpl(StorageProperties properties) {
        this(Paths.get(properties.getLocal().getDirectory()),
                properties.getLocal().getBaseUrl(),
                properties.getMaxFileSize(),
                properties.getAllowedExtensions(),
                properties.getOperationTimeout(),
                Clock.systemUTC());
    }

    public LocalStorageServiceImpl(Path storageRoot, String baseUrl, long maxFileSize,
            Set<String> allowedExtensions, Duration operationTimeout, Clock clock) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        this.baseUrl = baseUrl;
        this.maxFileSize = maxFileSize;
        this.allowedExtensions = allowedExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.operationTimeout = operationTimeout;
        this.clock = clock;
        try {
            Files.createDirectories(this.storageRoot);
            log.info("LocalStorageService initialized at {} (baseUrl={}, timeout={})",
                    this.storageRoot, baseUrl, operationTimeout);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create upload directory: " + this.storageRoot, e);
        }
    }

    @Override
    public String save(InputStream content, String declaredFilename, long declaredSize) {
        String ext = StoredFileNames.validate(declaredFilename, declaredSize, maxFileSize, allowedExtensions);
        String filename = StoredFileNames.generate(ext, clock);
        Path target = storageRoot.resolve(filename);

        try {
            long written = copyBounded(content, target);
            log.debug("Stored {} ({} bytes, declared={})", filename, written, declaredSize);
            return filename;
        } catch (StorageException e) {
            removePartial(target);
            throw e;
        } catch (FileAlreadyExistsException e) {
            // generated name collided with an existing file, leave that file alone
            throw new StorageException(StorageErrorCode.IO_FAILURE, "failed to save file", e);
        } catch (IOException e) {
            removePartial(target);
            throw new StorageException(StorageErrorCode.IO_FAILURE, "failed to save file", e);
        }
    }

    @Override
    public void delete(String reference) {
        Path filePath = resolve(StoredFileNames.checkedFilename(reference));
        try {
            Files.delete(filePath);
            log.debug("Deleted {}", filePath.getFileName());
        } catch (NoSuchFileException e) {
            throw new StorageException(StorageErrorCode.NOT_FOUND, "file not found: " + filePath.getFileName(), e);
        } catch (IOException e) {
            throw new StorageException(StorageErrorCode.IO_FAILURE, "failed to delete file: " + filePath.getFileName(), e);
        }
    }

    @Override
    public String resolveUrl(String reference) {
        return StoredFileNames.joinUrl(baseUrl, reference);
    }

    /**
     * Copies until end of stream, enforcing the size limit on the real byte
     * count and the operation timeout between chunks. A single blocked read
     * is not interrupted.
     */
    private long copyBounded(InputStream content, Path target) throws IOException {
        Instant deadline = clock.instant().plus(operationTimeout);
        long total = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE)) {
            int read;
            while ((read = content.read(buffer)) != -1) {
                total += read;
                if (total > maxFileSize) {
                    throw new StorageException(StorageErrorCode.SIZE_EXCEEDED,
                            "file size exceeds maximum allowed size of " + maxFileSize + " bytes");
                }
                if (clock.instant().isAfter(deadline)) {
                    throw new StorageException(StorageErrorCode.TIMEOUT,
                            "file upload did not complete within " + operationTimeout);
                }
                out.write(buffer, 0, read);
            }
        }
        return total;
    }

    private void removePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Could not remove partial upload {}: {}", target.getFileName(), e.getMessage());
        }
    }

    private Path resolve(String filename) {
        Path resolved = storageRoot.resolve(filename).normalize();
        if (!resolved.startsWith(storageRoot) || resolved.equals(storageRoot)) {
            throw new StorageException(StorageErrorCode.INVALID_REFERENCE, "invalid filename: " + filename);
        }
        return resolved;
    }
}
