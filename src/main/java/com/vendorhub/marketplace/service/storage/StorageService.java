package com.vendorhub.marketplace.service.storage;

import java.io.InputStream;

/**
 * Abstraction for product image storage.
 * Implementations target the local filesystem or an S3-compatible object store
 * and are selected once at start-up via {@code storage.provider}.
 */
public interface StorageService {

    /**
     * Validate and store an uploaded file under a freshly generated name.
     *
     * @param content          the file content, read to the end on success
     * @param declaredFilename the client-supplied filename, used only for its
     *                         extension
     * @param declaredSize     the client-declared size in bytes
     * @return the generated reference (bare filename)
     * @throws StorageException with {@code SIZE_EXCEEDED},
     *                          {@code UNSUPPORTED_TYPE}, {@code IO_FAILURE} or
     *                          {@code TIMEOUT}
     */
    String save(InputStream content, String declaredFilename, long declaredSize);

    /**
     * Delete a stored file.
     *
     * @param reference bare filename or full locator
     * @throws StorageException with {@code INVALID_REFERENCE}, {@code NOT_FOUND},
     *                          {@code IO_FAILURE} or {@code TIMEOUT}
     */
    void delete(String reference);

    /**
     * Build the externally fetchable URL for a reference. Pure, never fails.
     *
     * @param reference bare filename or an already resolved locator
     * @return the public URL
     */
    String resolveUrl(String reference);
}
