package com.vendorhub.marketplace.service.storage;

import java.time.Clock;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Naming rules shared by all storage backends.
 * <p>
 * Stored files are always named {@code <unix-seconds>_<8-hex>.<ext>}; the
 * client-supplied filename contributes nothing but its extension.
 * </p>
 */
public final class StoredFileNames {

    private StoredFileNames() {
    }

    /**
     * Check the declared size and extension of an upload.
     *
     * @return the lowercase extension without the dot
     */
    public static String validate(String declaredFilename, long declaredSize, long maxFileSize,
            Set<String> allowedExtensions) {
        if (declaredSize > maxFileSize) {
            throw new StorageException(StorageErrorCode.SIZE_EXCEEDED,
                    "file size exceeds maximum allowed size of " + maxFileSize + " bytes");
        }
        String ext = extensionOf(declaredFilename);
        if (ext.isEmpty() || !allowedExtensions.contains(ext)) {
            throw new StorageException(StorageErrorCode.UNSUPPORTED_TYPE,
                    "file type ." + ext + " not allowed. Allowed types: " + String.join(", ", allowedExtensions));
        }
        return ext;
    }

    public static String generate(String ext, Clock clock) {
        String randomId = UUID.randomUUID().toString().substring(0, 8);
        return clock.instant().getEpochSecond() + "_" + randomId + "." + ext;
    }

    /**
     * Reduce a bare filename or full locator to the stored filename, rejecting
     * anything that tries to climb out of the storage root.
     */
    public static String checkedFilename(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new StorageException(StorageErrorCode.INVALID_REFERENCE, "invalid filename");
        }
        if (reference.contains("..")) {
            throw new StorageException(StorageErrorCode.INVALID_REFERENCE, "invalid filename: " + reference);
        }
        String filename = trailingSegment(reference);
        if (filename.isBlank()) {
            throw new StorageException(StorageErrorCode.INVALID_REFERENCE, "invalid filename: " + reference);
        }
        return filename;
    }

    public static String trailingSegment(String reference) {
        int cut = Math.max(reference.lastIndexOf('/'), reference.lastIndexOf('\\'));
        return cut >= 0 ? reference.substring(cut + 1) : reference;
    }

    public static String joinUrl(String baseUrl, String reference) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/" + trailingSegment(reference);
    }

    public static String contentType(String ext) {
        return switch (ext) {
            case "png" -> "image/png";
            case "gif" -> "image/gif";
            case "webp" -> "image/webp";
            default -> "image/jpeg";
        };
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        String name = trailingSegment(filename);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
