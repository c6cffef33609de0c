package com.vendorhub.marketplace.modules.image;

import com.vendorhub.marketplace.model.entity.Product;
import com.vendorhub.marketplace.model.entity.ProductImage;
import com.vendorhub.marketplace.modules.image.dto.ProductImageResponse;
import com.vendorhub.marketplace.modules.image.exception.ImageErrorCode;
import com.vendorhub.marketplace.modules.image.exception.ImageOperationException;
import com.vendorhub.marketplace.repository.ProductImageRepository;
import com.vendorhub.marketplace.repository.ProductRepository;
import com.vendorhub.marketplace.service.AuditService;
import com.vendorhub.marketplace.service.storage.StorageException;
import com.vendorhub.marketplace.service.storage.StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lifecycle of product images.
 * <ul>
 * <li>Upload stores the file first, then the metadata row. If the row cannot
 * be written the stored file is deleted again (best effort).</li>
 * <li>Delete removes the stored file best effort, then always the row. A
 * failed file delete can leave an orphaned file, never an orphaned row.</li>
 * <li>Positions are plain sort keys: no uniqueness, no re-sequencing.</li>
 * </ul>
 * Only the vendor owning the product may modify its images.
 * <p>
 * {@link #upload} is deliberately not one database transaction: the insert
 * must have succeeded or failed before the method decides whether to
 * compensate.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@SuppressWarnings("null")
public class ProductImageService {

    static final String ENTITY_TYPE = "ProductImage";

    private final ProductRepository productRepository;
    private final ProductImageRepository imageRepository;
    private final StorageService storageService;
    private final AuditService auditService;

    /**
     * Store an image for a product owned by {@code vendorId}.
     *
     * @param position display position, {@code null} means 0
     * @throws ImageOperationException {@code INVALID_POSITION},
     *                                 {@code PRODUCT_NOT_FOUND} or
     *                                 {@code FORBIDDEN}
     * @throws StorageException        as raised by the storage backend
     */
    public ProductImageResponse upload(UUID productId, UUID vendorId, InputStream content,
            String filename, long size, Integer position) {
        int effectivePosition = checkPosition(position == null ? 0 : position);
        requireOwnedProduct(productId, vendorId);

        String reference = storageService.save(content, filename, size);

        ProductImage saved;
        try {
            saved = imageRepository.saveAndFlush(ProductImage.builder()
                    .productId(productId)
                    .imageUrl(reference)
                    .position(effectivePosition)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to persist image record for product {}: {}", productId, e.getMessage());
            removeStoredFile(reference);
            throw e;
        }

        log.info("Vendor {} uploaded image {} for product {} (file={}, position={})",
                vendorId, saved.getId(), productId, reference, effectivePosition);

        auditService.log(vendorId, "IMAGE_UPLOAD", ENTITY_TYPE, saved.getId().toString(),
                Map.of("productId", productId.toString(),
                        "file", reference,
                        "position", effectivePosition));

        return toResponse(saved);
    }

    /**
     * Delete an image row and, best effort, its stored file.
     *
     * @throws ImageOperationException {@code IMAGE_NOT_FOUND},
     *                                 {@code PRODUCT_NOT_FOUND} or
     *                                 {@code FORBIDDEN}
     */
    public void delete(UUID imageId, UUID vendorId) {
        ProductImage image = requireImage(imageId);
        requireOwnedProduct(image.getProductId(), vendorId);

        try {
            storageService.delete(image.getImageUrl());
        } catch (StorageException e) {
            log.warn("Failed to delete image file {} ({}), removing record anyway: {}",
                    image.getImageUrl(), e.getErrorCode(), e.getMessage());
        }

        imageRepository.deleteById(imageId);

        log.info("Vendor {} deleted image {} of product {}", vendorId, imageId, image.getProductId());

        auditService.log(vendorId, "IMAGE_DELETE", ENTITY_TYPE, imageId.toString(),
                Map.of("productId", image.getProductId().toString(),
                        "file", image.getImageUrl()));
    }

    /**
     * Move an image to a new display position. Sibling positions are left
     * untouched.
     */
    public void updatePosition(UUID imageId, UUID vendorId, Integer newPosition) {
        int position = checkPosition(newPosition);
        ProductImage image = requireImage(imageId);
        requireOwnedProduct(image.getProductId(), vendorId);

        if (imageRepository.updatePosition(imageId, position) == 0) {
            // removed between lookup and update
            throw new ImageOperationException(ImageErrorCode.IMAGE_NOT_FOUND, "image not found: " + imageId);
        }

        log.info("Vendor {} moved image {} from position {} to {}", vendorId, imageId, image.getPosition(), position);

        auditService.log(vendorId, "IMAGE_REPOSITION", ENTITY_TYPE, imageId.toString(),
                Map.of("productId", image.getProductId().toString(),
                        "from", image.getPosition(),
                        "to", position));
    }

    /**
     * Images of a product in display order; empty when it has none.
     */
    @Transactional(readOnly = true)
    public List<ProductImageResponse> listForProduct(UUID productId) {
        if (!productRepository.existsById(productId)) {
            throw new ImageOperationException(ImageErrorCode.PRODUCT_NOT_FOUND, "product not found: " + productId);
        }
        return imageRepository.findByProductIdOrderByPositionAscCreatedAtAscIdAsc(productId)
                .stream()
                .map(this::toResponse)
                .toList();
    }

    private ProductImageResponse toResponse(ProductImage image) {
        return new ProductImageResponse(image.getId(), storageService.resolveUrl(image.getImageUrl()),
                image.getPosition());
    }

    private ProductImage requireImage(UUID imageId) {
        return imageRepository.findById(imageId)
                .orElseThrow(() -> new ImageOperationException(ImageErrorCode.IMAGE_NOT_FOUND,
                        "image not found: " + imageId));
    }

    private Product requireOwnedProduct(UUID productId, UUID vendorId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ImageOperationException(ImageErrorCode.PRODUCT_NOT_FOUND,
                        "product not found: " + productId));
        if (!product.getUserId().equals(vendorId)) {
            log.warn("Vendor {} attempted to modify images of product {} owned by {}",
                    vendorId, productId, product.getUserId());
            throw new ImageOperationException(ImageErrorCode.FORBIDDEN,
                    "unauthorized: image does not belong to this vendor");
        }
        return product;
    }

    private static int checkPosition(Integer position) {
        if (position == null || position < 0) {
            throw new ImageOperationException(ImageErrorCode.INVALID_POSITION,
                    "position must be a non-negative integer");
        }
        return position;
    }

    /**
     * Compensation for a failed metadata insert. Runs even if the request
     * thread was interrupted; the interrupt flag is restored afterwards.
     */
    private void removeStoredFile(String reference) {
        boolean interrupted = Thread.interrupted();
        try {
            storageService.delete(reference);
            log.info("Removed stored file {} after failed metadata insert", reference);
        } catch (RuntimeException e) {
            log.warn("Compensation failed, file {} is orphaned in storage: {}", reference, e.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
