package com.vendorhub.marketplace.modules.image;

import com.vendorhub.marketplace.modules.auth.AuthenticatedUser;
import com.vendorhub.marketplace.modules.auth.JwtAuthFilter;
import com.vendorhub.marketplace.modules.image.dto.MessageResponse;
import com.vendorhub.marketplace.modules.image.dto.ProductImageResponse;
import com.vendorhub.marketplace.modules.image.dto.UpdatePositionRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Controller for product images.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /products/{productId}/images: Upload an image (vendor)</li>
 * <li>GET /products/{productId}/images: List images in display order
 * (public)</li>
 * <li>DELETE /images/{imageId}: Delete an image (vendor)</li>
 * <li>PUT /images/{imageId}/position: Change display position (vendor)</li>
 * </ul>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ProductImageController {

    static final String DELETED_MESSAGE = "image deleted successfully";
    static final String POSITION_UPDATED_MESSAGE = "image position updated successfully";

    private final ProductImageService productImageService;

    // ================================================================
    // POST /products/{productId}/images: multipart upload
    // ================================================================

    @PostMapping(value = "/products/{productId}/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> upload(@PathVariable("productId") UUID productId,
            @RequestPart("image") MultipartFile image,
            @RequestParam(value = "position", required = false) Integer position,
            HttpServletRequest request) throws IOException {

        AuthenticatedUser vendor = getCurrentUser(request);
        if (vendor == null || !vendor.isVendor()) {
            return forbidden("only vendors can upload product images");
        }

        ProductImageResponse created;
        try (InputStream content = image.getInputStream()) {
            created = productImageService.upload(productId, vendor.userId(), content,
                    image.getOriginalFilename(), image.getSize(), position);
        }

        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // ================================================================
    // GET /products/{productId}/images: public listing
    // ================================================================

    @GetMapping("/products/{productId}/images")
    public ResponseEntity<List<ProductImageResponse>> list(@PathVariable("productId") UUID productId) {
        return ResponseEntity.ok(productImageService.listForProduct(productId));
    }

    // ================================================================
    // DELETE /images/{imageId}
    // ================================================================

    @DeleteMapping("/images/{imageId}")
    public ResponseEntity<?> delete(@PathVariable("imageId") UUID imageId, HttpServletRequest request) {
        AuthenticatedUser vendor = getCurrentUser(request);
        if (vendor == null || !vendor.isVendor()) {
            return forbidden("only vendors can delete product images");
        }

        productImageService.delete(imageId, vendor.userId());

        return ResponseEntity.ok(new MessageResponse(DELETED_MESSAGE));
    }

    // ================================================================
    // PUT /images/{imageId}/position
    // ================================================================

    @PutMapping("/images/{imageId}/position")
    public ResponseEntity<?> updatePosition(@PathVariable("imageId") UUID imageId,
            @Valid @RequestBody UpdatePositionRequest body,
            HttpServletRequest request) {
        AuthenticatedUser vendor = getCurrentUser(request);
        if (vendor == null || !vendor.isVendor()) {
            return forbidden("only vendors can update product images");
        }

        productImageService.updatePosition(imageId, vendor.userId(), body.getPosition());

        return ResponseEntity.ok(new MessageResponse(POSITION_UPDATED_MESSAGE));
    }

    private AuthenticatedUser getCurrentUser(HttpServletRequest request) {
        return (AuthenticatedUser) request.getAttribute(JwtAuthFilter.CURRENT_USER_ATTRIBUTE);
    }

    private ResponseEntity<Map<String, Object>> forbidden(String message) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Map.of("status", HttpStatus.FORBIDDEN.value(),
                        "error", "Forbidden",
                        "message", message));
    }
}
