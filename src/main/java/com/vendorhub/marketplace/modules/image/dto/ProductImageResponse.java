package com.vendorhub.marketplace.modules.image.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Image as returned to clients; {@code image_url} is the resolved public URL.
 */
public record ProductImageResponse(
        UUID id,
        @JsonProperty("image_url") String imageUrl,
        int position) {
}
