package com.vendorhub.marketplace.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "product_images")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductImage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /** FK to products.id, rows are removed by ON DELETE CASCADE. */
    @Column(name = "product_id", updatable = false, nullable = false)
    private UUID productId;

    /** Stored reference (generated filename), resolved to a URL on read. */
    @Column(name = "image_url", updatable = false, nullable = false)
    private String imageUrl;

    @Column(name = "position", nullable = false)
    private Integer position;

    @Column(name = "created_at", updatable = false, nullable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
        if (position == null)
            position = 0;
    }
}
