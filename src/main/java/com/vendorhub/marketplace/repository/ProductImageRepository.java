package com.vendorhub.marketplace.repository;

import com.vendorhub.marketplace.model.entity.ProductImage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProductImageRepository extends JpaRepository<ProductImage, UUID> {

    /** Display order: position, then upload time, then id for a stable tie-break. */
    List<ProductImage> findByProductIdOrderByPositionAscCreatedAtAscIdAsc(UUID productId);

    /** Sets one image's position; siblings keep theirs. Returns the number of rows updated. */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE ProductImage i SET i.position = :position WHERE i.id = :id")
    int updatePosition(@Param("id") UUID id, @Param("position") int position);
}
