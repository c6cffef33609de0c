package com.vendorhub.marketplace.modules.image;

import com.vendorhub.marketplace.model.entity.Product;
import com.vendorhub.marketplace.model.entity.ProductImage;
import com.vendorhub.marketplace.modules.image.dto.ProductImageResponse;
import com.vendorhub.marketplace.modules.image.exception.ImageErrorCode;
import com.vendorhub.marketplace.modules.image.exception.ImageOperationException;
import com.vendorhub.marketplace.repository.ProductImageRepository;
import com.vendorhub.marketplace.repository.ProductRepository;
import com.vendorhub.marketplace.service.AuditService;
import com.vendorhub.marketplace.service.storage.StorageErrorCode;
import com.vendorhub.marketplace.service.storage.StorageException;
import com.vendorhub.marketplace.service.storage.StorageService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class ProductImageServiceTest {

    private static final String BASE_URL = "http://localhost:8080/uploads";
    private static final String STORED = "1700000000_abcd1234.jpg";

    @Mock
    private ProductRepository productRepository;

    @Mock
    private ProductImageRepository imageRepository;

    @Mock
    private StorageService storageService;

    @Mock
    private AuditService auditService;

    @InjectMocks
    private ProductImageService productImageService;

    private final UUID vendorId = UUID.randomUUID();
    private final UUID productId = UUID.randomUUID();
    private final InputStream content = new ByteArrayInputStream(new byte[] { 1, 2, 3 });

    // ---------------------------------------------------------------- upload

    @Test
    @DisplayName("Upload stores the file before inserting the row and returns the public URL")
    void uploadStoresFileThenRecord() {
        givenOwnedProduct();
        when(storageService.save(content, "shoe.jpg", 3)).thenReturn(STORED);
        when(imageRepository.saveAndFlush(any(ProductImage.class))).thenAnswer(inv -> withId(inv.getArgument(0)));
        givenUrlResolution();

        ProductImageResponse response = productImageService.upload(productId, vendorId, content, "shoe.jpg", 3, 2);

        assertNotNull(response.id());
        assertEquals(BASE_URL + "/" + STORED, response.imageUrl());
        assertEquals(2, response.position());

        InOrder order = inOrder(storageService, imageRepository);
        order.verify(storageService).save(content, "shoe.jpg", 3);
        ArgumentCaptor<ProductImage> row = ArgumentCaptor.forClass(ProductImage.class);
        order.verify(imageRepository).saveAndFlush(row.capture());
        assertEquals(productId, row.getValue().getProductId());
        assertEquals(STORED, row.getValue().getImageUrl());

        verify(auditService).log(eq(vendorId), eq("IMAGE_UPLOAD"), eq("ProductImage"), anyString(), any());
    }

    @Test
    void uploadWithoutPositionDefaultsToZero() {
        givenOwnedProduct();
        when(storageService.save(any(), anyString(), anyLong())).thenReturn(STORED);
        when(imageRepository.saveAndFlush(any(ProductImage.class))).thenAnswer(inv -> withId(inv.getArgument(0)));
        givenUrlResolution();

        ProductImageResponse response = productImageService.upload(productId, vendorId, content, "shoe.jpg", 3, null);

        assertEquals(0, response.position());
    }

    @Test
    @DisplayName("Negative position is rejected before any lookup or storage call")
    void uploadRejectsNegativePosition() {
        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.upload(productId, vendorId, content, "shoe.jpg", 3, -1));

        assertEquals(ImageErrorCode.INVALID_POSITION, ex.getErrorCode());
        verifyNoInteractions(productRepository, imageRepository, storageService, auditService);
    }

    @Test
    void uploadForUnknownProduct() {
        when(productRepository.findById(productId)).thenReturn(Optional.empty());

        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.upload(productId, vendorId, content, "shoe.jpg", 3, 0));

        assertEquals(ImageErrorCode.PRODUCT_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(storageService);
    }

    @Test
    @DisplayName("Another vendor's product: forbidden, nothing stored")
    void uploadForForeignProduct() {
        when(productRepository.findById(productId)).thenReturn(Optional.of(product(UUID.randomUUID())));

        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.upload(productId, vendorId, content, "shoe.jpg", 3, 0));

        assertEquals(ImageErrorCode.FORBIDDEN, ex.getErrorCode());
        assertEquals("unauthorized: image does not belong to this vendor", ex.getMessage());
        verifyNoInteractions(storageService, imageRepository, auditService);
    }

    @Test
    void uploadSurfacesStorageRejectionUnchanged() {
        givenOwnedProduct();
        StorageException rejected = new StorageException(StorageErrorCode.UNSUPPORTED_TYPE,
                "unsupported file type: exe");
        when(storageService.save(any(), eq("virus.exe"), anyLong())).thenThrow(rejected);

        StorageException ex = assertThrows(StorageException.class,
                () -> productImageService.upload(productId, vendorId, content, "virus.exe", 3, 0));

        assertSame(rejected, ex);
        verifyNoInteractions(imageRepository, auditService);
    }

    @Test
    @DisplayName("Failed row insert deletes the freshly stored file and surfaces the insert error")
    void uploadCompensatesFailedInsert() {
        givenOwnedProduct();
        when(storageService.save(any(), anyString(), anyLong())).thenReturn(STORED);
        DataIntegrityViolationException insertFailure = new DataIntegrityViolationException("fk violation");
        when(imageRepository.saveAndFlush(any(ProductImage.class))).thenThrow(insertFailure);

        DataIntegrityViolationException ex = assertThrows(DataIntegrityViolationException.class,
                () -> productImageService.upload(productId, vendorId, content, "shoe.jpg", 3, 0));

        assertSame(insertFailure, ex);
        verify(storageService).delete(STORED);
        verifyNoInteractions(auditService);
    }

    @Test
    void uploadCompensationFailureKeepsOriginalError() {
        givenOwnedProduct();
        when(storageService.save(any(), anyString(), anyLong())).thenReturn(STORED);
        QueryTimeoutException insertFailure = new QueryTimeoutException("statement timeout");
        when(imageRepository.saveAndFlush(any(ProductImage.class))).thenThrow(insertFailure);
        doThrow(new StorageException(StorageErrorCode.IO_FAILURE, "disk gone"))
                .when(storageService).delete(STORED);

        QueryTimeoutException ex = assertThrows(QueryTimeoutException.class,
                () -> productImageService.upload(productId, vendorId, content, "shoe.jpg", 3, 0));

        assertSame(insertFailure, ex);
        verify(storageService).delete(STORED);
    }

    @Test
    @DisplayName("Compensation still runs for an interrupted request and the interrupt is restored")
    void uploadCompensationRunsWhenInterrupted() {
        givenOwnedProduct();
        when(storageService.save(any(), anyString(), anyLong())).thenReturn(STORED);
        when(imageRepository.saveAndFlush(any(ProductImage.class)))
                .thenThrow(new DataIntegrityViolationException("cancelled"));
        AtomicBoolean interruptedDuringDelete = new AtomicBoolean(true);
        doAnswer(inv -> {
            interruptedDuringDelete.set(Thread.currentThread().isInterrupted());
            return null;
        }).when(storageService).delete(STORED);

        Thread.currentThread().interrupt();
        try {
            assertThrows(DataIntegrityViolationException.class,
                    () -> productImageService.upload(productId, vendorId, content, "shoe.jpg", 3, 0));
        } finally {
            assertTrue(Thread.interrupted(), "interrupt flag must be restored");
        }

        verify(storageService).delete(STORED);
        assertFalse(interruptedDuringDelete.get());
    }

    // ---------------------------------------------------------------- delete

    @Test
    void deleteRemovesFileThenRecord() {
        ProductImage image = image(3);
        when(imageRepository.findById(image.getId())).thenReturn(Optional.of(image));
        givenOwnedProduct();

        productImageService.delete(image.getId(), vendorId);

        InOrder order = inOrder(storageService, imageRepository);
        order.verify(storageService).delete(STORED);
        order.verify(imageRepository).deleteById(image.getId());
        verify(auditService).log(eq(vendorId), eq("IMAGE_DELETE"), eq("ProductImage"),
                eq(image.getId().toString()), any());
    }

    @Test
    @DisplayName("Storage failure during delete is logged and the record is removed anyway")
    void deleteIgnoresStorageFailure() {
        ProductImage image = image(0);
        when(imageRepository.findById(image.getId())).thenReturn(Optional.of(image));
        givenOwnedProduct();
        doThrow(new StorageException(StorageErrorCode.NOT_FOUND, "file not found"))
                .when(storageService).delete(STORED);

        assertDoesNotThrow(() -> productImageService.delete(image.getId(), vendorId));

        verify(imageRepository).deleteById(image.getId());
    }

    @Test
    void deleteTwiceReportsImageNotFound() {
        ProductImage image = image(0);
        when(imageRepository.findById(image.getId()))
                .thenReturn(Optional.of(image))
                .thenReturn(Optional.empty());
        givenOwnedProduct();

        productImageService.delete(image.getId(), vendorId);
        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.delete(image.getId(), vendorId));

        assertEquals(ImageErrorCode.IMAGE_NOT_FOUND, ex.getErrorCode());
        verify(storageService, times(1)).delete(STORED);
        verify(imageRepository, times(1)).deleteById(image.getId());
    }

    @Test
    void deleteForeignImageIsForbidden() {
        ProductImage image = image(0);
        when(imageRepository.findById(image.getId())).thenReturn(Optional.of(image));
        when(productRepository.findById(productId)).thenReturn(Optional.of(product(UUID.randomUUID())));

        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.delete(image.getId(), vendorId));

        assertEquals(ImageErrorCode.FORBIDDEN, ex.getErrorCode());
        verifyNoInteractions(storageService);
        verify(imageRepository, never()).deleteById(any());
    }

    // ---------------------------------------------------------- updatePosition

    @Test
    void updatePositionRejectsNegativeBeforeLookup() {
        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.updatePosition(UUID.randomUUID(), vendorId, -1));

        assertEquals(ImageErrorCode.INVALID_POSITION, ex.getErrorCode());
        verifyNoInteractions(imageRepository, productRepository);
    }

    @Test
    void updatePositionRejectsMissingValue() {
        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.updatePosition(UUID.randomUUID(), vendorId, null));

        assertEquals(ImageErrorCode.INVALID_POSITION, ex.getErrorCode());
    }

    @Test
    void updatePositionChangesOnlyThatImage() {
        ProductImage image = image(1);
        when(imageRepository.findById(image.getId())).thenReturn(Optional.of(image));
        givenOwnedProduct();
        when(imageRepository.updatePosition(image.getId(), 5)).thenReturn(1);

        productImageService.updatePosition(image.getId(), vendorId, 5);

        verify(imageRepository).updatePosition(image.getId(), 5);
        verify(imageRepository, never()).save(any());
        verifyNoInteractions(storageService);
        verify(auditService).log(eq(vendorId), eq("IMAGE_REPOSITION"), eq("ProductImage"),
                eq(image.getId().toString()), any());
    }

    @Test
    void updatePositionOfUnknownImage() {
        UUID imageId = UUID.randomUUID();
        when(imageRepository.findById(imageId)).thenReturn(Optional.empty());

        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.updatePosition(imageId, vendorId, 2));

        assertEquals(ImageErrorCode.IMAGE_NOT_FOUND, ex.getErrorCode());
        verify(imageRepository, never()).updatePosition(any(), anyInt());
    }

    @Test
    @DisplayName("Image removed between lookup and update reports not found")
    void updatePositionLosesRaceWithDelete() {
        ProductImage image = image(1);
        when(imageRepository.findById(image.getId())).thenReturn(Optional.of(image));
        givenOwnedProduct();
        when(imageRepository.updatePosition(image.getId(), 4)).thenReturn(0);

        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.updatePosition(image.getId(), vendorId, 4));

        assertEquals(ImageErrorCode.IMAGE_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(auditService);
    }

    // ------------------------------------------------------------------- list

    @Test
    void listReturnsRepositoryOrderWithResolvedUrls() {
        ProductImage first = image(1);
        ProductImage second = image(2);
        second.setImageUrl("1700000001_ffff0000.png");
        when(productRepository.existsById(productId)).thenReturn(true);
        when(imageRepository.findByProductIdOrderByPositionAscCreatedAtAscIdAsc(productId))
                .thenReturn(List.of(first, second));
        givenUrlResolution();

        List<ProductImageResponse> images = productImageService.listForProduct(productId);

        assertEquals(2, images.size());
        assertEquals(first.getId(), images.get(0).id());
        assertEquals(BASE_URL + "/" + STORED, images.get(0).imageUrl());
        assertEquals(2, images.get(1).position());
        assertEquals(BASE_URL + "/1700000001_ffff0000.png", images.get(1).imageUrl());
    }

    @Test
    void listOfProductWithoutImagesIsEmpty() {
        when(productRepository.existsById(productId)).thenReturn(true);
        when(imageRepository.findByProductIdOrderByPositionAscCreatedAtAscIdAsc(productId)).thenReturn(List.of());

        assertTrue(productImageService.listForProduct(productId).isEmpty());
    }

    @Test
    void listOfUnknownProduct() {
        when(productRepository.existsById(productId)).thenReturn(false);

        ImageOperationException ex = assertThrows(ImageOperationException.class,
                () -> productImageService.listForProduct(productId));

        assertEquals(ImageErrorCode.PRODUCT_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(imageRepository);
    }

    // ---------------------------------------------------------------- helpers

    private void givenOwnedProduct() {
        when(productRepository.findById(productId)).thenReturn(Optional.of(product(vendorId)));
    }

    private void givenUrlResolution() {
        when(storageService.resolveUrl(anyString())).thenAnswer(inv -> BASE_URL + "/" + inv.getArgument(0));
    }

    private Product product(UUID ownerId) {
        return Product.builder().id(productId).userId(ownerId).name("Sneaker").build();
    }

    private ProductImage image(int position) {
        return ProductImage.builder()
                .id(UUID.randomUUID())
                .productId(productId)
                .imageUrl(STORED)
                .position(position)
                .build();
    }

    private static ProductImage withId(ProductImage image) {
        image.setId(UUID.randomUUID());
        return image;
    }
}
