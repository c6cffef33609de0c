package com.vendorhub.marketplace.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vendorhub.marketplace.model.entity.AuditLog;
import com.vendorhub.marketplace.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Records audit trail entries for vendor image operations (upload, delete,
 * reposition). A failed audit write is logged and never fails the operation
 * it describes.
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit log entry.
     *
     * @param userId     the vendor performing the action
     * @param action     short action descriptor, e.g. "IMAGE_UPLOAD"
     * @param entityType the type of entity affected, e.g. "ProductImage"
     * @param entityId   the ID of the affected entity
     * @param metadata   arbitrary key-value metadata (serialized as JSONB)
     */
    public void log(UUID userId, String action, String entityType, String entityId,
            Map<String, Object> metadata) {
        AuditLog.AuditLogBuilder entry = AuditLog.builder()
                .userId(userId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId);
        try {
            entry.metadata(metadata != null ? objectMapper.writeValueAsString(metadata) : null);
        } catch (JsonProcessingException e) {
            // Still save without metadata rather than losing the audit entry
            log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
        }

        try {
            auditLogRepository.save(entry.build());
            log.debug("Audit logged: action={}, entity={}:{}, user={}", action, entityType, entityId, userId);
        } catch (DataAccessException e) {
            log.error("Failed to write audit entry action={} entity={}:{}: {}",
                    action, entityType, entityId, e.getMessage());
        }
    }
}
