package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.common.exception.BaseException;
import com.cgi.fielddiscovery.common.exception.ResourceNotFoundException;
import com.cgi.fielddiscovery.common.exception.ValidationException;
import com.cgi.fielddiscovery.discovery.model.BulkUpdateResult;
import com.cgi.fielddiscovery.discovery.model.ClassificationHistoryEntry;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.enums.BulkAction;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import com.cgi.fielddiscovery.discovery.repository.ClassificationHistoryRepository;
import com.cgi.fielddiscovery.discovery.repository.DiscoveredFieldRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Human review of discovered fields. Every change appends a history entry in the same transaction.
 */
@Service
public class FieldReviewService {
    private static final Logger log = LoggerFactory.getLogger(FieldReviewService.class);

    static final String REASON_MANUAL_REVIEW = "Manual review";
    static final String REASON_MANUAL_CLASSIFICATION = "Manual classification";

    private final DiscoveredFieldRepository fieldRepository;
    private final ClassificationHistoryRepository historyRepository;
    private final TransactionTemplate transactionTemplate;

    public FieldReviewService(DiscoveredFieldRepository fieldRepository,
                              ClassificationHistoryRepository historyRepository,
                              PlatformTransactionManager transactionManager) {
        this.fieldRepository = fieldRepository;
        this.historyRepository = historyRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Sets the review status of a field.
     * Moving a field back to pending keeps its previous review stamp.
     *
     * @param fieldId Field to update
     * @param status New status
     * @param userId Reviewer
     * @return Updated field
     * @throws ResourceNotFoundException If the field does not exist
     */
    @Transactional
    @CacheEvict(cacheNames = DiscoveryStatsService.STATS_CACHE, allEntries = true)
    public DiscoveredField updateFieldStatus(String fieldId, FieldStatus status, String userId) {
        if (status == null) {
            throw new ValidationException("status is required");
        }
        return applyStatus(fieldId, status, userId, REASON_MANUAL_REVIEW);
    }

    /**
     * Accepts or rejects several fields. Each field is updated in its own transaction,
     * so one missing or failing field does not roll back the others.
     *
     * @param fieldIds Fields to update
     * @param action Bulk action
     * @param userId Reviewer
     * @return Per-field outcome
     */
    @CacheEvict(cacheNames = DiscoveryStatsService.STATS_CACHE, allEntries = true)
    public BulkUpdateResult bulkUpdateStatus(List<String> fieldIds, BulkAction action, String userId) {
        if (action == null) {
            throw new ValidationException("action is required");
        }
        if (fieldIds == null || fieldIds.isEmpty()) {
            throw new ValidationException("fieldIds must not be empty");
        }

        BulkUpdateResult result = BulkUpdateResult.builder()
                .action(action)
                .requested(fieldIds.size())
                .build();

        for (String fieldId : new LinkedHashSet<>(fieldIds)) {
            try {
                transactionTemplate.executeWithoutResult(status ->
                        applyStatus(fieldId, action.targetStatus(), userId, action.historyReason()));
                result.getSucceeded().add(fieldId);
            } catch (BaseException e) {
                log.warn("Bulk {} failed for field {}: {}", action.getValue(), fieldId, e.getMessage());
                result.getFailed().put(fieldId, e.getMessage());
            } catch (DataAccessException | TransactionException e) {
                log.error("Bulk {} could not be stored for field {}: {}", action.getValue(), fieldId,
                        e.getMessage(), e);
                result.getFailed().put(fieldId, "Could not store review: " + e.getMostSpecificCause().getMessage());
            }
        }

        log.info("Bulk {} by {}: {} succeeded, {} failed", action.getValue(), userId,
                result.getSucceeded().size(), result.getFailed().size());
        return result;
    }

    /**
     * Overrides the classification of a field.
     *
     * @param fieldId Field to classify
     * @param classification New classification
     * @param sensitivity New sensitivity, or null for the default of the classification
     * @param userId Reviewer
     * @return Updated field
     */
    @Transactional
    @CacheEvict(cacheNames = DiscoveryStatsService.STATS_CACHE, allEntries = true)
    public DiscoveredField classifyField(String fieldId, FieldClassification classification,
                                         Sensitivity sensitivity, String userId) {
        if (classification == null) {
            throw new ValidationException("classification is required");
        }
        DiscoveredField current = findField(fieldId);
        Sensitivity target = sensitivity != null ? sensitivity : classification.defaultSensitivity();
        LocalDateTime now = LocalDateTime.now();

        fieldRepository.updateClassification(fieldId, classification, target, userId, now);
        historyRepository.insert(ClassificationHistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .fieldId(fieldId)
                .previousClassification(current.getClassification())
                .newClassification(classification)
                .previousSensitivity(current.getSensitivity())
                .newSensitivity(target)
                .previousStatus(current.getStatus())
                .newStatus(current.getStatus())
                .changeReason(REASON_MANUAL_CLASSIFICATION)
                .changedBy(userId)
                .changedAt(now)
                .build());

        log.info("Field {} classified as {} / {} by {}", fieldId, classification.getValue(),
                target.getValue(), userId);
        return findField(fieldId);
    }

    private DiscoveredField applyStatus(String fieldId, FieldStatus status, String userId, String reason) {
        DiscoveredField current = findField(fieldId);
        LocalDateTime now = LocalDateTime.now();
        boolean stamp = status != FieldStatus.PENDING;

        fieldRepository.updateStatus(fieldId, status, stamp ? now : null, stamp ? userId : null, now);
        historyRepository.insert(ClassificationHistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .fieldId(fieldId)
                .previousClassification(current.getClassification())
                .newClassification(current.getClassification())
                .previousSensitivity(current.getSensitivity())
                .newSensitivity(current.getSensitivity())
                .previousStatus(current.getStatus())
                .newStatus(status)
                .changeReason(reason)
                .changedBy(userId)
                .changedAt(now)
                .build());

        log.debug("Field {} moved from {} to {} by {}", fieldId, current.getStatus().getValue(),
                status.getValue(), userId);
        return findField(fieldId);
    }

    private DiscoveredField findField(String fieldId) {
        return fieldRepository.findById(fieldId)
                .orElseThrow(() -> new ResourceNotFoundException("Discovered field", fieldId));
    }
}
