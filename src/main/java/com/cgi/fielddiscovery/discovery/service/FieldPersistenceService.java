package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.discovery.model.ClassificationHistoryEntry;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.repository.ClassificationHistoryRepository;
import com.cgi.fielddiscovery.discovery.repository.DiscoveredFieldRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes the discovered fields of one table group.
 * All fields of a group are written in a single transaction: either every field and history entry lands or none does.
 */
@Service
public class FieldPersistenceService {
    private static final Logger log = LoggerFactory.getLogger(FieldPersistenceService.class);

    static final String SYSTEM_USER = "system";
    static final String REASON_INITIAL = "Initial discovery";
    static final String REASON_REDISCOVERED = "Field re-discovered";

    private final DiscoveredFieldRepository fieldRepository;
    private final ClassificationHistoryRepository historyRepository;

    public FieldPersistenceService(DiscoveredFieldRepository fieldRepository,
                                   ClassificationHistoryRepository historyRepository) {
        this.fieldRepository = fieldRepository;
        this.historyRepository = historyRepository;
    }

    /**
     * Upserts the fields of one table group.
     * A field that was already reviewed keeps its status and review stamps.
     *
     * @param sessionId Session recorded on the history entries
     * @param fields Freshly assembled fields
     * @return Fields as persisted
     */
    @Transactional
    @CacheEvict(cacheNames = DiscoveryStatsService.STATS_CACHE, allEntries = true)
    public List<DiscoveredField> saveTableFields(String sessionId, List<DiscoveredField> fields) {
        List<DiscoveredField> saved = new ArrayList<>(fields.size());
        LocalDateTime now = LocalDateTime.now();

        for (DiscoveredField field : fields) {
            Optional<DiscoveredField> existing = fieldRepository.findByKey(
                    field.getDataSourceId(), field.getSchema(), field.getTableName(), field.getFieldName());

            if (existing.isPresent()) {
                DiscoveredField previous = existing.get();
                field.setId(previous.getId());
                field.setCreatedAt(previous.getCreatedAt());
                field.setReviewedAt(previous.getReviewedAt());
                field.setReviewedBy(previous.getReviewedBy());
                if (previous.getStatus() != FieldStatus.PENDING) {
                    field.setStatus(previous.getStatus());
                }
                field.setUpdatedAt(now);
                fieldRepository.updateDiscovery(field);
                historyRepository.insert(historyEntry(sessionId, field, previous, REASON_REDISCOVERED, now));
            } else {
                field.setId(UUID.randomUUID().toString());
                field.setCreatedAt(now);
                field.setUpdatedAt(now);
                fieldRepository.insert(field);
                historyRepository.insert(historyEntry(sessionId, field, null, REASON_INITIAL, now));
            }
            saved.add(field);
        }

        log.debug("Persisted {} fields for session {}", saved.size(), sessionId);
        return saved;
    }

    private static ClassificationHistoryEntry historyEntry(String sessionId, DiscoveredField field,
                                                           DiscoveredField previous, String reason,
                                                           LocalDateTime now) {
        return ClassificationHistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .fieldId(field.getId())
                .previousClassification(previous != null ? previous.getClassification() : null)
                .newClassification(field.getClassification())
                .previousSensitivity(previous != null ? previous.getSensitivity() : null)
                .newSensitivity(field.getSensitivity())
                .previousStatus(previous != null ? previous.getStatus() : null)
                .newStatus(field.getStatus())
                .changeReason(reason)
                .changedBy(SYSTEM_USER)
                .changedAt(now)
                .sessionId(sessionId)
                .build();
    }
}
