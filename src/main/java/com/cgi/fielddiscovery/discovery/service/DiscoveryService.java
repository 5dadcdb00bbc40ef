package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.common.exception.InvalidStateException;
import com.cgi.fielddiscovery.common.exception.ResourceNotFoundException;
import com.cgi.fielddiscovery.common.exception.ValidationException;
import com.cgi.fielddiscovery.discovery.model.ClassificationHistoryEntry;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.DiscoverySession;
import com.cgi.fielddiscovery.discovery.model.FieldFilter;
import com.cgi.fielddiscovery.discovery.model.FieldPage;
import com.cgi.fielddiscovery.discovery.model.enums.SessionStatus;
import com.cgi.fielddiscovery.discovery.repository.ClassificationHistoryRepository;
import com.cgi.fielddiscovery.discovery.repository.DiscoveredFieldRepository;
import com.cgi.fielddiscovery.discovery.repository.DiscoverySessionRepository;
import com.cgi.fielddiscovery.discovery.service.queue.DiscoveryTask;
import com.cgi.fielddiscovery.discovery.service.queue.DiscoveryTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for discovery sessions and discovered-field queries.
 */
@Service
public class DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    static final int MAX_FIELD_PAGE = 1000;
    static final int DEFAULT_SESSION_LIMIT = 20;
    static final int MAX_SESSION_LIMIT = 100;

    private final DiscoverySessionRepository sessionRepository;
    private final DiscoveredFieldRepository fieldRepository;
    private final ClassificationHistoryRepository historyRepository;
    private final DiscoveryTaskQueue taskQueue;

    public DiscoveryService(DiscoverySessionRepository sessionRepository,
                            DiscoveredFieldRepository fieldRepository,
                            ClassificationHistoryRepository historyRepository,
                            DiscoveryTaskQueue taskQueue) {
        this.sessionRepository = sessionRepository;
        this.fieldRepository = fieldRepository;
        this.historyRepository = historyRepository;
        this.taskQueue = taskQueue;
    }

    /**
     * Creates a pending session and queues it for processing.
     * Returns before any table is analysed.
     *
     * @param dataSourceId Data source to discover
     * @param schemas Optional schema scope
     * @param tables Optional table scope
     * @param forceRefresh Skip cached analyses
     * @param triggeredBy User who requested the run
     * @return The pending session
     * @throws ValidationException If the data source id is missing
     * @throws InvalidStateException If the discovery queue cannot take the session
     */
    public DiscoverySession startDiscovery(String dataSourceId, List<String> schemas, List<String> tables,
                                           boolean forceRefresh, String triggeredBy) {
        if (dataSourceId == null || dataSourceId.isBlank()) {
            throw new ValidationException("dataSourceId is required");
        }

        LocalDateTime now = LocalDateTime.now();
        DiscoverySession session = DiscoverySession.builder()
                .id(UUID.randomUUID().toString())
                .dataSourceId(dataSourceId)
                .targetSchemas(schemas != null ? new ArrayList<>(schemas) : new ArrayList<>())
                .targetTables(tables != null ? new ArrayList<>(tables) : new ArrayList<>())
                .status(SessionStatus.PENDING)
                .triggeredBy(triggeredBy)
                .forceRefresh(forceRefresh)
                .startedAt(now)
                .updatedAt(now)
                .build();
        sessionRepository.insert(session);

        DiscoveryTask task = new DiscoveryTask(session.getId(), dataSourceId, session.getTargetSchemas(),
                session.getTargetTables(), forceRefresh);
        boolean queued;
        try {
            queued = taskQueue.offer(task);
        } catch (IllegalStateException e) {
            queued = false;
        }
        if (!queued) {
            sessionRepository.fail(session.getId(), "Discovery queue is full", LocalDateTime.now());
            throw new InvalidStateException("Discovery queue cannot accept new sessions, retry later");
        }

        log.info("Queued discovery session {} for data source {}", session.getId(), dataSourceId);
        return session;
    }

    public DiscoverySession getSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Discovery session", sessionId));
    }

    /**
     * Lists the most recent sessions.
     *
     * @param dataSourceId Optional data source filter
     * @param limit Requested size, clamped to [1, 100]
     */
    public List<DiscoverySession> listSessions(String dataSourceId, Integer limit) {
        int size = limit == null ? DEFAULT_SESSION_LIMIT : Math.max(1, Math.min(limit, MAX_SESSION_LIMIT));
        return sessionRepository.findRecent(dataSourceId, size);
    }

    /**
     * Deletes a finished session. History entries of the session are kept and detached.
     *
     * @throws InvalidStateException If the session is still pending or processing
     */
    @Transactional
    public void deleteSession(String sessionId) {
        DiscoverySession session = getSession(sessionId);
        if (!session.getStatus().isTerminal()) {
            throw new InvalidStateException("Session " + sessionId + " is " + session.getStatus().getValue()
                    + " and cannot be deleted until it completes or fails");
        }
        int detached = historyRepository.unlinkSession(sessionId);
        sessionRepository.delete(sessionId);
        log.info("Deleted session {} ({} history entries detached)", sessionId, detached);
    }

    public FieldPage getDiscoveredFields(FieldFilter filter) {
        FieldFilter window = filter.toBuilder()
                .limit(Math.max(1, Math.min(filter.getLimit(), MAX_FIELD_PAGE)))
                .offset(Math.max(0, filter.getOffset()))
                .build();
        return FieldPage.builder()
                .fields(fieldRepository.findByFilter(window))
                .total(fieldRepository.countByFilter(window))
                .limit(window.getLimit())
                .offset(window.getOffset())
                .build();
    }

    public DiscoveredField getField(String fieldId) {
        return fieldRepository.findById(fieldId)
                .orElseThrow(() -> new ResourceNotFoundException("Discovered field", fieldId));
    }

    public List<ClassificationHistoryEntry> getFieldHistory(String fieldId) {
        getField(fieldId);
        return historyRepository.findByFieldId(fieldId);
    }
}
