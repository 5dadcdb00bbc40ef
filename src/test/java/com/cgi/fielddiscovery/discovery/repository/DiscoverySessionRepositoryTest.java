package com.cgi.fielddiscovery.discovery.repository;

import com.cgi.fielddiscovery.discovery.model.DiscoverySession;
import com.cgi.fielddiscovery.discovery.model.enums.SessionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import(DiscoverySessionRepository.class)
@DisplayName("DiscoverySessionRepository")
class DiscoverySessionRepositoryTest {

    @Autowired
    private DiscoverySessionRepository repository;

    private DiscoverySession insertPending(String dataSourceId, LocalDateTime startedAt) {
        DiscoverySession session = DiscoverySession.builder()
                .id(UUID.randomUUID().toString())
                .dataSourceId(dataSourceId)
                .targetSchemas(List.of("crm"))
                .triggeredBy("alice")
                .startedAt(startedAt)
                .updatedAt(startedAt)
                .build();
        repository.insert(session);
        return session;
    }

    @Test
    @DisplayName("Round-trips a pending session with its scope lists")
    void insertAndFind() {
        DiscoverySession session = insertPending("ds-1", LocalDateTime.now());

        DiscoverySession found = repository.findById(session.getId()).orElseThrow();

        assertThat(found.getStatus()).isEqualTo(SessionStatus.PENDING);
        assertThat(found.getTargetSchemas()).containsExactly("crm");
        assertThat(found.getTargetTables()).isEmpty();
        assertThat(found.getTriggeredBy()).isEqualTo("alice");
        assertThat(found.getDurationMs()).isNull();
        assertThat(found.getCompletedAt()).isNull();
    }

    @Test
    @DisplayName("Moves pending to processing once and keeps progress monotonic")
    void processingAndProgress() {
        DiscoverySession session = insertPending("ds-1", LocalDateTime.now());
        LocalDateTime now = LocalDateTime.now();

        assertThat(repository.markProcessing(session.getId(), 10, now)).isTrue();
        assertThat(repository.markProcessing(session.getId(), 10, now)).isFalse();

        repository.updateProgress(session.getId(), 65, now);
        repository.updateProgress(session.getId(), 40, now);

        DiscoverySession found = repository.findById(session.getId()).orElseThrow();
        assertThat(found.getStatus()).isEqualTo(SessionStatus.PROCESSING);
        assertThat(found.getProgress()).isEqualTo(65);
    }

    @Test
    @DisplayName("Completes a processing session with its counts and never reopens it")
    void completeIsTerminal() {
        DiscoverySession session = insertPending("ds-1", LocalDateTime.now());
        LocalDateTime now = LocalDateTime.now();
        repository.markProcessing(session.getId(), 10, now);

        boolean completed = repository.complete(DiscoverySession.builder()
                .id(session.getId())
                .fieldsDiscovered(12)
                .fieldsClassified(12)
                .piiFieldsFound(4)
                .phiFieldsFound(1)
                .financialFieldsFound(2)
                .durationMs(1500L)
                .build(), now);

        assertThat(completed).isTrue();
        assertThat(repository.fail(session.getId(), "too late", now)).isFalse();
        repository.updateProgress(session.getId(), 50, now);

        DiscoverySession found = repository.findById(session.getId()).orElseThrow();
        assertThat(found.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(found.getProgress()).isEqualTo(100);
        assertThat(found.getPiiFieldsFound()).isEqualTo(4);
        assertThat(found.getDurationMs()).isEqualTo(1500L);
        assertThat(found.getErrorMessage()).isNull();
        assertThat(found.getCompletedAt()).isNotNull();
    }

    @Test
    @DisplayName("Completion requires the processing status")
    void completeRequiresProcessing() {
        DiscoverySession session = insertPending("ds-1", LocalDateTime.now());

        assertThat(repository.complete(DiscoverySession.builder().id(session.getId()).build(),
                LocalDateTime.now())).isFalse();
    }

    @Test
    @DisplayName("Finds only active sessions that stopped updating")
    void findStaleIds() {
        LocalDateTime now = LocalDateTime.now();
        DiscoverySession stale = insertPending("ds-stale", now.minusHours(2));
        DiscoverySession fresh = insertPending("ds-stale", now);
        DiscoverySession failed = insertPending("ds-stale", now.minusHours(2));
        repository.fail(failed.getId(), "boom", now.minusHours(2));

        List<String> ids = repository.findStaleIds(now.minusMinutes(30));

        assertThat(ids).contains(stale.getId()).doesNotContain(fresh.getId(), failed.getId());
    }

    @Test
    @DisplayName("Lists sessions newest first within the limit")
    void findRecent() {
        LocalDateTime now = LocalDateTime.now();
        DiscoverySession older = insertPending("ds-recent", now.minusMinutes(5));
        DiscoverySession newer = insertPending("ds-recent", now);
        insertPending("ds-other", now);

        List<DiscoverySession> sessions = repository.findRecent("ds-recent", 10);

        assertThat(sessions).extracting(DiscoverySession::getId).containsExactly(newer.getId(), older.getId());
        assertThat(repository.findRecent("ds-recent", 1)).hasSize(1);
    }

    @Test
    @DisplayName("Deletes a session")
    void delete() {
        DiscoverySession session = insertPending("ds-1", LocalDateTime.now());

        assertThat(repository.delete(session.getId())).isTrue();
        assertThat(repository.findById(session.getId())).isEmpty();
        assertThat(repository.delete(session.getId())).isFalse();
    }
}
