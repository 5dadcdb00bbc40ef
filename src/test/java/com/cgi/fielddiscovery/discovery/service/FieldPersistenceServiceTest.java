package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.discovery.model.ClassificationHistoryEntry;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.enums.FieldClassification;
import com.cgi.fielddiscovery.discovery.model.enums.FieldStatus;
import com.cgi.fielddiscovery.discovery.model.enums.Sensitivity;
import com.cgi.fielddiscovery.discovery.repository.ClassificationHistoryRepository;
import com.cgi.fielddiscovery.discovery.repository.DiscoveredFieldRepository;
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

import static org.assertj.core.api.Assertions.assertThat;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({FieldPersistenceService.class, DiscoveredFieldRepository.class, ClassificationHistoryRepository.class})
@DisplayName("FieldPersistenceService")
class FieldPersistenceServiceTest {

    @Autowired
    private FieldPersistenceService persistenceService;

    @Autowired
    private DiscoveredFieldRepository fieldRepository;

    @Autowired
    private ClassificationHistoryRepository historyRepository;

    private static DiscoveredField discovered(String name, FieldClassification classification, double confidence) {
        return DiscoveredField.builder()
                .dataSourceId("ds-persist")
                .assetName("crm.customers")
                .schema("crm")
                .tableName("customers")
                .fieldName(name)
                .dataType("varchar")
                .classification(classification)
                .sensitivity(classification.defaultSensitivity())
                .confidence(confidence)
                .riskLevel("high")
                .detectedAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("Inserts new fields with an initial history entry")
    void insertsNewFields() {
        List<DiscoveredField> saved = persistenceService.saveTableFields("session-1", List.of(
                discovered("email", FieldClassification.PII, 0.9),
                discovered("notes", FieldClassification.GENERAL, 0.5)));

        assertThat(saved).hasSize(2).allSatisfy(f -> assertThat(f.getId()).isNotNull());

        List<ClassificationHistoryEntry> history = historyRepository.findByFieldId(saved.get(0).getId());
        assertThat(history).hasSize(1);
        ClassificationHistoryEntry entry = history.get(0);
        assertThat(entry.getPreviousClassification()).isNull();
        assertThat(entry.getNewClassification()).isEqualTo(FieldClassification.PII);
        assertThat(entry.getNewStatus()).isEqualTo(FieldStatus.PENDING);
        assertThat(entry.getChangeReason()).isEqualTo(FieldPersistenceService.REASON_INITIAL);
        assertThat(entry.getChangedBy()).isEqualTo(FieldPersistenceService.SYSTEM_USER);
        assertThat(entry.getSessionId()).isEqualTo("session-1");
    }

    @Test
    @DisplayName("Re-discovery keeps an accepted status, updates the classification and appends history")
    void rediscoveryPreservesReview() {
        DiscoveredField first = persistenceService.saveTableFields("session-1",
                List.of(discovered("contact", FieldClassification.GENERAL, 0.5))).get(0);
        LocalDateTime reviewedAt = LocalDateTime.of(2024, 5, 2, 14, 30);
        fieldRepository.updateStatus(first.getId(), FieldStatus.ACCEPTED, reviewedAt, "reviewer", reviewedAt);

        DiscoveredField again = persistenceService.saveTableFields("session-2",
                List.of(discovered("contact", FieldClassification.PII, 0.92))).get(0);

        assertThat(again.getId()).isEqualTo(first.getId());
        DiscoveredField stored = fieldRepository.findById(first.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(FieldStatus.ACCEPTED);
        assertThat(stored.getClassification()).isEqualTo(FieldClassification.PII);
        assertThat(stored.getSensitivity()).isEqualTo(Sensitivity.HIGH);
        assertThat(stored.getConfidence()).isEqualTo(0.92);
        assertThat(stored.getReviewedBy()).isEqualTo("reviewer");
        assertThat(stored.getReviewedAt()).isEqualTo(reviewedAt);

        List<ClassificationHistoryEntry> history = historyRepository.findByFieldId(first.getId());
        assertThat(history).hasSize(2);
        ClassificationHistoryEntry latest = history.get(1);
        assertThat(latest.getPreviousClassification()).isEqualTo(FieldClassification.GENERAL);
        assertThat(latest.getNewClassification()).isEqualTo(FieldClassification.PII);
        assertThat(latest.getPreviousStatus()).isEqualTo(FieldStatus.ACCEPTED);
        assertThat(latest.getNewStatus()).isEqualTo(FieldStatus.ACCEPTED);
        assertThat(latest.getChangeReason()).isEqualTo(FieldPersistenceService.REASON_REDISCOVERED);
        assertThat(latest.getSessionId()).isEqualTo("session-2");
    }

    @Test
    @DisplayName("A pending field stays pending on re-discovery")
    void pendingStaysPending() {
        DiscoveredField first = persistenceService.saveTableFields("session-1",
                List.of(discovered("phone", FieldClassification.PII, 0.7))).get(0);

        persistenceService.saveTableFields("session-2", List.of(discovered("phone", FieldClassification.PII, 0.8)));

        assertThat(fieldRepository.findById(first.getId()).orElseThrow().getStatus()).isEqualTo(FieldStatus.PENDING);
        assertThat(historyRepository.countBySessionId("session-2")).isEqualTo(1);
    }
}
