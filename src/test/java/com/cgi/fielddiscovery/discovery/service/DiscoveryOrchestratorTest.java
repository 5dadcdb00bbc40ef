package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.catalog.model.TableGroup;
import com.cgi.fielddiscovery.catalog.service.CatalogAssetService;
import com.cgi.fielddiscovery.classifier.cache.TableAnalysisCache;
import com.cgi.fielddiscovery.classifier.model.ClassificationResult;
import com.cgi.fielddiscovery.classifier.model.FieldAnalysis;
import com.cgi.fielddiscovery.classifier.model.RiskAssessment;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.TableAnalysis;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import com.cgi.fielddiscovery.classifier.model.enums.RiskLevel;
import com.cgi.fielddiscovery.classifier.service.ClassificationMetricsCollector;
import com.cgi.fielddiscovery.classifier.service.ClassificationPipelineService;
import com.cgi.fielddiscovery.common.exception.CatalogException;
import com.cgi.fielddiscovery.common.exception.PersistenceException;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.model.DiscoverySession;
import com.cgi.fielddiscovery.discovery.repository.DiscoverySessionRepository;
import com.cgi.fielddiscovery.discovery.service.queue.DiscoveryTask;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DiscoveryOrchestrator")
class DiscoveryOrchestratorTest {

    private static final String SESSION_ID = "session-1";

    @Mock
    private DiscoverySessionRepository sessionRepository;

    @Mock
    private CatalogAssetService catalogAssetService;

    @Mock
    private ClassificationPipelineService pipelineService;

    @Mock
    private TableAnalysisCache analysisCache;

    @Mock
    private FieldPersistenceService persistenceService;

    private final ClassificationMetricsCollector metrics = new ClassificationMetricsCollector();
    private DiscoveryOrchestrator orchestrator;

    private final TableGroup customers = group("customers", "email");
    private final TableGroup patients = group("patients", "diagnosis");
    private final TableGroup orders = group("orders", "card_number");

    @BeforeEach
    void setUp() {
        orchestrator = new DiscoveryOrchestrator(sessionRepository, catalogAssetService, pipelineService,
                analysisCache, new DiscoveredFieldAssembler(), persistenceService, metrics, 10, 1);
    }

    @AfterEach
    void tearDown() {
        orchestrator.destroy();
    }

    private static TableGroup group(String table, String column) {
        TableGroup group = TableGroup.builder().schema("public").tableName(table).assetId("asset-" + table).build();
        group.addColumn(CatalogColumn.builder().name(column).dataType("varchar").build());
        return group;
    }

    private static TableAnalysis analysis(TableGroup group, DataCategory category, boolean ai) {
        List<FieldAnalysis> fields = new ArrayList<>();
        for (CatalogColumn column : group.getColumns()) {
            fields.add(FieldAnalysis.builder()
                    .column(column)
                    .result(ClassificationResult.builder()
                            .fieldName(column.getName())
                            .classification(SemanticClassification.builder()
                                    .category(category)
                                    .subcategory(category.getSubcategories().get(0))
                                    .confidence(ai ? 0.9 : 0.85)
                                    .aiGenerated(ai)
                                    .build())
                            .risk(RiskAssessment.builder().riskLevel(RiskLevel.HIGH).build())
                            .build())
                    .build());
        }
        return TableAnalysis.builder()
                .schema(group.getSchema())
                .tableName(group.getTableName())
                .assetId(group.getAssetId())
                .fields(fields)
                .degraded(!ai)
                .build();
    }

    private static DiscoveryTask task() {
        return new DiscoveryTask(SESSION_ID, "ds-1", List.of(), List.of(), false);
    }

    private void startsAndPersistsEverything() {
        when(sessionRepository.markProcessing(eq(SESSION_ID), eq(DiscoveryOrchestrator.PROGRESS_STARTED), any()))
                .thenReturn(true);
        when(persistenceService.saveTableFields(eq(SESSION_ID), anyList()))
                .thenAnswer(invocation -> invocation.getArgument(1));
    }

    private DiscoverySession completedSession() {
        ArgumentCaptor<DiscoverySession> captor = ArgumentCaptor.forClass(DiscoverySession.class);
        verify(sessionRepository).complete(captor.capture(), any(LocalDateTime.class));
        return captor.getValue();
    }

    @Test
    @DisplayName("A table whose AI analysis times out is classified by rules and the session still completes")
    void timeoutFallsBackToRules() {
        startsAndPersistsEverything();
        when(catalogAssetService.fetchTableGroups("ds-1", List.of(), List.of()))
                .thenReturn(List.of(customers, patients, orders));
        when(pipelineService.analyzeTable(customers, false))
                .thenReturn(analysis(customers, DataCategory.PERSONAL_DATA, true));
        when(pipelineService.analyzeTable(patients, false)).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return analysis(patients, DataCategory.HEALTH_DATA, true);
        });
        when(pipelineService.analyzeTable(patients, true))
                .thenReturn(analysis(patients, DataCategory.HEALTH_DATA, false));
        when(pipelineService.analyzeTable(orders, false))
                .thenReturn(analysis(orders, DataCategory.FINANCIAL_DATA, true));
        when(sessionRepository.complete(any(), any())).thenReturn(true);

        orchestrator.run(task());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DiscoveredField>> saved = ArgumentCaptor.forClass(List.class);
        verify(persistenceService, times(3)).saveTableFields(eq(SESSION_ID), saved.capture());
        DiscoveredField diagnosis = saved.getAllValues().get(1).get(0);
        assertThat(diagnosis.getFieldName()).isEqualTo("diagnosis");
        assertThat(diagnosis.isAiGenerated()).isFalse();
        assertThat(saved.getAllValues().get(0).get(0).isAiGenerated()).isTrue();

        DiscoverySession completed = completedSession();
        assertThat(completed.getFieldsDiscovered()).isEqualTo(3);
        assertThat(completed.getPiiFieldsFound()).isEqualTo(1);
        assertThat(completed.getPhiFieldsFound()).isEqualTo(1);
        assertThat(completed.getFinancialFieldsFound()).isEqualTo(1);
        assertThat(completed.getFailedTableGroups()).isZero();
        assertThat(completed.getErrorMessage()).isNull();

        verify(analysisCache, never()).store(eq(patients), any());
    }

    @Test
    @DisplayName("Slow tables of one batch share a single timeout instead of waiting one each")
    void batchSharesOneDeadline() {
        startsAndPersistsEverything();
        when(catalogAssetService.fetchTableGroups("ds-1", List.of(), List.of()))
                .thenReturn(List.of(customers, patients, orders));
        when(pipelineService.analyzeTable(any(TableGroup.class), eq(false))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return analysis(invocation.getArgument(0), DataCategory.BUSINESS_DATA, true);
        });
        when(pipelineService.analyzeTable(any(TableGroup.class), eq(true))).thenAnswer(invocation ->
                analysis(invocation.getArgument(0), DataCategory.BUSINESS_DATA, false));
        when(sessionRepository.complete(any(), any())).thenReturn(true);

        long start = System.nanoTime();
        orchestrator.run(task());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isLessThan(2_500);
        assertThat(completedSession().getFieldsDiscovered()).isEqualTo(3);
        verify(pipelineService, times(3)).analyzeTable(any(TableGroup.class), eq(true));
    }

    @Test
    @DisplayName("Progress only moves forward and ends at the last table checkpoint before completion")
    void progressIsMonotonic() {
        startsAndPersistsEverything();
        when(catalogAssetService.fetchTableGroups("ds-1", List.of(), List.of()))
                .thenReturn(List.of(customers, patients, orders));
        when(pipelineService.analyzeTable(any(TableGroup.class), eq(false))).thenAnswer(invocation -> {
            TableGroup group = invocation.getArgument(0);
            return analysis(group, DataCategory.BUSINESS_DATA, true);
        });
        when(sessionRepository.complete(any(), any())).thenReturn(true);

        orchestrator.run(task());

        ArgumentCaptor<Integer> progress = ArgumentCaptor.forClass(Integer.class);
        verify(sessionRepository, times(4)).updateProgress(eq(SESSION_ID), progress.capture(), any());
        assertThat(progress.getAllValues()).containsExactly(40, 56, 73, 90);
    }

    @Test
    @DisplayName("Cached analyses are reused unless a refresh is forced")
    void usesCache() {
        startsAndPersistsEverything();
        when(catalogAssetService.fetchTableGroups("ds-1", List.of(), List.of())).thenReturn(List.of(customers));
        when(analysisCache.lookup(customers))
                .thenReturn(Optional.of(analysis(customers, DataCategory.PERSONAL_DATA, true)));
        when(sessionRepository.complete(any(), any())).thenReturn(true);

        orchestrator.run(task());

        verify(pipelineService, never()).analyzeTable(any(), eq(false));
        assertThat(completedSession().getPiiFieldsFound()).isEqualTo(1);
    }

    @Test
    @DisplayName("A forced refresh skips the cache and stores the new analysis")
    void forceRefresh() {
        TableAnalysis fresh = analysis(customers, DataCategory.PERSONAL_DATA, true);
        when(pipelineService.analyzeTable(customers, false)).thenReturn(fresh);

        TableAnalysis result = orchestrator.analyze(customers, true);

        assertThat(result).isSameAs(fresh);
        verify(analysisCache, never()).lookup(any());
        verify(analysisCache).store(customers, fresh);
        assertThat(metrics.getMetricsReport()).containsEntry("tablesProcessed", 1);
    }

    @Test
    @DisplayName("A catalog failure fails the session")
    void catalogFailure() {
        when(sessionRepository.markProcessing(eq(SESSION_ID), anyInt(), any())).thenReturn(true);
        when(catalogAssetService.fetchTableGroups("ds-1", List.of(), List.of()))
                .thenThrow(new CatalogException("Catalog unreachable"));

        orchestrator.run(task());

        verify(sessionRepository).fail(eq(SESSION_ID), eq("Catalog unreachable"), any());
        verify(sessionRepository, never()).complete(any(), any());
    }

    @Test
    @DisplayName("A table group that cannot be persisted is counted and the run continues")
    void persistenceFailure() {
        when(sessionRepository.markProcessing(eq(SESSION_ID), anyInt(), any())).thenReturn(true);
        when(catalogAssetService.fetchTableGroups("ds-1", List.of(), List.of()))
                .thenReturn(List.of(customers, orders));
        when(pipelineService.analyzeTable(customers, false))
                .thenReturn(analysis(customers, DataCategory.PERSONAL_DATA, true));
        when(pipelineService.analyzeTable(orders, false))
                .thenReturn(analysis(orders, DataCategory.FINANCIAL_DATA, true));
        when(persistenceService.saveTableFields(eq(SESSION_ID), anyList()))
                .thenThrow(new PersistenceException("Error during insert field email"))
                .thenAnswer(invocation -> invocation.getArgument(1));
        when(sessionRepository.complete(any(), any())).thenReturn(true);

        orchestrator.run(task());

        DiscoverySession completed = completedSession();
        assertThat(completed.getFailedTableGroups()).isEqualTo(1);
        assertThat(completed.getFieldsDiscovered()).isEqualTo(2);
        assertThat(completed.getFieldsClassified()).isEqualTo(1);
        assertThat(completed.getFinancialFieldsFound()).isEqualTo(1);
        assertThat(completed.getErrorMessage()).isEqualTo("1 table group(s) could not be persisted");
        assertThat(metrics.getMetricsReport()).containsEntry("tablesFailed", 1);
    }

    @Test
    @DisplayName("A session that is no longer pending is skipped")
    void skipsNonPending() {
        when(sessionRepository.markProcessing(eq(SESSION_ID), anyInt(), any())).thenReturn(false);

        orchestrator.run(task());

        verify(catalogAssetService, never()).fetchTableGroups(anyString(), anyList(), anyList());
        verify(sessionRepository, never()).fail(anyString(), anyString(), any());
    }
}
