package com.cgi.fielddiscovery.classifier.cache;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.catalog.model.TableGroup;
import com.cgi.fielddiscovery.classifier.model.ClassificationResult;
import com.cgi.fielddiscovery.classifier.model.DataProfile;
import com.cgi.fielddiscovery.classifier.model.FieldAnalysis;
import com.cgi.fielddiscovery.classifier.model.RiskAssessment;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.TableAnalysis;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import com.cgi.fielddiscovery.classifier.model.enums.RiskLevel;
import com.cgi.fielddiscovery.classifier.service.ClassificationMetricsCollector;
import com.cgi.fielddiscovery.discovery.model.DiscoveredField;
import com.cgi.fielddiscovery.discovery.service.DiscoveredFieldAssembler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TableAnalysisCache")
class TableAnalysisCacheTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ClassificationMetricsCollector metrics;

    @Mock
    private ResultCache failingStore;

    @BeforeEach
    void setUp() {
        metrics = new ClassificationMetricsCollector();
    }

    private TableAnalysisCache cache(ResultCache store) {
        return new TableAnalysisCache(store, new FingerprintGenerator(objectMapper), objectMapper, metrics,
                3600, "field_analysis:");
    }

    private static TableGroup group(String sample) {
        return group(sample, "a1", "c1");
    }

    private static TableGroup group(String sample, String assetId, String columnId) {
        List<CatalogColumn> columns = new ArrayList<>();
        columns.add(CatalogColumn.builder().id(columnId).name("email").dataType("varchar")
                .sampleValues(new ArrayList<>(List.of(sample))).build());
        return TableGroup.builder().schema("public").tableName("users").assetId(assetId).columns(columns).build();
    }

    private static TableAnalysis analysis(TableGroup group) {
        ClassificationResult result = ClassificationResult.builder()
                .fieldName("email")
                .patterns(new ArrayList<>())
                .dataProfile(DataProfile.empty())
                .classification(SemanticClassification.builder()
                        .category(DataCategory.PERSONAL_DATA).subcategory("PII").confidence(0.85)
                        .reasoning("Field name contains 'email'").model("Rule-based").build())
                .risk(RiskAssessment.builder().riskLevel(RiskLevel.CRITICAL).build())
                .build();
        return TableAnalysis.builder()
                .schema(group.getSchema()).tableName(group.getTableName()).assetId(group.getAssetId())
                .fields(new ArrayList<>(List.of(FieldAnalysis.builder()
                        .column(group.getColumns().get(0)).result(result).build())))
                .build();
    }

    @Test
    @DisplayName("A stored analysis is returned for identical table content only")
    void hitOnSameContent() {
        TableAnalysisCache cache = cache(new InMemoryResultCache());
        TableGroup group = group("a@b.io");
        cache.store(group, analysis(group));

        Optional<TableAnalysis> hit = cache.lookup(group("a@b.io"));
        Optional<TableAnalysis> miss = cache.lookup(group("other@b.io"));

        assertThat(hit).isPresent();
        assertThat(hit.get().getFields().get(0).getResult().getCategory()).isEqualTo(DataCategory.PERSONAL_DATA);
        assertThat(hit.get().getFields().get(0).getResult().getRiskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(miss).isEmpty();
        assertThat(metrics.getMetricsReport())
                .containsEntry("cacheHits", 1)
                .containsEntry("cacheMisses", 1);
    }

    @Test
    @DisplayName("A hit from another data source carries the asset ids of the table being analysed")
    void hitIsReboundToLiveCatalogIds() {
        TableAnalysisCache cache = cache(new InMemoryResultCache());
        TableGroup firstSource = group("a@b.io", "ds1-table", "ds1-col-asset");
        cache.store(firstSource, analysis(firstSource));

        TableGroup secondSource = group("a@b.io", "ds2-table", "ds2-col-asset");
        TableAnalysis hit = cache.lookup(secondSource).orElseThrow();
        List<DiscoveredField> fields = new DiscoveredFieldAssembler().assemble("ds-2", hit, LocalDateTime.now());

        assertThat(hit.getAssetId()).isEqualTo("ds2-table");
        assertThat(hit.getFields().get(0).getColumn().getId()).isEqualTo("ds2-col-asset");
        assertThat(hit.getFields().get(0).getResult().getCategory()).isEqualTo(DataCategory.PERSONAL_DATA);
        assertThat(fields).singleElement().satisfies(field -> {
            assertThat(field.getDataSourceId()).isEqualTo("ds-2");
            assertThat(field.getAssetId()).isEqualTo("ds2-col-asset");
        });
    }

    @Test
    @DisplayName("A read failure of the store counts as a miss")
    void readFailureIsMiss() {
        when(failingStore.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(cache(failingStore).lookup(group("a@b.io"))).isEmpty();
        assertThat(metrics.getMetricsReport())
                .containsEntry("cacheErrors", 1)
                .containsEntry("cacheMisses", 1);
    }

    @Test
    @DisplayName("A write failure of the store is swallowed")
    void writeFailureSwallowed() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(failingStore).put(anyString(), anyString(), any(Duration.class));
        TableGroup group = group("a@b.io");

        assertThatCode(() -> cache(failingStore).store(group, analysis(group))).doesNotThrowAnyException();
        assertThat(metrics.getMetricsReport()).containsEntry("cacheErrors", 1);
    }

    @Test
    @DisplayName("The fingerprint depends on samples")
    void fingerprintStable() {
        FingerprintGenerator generator = new FingerprintGenerator(objectMapper);

        assertThat(generator.fingerprint(group("x"))).isEqualTo(generator.fingerprint(group("x")))
                .hasSize(64)
                .isNotEqualTo(generator.fingerprint(group("y")));
    }
}
