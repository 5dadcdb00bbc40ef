package com.cgi.fielddiscovery.classifier.service;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.catalog.model.TableGroup;
import com.cgi.fielddiscovery.classifier.model.ClassificationResult;
import com.cgi.fielddiscovery.classifier.model.DataProfile;
import com.cgi.fielddiscovery.classifier.model.FieldAnalysis;
import com.cgi.fielddiscovery.classifier.model.FieldDescriptor;
import com.cgi.fielddiscovery.classifier.model.PatternMatch;
import com.cgi.fielddiscovery.classifier.model.RiskAssessment;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.TableAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service that runs the full analysis of a field:
 * pattern matching, semantic classification, profiling, then risk and compliance assessment.
 */
@Service
public class ClassificationPipelineService {
    private static final Logger log = LoggerFactory.getLogger(ClassificationPipelineService.class);

    private final PatternMatcher patternMatcher;
    private final DataProfiler dataProfiler;
    private final FieldClassifier fieldClassifier;
    private final RiskComplianceEngine riskEngine;

    public ClassificationPipelineService(PatternMatcher patternMatcher,
                                         DataProfiler dataProfiler,
                                         FieldClassifier fieldClassifier,
                                         RiskComplianceEngine riskEngine) {
        this.patternMatcher = patternMatcher;
        this.dataProfiler = dataProfiler;
        this.fieldClassifier = fieldClassifier;
        this.riskEngine = riskEngine;
    }

    /**
     * Analyzes a single field.
     *
     * @param field Field to analyze
     * @param samples Sample values, may be null
     * @param rulesOnly Skip the AI provider and classify with the deterministic rules
     * @return Classification result
     */
    public ClassificationResult analyze(FieldDescriptor field, List<String> samples, boolean rulesOnly) {
        long start = System.currentTimeMillis();

        List<PatternMatch> patterns = patternMatcher.match(field.getName(), samples);
        SemanticClassification classification = rulesOnly
                ? fieldClassifier.classifyWithRules(field)
                : fieldClassifier.classify(field);
        DataProfile profile = dataProfiler.profile(samples);
        RiskAssessment risk = riskEngine.assess(patterns, classification, profile);

        long elapsed = System.currentTimeMillis() - start;
        log.debug("Field {}.{} -> {}/{} risk {} ({} patterns) in {} ms",
                field.getTableName(), field.getName(),
                classification.getCategory().getLabel(), classification.getSubcategory(),
                risk.getRiskLevel().getValue(), patterns.size(), elapsed);

        return ClassificationResult.builder()
                .fieldName(field.getName())
                .patterns(patterns)
                .dataProfile(profile)
                .classification(classification)
                .risk(risk)
                .processingTimeMs(elapsed)
                .build();
    }

    /**
     * Analyzes every column of a table group.
     *
     * A table is degraded when it was analysed with rules only, or when the AI provider was
     * available but at least one column fell back to the rules.
     *
     * @param group Table group
     * @param rulesOnly Skip the AI provider for every column
     * @return Analysis of the table, in column order
     */
    public TableAnalysis analyzeTable(TableGroup group, boolean rulesOnly) {
        boolean aiExpected = !rulesOnly && fieldClassifier.isAiAvailable();
        List<FieldAnalysis> fields = new ArrayList<>();
        for (CatalogColumn column : group.getColumns()) {
            FieldDescriptor descriptor = FieldDescriptor.of(column, group.getSchema(), group.getTableName());
            // A cancelled analysis stops calling the provider for its remaining columns.
            boolean columnRulesOnly = rulesOnly || Thread.currentThread().isInterrupted();
            fields.add(FieldAnalysis.builder()
                    .column(column)
                    .result(analyze(descriptor, column.getSampleValues(), columnRulesOnly))
                    .build());
        }

        boolean fellBack = aiExpected && fields.stream()
                .anyMatch(f -> !f.getResult().getClassification().isAiGenerated());
        if (fellBack) {
            log.warn("Table {} had AI classification failures, its analysis will not be cached",
                    group.getQualifiedName());
        }

        return TableAnalysis.builder()
                .schema(group.getSchema())
                .tableName(group.getTableName())
                .assetId(group.getAssetId())
                .fields(fields)
                .degraded(rulesOnly || fellBack)
                .build();
    }
}
