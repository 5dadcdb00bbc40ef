package com.cgi.fielddiscovery.classifier.service;

import com.cgi.fielddiscovery.classifier.model.FieldDescriptor;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.strategy.AiClassificationStrategy;
import com.cgi.fielddiscovery.classifier.strategy.RuleBasedClassificationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Semantic classifier. Uses the AI strategy when it is available and falls back
 * to the rule-based strategy on any failure, so {@link #classify} never throws.
 */
@Slf4j
@Service
public class FieldClassifier {

    private final AiClassificationStrategy aiStrategy;
    private final RuleBasedClassificationStrategy ruleStrategy;
    private final ClassificationMetricsCollector metricsCollector;

    public FieldClassifier(AiClassificationStrategy aiStrategy,
                           RuleBasedClassificationStrategy ruleStrategy,
                           ClassificationMetricsCollector metricsCollector) {
        this.aiStrategy = aiStrategy;
        this.ruleStrategy = ruleStrategy;
        this.metricsCollector = metricsCollector;
    }

    /**
     * Classifies a field, preferring the AI provider.
     *
     * @param field Field to classify
     * @return Classification, never null
     */
    public SemanticClassification classify(FieldDescriptor field) {
        if (aiStrategy.isAvailable()) {
            try {
                SemanticClassification result = aiStrategy.classify(field);
                metricsCollector.recordAiClassification();
                return result;
            } catch (RuntimeException e) {
                metricsCollector.recordAiFailure();
                log.warn("AI classification failed for field {}, using rule-based fallback: {}",
                        field != null ? field.getName() : null, e.getMessage());
            }
        }
        return classifyWithRules(field);
    }

    public boolean isAiAvailable() {
        return aiStrategy.isAvailable();
    }

    /**
     * Classifies a field with the deterministic rules only.
     *
     * @param field Field to classify
     * @return Classification, never null
     */
    public SemanticClassification classifyWithRules(FieldDescriptor field) {
        metricsCollector.recordFallbackClassification();
        return ruleStrategy.classify(field);
    }
}
