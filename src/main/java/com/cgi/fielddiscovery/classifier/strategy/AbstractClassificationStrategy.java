package com.cgi.fielddiscovery.classifier.strategy;

import com.cgi.fielddiscovery.classifier.api.ClassificationStrategy;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.model.enums.DataCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base strategy for semantic classification.
 */
public abstract class AbstractClassificationStrategy implements ClassificationStrategy {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /**
     * Creates a classification, clamping the confidence into [0, 1].
     *
     * @param category Category
     * @param subcategory Subcategory
     * @param confidence Confidence level
     * @param reasoning Explanation of the decision
     * @param model Producing model, or the rule-based marker
     * @param aiGenerated Whether an AI provider produced the result
     * @return Classification
     */
    protected SemanticClassification createClassification(DataCategory category, String subcategory,
                                                          double confidence, String reasoning,
                                                          String model, boolean aiGenerated) {
        return SemanticClassification.builder()
                .category(category)
                .subcategory(subcategory)
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .reasoning(reasoning)
                .model(model)
                .aiGenerated(aiGenerated)
                .build();
    }
}
