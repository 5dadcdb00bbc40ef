package com.cgi.fielddiscovery.classifier.api;

import com.cgi.fielddiscovery.classifier.model.FieldDescriptor;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;

/**
 * Interface for semantic classification strategies.
 * Implements the Strategy pattern.
 */
public interface ClassificationStrategy {
    /**
     * Unique name of the strategy.
     *
     * @return Strategy name
     */
    String getName();

    /**
     * Classifies a field into a category and subcategory of the taxonomy.
     *
     * @param field Field to classify
     * @return Classification with confidence and reasoning
     */
    SemanticClassification classify(FieldDescriptor field);

    /**
     * Indicates if this strategy can currently be used.
     *
     * @return true if the strategy is available
     */
    boolean isAvailable();
}
