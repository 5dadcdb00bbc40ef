package com.cgi.fielddiscovery.classifier.strategy;

import com.cgi.fielddiscovery.classifier.model.FieldDescriptor;
import com.cgi.fielddiscovery.classifier.model.SemanticClassification;
import com.cgi.fielddiscovery.classifier.service.AiClassificationClient;
import com.cgi.fielddiscovery.common.exception.ClassificationException;
import org.springframework.stereotype.Component;

/**
 * Strategy delegating classification to the AI provider.
 * Any provider failure or unusable answer surfaces as a {@link ClassificationException}.
 */
@Component
public class AiClassificationStrategy extends AbstractClassificationStrategy {

    private final AiClassificationClient client;

    public AiClassificationStrategy(AiClassificationClient client) {
        this.client = client;
    }

    @Override
    public String getName() {
        return "AiClassificationStrategy";
    }

    @Override
    public SemanticClassification classify(FieldDescriptor field) {
        AiClassificationClient.AiAnswer answer = client.classify(field);
        return createClassification(answer.getCategory(), answer.getSubcategory(), answer.getConfidence(),
                answer.getReasoning(), client.getModel(), true);
    }

    @Override
    public boolean isAvailable() {
        return client.isConfigured();
    }
}
