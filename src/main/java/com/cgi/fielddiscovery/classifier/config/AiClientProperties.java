package com.cgi.fielddiscovery.classifier.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings of the AI classification provider (an OpenAI-compatible chat completions endpoint).
 */
@Component
@ConfigurationProperties(prefix = "fielddiscovery.ai")
@Getter
@Setter
public class AiClientProperties {
    private boolean enabled = true;
    private String url = "https://api.openai.com/v1/chat/completions";
    private String apiKey;
    private String model = "gpt-4";
    private double temperature = 0.1;
    private int maxTokens = 500;
    private int connectTimeoutMs = 5000;
    private int timeoutMs = 30000;
}
