package com.adlanda.citedsearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for answer generation.
 *
 * Maps to properties prefixed with 'citedsearch.generation' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "citedsearch.generation")
public class GenerationProperties {

    /**
     * Longest wait for the first or next delta of a generation stream.
     */
    private Duration timeout = Duration.ofSeconds(120);

    /**
     * Used in the system prompt, e.g. "support center assistant for ACME combustion controls".
     */
    private String assistantRole = "support center assistant for the indexed product documentation";

    /**
     * Upper bound for the chunk context placed in the prompt, in characters.
     */
    private int maxContextLength = 12000;

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getAssistantRole() {
        return assistantRole;
    }

    public void setAssistantRole(String assistantRole) {
        this.assistantRole = assistantRole;
    }

    public int getMaxContextLength() {
        return maxContextLength;
    }

    public void setMaxContextLength(int maxContextLength) {
        this.maxContextLength = maxContextLength;
    }
}
