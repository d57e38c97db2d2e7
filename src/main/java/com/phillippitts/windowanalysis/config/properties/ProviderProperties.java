package com.phillippitts.windowanalysis.config.properties;

import jakarta.validation.Valid;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings for each external analysis provider, keyed by provider id.
 *
 * <pre>
 * analysis.providers.anthropic.base-url=https://api.anthropic.com
 * analysis.providers.anthropic.model=claude-3-5-sonnet-20241022
 * analysis.providers.anthropic.credential-name=ANTHROPIC_API_KEY
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "analysis.providers")
public class ProviderProperties {

    @Valid
    private Settings anthropic = new Settings();

    @Valid
    private Settings openai = new Settings();

    @Valid
    private Settings googleVision = new Settings();

    /**
     * All known providers keyed by provider id, in declaration order.
     */
    public Map<String, Settings> asMap() {
        Map<String, Settings> all = new LinkedHashMap<>();
        all.put("anthropic", anthropic);
        all.put("openai", openai);
        all.put("google-vision", googleVision);
        return all;
    }

    public Settings getAnthropic() {
        return anthropic;
    }

    public void setAnthropic(Settings anthropic) {
        this.anthropic = anthropic;
    }

    public Settings getOpenai() {
        return openai;
    }

    public void setOpenai(Settings openai) {
        this.openai = openai;
    }

    public Settings getGoogleVision() {
        return googleVision;
    }

    public void setGoogleVision(Settings googleVision) {
        this.googleVision = googleVision;
    }

    /**
     * Settings for a single provider. Unused fields are ignored by adapters that don't need them.
     */
    public static class Settings {
        private boolean enabled = true;
        private String baseUrl;
        private String model;
        private int maxTokens = 1000;
        private double temperature = 0.3;
        private String credentialName;
        private String apiVersion;
        private String prompt;
        private int maxResults = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public String getCredentialName() {
            return credentialName;
        }

        public void setCredentialName(String credentialName) {
            this.credentialName = credentialName;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public String getPrompt() {
            return prompt;
        }

        public void setPrompt(String prompt) {
            this.prompt = prompt;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }
    }
}
