package io.github.drompincen.codeforge.runtime.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for an OpenAI-compatible chat completions endpoint.
 */
@ConfigurationProperties(prefix = "codeforge.provider")
public record ProviderProperties(
        String baseUrl,
        String apiKey,
        String model,
        Double temperature,
        Integer maxTokens,
        Duration connectTimeout,
        Duration readTimeout,
        String referer,
        String title
) {
    public ProviderProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://openrouter.ai/api/v1";
        }
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (model == null || model.isBlank()) {
            model = "openai/gpt-4o-mini";
        }
        if (temperature == null) {
            temperature = 0.7;
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(60);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(180);
        }
        if (referer == null) {
            referer = "https://github.com/drompincen/codeforge";
        }
        if (title == null) {
            title = "CodeForge";
        }
    }

    public static ProviderProperties of(String baseUrl, String apiKey, String model) {
        return new ProviderProperties(baseUrl, apiKey, model, null, null, null, null, null, null);
    }

    public String completionsUrl() {
        return baseUrl + "/chat/completions";
    }
}
