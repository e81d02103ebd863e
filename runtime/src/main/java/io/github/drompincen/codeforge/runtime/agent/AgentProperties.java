package io.github.drompincen.codeforge.runtime.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "codeforge.agent")
public record AgentProperties(
        Integer maxIterations,
        Integer maxRetries,
        Duration retryBackoff,
        Integer contextBudgetTokens,
        Integer maxToolOutputChars
) {
    public AgentProperties {
        if (maxIterations == null || maxIterations < 1) {
            maxIterations = 25;
        }
        if (maxRetries == null || maxRetries < 0) {
            maxRetries = 2;
        }
        if (retryBackoff == null) {
            retryBackoff = Duration.ofSeconds(2);
        }
        if (contextBudgetTokens == null || contextBudgetTokens < 1) {
            contextBudgetTokens = 24000;
        }
        if (maxToolOutputChars == null || maxToolOutputChars < 1) {
            maxToolOutputChars = 16000;
        }
    }

    public static AgentProperties defaults() {
        return new AgentProperties(null, null, null, null, null);
    }
}
