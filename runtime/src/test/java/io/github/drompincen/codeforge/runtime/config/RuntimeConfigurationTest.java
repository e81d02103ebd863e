package io.github.drompincen.codeforge.runtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.codeforge.protocol.api.TodoItem;
import io.github.drompincen.codeforge.runtime.agent.AgentProperties;
import io.github.drompincen.codeforge.runtime.llm.ProviderProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.net.http.HttpClient;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RuntimeConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(RuntimeConfiguration.class);

    @Test
    void defaultsApplyWithoutProperties() {
        runner.run(ctx -> {
            ProviderProperties provider = ctx.getBean(ProviderProperties.class);
            assertThat(provider.completionsUrl()).isEqualTo("https://openrouter.ai/api/v1/chat/completions");
            assertThat(provider.model()).isEqualTo("openai/gpt-4o-mini");
            assertThat(provider.temperature()).isEqualTo(0.7);
            assertThat(provider.readTimeout()).isEqualTo(Duration.ofSeconds(180));

            AgentProperties agent = ctx.getBean(AgentProperties.class);
            assertThat(agent.maxIterations()).isEqualTo(25);
            assertThat(agent.maxRetries()).isEqualTo(2);
            assertThat(agent.contextBudgetTokens()).isEqualTo(24000);
            assertThat(agent.maxToolOutputChars()).isEqualTo(16000);
            assertThat(ctx).hasSingleBean(HttpClient.class);
        });
    }

    @Test
    void bindsProviderAndAgentProperties() {
        runner.withPropertyValues(
                        "codeforge.provider.base-url=http://localhost:11434/v1/",
                        "codeforge.provider.api-key=sk-local",
                        "codeforge.provider.model=llama3",
                        "codeforge.provider.max-tokens=2048",
                        "codeforge.provider.read-timeout=30s",
                        "codeforge.agent.max-iterations=5",
                        "codeforge.agent.retry-backoff=500ms",
                        "codeforge.agent.context-budget-tokens=8000")
                .run(ctx -> {
                    ProviderProperties provider = ctx.getBean(ProviderProperties.class);
                    assertThat(provider.completionsUrl()).isEqualTo("http://localhost:11434/v1/chat/completions");
                    assertThat(provider.apiKey()).isEqualTo("sk-local");
                    assertThat(provider.maxTokens()).isEqualTo(2048);
                    assertThat(provider.readTimeout()).isEqualTo(Duration.ofSeconds(30));

                    AgentProperties agent = ctx.getBean(AgentProperties.class);
                    assertThat(agent.maxIterations()).isEqualTo(5);
                    assertThat(agent.retryBackoff()).isEqualTo(Duration.ofMillis(500));
                    assertThat(agent.contextBudgetTokens()).isEqualTo(8000);
                });
    }

    @Test
    void objectMapperWritesIsoDatesAndIgnoresUnknownFields() {
        runner.run(ctx -> {
            ObjectMapper mapper = ctx.getBean(ObjectMapper.class);
            TodoItem item = mapper.readValue(
                    "{\"id\":\"4f1c2a34-9a53-4c1e-8e0a-1b2c3d4e5f60\",\"title\":\"t\",\"status\":\"pending\",\"extra\":1}",
                    TodoItem.class);
            assertThat(item.title()).isEqualTo("t");
        });
    }
}
