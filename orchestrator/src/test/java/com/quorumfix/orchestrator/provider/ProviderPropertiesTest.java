package com.quorumfix.orchestrator.provider;

import com.quorumfix.orchestrator.llm.WireFormat;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binding of {@code quorumfix.providers.*} into the registry, without the
 * rest of the application.
 */
class ProviderPropertiesTest {

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(ProviderProperties.class)
    @Import(ProviderRegistry.class)
    static class RegistryConfig {}

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(RegistryConfig.class)
            .withPropertyValues(
                    "quorumfix.providers.gpt4.model=gpt-4-turbo-preview",
                    "quorumfix.providers.gpt4.endpoint=https://api.openai.com/v1/chat/completions",
                    "quorumfix.providers.gpt4.credential=OPENAI_API_KEY",
                    "quorumfix.providers.claude.model=claude-3-5-sonnet-20241022",
                    "quorumfix.providers.claude.weight=0.9",
                    "quorumfix.providers.claude.endpoint=https://api.anthropic.com/v1/messages",
                    "quorumfix.providers.claude.wire-format=ANTHROPIC_MESSAGES",
                    "quorumfix.providers.qwen.enabled=false",
                    "quorumfix.providers.qwen.model=qwen/qwen-2.5-coder-32b-instruct",
                    "quorumfix.providers.qwen.endpoint=https://openrouter.ai/api/v1/chat/completions",
                    "quorumfix.providers.qwen.timeout=45s");

    @Test
    void enabledProvidersAreRegisteredWithDefaultsApplied() {
        runner.run(context -> {
            ProviderRegistry registry = context.getBean(ProviderRegistry.class);

            assertThat(registry.all()).extracting(ProviderProfile::id)
                    .containsExactly(ProviderId.GPT4, ProviderId.CLAUDE);

            ProviderProfile gpt = registry.get(ProviderId.GPT4);
            assertThat(gpt.weight()).isEqualTo(1.0);
            assertThat(gpt.timeout()).isEqualTo(Duration.ofSeconds(60));
            assertThat(gpt.wireFormat()).isEqualTo(WireFormat.OPENAI_CHAT);
            assertThat(gpt.credentialRef()).isEqualTo("OPENAI_API_KEY");
            assertThat(gpt.steering()).isEqualTo(ProviderId.GPT4.defaultSteering());

            ProviderProfile claude = registry.get(ProviderId.CLAUDE);
            assertThat(claude.weight()).isEqualTo(0.9);
            assertThat(claude.wireFormat()).isEqualTo(WireFormat.ANTHROPIC_MESSAGES);
        });
    }

    @Test
    void negativeWeight_failsStartup() {
        runner.withPropertyValues("quorumfix.providers.gpt4.weight=-1")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(ProviderConfigurationException.class)
                            .hasMessageContaining("gpt4");
                });
    }

    @Test
    void missingEndpoint_failsStartup() {
        runner.withPropertyValues("quorumfix.providers.deepseek.model=deepseek/deepseek-r1")
                .run(context -> assertThat(context).hasFailed());
    }
}
