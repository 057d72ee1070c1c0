package net.luminalib.config;

import net.luminalib.application.ai.GenerationProvider;
import net.luminalib.application.ai.HostedGenerationProvider;
import net.luminalib.application.ai.LocalInferenceGenerationProvider;
import net.luminalib.application.ai.MockGenerationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the generation backend named by {@code app.intelligence.generation-provider}.
 */
@Configuration
public class GenerationProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationProviderConfig.class);

    @Bean
    public GenerationProvider generationProvider(IntelligenceProperties properties, WebClient.Builder webClientBuilder) {
        GenerationProvider provider = switch (properties.getGenerationProvider()) {
            case LOCAL -> new LocalInferenceGenerationProvider(
                webClientBuilder.clone().baseUrl(properties.getLocalBaseUrl()).build(),
                properties.getGenerationModel(),
                properties.getGenerationTimeout()
            );
            case HOSTED -> new HostedGenerationProvider(
                properties.getHostedApiKey(),
                properties.getHostedBaseUrl(),
                properties.getGenerationModel(),
                properties.getGenerationTimeout()
            );
            case MOCK -> new MockGenerationProvider(properties.getMockLatency());
        };
        log.info("Generation provider selected: {} (model={}, available={})",
            provider.providerName(), properties.getGenerationModel(), provider.isAvailable());
        return provider;
    }
}
