/**
 * Configuration for WebClient
 * - Builds the shared WebClient builder used by outbound HTTP adapters
 * - Timeouts follow the generation timeout so long model replies are not cut short
 */
package net.luminalib.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "LuminaLib/0.1";

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connect timeout of 5 seconds
     * - Read and response timeouts equal to the configured generation timeout
     */
    @Bean
    public WebClient.Builder webClientBuilder(IntelligenceProperties properties) {
        long timeoutMillis = properties.getGenerationTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(30, TimeUnit.SECONDS))
            )
            .responseTimeout(properties.getGenerationTimeout());

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(4 * 1024 * 1024)) // 4MB
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
