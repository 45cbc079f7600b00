package eu.virtualparadox.ragservice.application.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the external embedding service.
 * <p>Connect and read timeouts come from {@code rag.embedding.*}; the read timeout bounds a single embedding call.</p>
 */
@Configuration
public class EmbeddingClientConfig {

    @Bean
    public RestTemplate embeddingRestTemplate(final RestTemplateBuilder builder,
                                              final ApplicationConfig config) {
        final ApplicationConfig.Embedding embedding = config.getEmbedding();
        return builder
                .rootUri(embedding.getUrl())
                .setConnectTimeout(embedding.getConnectTimeout())
                .setReadTimeout(embedding.getReadTimeout())
                .build();
    }
}
