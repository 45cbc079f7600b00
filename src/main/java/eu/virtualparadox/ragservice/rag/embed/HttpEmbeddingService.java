package eu.virtualparadox.ragservice.rag.embed;

import com.fasterxml.jackson.databind.JsonNode;
import eu.virtualparadox.ragservice.application.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Calls an OpenAI-compatible {@code POST /embeddings} endpoint (text-embeddings-inference, vLLM, OpenAI).
 * <p>
 * Request: {@code {"input": ["<prefix><query>"], "model": "<model>"}}. The prefix is the task prefix
 * the model expects for queries ({@code "search_query: "} for nomic models).
 * <p>
 * Two response shapes are understood: {@code {"data": [{"embedding": [...]}]}} and
 * {@code {"embeddings": [[...]]}}. The returned vector is L2-normalized.
 */
@Service
@Slf4j
public class HttpEmbeddingService implements EmbeddingService {

    private static final String EMBEDDINGS_PATH = "/embeddings";

    private final RestTemplate restTemplate;
    private final String model;
    private final String queryPrefix;

    public HttpEmbeddingService(@Qualifier("embeddingRestTemplate") final RestTemplate restTemplate,
                                final ApplicationConfig config) {
        this.restTemplate = restTemplate;
        this.model = config.getEmbedding().getRequestModel();
        this.queryPrefix = StringUtils.defaultString(config.getEmbedding().getQueryPrefix());
    }

    @Override
    public float[] embedQuery(final String text) {
        final EmbeddingRequest request = new EmbeddingRequest(List.of(queryPrefix + text), model);

        final JsonNode response;
        try {
            response = restTemplate.postForObject(EMBEDDINGS_PATH, request, JsonNode.class);
        } catch (RestClientException e) {
            throw new EmbeddingServiceException("Embedding service call failed: " + e.getMessage(), e);
        }

        final float[] vec = toVector(extractEmbedding(response));
        normalize(vec);
        log.debug("Embedded query ({} chars) into {} dimensions", text.length(), vec.length);
        return vec;
    }

    private JsonNode extractEmbedding(final JsonNode response) {
        if (response == null) {
            throw new EmbeddingServiceException("Embedding service returned an empty body");
        }
        final JsonNode data = response.path("data");
        if (data.isArray() && !data.isEmpty()) {
            return data.get(0).path("embedding");
        }
        final JsonNode embeddings = response.path("embeddings");
        if (embeddings.isArray() && !embeddings.isEmpty()) {
            return embeddings.get(0);
        }
        throw new EmbeddingServiceException("Unexpected embedding response format");
    }

    private float[] toVector(final JsonNode values) {
        if (!values.isArray() || values.isEmpty()) {
            throw new EmbeddingServiceException("Embedding response carries no vector");
        }
        final float[] vec = new float[values.size()];
        for (int i = 0; i < vec.length; i++) {
            final JsonNode v = values.get(i);
            if (!v.isNumber()) {
                throw new EmbeddingServiceException("Embedding response has a non-numeric value at position " + i);
            }
            vec[i] = v.floatValue();
        }
        return vec;
    }

    private void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm == 0.0 || Double.isNaN(norm) || Double.isInfinite(norm)) {
            throw new EmbeddingServiceException("Embedding service returned a vector that cannot be normalized");
        }
        for (int i = 0; i < vec.length; i++) {
            vec[i] /= (float) norm;
        }
    }

    public record EmbeddingRequest(List<String> input, String model) {
    }
}
