package ch.so.arp.rag.text2sql.knowledge;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Calls the {@code /embeddings} endpoint of an OpenAI compatible API. A batch
 * is sent as a single request; the response items are put back into input
 * order by their {@code index}.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestClient restClient;
    private final String model;
    private final Integer dimensions;

    public OpenAiEmbeddingProvider(RestClient.Builder builder, String baseUrl, String apiKey, String model,
            Integer dimensions) {
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException(
                    "Property 'spring.ai.openai.api-key' must be provided when mocks are disabled");
        }
        this.restClient = builder
                .baseUrl(Objects.requireNonNull(baseUrl, "baseUrl"))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
        this.model = Objects.requireNonNull(model, "model");
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", texts);
        if (dimensions != null) {
            body.put("dimensions", dimensions);
        }
        EmbeddingResponse response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(EmbeddingResponse.class);
        } catch (RestClientException ex) {
            throw new EmbeddingServiceException("Embedding request with model " + model + " failed: "
                    + ex.getMessage(), ex);
        }
        if (response == null || response.data() == null || response.data().size() != texts.size()) {
            throw new EmbeddingServiceException("Embedding count mismatch: requested " + texts.size()
                    + " but received " + (response == null || response.data() == null ? 0 : response.data().size()));
        }
        LOGGER.debug("Embedded {} texts with model {}", texts.size(), model);
        return response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingItem::index))
                .map(item -> {
                    if (item.embedding() == null || item.embedding().length == 0) {
                        throw new EmbeddingServiceException("Empty embedding at index " + item.index());
                    }
                    return item.embedding();
                })
                .toList();
    }

    @Override
    public int dimensions() {
        return dimensions != null ? dimensions : EmbeddingProvider.super.dimensions();
    }

    @Override
    public String modelId() {
        return model;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingItem> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingItem(int index, float[] embedding) {
    }
}
