package ch.so.arp.rag.text2sql.generation;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link LlmClient} for the {@code /chat/completions} endpoint of an OpenAI
 * compatible API. The prompt is sent as a single user message.
 */
public class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final RestClient restClient;
    private final String model;
    private final String baseUrl;
    private final String apiKey;

    public OpenAiLlmClient(RestClient.Builder builder, String baseUrl, String apiKey, String model) {
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException(
                    "Property 'spring.ai.openai.api-key' must be provided when mocks are disabled");
        }
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.apiKey = apiKey;
        this.model = Objects.requireNonNull(model, "model");
        this.restClient = builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
    }

    @Override
    public String complete(String prompt, GenerationOptions options) {
        LOGGER.debug("Requesting completion with model {} via base URL {} (key {})", model, baseUrl, mask(apiKey));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("temperature", options.temperature());
        body.put("max_tokens", options.maxTokens());

        ChatResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(ChatResponse.class);
        } catch (ResourceAccessException ex) {
            if (isTimeout(ex)) {
                throw new LlmTimeoutException("Model " + model + " did not answer in time", ex);
            }
            throw new LlmServiceException("Model endpoint " + baseUrl + " is not reachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new LlmServiceException("Completion request with model " + model + " failed: " + ex.getMessage(),
                    ex);
        }
        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new LlmServiceException("Completion response of model " + model + " contains no choices");
        }
        String content = response.choices().get(0).message().content();
        return content == null ? "" : content;
    }

    private static boolean isTimeout(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private String mask(String key) {
        if (key == null || key.length() < 4) {
            return "***";
        }
        return "***" + key.substring(key.length() - 4);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }
}
