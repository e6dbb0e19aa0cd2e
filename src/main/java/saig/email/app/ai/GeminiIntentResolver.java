package saig.email.app.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import saig.email.app.command.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves intents with Google Gemini over its REST API.
 */
@Slf4j
public class GeminiIntentResolver implements IntentResolver {
    private static final String GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta/models/gemini-pro:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public GeminiIntentResolver(String apiKey) {
        this(apiKey, new RestTemplate());
    }

    GeminiIntentResolver(String apiKey, RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();
        this.apiKey = apiKey;

        if (apiKey == null || apiKey.isEmpty() || apiKey.startsWith("${")) {
            log.warn("Gemini API key not configured. Set gemini.api.key in application.properties or environment variable.");
        }
    }

    @Override
    public Intent resolve(String text) {
        Intent intent = IntentPrompts.parse(callGeminiAPI(IntentPrompts.build(text), 300, 0.0f), objectMapper);
        log.debug("Resolved '{}' to intent {}", text, intent.getName());
        return intent;
    }

    private String callGeminiAPI(String prompt, int maxTokens, float temperature) {
        if (apiKey == null || apiKey.isEmpty() || apiKey.startsWith("${")) {
            throw new ResolutionException("Gemini API key not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> requestBody = new HashMap<>();
        Map<String, Object> contents = new HashMap<>();
        Map<String, Object> part = new HashMap<>();
        part.put("text", prompt);
        contents.put("parts", List.of(part));
        requestBody.put("contents", List.of(contents));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("maxOutputTokens", maxTokens);
        generationConfig.put("temperature", temperature);
        requestBody.put("generationConfig", generationConfig);

        ResponseEntity<String> response;
        try {
            String url = GEMINI_API_URL + "?key=" + apiKey;
            response = restTemplate.postForEntity(url, new HttpEntity<>(requestBody, headers), String.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                    || e.getResponseBodyAsString().contains("RESOURCE_EXHAUSTED")) {
                throw new QuotaException("Gemini quota/rate limit exceeded: " + e.getStatusCode(), e);
            }
            throw new ResolutionException("Gemini API error: " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            throw new ResolutionException("Gemini API unreachable: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new ResolutionException("Gemini API error: " + response.getStatusCode());
        }
        try {
            JsonNode jsonResponse = objectMapper.readTree(response.getBody());
            JsonNode parts = jsonResponse.path("candidates").path(0).path("content").path("parts");
            if (parts.isArray() && parts.size() > 0 && parts.get(0).has("text")) {
                return parts.get(0).get("text").asText();
            }
        } catch (JsonProcessingException e) {
            throw new ResolutionException("Unreadable Gemini response: " + e.getMessage(), e);
        }
        throw new ResolutionException("Unexpected Gemini API response format: " + response.getBody());
    }
}
