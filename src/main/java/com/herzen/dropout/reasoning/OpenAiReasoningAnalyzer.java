package com.herzen.dropout.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.dropout.event.EventModels.Attempt;
import com.herzen.dropout.event.EventModels.AttemptHistory;
import com.herzen.dropout.features.SignalModels.ReasoningInsight;
import org.springframework.http.*;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Asks an OpenAI-compatible chat-completions endpoint for a structured reading of the attempts.
 *
 * <p>Any transport or parsing problem is thrown; {@link BoundedReasoningAnalyzer} turns it into
 * a heuristic fallback.
 */
public class OpenAiReasoningAnalyzer implements ReasoningAnalyzer {
    private static final String SYSTEM_PROMPT =
            "You are an expert learning analyst. Analyze student attempts and reply with a JSON object.";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public OpenAiReasoningAnalyzer(RestTemplate restTemplate, ObjectMapper objectMapper,
                                   String baseUrl, String apiKey, String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public ReasoningInsight analyze(AttemptHistory history, String questionContext) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = Map.of(
                "model", model,
                "temperature", 0.5,
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt(history, questionContext))
                )
        );

        ResponseEntity<JsonNode> resp = restTemplate.exchange(baseUrl + "/v1/chat/completions",
                HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class);
        if (!resp.getStatusCode().is2xxSuccessful() || resp.getBody() == null) {
            throw new IllegalStateException("chat completion failed with status " + resp.getStatusCode());
        }
        String content = resp.getBody().path("choices").path(0).path("message").path("content").asText(null);
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("chat completion returned no content");
        }
        return parse(content);
    }

    ReasoningInsight parse(String content) {
        JsonNode result;
        try {
            result = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("chat completion content is not JSON", e);
        }
        List<String> misconceptions = new ArrayList<>();
        result.path("misconceptions").forEach(n -> misconceptions.add(n.asText()));
        double confidence = Math.max(0.0, Math.min(1.0, result.path("confidence").asDouble(0.0)));
        return new ReasoningInsight(
                result.path("conceptual_gap").asText(""),
                result.path("summary").asText(""),
                confidence,
                misconceptions,
                result.path("confidence_gap").asDouble(0.0),
                false
        );
    }

    static String prompt(AttemptHistory history, String questionContext) {
        StringBuilder sb = new StringBuilder("Analyze the following attempts on one question.\n\n");
        if (questionContext != null && !questionContext.isBlank()) {
            sb.append("Question context: ").append(questionContext).append("\n\n");
        }
        sb.append("Attempt history:\n");
        for (Attempt a : history.attempts()) {
            sb.append("Attempt ").append(a.attemptNumber())
                    .append(" (").append(a.timestamp()).append("): answer=").append(a.answer())
                    .append(", correct=").append(a.correct()).append('\n');
        }
        sb.append("""

                Reply as JSON:
                {"conceptual_gap": string, "summary": string, "confidence": 0.0-1.0,
                 "misconceptions": [string], "confidence_gap": -50..50}
                Consider whether the student understands or guesses, recurring error patterns,
                progression from first to last attempt and the kind of help needed.
                """);
        return sb.toString();
    }
}
