package com.goormthonuniv.groundedchat.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OpenAI 호환 /chat/completions 클라이언트 (LM Studio 기본).
 */
@Slf4j
@Component
public class OpenAiCompatibleLlmClient implements LlmClient {

    private final RestClient rest;
    private final String baseUrl;
    private final String apiKey;

    public OpenAiCompatibleLlmClient(RestClient restClient,
                                     @Value("${assistant.adapters.llm.baseUrl:http://localhost:1234/v1}") String baseUrl,
                                     @Value("${assistant.adapters.llm.apiKey:}") String apiKey) {
        this.rest = restClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public String complete(LlmRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", req.model());
        body.put("messages", req.messages().stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList());
        body.put("temperature", req.temperature());
        if (req.maxTokens() != null) body.put("max_tokens", req.maxTokens());
        if (req.responseFormat() != null) body.put("response_format", req.responseFormat());

        JsonNode res;
        try {
            var spec = rest.post()
                    .uri(baseUrl + "/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON);
            if (apiKey != null && !apiKey.isBlank()) {
                spec = spec.header("Authorization", "Bearer " + apiKey);
            }
            res = spec.body(body).retrieve().body(JsonNode.class);
        } catch (Exception e) {
            throw new LlmCallException("chat completion failed: " + e.getMessage(), e);
        }

        JsonNode choices = res == null ? null : res.path("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new LlmCallException("chat completion returned no choices");
        }
        String content = choices.get(0).path("message").path("content").asText("");
        log.debug("[llm] model={} messages={} chars={}", req.model(), req.messages().size(), content.length());
        return content;
    }
}
