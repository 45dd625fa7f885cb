package com.goormthonuniv.groundedchat.llm;

import java.util.List;
import java.util.Map;

public record LlmRequest(
        String model,
        List<ChatMessage> messages,
        double temperature,
        Integer maxTokens,                 // null 이면 상한 없음
        Map<String, Object> responseFormat // 구조화 출력 스키마 (선택)
) {
    public LlmRequest {
        messages = List.copyOf(messages);
    }
}
