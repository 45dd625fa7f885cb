package com.goormthonuniv.groundedchat.llm;

public interface LlmClient {
    /**
     * chat-completions 한 번 호출.
     * @return 생성 텍스트 (null 아님)
     * @throws LlmCallException 전송 실패 또는 비정상 응답
     */
    String complete(LlmRequest request);
}
