package com.goormthonuniv.groundedchat.llm;

/** 모델 호출 실패(전송/응답 형식). 호출 측에서 저하 경로로 흡수한다. */
public class LlmCallException extends RuntimeException {
    public LlmCallException(String message) { super(message); }
    public LlmCallException(String message, Throwable cause) { super(message, cause); }
}
