package com.goormthonuniv.groundedchat.dto;

/** 턴을 실패시키지 않는 성능 저하 경로. 응답에 기록되고 WARN 으로 남긴다. */
public enum Degradation {
    PLANNING_DEGRADED,
    RETRIEVAL_EMPTY,
    SUMMARIZATION_SKIPPED,
    VALIDATION_EXHAUSTED
}
