package com.goormthonuniv.groundedchat.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 채팅별 영속 선호/요약 문서.
 * 병합은 추가 전용: 들어온 값이 null 이거나 공백이면 기존 값을 유지한다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Profile(
        String preferredLanguage,       // "zh-Hant" | "zh-Hans" | "en"
        String defaultWeatherLocation,  // 예: "台北"
        Boolean preferLinks,
        String conversationSummary
) {
    public static Profile empty() {
        return new Profile(null, null, null, null);
    }

    public Profile mergedWith(Profile updates) {
        if (updates == null) return this;
        return new Profile(
                pick(updates.preferredLanguage, preferredLanguage),
                pick(updates.defaultWeatherLocation, defaultWeatherLocation),
                updates.preferLinks != null ? updates.preferLinks : preferLinks,
                pick(updates.conversationSummary, conversationSummary)
        );
    }

    public boolean isEmpty() {
        return preferredLanguage == null && defaultWeatherLocation == null
                && preferLinks == null && conversationSummary == null;
    }

    public Profile withDefaultWeatherLocation(String v) { return new Profile(preferredLanguage, v, preferLinks, conversationSummary); }
    public Profile withConversationSummary(String v) { return new Profile(preferredLanguage, defaultWeatherLocation, preferLinks, v); }

    private static String pick(String incoming, String current) {
        return incoming != null && !incoming.isBlank() ? incoming : current;
    }
}
