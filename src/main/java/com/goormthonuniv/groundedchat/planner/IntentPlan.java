package com.goormthonuniv.groundedchat.planner;

import com.goormthonuniv.groundedchat.dto.PlanDecision;

/**
 * 플래너 결정 + 결정론적 보정 결과.
 *
 * @param itemLimit 뉴스 항목 수 (뉴스가 아니면 0)
 */
public record IntentPlan(
        PlanDecision decision,
        boolean reuse,
        int itemLimit,
        boolean weather,
        String weatherLocation,
        boolean needsClarification,
        boolean news,
        boolean recentNews,
        boolean wantsLinks,
        boolean degraded
) {
    public boolean webSearch() { return decision.isWebSearch(); }

    /** 최신성 민감: 날씨 또는 최근 뉴스 */
    public boolean recencySensitive() { return weather || recentNews; }
}
