package com.goormthonuniv.groundedchat.validate;

import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.planner.IntentPlan;
import com.goormthonuniv.groundedchat.retrieval.RetrievalBundle;

/**
 * 검증 단계가 보는 턴 정보.
 *
 * @param requiredLanguage 프로필이 강제한 출력 언어, 없으면 null
 * @param outputLanguage   실제 출력 언어 (프로필 또는 기본값), fallback 문구에 쓴다
 * @param currentYear      설정 시간대 기준 올해
 */
public record ValidationContext(
        IntentPlan plan,
        RetrievalBundle bundle,
        String requiredLanguage,
        String outputLanguage,
        int currentYear
) {
    public int sourceCount() { return bundle.results().size(); }

    public SourceDateHints dateHints() { return bundle.dateHints(); }

    public boolean newsWithResults() { return plan.news() && bundle.hasResults(); }
}
