package com.goormthonuniv.groundedchat.validate;

import java.util.List;

/**
 * @param corrected   교정 시도가 일어난 검사 이름들 (순서대로)
 * @param exhausted   fallback 이 한 번이라도 쓰였는지
 * @param linkListing 최종 답이 링크 목록 fallback 인지 (이 경우 링크 부록 생략)
 */
public record ValidationOutcome(
        String text,
        List<String> corrected,
        boolean exhausted,
        boolean linkListing
) {
    public ValidationOutcome {
        corrected = List.copyOf(corrected);
    }
}
