package com.goormthonuniv.groundedchat.validate;

import java.util.Optional;

/**
 * 생성 후 검사 하나: 적용 조건, 통과 조건, 교정 시도 1회, 선택적 결정론 fallback.
 */
public interface GroundingCheck {

    String name();

    boolean applies(ValidationContext ctx);

    boolean passes(String text, ValidationContext ctx);

    /** 교정 시도. 보통 교정 지시를 붙인 재생성이다. */
    String correct(String text, ValidationContext ctx, Generation generation);

    /** 교정 후에도 실패하면 쓸 답. 비어 있으면 교정본을 그대로 받아들인다. */
    default Optional<String> fallback(String text, ValidationContext ctx) {
        return Optional.empty();
    }
}
