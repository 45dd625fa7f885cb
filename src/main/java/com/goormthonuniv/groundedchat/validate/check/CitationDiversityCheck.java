package com.goormthonuniv.groundedchat.validate.check;

import com.goormthonuniv.groundedchat.validate.FallbackAnswers;
import com.goormthonuniv.groundedchat.validate.Generation;
import com.goormthonuniv.groundedchat.validate.GroundingCheck;
import com.goormthonuniv.groundedchat.validate.NewsBullets;
import com.goormthonuniv.groundedchat.validate.ValidationContext;

import java.util.Optional;
import java.util.Set;

/**
 * bullet 3개 이상에서 서로 다른 인용이 2개 미만이면 재생성, 그래도 안 되면 출처별 bullet 로 대체.
 */
public class CitationDiversityCheck implements GroundingCheck {

    static final int MIN_BULLETS = 3;
    static final int MIN_DISTINCT = 2;

    @Override
    public String name() { return "citation_diversity"; }

    @Override
    public boolean applies(ValidationContext ctx) {
        return ctx.newsWithResults() && ctx.sourceCount() >= MIN_DISTINCT;
    }

    @Override
    public boolean passes(String text, ValidationContext ctx) {
        if (NewsBullets.bullets(text).size() < MIN_BULLETS) return true;
        return NewsBullets.citations(text, ctx.sourceCount()).size() >= MIN_DISTINCT;
    }

    @Override
    public String correct(String text, ValidationContext ctx, Generation generation) {
        Set<Integer> cited = NewsBullets.citations(text, ctx.sourceCount());
        return generation.regenerate(text,
                "Your bullets cite only " + cited + " although " + ctx.sourceCount() + " sources are available. "
                        + "Each bullet must come from a different source and cite that source's own index [n] (1-"
                        + ctx.sourceCount() + ").");
    }

    @Override
    public Optional<String> fallback(String text, ValidationContext ctx) {
        return FallbackAnswers.perSourceBullets(ctx);
    }
}
