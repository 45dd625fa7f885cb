package com.goormthonuniv.groundedchat.validate.check;

import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.validate.Generation;
import com.goormthonuniv.groundedchat.validate.GroundingCheck;
import com.goormthonuniv.groundedchat.validate.NewsBullets;
import com.goormthonuniv.groundedchat.validate.ValidationContext;

/** 뉴스 bullet 은 날짜 토큰(YYYY-MM-DD 또는 [none])으로 시작해야 한다. */
public class NewsDateFormatCheck implements GroundingCheck {

    @Override
    public String name() { return "news_date_format"; }

    @Override
    public boolean applies(ValidationContext ctx) {
        return ctx.newsWithResults();
    }

    @Override
    public boolean passes(String text, ValidationContext ctx) {
        return NewsBullets.bullets(text).stream().allMatch(b -> NewsBullets.leadingDate(b).isPresent());
    }

    @Override
    public String correct(String text, ValidationContext ctx, Generation generation) {
        return generation.regenerate(text,
                "Some bullets do not start with a date. Every bullet MUST start with the item's date as YYYY-MM-DD, or "
                        + SourceDateHints.NO_DATE + " when the source has no date, for example:\n"
                        + "- 2026-02-18 Headline: one or two sentences. [1]");
    }
}
