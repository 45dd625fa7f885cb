package com.goormthonuniv.groundedchat.validate.check;

import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.validate.Generation;
import com.goormthonuniv.groundedchat.validate.GroundingCheck;
import com.goormthonuniv.groundedchat.validate.NewsBullets;
import com.goormthonuniv.groundedchat.validate.ValidationContext;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/** bullet 날짜가 출처에서 뽑은 허용 날짜 집합 안에 있어야 한다. */
public class NewsAllowedDateCheck implements GroundingCheck {

    @Override
    public String name() { return "news_allowed_dates"; }

    @Override
    public boolean applies(ValidationContext ctx) {
        return ctx.newsWithResults() && !ctx.dateHints().allowed().isEmpty();
    }

    @Override
    public boolean passes(String text, ValidationContext ctx) {
        return unsupported(text, ctx.dateHints()).isEmpty();
    }

    @Override
    public String correct(String text, ValidationContext ctx, Generation generation) {
        return generation.regenerate(text,
                "These bullet dates do not appear in the sources: " + String.join(", ", unsupported(text, ctx.dateHints()))
                        + ". Use ONLY these dates: " + String.join(", ", ctx.dateHints().allowed())
                        + ". Use " + SourceDateHints.NO_DATE + " when the cited source has no date.");
    }

    static Set<String> unsupported(String text, SourceDateHints hints) {
        Set<String> out = new LinkedHashSet<>();
        for (String b : NewsBullets.bullets(text)) {
            Optional<String> d = NewsBullets.leadingDate(b);
            if (d.isPresent() && !hints.isAllowed(d.get())) out.add(d.get());
        }
        return out;
    }
}
