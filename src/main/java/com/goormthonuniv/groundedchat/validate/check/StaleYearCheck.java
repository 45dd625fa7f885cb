package com.goormthonuniv.groundedchat.validate.check;

import com.goormthonuniv.groundedchat.validate.FallbackAnswers;
import com.goormthonuniv.groundedchat.validate.Generation;
import com.goormthonuniv.groundedchat.validate.GroundingCheck;
import com.goormthonuniv.groundedchat.validate.ValidationContext;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 최근 뉴스 질문인데 (올해-1) 보다 오래된 연도가 나오면 재생성, 그래도 나오면 링크 목록으로 대체.
 */
public class StaleYearCheck implements GroundingCheck {

    private static final Pattern YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");

    private final int listingSize;

    public StaleYearCheck(int listingSize) {
        this.listingSize = listingSize;
    }

    @Override
    public String name() { return "stale_year"; }

    @Override
    public boolean applies(ValidationContext ctx) {
        return ctx.plan().recentNews() && ctx.bundle().hasResults();
    }

    @Override
    public boolean passes(String text, ValidationContext ctx) {
        return staleYears(text, ctx.currentYear()).isEmpty();
    }

    @Override
    public String correct(String text, ValidationContext ctx, Generation generation) {
        int oldest = ctx.currentYear() - 1;
        return generation.regenerate(text,
                "Your answer mentions outdated years " + staleYears(text, ctx.currentYear())
                        + ". The user wants recent news: only report items from " + oldest + " or " + ctx.currentYear()
                        + ", and leave out anything older. Do not mention years before " + oldest + ".");
    }

    @Override
    public Optional<String> fallback(String text, ValidationContext ctx) {
        return FallbackAnswers.linkListing(ctx, listingSize);
    }

    static Set<Integer> staleYears(String text, int currentYear) {
        Set<Integer> out = new TreeSet<>();
        Matcher m = YEAR.matcher(text == null ? "" : text);
        while (m.find()) {
            int y = Integer.parseInt(m.group(1));
            if (y < currentYear - 1) out.add(y);
        }
        return out;
    }
}
