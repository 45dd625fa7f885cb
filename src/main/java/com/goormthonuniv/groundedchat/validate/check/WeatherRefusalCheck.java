package com.goormthonuniv.groundedchat.validate.check;

import com.goormthonuniv.groundedchat.validate.Generation;
import com.goormthonuniv.groundedchat.validate.GroundingCheck;
import com.goormthonuniv.groundedchat.validate.ValidationContext;

import java.util.List;
import java.util.regex.Pattern;

/** 검색 결과가 있는데도 "실시간 정보를 줄 수 없다"고 답한 날씨 응답 */
public class WeatherRefusalCheck implements GroundingCheck {

    private final List<Pattern> refusals;

    public WeatherRefusalCheck(List<Pattern> refusals) {
        this.refusals = refusals;
    }

    @Override
    public String name() { return "weather_refusal"; }

    @Override
    public boolean applies(ValidationContext ctx) {
        return ctx.plan().weather() && ctx.bundle().hasResults();
    }

    @Override
    public boolean passes(String text, ValidationContext ctx) {
        return refusals.stream().noneMatch(p -> p.matcher(text).find());
    }

    @Override
    public String correct(String text, ValidationContext ctx, Generation generation) {
        return generation.regenerate(text,
                "Your answer claimed you cannot provide real-time information. That is wrong: "
                        + "current weather content from the web is provided above. "
                        + "You MUST answer from those sources with [n] citations and must not claim inability.");
    }
}
