package com.goormthonuniv.groundedchat.validate;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.planner.HeuristicLexicon;
import com.goormthonuniv.groundedchat.validate.check.CitationDiversityCheck;
import com.goormthonuniv.groundedchat.validate.check.NewsAllowedDateCheck;
import com.goormthonuniv.groundedchat.validate.check.NewsDateFormatCheck;
import com.goormthonuniv.groundedchat.validate.check.ScriptVariantCheck;
import com.goormthonuniv.groundedchat.validate.check.StaleYearCheck;
import com.goormthonuniv.groundedchat.validate.check.WeatherRefusalCheck;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 생성 직후 검사 목록을 순서대로 한 번씩 돈다.
 * 검사마다 교정 1회, 그래도 실패하면 fallback 또는 교정본 수용.
 * 뒤 검사의 교정 결과를 앞 검사로 다시 검증하지는 않는다.
 */
@Slf4j
@Component
public class ValidationEngine {

    private final List<GroundingCheck> checks;

    @Autowired
    public ValidationEngine(HeuristicLexicon lexicon, AssistantProperties props) {
        this(List.of(
                new WeatherRefusalCheck(lexicon.compiledRefusals()),
                new ScriptVariantCheck(new ScriptVariantDetector(lexicon)),
                new StaleYearCheck(props.getNews().getAppendixDefaultLinks()),
                new NewsDateFormatCheck(),
                new NewsAllowedDateCheck(),
                new CitationDiversityCheck()));
    }

    public ValidationEngine(List<GroundingCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public List<GroundingCheck> checks() { return checks; }

    public ValidationOutcome validate(String draft, ValidationContext ctx, Generation generation) {
        String text = draft;
        List<String> corrected = new ArrayList<>();
        boolean exhausted = false;
        boolean linkListing = false;

        for (GroundingCheck check : checks) {
            if (!check.applies(ctx) || check.passes(text, ctx)) continue;

            corrected.add(check.name());
            String attempt;
            try {
                attempt = check.correct(text, ctx, generation);
            } catch (RuntimeException e) {
                log.warn("[validate] check={} correction call failed: {}", check.name(), e.getMessage());
                attempt = text;
            }
            if (attempt == null || attempt.isBlank()) attempt = text;

            if (check.passes(attempt, ctx)) {
                text = attempt;
                linkListing = false;
                continue;
            }
            Optional<String> fallback = check.fallback(attempt, ctx);
            if (fallback.isPresent()) {
                log.warn("[validate] check={} still failing, deterministic fallback used", check.name());
                text = fallback.get();
                exhausted = true;
                linkListing = check instanceof StaleYearCheck;
            } else {
                log.info("[validate] check={} still failing, corrected text accepted", check.name());
                text = attempt;
            }
        }
        return new ValidationOutcome(text, corrected, exhausted, linkListing);
    }
}
