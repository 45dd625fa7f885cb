package com.goormthonuniv.groundedchat.validate;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.planner.HeuristicLexicon;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 검사 이후 마무리: 문자 체계 재작성 한 번 더 → 뉴스 항목 수 제한 → 링크 부록.
 */
@Slf4j
@Component
public class AnswerFinalizer {

    private final ScriptVariantDetector detector;
    private final AssistantProperties props;

    public AnswerFinalizer(HeuristicLexicon lexicon, AssistantProperties props) {
        this.detector = new ScriptVariantDetector(lexicon);
        this.props = props;
    }

    public String finish(ValidationOutcome outcome, ValidationContext ctx, Generation generation) {
        String text = outcome.text();

        // 뒤쪽 교정 재생성이 다른 문자 체계를 다시 들여올 수 있다
        if (ctx.requiredLanguage() != null && detector.mismatch(text, ctx.requiredLanguage())) {
            try {
                String rewritten = generation.rewriteScript(text, ctx.requiredLanguage());
                if (!rewritten.isBlank()) text = rewritten;
            } catch (RuntimeException e) {
                log.warn("[finalize] script rewrite failed: {}", e.getMessage());
            }
        }

        if (outcome.linkListing() || !ctx.plan().webSearch() || !ctx.bundle().hasResults()) {
            return text;
        }

        AssistantProperties.News news = props.getNews();
        if (ctx.plan().news()) {
            if (ctx.plan().itemLimit() > 0) text = NewsBullets.cap(text, ctx.plan().itemLimit());
            return LinkAppendix.forNews(text, ctx.bundle().results(), news.getAppendixDefaultLinks(), ctx.outputLanguage());
        }
        if (ctx.plan().wantsLinks()) {
            return LinkAppendix.rawUrls(text, ctx.bundle().results(), news.getRawLinkCount());
        }
        return text;
    }
}
