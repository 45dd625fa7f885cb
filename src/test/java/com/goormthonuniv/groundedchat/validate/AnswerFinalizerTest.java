package com.goormthonuniv.groundedchat.validate;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.llm.ChatMessage;
import com.goormthonuniv.groundedchat.planner.IntentPlan;
import com.goormthonuniv.groundedchat.retrieval.RetrievalBundle;
import com.goormthonuniv.groundedchat.support.Fixtures;
import com.goormthonuniv.groundedchat.support.ScriptedLlmClient;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerFinalizerTest {

    private final AnswerFinalizer finalizer = new AnswerFinalizer(Fixtures.lexicon(), new AssistantProperties());

    private static ValidationContext ctx(IntentPlan plan, int sources, String required, String output) {
        RetrievalBundle bundle = new RetrievalBundle(true, "q", Fixtures.results(sources), List.of(), List.of(),
                SourceDateHints.empty(), false, 0);
        return new ValidationContext(plan, bundle, required, output, 2026);
    }

    private static Generation generation(ScriptedLlmClient llm) {
        return new Generation(llm, "m", List.of(ChatMessage.user("q")), 0.3, null);
    }

    private static ValidationOutcome outcome(String text) {
        return new ValidationOutcome(text, List.of(), false, false);
    }

    @Test
    void newsAnswerShouldListOnlyCitedSourceLinks() {
        String body = "- 2026-02-18 A [2]\n- 2026-02-17 B [5]\n- [none] C [2]";

        String out = finalizer.finish(outcome(body), ctx(Fixtures.newsPlan(8, true), 6, null, "zh-Hant"),
                generation(ScriptedLlmClient.queue("unused")));

        assertThat(out).isEqualTo(body + "\n\n來源連結：\n[2] https://news2.example.com/a2\n[5] https://news5.example.com/a5");
    }

    @Test
    void newsAnswerWithoutCitationsShouldListFirstSources() {
        String out = finalizer.finish(outcome("今天沒有重大新聞。"), ctx(Fixtures.newsPlan(8, true), 12, null, "en"),
                generation(ScriptedLlmClient.queue("unused")));

        assertThat(out).contains("Sources:").contains("[10] https://news10.example.com/a10")
                .doesNotContain("[11]");
    }

    @Test
    void newsAnswerShouldBeCappedToItemLimit() {
        StringBuilder body = new StringBuilder();
        for (int i = 1; i <= 8; i++) body.append("- 2026-02-18 新聞").append(i).append(" [").append(i).append("]\n");

        String out = finalizer.finish(outcome(body.toString()), ctx(Fixtures.newsPlan(5, true), 8, null, "zh-Hant"),
                generation(ScriptedLlmClient.queue("unused")));

        assertThat(NewsBullets.bullets(out)).hasSize(5);
        assertThat(out).contains("[5] https://news5.example.com/a5").doesNotContain("news6.example.com");
    }

    @Test
    void linkRequestOnNonNewsTurnShouldAppendRawUrls() {
        String out = finalizer.finish(outcome("答案 [1]"), ctx(Fixtures.plainSearchPlan(true), 7, null, "zh-Hant"),
                generation(ScriptedLlmClient.queue("unused")));

        assertThat(out.lines().filter(l -> l.startsWith("https://")).count()).isEqualTo(5);
        assertThat(out).doesNotContain("來源連結");
    }

    @Test
    void plainAnswerShouldBeLeftAlone() {
        String out = finalizer.finish(outcome("答案 [1]"), ctx(Fixtures.plainSearchPlan(false), 3, null, "zh-Hant"),
                generation(ScriptedLlmClient.queue("unused")));

        assertThat(out).isEqualTo("答案 [1]");
    }

    @Test
    void linkListingFallbackShouldNotGetAnotherAppendix() {
        ValidationOutcome listing = new ValidationOutcome("[1] 標題1\n    https://news1.example.com/a1", List.of("stale_year"), true, true);

        String out = finalizer.finish(listing, ctx(Fixtures.newsPlan(8, true), 3, null, "zh-Hant"),
                generation(ScriptedLlmClient.queue("unused")));

        assertThat(out).isEqualTo(listing.text());
    }

    @Test
    void secondScriptPassShouldRewriteReintroducedVariant() {
        ScriptedLlmClient llm = ScriptedLlmClient.queue("這是答案");

        String out = finalizer.finish(outcome("这是答案"), ctx(Fixtures.plainSearchPlan(false), 1, "zh-Hant", "zh-Hant"),
                generation(llm));

        assertThat(out).isEqualTo("這是答案");
        assertThat(llm.requests()).hasSize(1);
    }
}
