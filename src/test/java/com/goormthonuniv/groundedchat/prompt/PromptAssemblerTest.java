package com.goormthonuniv.groundedchat.prompt;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.FetchedPage;
import com.goormthonuniv.groundedchat.dto.PlanDecision;
import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.dto.SourceSummary;
import com.goormthonuniv.groundedchat.dto.Turn;
import com.goormthonuniv.groundedchat.llm.ChatMessage;
import com.goormthonuniv.groundedchat.planner.IntentPlan;
import com.goormthonuniv.groundedchat.retrieval.RetrievalBundle;
import com.goormthonuniv.groundedchat.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PromptAssemblerTest {

    private final PromptAssembler assembler = new PromptAssembler(new AssistantProperties());

    private static List<Turn> history(int pairs) {
        List<Turn> out = new ArrayList<>();
        Instant t = Fixtures.CLOCK.instant();
        for (int i = 0; i < pairs; i++) {
            out.add(Turn.user("問" + i, t));
            out.add(Turn.assistant("答" + i, t));
        }
        out.add(Turn.user("最新新聞", t));
        return out;
    }

    private static RetrievalBundle bundle(List<SourceSummary> summaries, List<FetchedPage> pages) {
        SourceDateHints hints = new SourceDateHints(Map.of(1, "2026-02-18", 2, "[none]"), Set.of("2026-02-18", "[none]"));
        return new RetrievalBundle(true, "新聞", Fixtures.results(2), pages, summaries, hints, false, 0);
    }

    @Test
    void assembleShouldOrderDirectivesAndNarrowHistoryForRecentNews() {
        Profile profile = new Profile("zh-Hant", null, true, "之前聊過颱風");
        RetrievalBundle bundle = bundle(
                List.of(new SourceSummary(1, "標題1", "news1.example.com", "- 2026-02-18 重點 [1]")),
                List.of(new FetchedPage("標題1", "https://news1.example.com/a1", "全文")));

        List<ChatMessage> messages = assembler.assemble(Fixtures.newsPlan(5, true), bundle, profile, history(4));

        List<String> system = messages.stream().filter(m -> m.role().equals("system")).map(ChatMessage::content).toList();
        assertThat(system.get(0)).isEqualTo(PromptAssembler.PERSONA);
        assertThat(system.get(1)).contains("Traditional Chinese");
        assertThat(system.get(2)).contains("[n] citation");
        assertThat(system.get(3)).contains("之前聊過颱風");
        assertThat(system.get(4)).startsWith("Web search results are provided").contains("Date: 2026-02-18")
                .doesNotContain("https://");
        assertThat(system.get(5)).contains("List 2 distinct news items").contains("Use ONLY these dates");
        assertThat(system.get(6)).startsWith("Per-source summaries").doesNotContain("全文");
        assertThat(system).hasSize(7);

        List<ChatMessage> rest = messages.subList(7, messages.size());
        assertThat(rest).extracting(ChatMessage::role).containsOnly("user");
        assertThat(rest).extracting(ChatMessage::content).containsExactly("問2", "問3", "最新新聞");
    }

    @Test
    void assembleShouldFallBackToFetchedTextThenSnippets() {
        IntentPlan plan = Fixtures.plainSearchPlan(false);
        List<ChatMessage> withPages = assembler.assemble(plan,
                bundle(List.of(), List.of(new FetchedPage("標題1", "https://news1.example.com/a1", "全文內容"))),
                Profile.empty(), history(0));
        List<ChatMessage> snippetsOnly = assembler.assemble(plan, bundle(List.of(), List.of()), Profile.empty(), history(0));

        assertThat(withPages).extracting(ChatMessage::content).anyMatch(c -> c.startsWith("Fetched page contents") && c.contains("全文內容"));
        assertThat(snippetsOnly).extracting(ChatMessage::content).anyMatch(c -> c.startsWith("Only search snippets") && c.contains("[2] 摘要2"));
    }

    @Test
    void assembleShouldSayNoSourcesWhenSearchCameBackEmpty() {
        RetrievalBundle empty = new RetrievalBundle(true, "q", List.of(), List.of(), List.of(), SourceDateHints.empty(), false, 0);

        List<ChatMessage> messages = assembler.assemble(Fixtures.plainSearchPlan(false), empty, Profile.empty(), history(1));

        assertThat(messages.get(1).content()).contains("no sources were found");
        assertThat(messages).extracting(ChatMessage::role).containsExactly("system", "system", "user", "assistant", "user");
    }

    @Test
    void assembleShouldAddWeatherDirectiveAndFollowUpNote() {
        IntentPlan weather = new IntentPlan(new PlanDecision(PlanDecision.Tool.WEB_SEARCH, "台北 天氣"),
                false, 0, true, "台北", false, false, false, false, false);
        IntentPlan more = new IntentPlan(new PlanDecision(PlanDecision.Tool.WEB_SEARCH, ""),
                true, 5, false, null, false, true, true, false, false);

        List<ChatMessage> w = assembler.assemble(weather, bundle(List.of(), List.of()), Profile.empty(), history(0));
        List<ChatMessage> m = assembler.assemble(more, bundle(List.of(), List.of()), Profile.empty(), history(0));

        assertThat(w).extracting(ChatMessage::content).anyMatch(c -> c.contains("weather question for 台北") && c.contains("降雨機率"));
        assertThat(m).extracting(ChatMessage::content).anyMatch(c -> c.contains("not covered in earlier answers"));
    }
}
