package com.goormthonuniv.groundedchat.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.FollowUpContext;
import com.goormthonuniv.groundedchat.dto.PlanDecision;
import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.llm.LlmCallException;
import com.goormthonuniv.groundedchat.support.Fixtures;
import com.goormthonuniv.groundedchat.support.ScriptedLlmClient;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntentPlannerTest {

    private final AssistantProperties props = new AssistantProperties();

    private IntentPlanner planner(ScriptedLlmClient llm) {
        return new IntentPlanner(llm, new ObjectMapper(), Fixtures.lexicon(), props, Fixtures.CLOCK);
    }

    private static FollowUpContext newsContext() {
        return new FollowUpContext(PlanDecision.Tool.WEB_SEARCH, true, "台灣 新聞",
                Fixtures.results(8), List.of(), SourceDateHints.empty(), Fixtures.CLOCK.instant());
    }

    @Test
    void planShouldUseModelDecisionWithStructuredOutput() {
        ScriptedLlmClient llm = ScriptedLlmClient.queue("{\"tool\":\"web_search\",\"query\":\"台積電 股價\"}");

        IntentPlan plan = planner(llm).plan("台積電股價多少", Profile.empty(), null);

        assertThat(plan.decision()).isEqualTo(new PlanDecision(PlanDecision.Tool.WEB_SEARCH, "台積電 股價"));
        assertThat(plan.news()).isTrue();
        assertThat(plan.itemLimit()).isEqualTo(8);
        assertThat(plan.degraded()).isFalse();
        assertThat(llm.requests().get(0).responseFormat()).containsEntry("type", "json_schema");
    }

    @Test
    void planShouldDegradeToNoneOnMalformedOrFailedCall() {
        IntentPlan malformed = planner(ScriptedLlmClient.queue("not json")).plan("講個笑話", Profile.empty(), null);
        IntentPlan failed = planner(new ScriptedLlmClient(r -> { throw new LlmCallException("timeout"); }))
                .plan("講個笑話", Profile.empty(), null);

        assertThat(malformed.decision()).isEqualTo(PlanDecision.none());
        assertThat(malformed.degraded()).isTrue();
        assertThat(failed.decision()).isEqualTo(PlanDecision.none());
        assertThat(failed.degraded()).isTrue();
    }

    @Test
    void planShouldForceSearchForKeywordsAndBuildWeatherQuery() {
        ScriptedLlmClient llm = ScriptedLlmClient.queue("{\"tool\":\"none\",\"query\":\"\"}");

        IntentPlan plan = planner(llm).plan("台北市今天天氣如何？", Profile.empty(), null);

        assertThat(plan.webSearch()).isTrue();
        assertThat(plan.weather()).isTrue();
        assertThat(plan.needsClarification()).isFalse();
        assertThat(plan.decision().query()).startsWith("台北 今天 天氣預報");
        assertThat(plan.recencySensitive()).isTrue();
    }

    @Test
    void planShouldAskForLocationWhenWeatherHasNoLocation() {
        ScriptedLlmClient llm = ScriptedLlmClient.queue("{\"tool\":\"web_search\",\"query\":\"天氣\"}");

        IntentPlan plan = planner(llm).plan("明天會下雨嗎？", Profile.empty(), null);
        IntentPlan withDefault = planner(llm).plan("明天會下雨嗎？", Profile.empty().withDefaultWeatherLocation("高雄"), null);

        assertThat(plan.needsClarification()).isTrue();
        assertThat(withDefault.needsClarification()).isFalse();
        assertThat(withDefault.weatherLocation()).isEqualTo("高雄");
    }

    @Test
    void planShouldReuseCachedNewsForFollowUpWithoutCallingModel() {
        ScriptedLlmClient llm = ScriptedLlmClient.queue("{\"tool\":\"none\",\"query\":\"\"}");

        IntentPlan plan = planner(llm).plan("繼續 更多5", Profile.empty(), newsContext());
        IntentPlan capped = planner(llm).plan("更多20", Profile.empty(), newsContext());
        IntentPlan byDefault = planner(llm).plan("繼續", Profile.empty(), newsContext());

        assertThat(plan.reuse()).isTrue();
        assertThat(plan.webSearch()).isTrue();
        assertThat(plan.decision().query()).isEmpty();
        assertThat(plan.itemLimit()).isEqualTo(5);
        assertThat(capped.itemLimit()).isEqualTo(8);
        assertThat(byDefault.itemLimit()).isEqualTo(5);
        assertThat(llm.requests()).isEmpty();
    }

    @Test
    void planShouldNotReuseWhenPreviousTurnWasNotNews() {
        ScriptedLlmClient llm = ScriptedLlmClient.queue("{\"tool\":\"none\",\"query\":\"\"}");
        FollowUpContext weather = new FollowUpContext(PlanDecision.Tool.WEB_SEARCH, false, "台北 天氣",
                Fixtures.results(3), List.of(), SourceDateHints.empty(), Fixtures.CLOCK.instant());

        IntentPlan plan = planner(llm).plan("繼續", Profile.empty(), weather);

        assertThat(plan.reuse()).isFalse();
        assertThat(llm.requests()).hasSize(1);
    }

    @Test
    void planShouldTreatExplicitOldYearAsNotRecent() {
        ScriptedLlmClient llm = ScriptedLlmClient.queue("{\"tool\":\"web_search\",\"query\":\"2023 金融 新聞\"}");

        IntentPlan old = planner(llm).plan("2023年的金融新聞", Profile.empty(), null);
        IntentPlan recent = planner(llm).plan("最新金融新聞", Profile.empty(), null);

        assertThat(old.news()).isTrue();
        assertThat(old.recentNews()).isFalse();
        assertThat(recent.recentNews()).isTrue();
    }

    @Test
    void englishSmallTalkShouldNotBeTreatedAsNewsOrLinkRequest() {
        ScriptedLlmClient llm = ScriptedLlmClient.queue("{\"tool\":\"none\",\"query\":\"\"}");
        IntentPlanner planner = planner(llm);

        IntentPlan know = planner.plan("Do you know a good pasta recipe?", Profile.empty(), null);
        IntentPlan resources = planner.plan("Any good resources for learning Java?", Profile.empty(), null);
        IntentPlan supermarket = planner.plan("Where is the nearest supermarket?", Profile.empty(), null);

        assertThat(know.webSearch()).isFalse();
        assertThat(resources.wantsLinks()).isFalse();
        assertThat(supermarket.news()).isFalse();
        assertThat(supermarket.recentNews()).isFalse();
        assertThat(supermarket.webSearch()).isFalse();
    }
}
