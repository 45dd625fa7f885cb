package com.goormthonuniv.groundedchat.planner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.FollowUpContext;
import com.goormthonuniv.groundedchat.dto.PlanDecision;
import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.llm.ChatMessage;
import com.goormthonuniv.groundedchat.llm.LlmClient;
import com.goormthonuniv.groundedchat.llm.LlmRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 검색 필요 여부/검색어 결정.
 * 모델의 {tool, query} 구조화 출력 뒤에 결정론적 보정을 순서대로 적용한다:
 * 이어보기 재사용 → 강제 검색 → 날씨 지역 확인.
 */
@Slf4j
@Component
public class IntentPlanner {

    private static final Pattern YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");

    private final LlmClient llm;
    private final ObjectMapper om;
    private final HeuristicLexicon lexicon;
    private final AssistantProperties props;
    private final Clock clock;
    private final FollowUpDetector followUps;
    private final WeatherLocationResolver locations;

    public IntentPlanner(LlmClient llm, ObjectMapper om, HeuristicLexicon lexicon,
                         AssistantProperties props, Clock clock) {
        this.llm = llm;
        this.om = om;
        this.lexicon = lexicon;
        this.props = props;
        this.clock = clock;
        this.followUps = new FollowUpDetector(lexicon);
        this.locations = new WeatherLocationResolver(lexicon);
    }

    public WeatherLocationResolver locations() { return locations; }

    public IntentPlan plan(String userText, Profile profile, FollowUpContext followUp) {
        // 1) 이어보기: 직전 뉴스 검색 결과 재사용 (모델 호출 불필요)
        OptionalInt more = followUps.match(userText);
        if (more.isPresent() && followUp != null && followUp.reusableForNews()) {
            int requested = more.getAsInt() > 0 ? more.getAsInt() : props.getNews().getFollowupDefaultCount();
            int limit = Math.min(requested, props.getNews().getMaxItems());
            log.debug("[planner] follow-up reuse requested={} limit={}", requested, limit);
            return new IntentPlan(
                    new PlanDecision(PlanDecision.Tool.WEB_SEARCH, ""),
                    true, limit, false, null, false, true, true, lexicon.wantsLinks(userText), false);
        }

        boolean degraded = false;
        PlanDecision decision;
        try {
            decision = askModel(userText, profile);
        } catch (Exception e) {
            log.warn("[planner] degraded to tool=none: {}", e.getMessage());
            decision = PlanDecision.none();
            degraded = true;
        }

        // 2) 강제 검색 키워드
        if (!decision.isWebSearch() && lexicon.forcesSearch(userText)) {
            decision = new PlanDecision(PlanDecision.Tool.WEB_SEARCH, decision.query());
        }

        // 3) 날씨: 지역 확인, 없으면 되묻기
        boolean weather = lexicon.isWeatherQuestion(userText);
        String location = null;
        boolean clarify = false;
        if (weather) {
            location = locations.resolve(userText, profile).orElse(null);
            if (location == null) {
                clarify = true;
            } else if (decision.isWebSearch() && decision.query().isBlank()) {
                String q = lexicon.weatherQueryTemplate().replace("{location}", locations.normalize(location));
                decision = new PlanDecision(PlanDecision.Tool.WEB_SEARCH, q);
            }
        }

        boolean news = lexicon.isNews(userText) || lexicon.isMarket(userText);
        boolean recentNews = news && !mentionsPastYear(userText);
        int itemLimit = news ? props.getNews().getMaxItems() : 0;

        return new IntentPlan(decision, false, itemLimit, weather, location, clarify,
                news, recentNews, lexicon.wantsLinks(userText), degraded);
    }

    PlanDecision askModel(String userText, Profile profile) throws Exception {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(Prompt.SYSTEM));
        if (profile != null && profile.conversationSummary() != null && !profile.conversationSummary().isBlank()) {
            messages.add(ChatMessage.system("Conversation summary so far (context only):\n" + profile.conversationSummary()));
        }
        messages.add(ChatMessage.user(userText));

        String content = llm.complete(new LlmRequest(
                props.getModel().plannerOrChat(), messages, 0.0, null, Prompt.RESPONSE_FORMAT));

        PlannerOutput out = om.readValue(stripFences(content), PlannerOutput.class);
        String tool = out.tool == null ? "" : out.tool.strip().toLowerCase(Locale.ROOT);
        String query = out.query == null ? "" : out.query.strip();
        if ("web_search".equals(tool)) return new PlanDecision(PlanDecision.Tool.WEB_SEARCH, query);
        if ("none".equals(tool)) return new PlanDecision(PlanDecision.Tool.NONE, query);
        throw new IllegalArgumentException("unknown tool: " + out.tool);
    }

    /** 사용자가 (작년 이전) 연도를 직접 지정했으면 최신 뉴스로 보지 않는다. */
    boolean mentionsPastYear(String text) {
        int threshold = LocalDate.now(clock).getYear() - 1;
        Matcher m = YEAR.matcher(text == null ? "" : text);
        while (m.find()) {
            if (Integer.parseInt(m.group(1)) < threshold) return true;
        }
        return false;
    }

    private static String stripFences(String s) {
        String t = s == null ? "" : s.strip();
        if (t.startsWith("```")) {
            t = t.replaceFirst("^```(?:json)?\\s*", "");
            if (t.endsWith("```")) t = t.substring(0, t.length() - 3);
        }
        return t.strip();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlannerOutput {
        public String tool;
        public String query;
    }

    static class Prompt {
        static final String SYSTEM = """
        You are the tool planner of a chat assistant. Decide whether answering the user's message
        needs an up-to-date web search.
        - Use "web_search" for news, weather, prices, schedules, recent events or anything time-sensitive.
        - Use "none" for chit-chat, opinions, writing help or stable general knowledge.
        - When searching, "query" is a concise search query in the user's language.
        Reply with JSON only: {"tool": "web_search" | "none", "query": "..."}
        """;

        static final Map<String, Object> RESPONSE_FORMAT = Map.of(
                "type", "json_schema",
                "json_schema", Map.of(
                        "name", "tool_plan",
                        "schema", Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "tool", Map.of("type", "string", "enum", List.of("web_search", "none")),
                                        "query", Map.of("type", "string")),
                                "required", List.of("tool", "query"),
                                "additionalProperties", false)));
    }
}
