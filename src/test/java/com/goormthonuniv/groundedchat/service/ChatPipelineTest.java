package com.goormthonuniv.groundedchat.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.ChatReply;
import com.goormthonuniv.groundedchat.dto.Degradation;
import com.goormthonuniv.groundedchat.dto.InboundMessage;
import com.goormthonuniv.groundedchat.dto.Turn;
import com.goormthonuniv.groundedchat.fetch.PageFetcher;
import com.goormthonuniv.groundedchat.llm.LlmCallException;
import com.goormthonuniv.groundedchat.llm.LlmRequest;
import com.goormthonuniv.groundedchat.memory.ChatStateRegistry;
import com.goormthonuniv.groundedchat.memory.ConversationStateManager;
import com.goormthonuniv.groundedchat.memory.JsonProfileStore;
import com.goormthonuniv.groundedchat.memory.MarkdownTurnStore;
import com.goormthonuniv.groundedchat.planner.IntentPlanner;
import com.goormthonuniv.groundedchat.prompt.PromptAssembler;
import com.goormthonuniv.groundedchat.retrieval.RetrievalOrchestrator;
import com.goormthonuniv.groundedchat.retrieval.SourceSummarizer;
import com.goormthonuniv.groundedchat.search.SearchResult;
import com.goormthonuniv.groundedchat.support.FakeSearchAdapter;
import com.goormthonuniv.groundedchat.support.Fixtures;
import com.goormthonuniv.groundedchat.support.ScriptedLlmClient;
import com.goormthonuniv.groundedchat.validate.AnswerFinalizer;
import com.goormthonuniv.groundedchat.validate.NewsBullets;
import com.goormthonuniv.groundedchat.validate.ValidationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatPipelineTest {

    @TempDir
    Path tempDir;

    private AssistantProperties props;
    private MarkdownTurnStore turns;
    private JsonProfileStore profiles;
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() {
        props = new AssistantProperties();
        turns = new MarkdownTurnStore(tempDir, "per_chat_daily", 1, Fixtures.CLOCK);
        profiles = new JsonProfileStore(tempDir, new ObjectMapper());
        fetcher = mock(PageFetcher.class);
        when(fetcher.fetchText(anyString())).thenAnswer(inv -> "頁面內容 " + inv.getArgument(0));
    }

    private ChatPipeline pipeline(ScriptedLlmClient llm, FakeSearchAdapter search) {
        ConversationStateManager state = new ConversationStateManager(turns, profiles,
                new ChatStateRegistry(Duration.ofHours(1)), llm, Fixtures.lexicon(), props, Fixtures.CLOCK);
        IntentPlanner planner = new IntentPlanner(llm, new ObjectMapper(), Fixtures.lexicon(), props, Fixtures.CLOCK);
        RetrievalOrchestrator retrieval = new RetrievalOrchestrator(search, fetcher,
                new SourceSummarizer(llm, props), Runnable::run, props, Fixtures.CLOCK);
        return new ChatPipeline(new MentionFilter(props), state, planner, retrieval, new PromptAssembler(props), llm,
                new ValidationEngine(Fixtures.lexicon(), props), new AnswerFinalizer(Fixtures.lexicon(), props),
                props, Fixtures.CLOCK);
    }

    /** 요청 종류별로 답하는 모델 */
    private static ScriptedLlmClient model(String plannerJson, Function<LlmRequest, String> main) {
        return new ScriptedLlmClient(req -> {
            String first = ScriptedLlmClient.firstSystem(req);
            if (req.responseFormat() != null) return plannerJson;
            if (first.startsWith("You are summarizing a single web source")) {
                String user = req.messages().get(1).content();
                int index = Integer.parseInt(user.replaceAll("(?s).*Source \\[(\\d+)].*", "$1"));
                return "- 2026-02-18 來源" + index + "的重點 [" + index + "]";
            }
            if (first.startsWith("You maintain a rolling summary")) return "- 聊過新聞";
            return main.apply(req);
        });
    }

    private static List<SearchResult> datedNews(int n) {
        List<SearchResult> out = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            String date = i % 2 == 1 ? "2026-02-18" : "2026-02-17";
            out.add(new SearchResult(date + " 新聞標題" + i, "https://news" + i + ".example.com/a" + i, "摘要" + i));
        }
        return out;
    }

    private static String bullets(int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i <= to; i++) {
            String date = i % 2 == 1 ? "2026-02-18" : "2026-02-17";
            sb.append("- ").append(date).append(" 新聞標題").append(i).append("：內容。[").append(i).append("]\n");
        }
        return sb.toString();
    }

    @Test
    void weatherWithoutLocationShouldAskBackWithoutRetrievalAndPersistTurn() {
        FakeSearchAdapter search = new FakeSearchAdapter(datedNews(3));
        ScriptedLlmClient llm = model("{\"tool\":\"web_search\",\"query\":\"明天 下雨\"}", req -> "unused");

        ChatReply reply = pipeline(llm, search).handle(new InboundMessage(11L, 100L, "private", "明天會下雨嗎？"));

        assertThat(reply.text()).isEqualTo("你想查哪個城市/地區的天氣？例如：台北 / 新北 / 台中 / 高雄。");
        assertThat(reply.replyToMessageId()).isEqualTo(100L);
        assertThat(search.calls()).isZero();
        assertThat(turns.recentTurns(11L, 10)).extracting(Turn::content)
                .containsExactly("明天會下雨嗎？", reply.text());
    }

    @Test
    void followUpShouldReuseCachedNewsWithoutNewSearch() {
        FakeSearchAdapter search = new FakeSearchAdapter(datedNews(8));
        ScriptedLlmClient llm = model("{\"tool\":\"web_search\",\"query\":\"台灣 新聞\"}", req -> bullets(1, 8));
        ChatPipeline pipeline = pipeline(llm, search);

        ChatReply first = pipeline.handle(new InboundMessage(21L, 1L, "private", "今天有什麼新聞"));
        ChatReply more = pipeline.handle(new InboundMessage(21L, 2L, "private", "繼續 更多5"));

        assertThat(NewsBullets.bullets(first.text())).hasSize(8);
        assertThat(first.text()).contains("來源連結：").contains("[8] https://news8.example.com/a8");
        assertThat(search.calls()).isEqualTo(1);
        assertThat(NewsBullets.bullets(more.text())).hasSizeLessThanOrEqualTo(5);
        assertThat(more.degradations()).isEmpty();
        assertThat(turns.recentTurns(21L, 10)).hasSize(4);
    }

    @Test
    void emptySearchShouldStillAnswerAndRecordDegradation() {
        FakeSearchAdapter search = new FakeSearchAdapter(List.of());
        List<String> seen = new ArrayList<>();
        ScriptedLlmClient llm = model("{\"tool\":\"web_search\",\"query\":\"冷門主題\"}", req -> {
            req.messages().forEach(m -> seen.add(m.content()));
            return "我找不到來源，不過一般來說……";
        });

        ChatReply reply = pipeline(llm, search).handle(new InboundMessage(31L, 1L, "private", "最新的冷門主題"));

        assertThat(reply.text()).startsWith("我找不到來源");
        assertThat(reply.degradations()).containsExactly(Degradation.RETRIEVAL_EMPTY);
        assertThat(seen).anyMatch(c -> c.contains("no sources were found"));
    }

    @Test
    void plannerFailureShouldDegradeToDirectAnswer() {
        FakeSearchAdapter search = new FakeSearchAdapter(datedNews(3));
        ScriptedLlmClient llm = new ScriptedLlmClient(req -> {
            if (req.responseFormat() != null) throw new LlmCallException("planner down");
            return "你好！";
        });

        ChatReply reply = pipeline(llm, search).handle(new InboundMessage(41L, 1L, "private", "你好"));

        assertThat(reply.text()).isEqualTo("你好！");
        assertThat(reply.degradations()).containsExactly(Degradation.PLANNING_DEGRADED);
        assertThat(search.calls()).isZero();
    }

    @Test
    void generationFailureShouldDeliverLinkListing() {
        FakeSearchAdapter search = new FakeSearchAdapter(datedNews(3));
        ScriptedLlmClient llm = model("{\"tool\":\"web_search\",\"query\":\"台灣 新聞\"}", req -> {
            throw new LlmCallException("main model down");
        });

        ChatReply reply = pipeline(llm, search).handle(new InboundMessage(51L, 1L, "private", "今天新聞"));

        assertThat(reply.text()).contains("https://news1.example.com/a1");
        assertThat(reply.degradations()).contains(Degradation.VALIDATION_EXHAUSTED);
        assertThat(turns.recentTurns(51L, 10)).hasSize(2);
    }

    @Test
    void groupMessageWithoutMentionShouldBeIgnoredAndNotPersisted() {
        FakeSearchAdapter search = new FakeSearchAdapter(List.of());
        ScriptedLlmClient llm = ScriptedLlmClient.queue("x");

        ChatReply reply = pipeline(llm, search).handle(new InboundMessage(61L, 1L, "group", "大家好"));

        assertThat(reply.ignored()).isTrue();
        assertThat(reply.text()).isNull();
        assertThat(llm.requests()).isEmpty();
        assertThat(turns.recentTurns(61L, 10)).isEmpty();
    }
}
