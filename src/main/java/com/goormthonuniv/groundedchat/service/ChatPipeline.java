package com.goormthonuniv.groundedchat.service;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.ChatReply;
import com.goormthonuniv.groundedchat.dto.Degradation;
import com.goormthonuniv.groundedchat.dto.FollowUpContext;
import com.goormthonuniv.groundedchat.dto.InboundMessage;
import com.goormthonuniv.groundedchat.dto.PlanDecision;
import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.dto.Turn;
import com.goormthonuniv.groundedchat.llm.ChatMessage;
import com.goormthonuniv.groundedchat.llm.LlmClient;
import com.goormthonuniv.groundedchat.memory.ConversationStateManager;
import com.goormthonuniv.groundedchat.planner.IntentPlan;
import com.goormthonuniv.groundedchat.planner.IntentPlanner;
import com.goormthonuniv.groundedchat.prompt.PromptAssembler;
import com.goormthonuniv.groundedchat.retrieval.RetrievalBundle;
import com.goormthonuniv.groundedchat.retrieval.RetrievalOrchestrator;
import com.goormthonuniv.groundedchat.validate.AnswerFinalizer;
import com.goormthonuniv.groundedchat.validate.FallbackAnswers;
import com.goormthonuniv.groundedchat.validate.Generation;
import com.goormthonuniv.groundedchat.validate.ValidationContext;
import com.goormthonuniv.groundedchat.validate.ValidationEngine;
import com.goormthonuniv.groundedchat.validate.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 메시지 한 건 처리:
 * 멘션 필터 → 채팅 lock → 윈도우 로드 → 플래닝 → 프로필 병합 → (되묻기) → 검색 → 프롬프트 →
 * 생성 → 검증/재시도 → 마무리 → 저장/요약 접기/이어보기 캐시
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatPipeline {

    private final MentionFilter mentionFilter;
    private final ConversationStateManager state;
    private final IntentPlanner planner;
    private final RetrievalOrchestrator retrieval;
    private final PromptAssembler assembler;
    private final LlmClient llm;
    private final ValidationEngine validator;
    private final AnswerFinalizer finalizer;
    private final AssistantProperties props;
    private final Clock clock;

    /** 메인 엔트리 */
    public ChatReply handle(InboundMessage msg) {
        String text = mentionFilter.accept(msg).orElse(null);
        if (text == null) {
            log.debug("[pipeline] chat={} message ignored (type={})", msg.chatId(), msg.chatType());
            return ChatReply.ignored(msg);
        }
        long chatId = msg.chatId();
        return state.withChatLock(chatId, () -> runTurn(chatId, msg.messageId(), text));
    }

    ChatReply runTurn(long chatId, Long messageId, String userText) {
        Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);

        // 1) 사용자 턴 기록 + 윈도우
        state.beginTurn(chatId, userText);
        Profile profile = state.profile(chatId);
        FollowUpContext followUp = state.followUp(chatId);

        // 2) 플래닝
        IntentPlan plan = planner.plan(userText, profile, followUp);
        if (plan.degraded()) degradations.add(Degradation.PLANNING_DEGRADED);
        log.info("[pipeline] chat={} tool={} query=\"{}\" reuse={} news={} weather={}",
                chatId, plan.decision().tool(), plan.decision().query(), plan.reuse(), plan.news(), plan.weather());

        // 3) 프로필 추론/병합
        String explicitLocation = plan.weather() ? planner.locations().fromText(userText).orElse(null) : null;
        profile = state.inferAndMerge(chatId, userText, explicitLocation);
        String language = outputLanguage(profile);

        // 4) 날씨 지역 되묻기
        if (plan.needsClarification()) {
            String reply = CannedReplies.weatherClarification(language);
            state.completeTurn(chatId, reply);
            return new ChatReply(chatId, messageId, false, reply, degradations);
        }

        // 5) 검색
        RetrievalBundle bundle = RetrievalBundle.none();
        if (plan.webSearch()) {
            bundle = plan.reuse()
                    ? retrieval.reuse(followUp, userText)
                    : retrieval.retrieve(userText, plan.decision().query(), plan.news());
            if (!bundle.hasResults()) degradations.add(Degradation.RETRIEVAL_EMPTY);
            if (bundle.skippedSummaries() > 0) degradations.add(Degradation.SUMMARIZATION_SKIPPED);
        }

        // 6) 생성 + 검증
        List<Turn> window = state.window(chatId);
        List<ChatMessage> messages = assembler.assemble(plan, bundle, profile, window);
        Integer maxTokens = plan.webSearch() && plan.news() ? props.getModel().getNewsMaxTokens() : null;
        Generation generation = new Generation(llm, props.getModel().getChat(), messages,
                props.getModel().getTemperature(), maxTokens);
        ValidationContext ctx = new ValidationContext(plan, bundle, profile.preferredLanguage(), language,
                LocalDate.now(clock).getYear());

        String reply;
        String draft = null;
        try {
            draft = generation.generate();
        } catch (RuntimeException e) {
            log.warn("[pipeline] chat={} generation failed: {}", chatId, e.getMessage());
        }
        if (draft == null || draft.isBlank()) {
            degradations.add(Degradation.VALIDATION_EXHAUSTED);
            reply = FallbackAnswers.linkListing(ctx, props.getNews().getAppendixDefaultLinks())
                    .orElseGet(() -> CannedReplies.apology(language));
        } else {
            ValidationOutcome outcome = validator.validate(draft, ctx, generation);
            if (outcome.exhausted()) degradations.add(Degradation.VALIDATION_EXHAUSTED);
            if (!outcome.corrected().isEmpty()) {
                log.info("[pipeline] chat={} corrected by {}", chatId, outcome.corrected());
            }
            reply = finalizer.finish(outcome, ctx, generation);
        }

        // 7) 저장 + 이어보기 캐시
        state.completeTurn(chatId, reply);
        if (plan.webSearch()) {
            state.rememberFollowUp(chatId, new FollowUpContext(
                    PlanDecision.Tool.WEB_SEARCH, plan.news(), bundle.query(),
                    bundle.results(), bundle.pages(), bundle.dateHints(), clock.instant()));
        }
        if (!degradations.isEmpty()) {
            log.warn("[pipeline] chat={} degradations={}", chatId, degradations);
        }
        return new ChatReply(chatId, messageId, false, reply, degradations);
    }

    private String outputLanguage(Profile profile) {
        return profile.preferredLanguage() != null ? profile.preferredLanguage() : props.getDefaultLanguage();
    }
}
