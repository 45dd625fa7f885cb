package com.goormthonuniv.groundedchat.memory;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.FollowUpContext;
import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.dto.Turn;
import com.goormthonuniv.groundedchat.llm.LlmClient;
import com.goormthonuniv.groundedchat.planner.HeuristicLexicon;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * 채팅별 대화 상태 관리.
 * 저장소가 원본이고 메모리 윈도우는 매 턴 다시 읽는 캐시다.
 * 윈도우가 recentTurns*2 에 닿으면 꼬리만 남기고 앞부분을 요약으로 접는다.
 */
@Slf4j
@Service
public class ConversationStateManager {

    private final TurnStore turns;
    private final ProfileStore profiles;
    private final ChatStateRegistry registry;
    private final ConversationCompactor compactor;
    private final ProfileInference inference;
    private final AssistantProperties props;
    private final Clock clock;

    public ConversationStateManager(TurnStore turns, ProfileStore profiles, ChatStateRegistry registry,
                                    LlmClient llm, HeuristicLexicon lexicon,
                                    AssistantProperties props, Clock clock) {
        this.turns = turns;
        this.profiles = profiles;
        this.registry = registry;
        this.compactor = new ConversationCompactor(llm, props);
        this.inference = new ProfileInference(lexicon);
        this.props = props;
        this.clock = clock;
    }

    /**
     * 채팅 lock 을 쥔 채로 한 턴 전체를 실행한다. 같은 채팅의 메시지는 직렬화된다.
     * 대기 중에도 상태가 고정되므로 그 사이 registry.get 은 같은 인스턴스를 돌려준다.
     */
    public <T> T withChatLock(long chatId, Supplier<T> work) {
        ChatState state = registry.acquire(chatId);
        try {
            state.lock().lock();
            try {
                return work.get();
            } finally {
                state.lock().unlock();
            }
        } finally {
            registry.release(chatId, state);
        }
    }

    /** 사용자 턴 기록 후 저장소에서 윈도우를 다시 읽는다. 현재 사용자 턴이 포함된 윈도우를 돌려준다. */
    public List<Turn> beginTurn(long chatId, String userText) {
        ChatState state = registry.get(chatId);
        turns.append(chatId, Turn.user(userText, clock.instant()));
        state.reload(turns.recentTurns(chatId, capacity()));
        return state.window();
    }

    public Profile profile(long chatId) {
        return profiles.get(chatId);
    }

    /** 사용자 문장에서 선호를 추론해 병합한다. 바뀐 것이 없으면 쓰지 않는다. */
    public Profile inferAndMerge(long chatId, String userText, String explicitLocation) {
        Profile current = profiles.get(chatId);
        Profile updates = inference.infer(userText, explicitLocation);
        if (updates.isEmpty() || current.mergedWith(updates).equals(current)) return current;
        log.info("[memory] chat={} profile updates={}", chatId, updates);
        return profiles.merge(chatId, updates);
    }

    public void clearProfile(long chatId) {
        profiles.clear(chatId);
    }

    /** 어시스턴트 턴 기록, 필요하면 요약 접기. */
    public void completeTurn(long chatId, String assistantText) {
        ChatState state = registry.get(chatId);
        Turn turn = Turn.assistant(assistantText, clock.instant());
        turns.append(chatId, turn);
        state.add(turn);
        if (state.size() >= capacity()) {
            compact(chatId, state);
        }
    }

    public void rememberFollowUp(long chatId, FollowUpContext ctx) {
        registry.get(chatId).followUp(ctx);
    }

    public FollowUpContext followUp(long chatId) {
        return registry.get(chatId).followUp();
    }

    public List<Turn> window(long chatId) {
        return registry.get(chatId).window();
    }

    private void compact(long chatId, ChatState state) {
        int keep = Math.max(0, Math.min(props.getSummary().getKeepTurns(), capacity() - 1));
        List<Turn> folded = state.shrinkTo(keep);
        if (folded.isEmpty()) return;

        Profile profile = profiles.get(chatId);
        String language = profile.preferredLanguage() != null ? profile.preferredLanguage() : props.getDefaultLanguage();
        String summary;
        try {
            summary = compactor.fold(profile.conversationSummary(), folded, language);
        } catch (RuntimeException e) {
            // 요약 실패 시 기존 요약 유지, 윈도우 축소는 그대로
            log.warn("[memory] chat={} summary failed, previous summary kept: {}", chatId, e.getMessage());
            return;
        }
        if (!summary.isBlank()) {
            profiles.merge(chatId, Profile.empty().withConversationSummary(summary));
        }
        log.info("[memory] chat={} folded={} kept={}", chatId, folded.size(), keep);
    }

    private int capacity() {
        return Math.max(2, props.getMemory().getRecentTurns() * 2);
    }
}
