package com.goormthonuniv.groundedchat.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.goormthonuniv.groundedchat.config.AssistantProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 채팅 id → ChatState 아레나. 오래 쓰지 않은 채팅은 만료된다 (영속 데이터는 저장소에 남음).
 * acquire ~ release 사이의 상태는 가중치 0 + 만료 없음으로 고정되어 크기/시간 축출 대상이 아니다.
 */
@Component
public class ChatStateRegistry {

    static final long DEFAULT_MAX_CHATS = 10_000;

    private final Cache<Long, ChatState> states;

    @Autowired
    public ChatStateRegistry(AssistantProperties props) {
        this(props.getMemory().getStateIdleTtl());
    }

    public ChatStateRegistry(Duration idleTtl) {
        this(idleTtl, DEFAULT_MAX_CHATS);
    }

    ChatStateRegistry(Duration idleTtl, long maxChats) {
        long ttl = idleTtl.toNanos();
        this.states = Caffeine.newBuilder()
                .maximumWeight(maxChats)
                .weigher((Long id, ChatState s) -> s.pinned() ? 0 : 1)
                .expireAfter(new Expiry<Long, ChatState>() {
                    @Override
                    public long expireAfterCreate(Long id, ChatState s, long now) {
                        return s.pinned() ? Long.MAX_VALUE : ttl;
                    }

                    @Override
                    public long expireAfterUpdate(Long id, ChatState s, long now, long current) {
                        return s.pinned() ? Long.MAX_VALUE : ttl;
                    }

                    @Override
                    public long expireAfterRead(Long id, ChatState s, long now, long current) {
                        return s.pinned() ? Long.MAX_VALUE : ttl;
                    }
                })
                .build();
    }

    public ChatState get(long chatId) {
        return states.get(chatId, id -> new ChatState());
    }

    /** 상태를 고정해 돌려준다. 반드시 release 와 짝을 맞춘다. */
    ChatState acquire(long chatId) {
        return states.asMap().compute(chatId, (id, s) -> {
            ChatState state = s == null ? new ChatState() : s;
            state.pin();
            return state;
        });
    }

    void release(long chatId, ChatState state) {
        states.asMap().computeIfPresent(chatId, (id, s) -> {
            if (s == state) s.unpin();
            return s;
        });
    }

    void cleanUp() {
        states.cleanUp();
    }
}
