package com.goormthonuniv.groundedchat.memory;

import com.goormthonuniv.groundedchat.dto.Turn;

import java.util.List;

/** 추가 전용 턴 저장소. 실패 시 PersistenceException. */
public interface TurnStore {
    void append(long chatId, Turn turn);

    /** 가장 최근 limit 개를 도착 순서대로 */
    List<Turn> recentTurns(long chatId, int limit);
}
