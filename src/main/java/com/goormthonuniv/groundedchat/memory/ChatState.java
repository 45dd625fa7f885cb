package com.goormthonuniv.groundedchat.memory;

import com.goormthonuniv.groundedchat.dto.FollowUpContext;
import com.goormthonuniv.groundedchat.dto.Turn;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 채팅 하나의 메모리 상태. lock 을 쥔 작업만 window/followUp 을 바꾼다.
 */
public class ChatState {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Turn> window = new ArrayList<>();
    /** 요약으로 접힌 뒤 남은 꼬리의 첫 턴. 저장소에서 다시 읽을 때 이 앞은 버린다. */
    private Turn retainedAnchor;
    private FollowUpContext followUp;
    /** lock 을 쥐었거나 기다리는 작업 수. 레지스트리의 compute 안에서만 바뀐다. */
    private volatile int pins;

    public ReentrantLock lock() { return lock; }

    boolean pinned() { return pins > 0; }

    void pin() { pins++; }

    void unpin() { pins = Math.max(0, pins - 1); }

    public List<Turn> window() { return List.copyOf(window); }

    public FollowUpContext followUp() { return followUp; }

    void followUp(FollowUpContext ctx) { this.followUp = ctx; }

    /** 저장소에서 다시 읽은 목록으로 윈도우를 교체 (이미 접힌 턴 제외) */
    void reload(List<Turn> persisted) {
        window.clear();
        int start = 0;
        if (retainedAnchor != null) {
            int idx = persisted.lastIndexOf(retainedAnchor);
            if (idx >= 0) start = idx;
        }
        window.addAll(persisted.subList(start, persisted.size()));
    }

    void add(Turn turn) { window.add(turn); }

    int size() { return window.size(); }

    /** 앞쪽 턴들을 떼어내고 마지막 keep 개만 남긴다. 떼어낸 턴을 돌려준다. */
    List<Turn> shrinkTo(int keep) {
        int cut = Math.max(0, window.size() - keep);
        List<Turn> folded = new ArrayList<>(window.subList(0, cut));
        window.subList(0, cut).clear();
        retainedAnchor = window.isEmpty() ? null : window.get(0);
        return folded;
    }
}
