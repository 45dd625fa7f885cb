package com.goormthonuniv.groundedchat.dto;

import com.goormthonuniv.groundedchat.search.SearchResult;

import java.time.Instant;
import java.util.List;

/** 직전 웹검색 턴의 검색 맥락. 채팅당 한 슬롯, 웹검색 턴마다 덮어쓴다. */
public record FollowUpContext(
        PlanDecision.Tool tool,
        boolean news,
        String query,
        List<SearchResult> searchResults,
        List<FetchedPage> fetchedPages,
        SourceDateHints sourceDateHints,
        Instant timestamp
) {
    public boolean reusableForNews() {
        return tool == PlanDecision.Tool.WEB_SEARCH && news;
    }
}
