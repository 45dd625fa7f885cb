package com.goormthonuniv.groundedchat.retrieval;

import com.goormthonuniv.groundedchat.dto.FetchedPage;
import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.dto.SourceSummary;
import com.goormthonuniv.groundedchat.search.SearchResult;

import java.util.List;

/**
 * 한 턴의 검색 근거 묶음.
 *
 * @param pages 검색 결과 순서와 정렬된 수집 페이지 (상위 N개까지)
 * @param skippedSummaries 요약 호출이 실패해 빠진 출처 수
 */
public record RetrievalBundle(
        boolean attempted,
        String query,
        List<SearchResult> results,
        List<FetchedPage> pages,
        List<SourceSummary> summaries,
        SourceDateHints dateHints,
        boolean reused,
        int skippedSummaries
) {
    public RetrievalBundle {
        results = List.copyOf(results);
        pages = List.copyOf(pages);
        summaries = List.copyOf(summaries);
    }

    public static RetrievalBundle none() {
        return new RetrievalBundle(false, "", List.of(), List.of(), List.of(), SourceDateHints.empty(), false, 0);
    }

    public boolean hasResults() { return !results.isEmpty(); }

    public boolean hasPageText() { return pages.stream().anyMatch(FetchedPage::hasText); }
}
