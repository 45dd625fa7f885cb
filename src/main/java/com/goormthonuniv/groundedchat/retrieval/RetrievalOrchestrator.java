package com.goormthonuniv.groundedchat.retrieval;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.FetchedPage;
import com.goormthonuniv.groundedchat.dto.FollowUpContext;
import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.dto.SourceSummary;
import com.goormthonuniv.groundedchat.fetch.PageFetcher;
import com.goormthonuniv.groundedchat.search.SearchAdapter;
import com.goormthonuniv.groundedchat.search.SearchResult;
import com.goormthonuniv.groundedchat.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 검색 → 상위 N 페이지 동시 수집 → 출처별 동시 요약 + 날짜 힌트 추출.
 * 검색/수집/요약 실패는 빈 근거로 흡수한다 (재시도 없음).
 */
@Slf4j
@Service
public class RetrievalOrchestrator {

    private final SearchAdapter search;
    private final PageFetcher fetcher;
    private final SourceSummarizer summarizer;
    private final Executor executor;
    private final AssistantProperties props;
    private final SourceDateExtractor dates;

    public RetrievalOrchestrator(SearchAdapter search,
                                 PageFetcher fetcher,
                                 SourceSummarizer summarizer,
                                 @Qualifier("retrievalExecutor") Executor executor,
                                 AssistantProperties props,
                                 Clock clock) {
        this.search = search;
        this.fetcher = fetcher;
        this.summarizer = summarizer;
        this.executor = executor;
        this.props = props;
        this.dates = new SourceDateExtractor(clock);
    }

    public RetrievalBundle retrieve(String userText, String query, boolean news) {
        AssistantProperties.Search cfg = props.getSearch();
        String q = TextUtils.isBlank(query) ? userText : query;

        List<SearchResult> results;
        try {
            results = search.search(q, cfg.getCountry(), cfg.getLanguage(), cfg.getCount());
        } catch (Exception e) {
            log.warn("[retrieval] backend={} failed: {}", search.name(), e.getMessage());
            results = List.of();
        }
        log.info("[retrieval] backend={} query=\"{}\" hits={}", search.name(), q, results.size());
        if (results.isEmpty()) {
            return new RetrievalBundle(true, q, List.of(), List.of(), List.of(), SourceDateHints.empty(), false, 0);
        }

        List<FetchedPage> pages = fetchTop(results);
        return summarizeAndDate(userText, q, results, pages, news, false);
    }

    /** 이어보기: 캐시된 결과/페이지를 그대로 쓰고 검색/수집은 하지 않는다. */
    public RetrievalBundle reuse(FollowUpContext cached, String userText) {
        String question = TextUtils.isBlank(cached.query()) ? userText : cached.query();
        RetrievalBundle b = summarizeAndDate(question, cached.query(),
                cached.searchResults(), cached.fetchedPages(), true, true);
        SourceDateHints hints = cached.sourceDateHints() != null ? cached.sourceDateHints() : b.dateHints();
        return new RetrievalBundle(true, b.query(), b.results(), b.pages(), b.summaries(), hints, true, b.skippedSummaries());
    }

    List<FetchedPage> fetchTop(List<SearchResult> results) {
        int n = Math.min(props.getFetch().getTopN(), results.size());
        List<CompletableFuture<FetchedPage>> futures = new ArrayList<>(n);
        for (SearchResult r : results.subList(0, n)) {
            if (r.url().isBlank()) {
                futures.add(CompletableFuture.completedFuture(new FetchedPage(r.title(), r.url(), "")));
                continue;
            }
            futures.add(submit(() -> new FetchedPage(r.title(), r.url(), fetcher.fetchText(r.url())))
                    .exceptionally(e -> new FetchedPage(r.title(), r.url(), "")));
        }
        List<FetchedPage> pages = futures.stream().map(CompletableFuture::join).toList();
        if (log.isDebugEnabled()) {
            log.debug("[retrieval] fetched={} sizes={}", pages.size(),
                    pages.stream().map(p -> TextUtils.safe(p.text()).length()).toList());
        }
        return pages;
    }

    /** 풀이 가득 차 거절되면 실패한 future 로 돌려 호출 측의 exceptionally 로 떨어지게 한다. */
    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.warn("[retrieval] executor rejected task: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    private RetrievalBundle summarizeAndDate(String userText, String query, List<SearchResult> results,
                                             List<FetchedPage> pages, boolean news, boolean reused) {
        List<CompletableFuture<SourceSummary>> futures = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            FetchedPage p = pages.get(i);
            if (!p.hasText()) continue;
            int index = i + 1;
            String domain = TextUtils.domainOf(p.url());
            futures.add(submit(() -> {
                        String s = summarizer.summarize(userText, index, p.title(), domain, p.text(), news);
                        return s == null || s.isBlank() ? null : new SourceSummary(index, p.title(), domain, s.strip());
                    })
                    .exceptionally(e -> {
                        log.warn("[retrieval] summary skipped source={}: {}", index, e.getMessage());
                        return null;
                    }));
        }

        List<SourceSummary> summaries = new ArrayList<>();
        int skipped = 0;
        for (CompletableFuture<SourceSummary> f : futures) {
            SourceSummary s = f.join();
            if (s == null) skipped++;
            else summaries.add(s);
        }

        SourceDateHints hints = dates.extract(results, pages);
        return new RetrievalBundle(true, query, results, pages, summaries, hints, reused, skipped);
    }
}
