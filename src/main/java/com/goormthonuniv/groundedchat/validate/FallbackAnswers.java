package com.goormthonuniv.groundedchat.validate;

import com.goormthonuniv.groundedchat.dto.SourceSummary;
import com.goormthonuniv.groundedchat.prompt.LanguageDirectives;
import com.goormthonuniv.groundedchat.search.SearchResult;
import com.goormthonuniv.groundedchat.util.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 모델 호출 없이 검색 근거만으로 만드는 답.
 */
public final class FallbackAnswers {

    static final int MIN_DISTINCT = 2;

    private FallbackAnswers() {}

    /** 검색 결과 링크 목록 */
    public static Optional<String> linkListing(ValidationContext ctx, int max) {
        List<SearchResult> results = ctx.bundle().results();
        StringBuilder sb = new StringBuilder(listingHeading(ctx.outputLanguage())).append('\n');
        int added = 0;
        for (int i = 0; i < results.size() && added < max; i++) {
            SearchResult r = results.get(i);
            if (r.url().isBlank()) continue;
            String title = r.title().isBlank() ? TextUtils.domainOf(r.url()) : r.title();
            sb.append('[').append(i + 1).append("] ").append(title).append('\n')
                    .append("    ").append(r.url()).append('\n');
            added++;
        }
        return added == 0 ? Optional.empty() : Optional.of(sb.toString().strip());
    }

    /**
     * 출처별 한 줄: 요약의 첫 bullet (없으면 검색 제목/설명) + 날짜 힌트 + 해당 인용 번호.
     * 제목이 거의 같은 출처는 건너뛰되, 그러면 인용이 2개 미만이 될 때는 건너뛴 출처로 채운다.
     */
    public static Optional<String> perSourceBullets(ValidationContext ctx) {
        List<SearchResult> results = ctx.bundle().results();
        int limit = ctx.plan().itemLimit() > 0 ? ctx.plan().itemLimit() : results.size();
        List<String> titles = new ArrayList<>();
        TreeMap<Integer, String> picked = new TreeMap<>();
        TreeMap<Integer, String> duplicates = new TreeMap<>();

        for (int i = 0; i < results.size() && picked.size() < limit; i++) {
            int n = i + 1;
            SearchResult r = results.get(i);
            String body = firstSummaryBullet(ctx.bundle().summaries(), n)
                    .orElseGet(() -> r.description().isBlank() ? r.title() : r.title() + "：" + r.description());
            body = TextUtils.collapseWhitespace(body);
            if (body.isEmpty()) continue;

            String line = "- " + ctx.dateHints().hintFor(n) + " " + body + " [" + n + "]";
            if (titles.stream().anyMatch(t -> TextUtils.nearDuplicate(t, r.title()))) {
                duplicates.put(n, line);
                continue;
            }
            titles.add(r.title());
            picked.put(n, line);
        }
        for (Map.Entry<Integer, String> d : duplicates.entrySet()) {
            if (picked.size() >= Math.min(MIN_DISTINCT, limit)) break;
            picked.put(d.getKey(), d.getValue());
        }
        return picked.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", picked.values()));
    }

    private static Optional<String> firstSummaryBullet(List<SourceSummary> summaries, int index) {
        return summaries.stream()
                .filter(s -> s.index() == index)
                .findFirst()
                .flatMap(s -> {
                    List<String> bullets = NewsBullets.bullets(s.text());
                    String first = bullets.isEmpty() ? s.text().strip().split("\\r?\\n")[0] : bullets.get(0);
                    String stripped = NewsBullets.stripMarkers(first);
                    return stripped.isEmpty() ? Optional.empty() : Optional.of(stripped);
                });
    }

    static String listingHeading(String language) {
        return switch (LanguageDirectives.normalize(language)) {
            case LanguageDirectives.SIMPLIFIED -> "我整理不出可靠的最新内容，以下是找到的相关来源，请直接查看：";
            case LanguageDirectives.ENGLISH -> "I couldn't put together a reliable up-to-date answer. Here are the sources I found:";
            default -> "我整理不出可靠的最新內容，以下是找到的相關來源，請直接查看：";
        };
    }
}
