package com.goormthonuniv.groundedchat.validate;

import com.goormthonuniv.groundedchat.prompt.LanguageDirectives;
import com.goormthonuniv.groundedchat.search.SearchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** 답변 뒤에 붙이는 출처 링크 블록 */
public final class LinkAppendix {

    private LinkAppendix() {}

    /** 본문에서 인용된 번호 → URL. 인용이 없으면 앞에서 defaultCount 개. */
    public static String forNews(String body, List<SearchResult> results, int defaultCount, String language) {
        Set<Integer> cited = new TreeSet<>(NewsBullets.citations(body, results.size()));
        if (cited.isEmpty()) {
            for (int i = 1; i <= Math.min(defaultCount, results.size()); i++) cited.add(i);
        }
        List<String> lines = new ArrayList<>();
        for (int n : cited) {
            String url = results.get(n - 1).url();
            if (!url.isBlank()) lines.add("[" + n + "] " + url);
        }
        if (lines.isEmpty()) return body;
        return body.stripTrailing() + "\n\n" + heading(language) + "\n" + String.join("\n", lines);
    }

    /** 링크를 요청한 일반 질문: URL 만 최대 max 개 */
    public static String rawUrls(String body, List<SearchResult> results, int max) {
        List<String> urls = results.stream().map(SearchResult::url).filter(u -> !u.isBlank()).limit(max).toList();
        if (urls.isEmpty()) return body;
        return body.stripTrailing() + "\n\n" + String.join("\n", urls);
    }

    static String heading(String language) {
        return switch (LanguageDirectives.normalize(language)) {
            case LanguageDirectives.SIMPLIFIED -> "来源链接：";
            case LanguageDirectives.ENGLISH -> "Sources:";
            default -> "來源連結：";
        };
    }
}
