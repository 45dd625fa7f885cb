package com.goormthonuniv.groundedchat.search;

/** 검색 결과 한 건. 목록 내 1-based 순위가 그 턴의 인용 번호가 된다. */
public record SearchResult(
        String title,
        String url,
        String description
) {
    public SearchResult {
        title = title == null ? "" : title.strip();
        url = url == null ? "" : url.strip();
        description = description == null ? "" : description.strip();
    }
}
