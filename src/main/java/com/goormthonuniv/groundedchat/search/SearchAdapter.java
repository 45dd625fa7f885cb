package com.goormthonuniv.groundedchat.search;

import java.util.List;

/**
 * 웹검색 백엔드 계약. 호출자는 어느 백엔드가 응답했는지 알 필요가 없다.
 * 실패는 예외가 아니라 빈 목록으로 돌려준다 (재시도 없음).
 */
public interface SearchAdapter {
    String name(); // "brave", "mcp_brave"
    List<SearchResult> search(String query, String country, String language, int count);
}
