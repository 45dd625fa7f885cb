package com.goormthonuniv.groundedchat.dto;

public record FetchedPage(
        String title,
        String url,
        String text     // 비어 있으면 수집 실패 또는 비공개 URL 거부
) {
    public boolean hasText() { return text != null && !text.isBlank(); }
}
