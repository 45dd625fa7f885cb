package com.goormthonuniv.groundedchat.dto;

public record SourceSummary(
        int index,      // 1-based 인용 번호
        String title,
        String domain,
        String text
) {}
