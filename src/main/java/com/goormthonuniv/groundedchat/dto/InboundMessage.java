package com.goormthonuniv.groundedchat.dto;

import jakarta.validation.constraints.NotNull;

public record InboundMessage(
        @NotNull Long chatId,
        Long messageId,
        String chatType,     // "private" | "group" | "supergroup"
        String text
) {
    public boolean isGroup() {
        return "group".equalsIgnoreCase(chatType) || "supergroup".equalsIgnoreCase(chatType);
    }
}
