package com.goormthonuniv.groundedchat.dto;

import java.util.Set;

public record ChatReply(
        Long chatId,
        Long replyToMessageId,
        boolean ignored,             // 그룹 멘션 없음/빈 메시지
        String text,
        Set<Degradation> degradations
) {
    public static ChatReply ignored(InboundMessage msg) {
        return new ChatReply(msg.chatId(), msg.messageId(), true, null, Set.of());
    }
}
