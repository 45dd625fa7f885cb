package com.goormthonuniv.groundedchat.service;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.InboundMessage;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * 그룹 채팅은 "@핸들" 로 시작하는 메시지만 처리하고 멘션은 떼어낸다.
 */
@Component
public class MentionFilter {

    private final AssistantProperties props;

    public MentionFilter(AssistantProperties props) {
        this.props = props;
    }

    /** 처리할 본문. 무시할 메시지면 empty. */
    public Optional<String> accept(InboundMessage msg) {
        String text = msg.text() == null ? "" : msg.text().strip();
        if (text.isEmpty()) return Optional.empty();
        if (!msg.isGroup()) return Optional.of(text);

        String mention = "@" + props.getTransport().getHandle();
        if (!text.toLowerCase(Locale.ROOT).startsWith(mention.toLowerCase(Locale.ROOT))) return Optional.empty();
        // "@bot_name2" 같은 다른 핸들은 제외
        if (text.length() > mention.length()) {
            char next = text.charAt(mention.length());
            if (Character.isLetterOrDigit(next) || next == '_') return Optional.empty();
        }
        String rest = text.substring(mention.length()).replaceFirst("^[\\s,:，：]+", "").strip();
        return rest.isEmpty() ? Optional.empty() : Optional.of(rest);
    }
}
