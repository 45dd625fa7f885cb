package com.goormthonuniv.groundedchat.memory;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.Turn;
import com.goormthonuniv.groundedchat.llm.ChatMessage;
import com.goormthonuniv.groundedchat.llm.LlmClient;
import com.goormthonuniv.groundedchat.llm.LlmRequest;
import com.goormthonuniv.groundedchat.prompt.LanguageDirectives;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 윈도우에서 밀려나는 턴들을 기존 요약과 합쳐 짧은 롤링 요약으로 접는다.
 */
public class ConversationCompactor {

    private static final Pattern URL = Pattern.compile("https?://\\S+");

    private final LlmClient llm;
    private final AssistantProperties props;

    public ConversationCompactor(LlmClient llm, AssistantProperties props) {
        this.llm = llm;
        this.props = props;
    }

    public String fold(String previousSummary, List<Turn> folded, String language) {
        AssistantProperties.Summary cfg = props.getSummary();
        String system = """
                You maintain a rolling summary of a chat so the assistant remembers context.
                Constraints:
                - Write in %s.
                - At most %d short lines.
                - No URLs.
                - Do not copy news lists or search results verbatim; only note which topics were discussed.
                - Keep user preferences, decisions and open questions.
                Return only the summary.""".formatted(LanguageDirectives.displayName(language), cfg.getMaxLines());

        StringBuilder user = new StringBuilder();
        if (previousSummary != null && !previousSummary.isBlank()) {
            user.append("Previous summary:\n").append(previousSummary.strip()).append("\n\n");
        }
        user.append("Conversation to fold in:\n");
        for (Turn t : folded) {
            user.append(t.role().wire()).append(": ").append(t.content()).append('\n');
        }

        String out = llm.complete(new LlmRequest(
                props.getModel().getChat(),
                List.of(ChatMessage.system(system), ChatMessage.user(user.toString())),
                cfg.getTemperature(),
                cfg.getMaxTokens(),
                null));
        return clean(out, cfg.getMaxLines());
    }

    static String clean(String summary, int maxLines) {
        String noUrls = URL.matcher(summary == null ? "" : summary).replaceAll("");
        return Arrays.stream(noUrls.split("\\r?\\n"))
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .limit(maxLines)
                .collect(Collectors.joining("\n"));
    }
}
