package com.goormthonuniv.groundedchat.retrieval;

import com.goormthonuniv.groundedchat.config.AssistantProperties;
import com.goormthonuniv.groundedchat.dto.SourceDateHints;
import com.goormthonuniv.groundedchat.llm.ChatMessage;
import com.goormthonuniv.groundedchat.llm.LlmClient;
import com.goormthonuniv.groundedchat.llm.LlmRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 출처 하나만 보고 질문 관련 요점을 bullet 로 요약하는 독립 모델 호출.
 */
@Component
public class SourceSummarizer {

    private final LlmClient llm;
    private final AssistantProperties props;

    public SourceSummarizer(LlmClient llm, AssistantProperties props) {
        this.llm = llm;
        this.props = props;
    }

    public String summarize(String userText, int index, String title, String domain, String content, boolean news) {
        StringBuilder system = new StringBuilder()
                .append("You are summarizing a single web source for a chat assistant. ")
                .append("Return concise bullet points that are directly relevant to the user's question. ")
                .append("Do NOT include URLs. Do NOT mention you cannot browse. ")
                .append("If the source does not contain relevant information, say so briefly. ")
                .append("End each bullet with the citation marker [").append(index).append("].");
        if (news) {
            system.append(" Start each bullet with the publication date of that item as YYYY-MM-DD, ")
                    .append("or ").append(SourceDateHints.NO_DATE)
                    .append(" when the source shows no date. Never guess a date.");
        }
        String user = """
                User question: %s

                Source [%d]
                Title: %s
                Domain: %s
                Content:
                %s""".formatted(userText, index, title, domain, content);

        AssistantProperties.Model m = props.getModel();
        return llm.complete(new LlmRequest(
                m.getChat(),
                List.of(ChatMessage.system(system.toString()), ChatMessage.user(user)),
                m.getSummarizerTemperature(),
                m.getSummarizerMaxTokens(),
                null));
    }
}
