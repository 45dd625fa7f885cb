package com.goormthonuniv.groundedchat.validate;

import com.goormthonuniv.groundedchat.llm.ChatMessage;
import com.goormthonuniv.groundedchat.llm.LlmClient;
import com.goormthonuniv.groundedchat.llm.LlmRequest;
import com.goormthonuniv.groundedchat.prompt.LanguageDirectives;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 턴의 생성 호출 묶음. 조립된 메시지를 고정하고 최초 생성/교정 재생성/문자 체계 재작성을 제공한다.
 */
public class Generation {

    private final LlmClient llm;
    private final String model;
    private final List<ChatMessage> messages;
    private final double temperature;
    private final Integer maxTokens;

    public Generation(LlmClient llm, String model, List<ChatMessage> messages, double temperature, Integer maxTokens) {
        this.llm = llm;
        this.model = model;
        this.messages = List.copyOf(messages);
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public String generate() {
        return llm.complete(new LlmRequest(model, messages, temperature, maxTokens, null)).strip();
    }

    /** 직전 초안 + 무엇이 틀렸는지 알려주는 교정 지시로 한 번 더 생성 */
    public String regenerate(String previous, String correction) {
        List<ChatMessage> retry = new ArrayList<>(messages);
        retry.add(ChatMessage.assistant(previous));
        retry.add(ChatMessage.system(correction + "\nRewrite the whole answer. Output only the corrected answer."));
        return llm.complete(new LlmRequest(model, retry, temperature, maxTokens, null)).strip();
    }

    /** 의미는 그대로, 문자 체계만 바꾸는 재작성 전용 호출 */
    public String rewriteScript(String text, String language) {
        String system = "Rewrite the user's text in " + LanguageDirectives.displayName(language) + ". "
                + "Keep the meaning, line structure, numbers, dates, [n] citations and URLs exactly. "
                + "Do not add or remove information. Output only the rewritten text.";
        return llm.complete(new LlmRequest(model,
                List.of(ChatMessage.system(system), ChatMessage.user(text)), 0.0, maxTokens, null)).strip();
    }
}
