package com.goormthonuniv.groundedchat.planner;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * "繼續", "更多5", "more 3" 같은 이어보기 요청 감지.
 * 일치하면 요청 개수(없으면 0)를 돌려준다.
 */
public class FollowUpDetector {

    private final Set<String> phrases;
    private final Pattern continuation;

    public FollowUpDetector(HeuristicLexicon lexicon) {
        this.phrases = lexicon.followUpPhrases().stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        String alt = lexicon.followUpPhrases().stream().map(Pattern::quote).collect(Collectors.joining("|"));
        this.continuation = Pattern.compile(
                "(?i)^(?:" + alt + ")(?:[\\s,，]*(?:" + alt + "))*[\\s,，]*(\\d{1,2})?\\s*(?:則|则|條|条|個|个|items?)?[\\s。.!！?？]*$");
    }

    public OptionalInt match(String text) {
        if (text == null) return OptionalInt.empty();
        String t = text.strip();
        if (t.isEmpty()) return OptionalInt.empty();
        if (phrases.contains(t.toLowerCase(Locale.ROOT))) return OptionalInt.of(0);
        Matcher m = continuation.matcher(t);
        if (!m.matches()) return OptionalInt.empty();
        return OptionalInt.of(m.group(1) == null ? 0 : Integer.parseInt(m.group(1)));
    }
}
