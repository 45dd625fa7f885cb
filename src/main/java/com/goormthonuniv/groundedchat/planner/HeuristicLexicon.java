package com.goormthonuniv.groundedchat.planner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 키워드/문구 휴리스틱 테이블. 제어 흐름과 분리해 classpath:heuristics/lexicon.json 에서 읽는다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeuristicLexicon(
        List<String> weatherTerms,
        List<String> forceSearchTerms,
        List<String> newsTerms,
        List<String> marketTerms,
        List<String> wantsLinkTerms,
        List<String> knownLocations,
        List<String> locationSuffixes,
        List<String> locationStopwords,
        List<String> locationFillerPrefixes,
        List<String> timeWords,
        List<String> weatherNouns,
        String weatherQueryTemplate,
        List<String> followUpPhrases,
        List<String> refusalPatterns,
        List<String> traditionalRequests,
        List<String> simplifiedRequests,
        List<String> englishRequests,
        List<String> linkOptIn,
        List<String> linkOptOut,
        String simplifiedOnlyChars,
        String traditionalOnlyChars
) {
    public static final String RESOURCE = "heuristics/lexicon.json";

    public static HeuristicLexicon load(ObjectMapper om) {
        try (InputStream in = HeuristicLexicon.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) throw new IllegalStateException("missing classpath resource " + RESOURCE);
            return om.readValue(in, HeuristicLexicon.class);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
    }

    public boolean isWeatherQuestion(String text) { return containsAny(text, weatherTerms); }
    public boolean forcesSearch(String text) { return containsAny(text, forceSearchTerms); }
    public boolean isNews(String text) { return containsAny(text, newsTerms); }
    public boolean isMarket(String text) { return containsAny(text, marketTerms); }
    public boolean wantsLinks(String text) { return containsAny(text, wantsLinkTerms); }

    public List<Pattern> compiledRefusals() {
        return refusalPatterns.stream().map(Pattern::compile).toList();
    }

    /**
     * 한자 용어는 부분 문자열로, 라틴 문자로 시작/끝나는 용어는 그 쪽 경계가 단어 경계일 때만 일치.
     * ("now" 는 "know" 에, "market" 은 "supermarket" 에 걸리지 않는다.)
     */
    public static boolean containsAny(String text, List<String> needles) {
        if (text == null || text.isBlank() || needles == null) return false;
        String t = text.toLowerCase(Locale.ROOT);
        for (String n : needles) {
            if (!n.isEmpty() && containsTerm(t, n.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    static boolean containsTerm(String text, String term) {
        boolean leftEdge = isLatinWordChar(term.charAt(0));
        boolean rightEdge = isLatinWordChar(term.charAt(term.length() - 1));
        int from = 0;
        int at;
        while ((at = text.indexOf(term, from)) >= 0) {
            int end = at + term.length();
            boolean leftOk = !leftEdge || at == 0 || !isLatinWordChar(text.charAt(at - 1));
            boolean rightOk = !rightEdge || end == text.length() || !isLatinWordChar(text.charAt(end));
            if (leftOk && rightOk) return true;
            from = at + 1;
        }
        return false;
    }

    private static boolean isLatinWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
