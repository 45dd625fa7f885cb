package com.goormthonuniv.groundedchat.validate;

import com.goormthonuniv.groundedchat.planner.HeuristicLexicon;
import com.goormthonuniv.groundedchat.prompt.LanguageDirectives;

/**
 * 간체/번체 전용 글자 빈도로 출력 문자 체계가 요구와 다른지 판정한다.
 */
public class ScriptVariantDetector {

    private final String simplifiedOnly;
    private final String traditionalOnly;

    public ScriptVariantDetector(HeuristicLexicon lexicon) {
        this.simplifiedOnly = lexicon.simplifiedOnlyChars() == null ? "" : lexicon.simplifiedOnlyChars();
        this.traditionalOnly = lexicon.traditionalOnlyChars() == null ? "" : lexicon.traditionalOnlyChars();
    }

    public boolean mismatch(String text, String language) {
        if (text == null || text.isBlank() || language == null || language.isBlank()) return false;
        int simplified = count(text, simplifiedOnly);
        int traditional = count(text, traditionalOnly);
        switch (LanguageDirectives.normalize(language)) {
            case LanguageDirectives.SIMPLIFIED:
                return traditional > 0 && traditional >= simplified;
            case LanguageDirectives.ENGLISH:
                return cjk(text) > latinLetters(text);
            default:
                return simplified > 0 && simplified >= traditional;
        }
    }

    static int count(String text, String alphabet) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (alphabet.indexOf(text.charAt(i)) >= 0) n++;
        }
        return n;
    }

    private static int cjk(String text) {
        return (int) text.codePoints()
                .filter(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.HAN)
                .count();
    }

    private static int latinLetters(String text) {
        return (int) text.chars().filter(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')).count();
    }
}
