package com.goormthonuniv.groundedchat.prompt;

import java.util.Locale;

/** 출력 언어 코드 → 표시 이름 / 지시문 */
public final class LanguageDirectives {

    public static final String TRADITIONAL = "zh-Hant";
    public static final String SIMPLIFIED = "zh-Hans";
    public static final String ENGLISH = "en";

    private LanguageDirectives() {}

    public static String displayName(String code) {
        return switch (normalize(code)) {
            case SIMPLIFIED -> "Simplified Chinese (简体中文)";
            case ENGLISH -> "English";
            default -> "Traditional Chinese (繁體中文)";
        };
    }

    public static String directive(String code) {
        return "Always reply in " + displayName(code) + ", even if the sources or the user use another script or language.";
    }

    public static String normalize(String code) {
        if (code == null) return TRADITIONAL;
        String c = code.strip().toLowerCase(Locale.ROOT);
        if (c.equals("zh-hans") || c.equals("zh-cn") || c.equals("simplified")) return SIMPLIFIED;
        if (c.startsWith("en")) return ENGLISH;
        return TRADITIONAL;
    }
}
