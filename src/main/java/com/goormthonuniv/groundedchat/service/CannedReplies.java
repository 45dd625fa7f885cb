package com.goormthonuniv.groundedchat.service;

import com.goormthonuniv.groundedchat.prompt.LanguageDirectives;

/** 모델 없이 보내는 고정 문구 (출력 언어별) */
final class CannedReplies {

    private CannedReplies() {}

    static String weatherClarification(String language) {
        return switch (LanguageDirectives.normalize(language)) {
            case LanguageDirectives.SIMPLIFIED -> "你想查哪个城市/地区的天气？例如：台北 / 新北 / 台中 / 高雄。";
            case LanguageDirectives.ENGLISH -> "Which city or area do you want the weather for? For example: Taipei / New Taipei / Taichung / Kaohsiung.";
            default -> "你想查哪個城市/地區的天氣？例如：台北 / 新北 / 台中 / 高雄。";
        };
    }

    static String apology(String language) {
        return switch (LanguageDirectives.normalize(language)) {
            case LanguageDirectives.SIMPLIFIED -> "抱歉，我现在无法产生回答，请稍后再试。";
            case LanguageDirectives.ENGLISH -> "Sorry, I can't produce an answer right now. Please try again later.";
            default -> "抱歉，我現在無法產生回答，請稍後再試。";
        };
    }
}
